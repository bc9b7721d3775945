package com.raditha.luakit.lexer;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class LuaStringsTest {

    @Test
    void testDecode_SimpleEscapes() {
        assertEquals("a\nb\t\"c\"", LuaStrings.decodeToText("\"a\\nb\\t\\\"c\\\"\""));
        assertEquals("it's", LuaStrings.decodeToText("'it\\'s'"));
    }

    @Test
    void testDecode_NumericEscapes() {
        assertEquals("Hi", LuaStrings.decodeToText("\"\\72\\105\""));
        assertEquals("Hi", LuaStrings.decodeToText("\"\\x48\\x69\""));
        assertEquals("é", LuaStrings.decodeToText("\"\\u{E9}\""));
        assertEquals("A1", LuaStrings.decodeToText("\"\\0651\""));
    }

    @Test
    void testDecode_SkipWhitespaceEscape() {
        assertEquals("ab", LuaStrings.decodeToText("\"a\\z   \n  b\""));
    }

    @Test
    void testDecode_LongBracketDropsFirstNewline() {
        assertEquals("line\n", LuaStrings.decodeToText("[[\nline\n]]"));
        assertEquals("a]]b", LuaStrings.decodeToText("[=[a]]b]=]"));
    }

    @Test
    void testDecode_MalformedReturnsNull() {
        assertNull(LuaStrings.decode("\"open"));
        assertNull(LuaStrings.decode("\"bad \\q escape\""));
        assertNull(LuaStrings.decode("\"\\256\""));
        assertNull(LuaStrings.decode("[==[open]=]"));
        assertNull(LuaStrings.decode("name"));
    }

    @Test
    void testQuote_EscapesOnlyWhatIsRequired() {
        assertEquals("\"a\\\"b\"", LuaStrings.quote("a\"b", '"'));
        assertEquals("'a\"b'", LuaStrings.quote("a\"b", '\''));
        assertEquals("\"x\\ny\"", LuaStrings.quote("x\ny", '"'));
        assertEquals("\"\\\\\"", LuaStrings.quote("\\", '"'));
        assertEquals("\"é\"", LuaStrings.quote("é", '"'));
    }

    @Test
    void testQuote_ControlBytePaddedBeforeDigit() {
        assertEquals("\"\\0011\"", LuaStrings.quote(new byte[] { 1, '1' }, '"'));
        assertEquals("\"\\1x\"", LuaStrings.quote(new byte[] { 1, 'x' }, '"'));
    }

    @Test
    void testQuote_InvalidUtf8UsesDecimalEscape() {
        assertEquals("\"\\255\"", LuaStrings.quote(new byte[] { (byte) 0xFF }, '"'));
    }

    @Test
    void testQuoteThenDecode_PreservesBytes() {
        byte[] bytes = "tab\tquote\"nul\u0000end".getBytes(StandardCharsets.UTF_8);
        assertArrayEquals(bytes, LuaStrings.decode(LuaStrings.quote(bytes, '"')));
        assertArrayEquals(bytes, LuaStrings.decode(LuaStrings.quote(bytes, '\'')));
    }

    @Test
    void testHasNumericEscape() {
        assertTrue(LuaStrings.hasNumericEscape("\"\\65\""));
        assertTrue(LuaStrings.hasNumericEscape("'\\x41'"));
        assertFalse(LuaStrings.hasNumericEscape("\"\\n\""));
        assertFalse(LuaStrings.hasNumericEscape("[[\\65]]"));
    }

    @Test
    void testIsQuotedAndIsLongBracket() {
        assertTrue(LuaStrings.isQuoted("\"x\""));
        assertFalse(LuaStrings.isQuoted("\"x"));
        assertTrue(LuaStrings.isLongBracket("[==[x]==]"));
        assertFalse(LuaStrings.isLongBracket("\"x\""));
    }
}
