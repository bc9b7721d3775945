package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.lexer.Tokens;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StringDecodePassesTest {

    private final LuaLexer lexer = new LuaLexer();
    private final RewriteContext context = new RewriteContext(3);

    private String run(RewritePass pass, String source) {
        return Tokens.join(pass.apply(lexer.tokenize(source), context));
    }

    @Test
    void testStringChar_DecimalAndHexArguments() {
        StringCharDecodePass pass = new StringCharDecodePass();

        assertEquals("x = \"Hi\"", run(pass, "x = string.char(72, 105)"));
        assertEquals("x = \"A\"", run(pass, "x = string.char(0x41)"));
        assertEquals("x = \"\"", run(pass, "x = string.char()"));
    }

    @Test
    void testStringChar_EscapesControlBytes() {
        assertEquals("print(\"a\\n\")", run(new StringCharDecodePass(), "print(string.char(97, 10))"));
    }

    @Test
    void testStringChar_ParenthesizedBeforeMethodCall() {
        assertEquals("s = (\"hi\"):upper()", run(new StringCharDecodePass(), "s = string.char(104, 105):upper()"));
    }

    @Test
    void testStringChar_LeavesUndecodableCalls() {
        StringCharDecodePass pass = new StringCharDecodePass();

        assertEquals("string.char(300)", run(pass, "string.char(300)"));
        assertEquals("string.char(n)", run(pass, "string.char(n)"));
        assertEquals("string.char(1.5)", run(pass, "string.char(1.5)"));
        assertEquals("lib.string.char(65)", run(pass, "lib.string.char(65)"));
    }

    @Test
    void testParseInteger() {
        assertEquals(255L, StringCharDecodePass.parseInteger("0xff"));
        assertEquals(72L, StringCharDecodePass.parseInteger("72"));
        assertNull(StringCharDecodePass.parseInteger("1e2"));
        assertNull(StringCharDecodePass.parseInteger("0x"));
    }

    @Test
    void testStringByte_FunctionAndMethodForms() {
        StringByteDecodePass pass = new StringByteDecodePass();

        assertEquals("x = 65", run(pass, "x = string.byte(\"A\")"));
        assertEquals("x = 97", run(pass, "x = ('a'):byte()"));
        assertEquals("x = 10", run(pass, "x = string.byte(\"\\n\")"));
    }

    @Test
    void testStringByte_LeavesOtherShapes() {
        StringByteDecodePass pass = new StringByteDecodePass();

        assertEquals("string.byte(\"AB\")", run(pass, "string.byte(\"AB\")"));
        assertEquals("string.byte(\"A\", 1)", run(pass, "string.byte(\"A\", 1)"));
        assertEquals("f(\"A\"):byte()", run(pass, "f(\"A\"):byte()"));
    }

    @Test
    void testEscapeNormalization_KeepsQuoteCharacter() {
        EscapeNormalizationPass pass = new EscapeNormalizationPass();

        assertEquals("print(\"Hi\")", run(pass, "print(\"\\72\\105\")"));
        assertEquals("print('A\\n')", run(pass, "print('\\x41\\n')"));
        assertEquals("print(\"é\")", run(pass, "print(\"\\u{E9}\")"));
    }

    @Test
    void testEscapeNormalization_LeavesPlainAndMalformedLiterals() {
        EscapeNormalizationPass pass = new EscapeNormalizationPass();

        assertEquals("s = \"a\\tb\"", run(pass, "s = \"a\\tb\""));
        assertEquals("s = \"\\999\"", run(pass, "s = \"\\999\""));
        assertEquals("s = [[\\65]]", run(pass, "s = [[\\65]]"));
    }
}
