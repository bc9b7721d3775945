package com.raditha.luakit.obfuscate;

import com.raditha.luakit.analysis.ObfuscationValidator;
import com.raditha.luakit.analysis.ValidationReport;
import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LuaObfuscatorTest {

    private final LuaObfuscator obfuscator = new LuaObfuscator();

    @Test
    void testObfuscate_RenamesEncodesAndMinifies() {
        ObfuscationResult result = obfuscator.obfuscate("local greeting = \"hi\" -- say it\nprint(greeting)\n");

        assertEquals("local a=\"\\104\\105\"print(a)", result.output());
        assertEquals(1, result.renamedLocals());
        assertEquals(1, result.encodedStrings());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).contains("'hi'"));
    }

    @Test
    void testObfuscate_GlobalsFieldsAndLongBracketsKeepTheirText() {
        String source = "config.name = [[raw]]\nlocal t = {key = 'x'}\nreturn t.key";

        ObfuscationResult result = obfuscator.obfuscate(source);

        assertEquals("config.name=[[raw]]local a={key=\"\\120\"}return a.key", result.output());
        assertEquals(1, result.encodedStrings());
    }

    @Test
    void testObfuscate_IsDeterministic() {
        String source = "local alpha, beta = 'a', 'b'\nprint(alpha .. beta)";

        assertEquals(obfuscator.obfuscate(source).output(), obfuscator.obfuscate(source).output());
    }

    @Test
    void testObfuscate_AbortsOnValidationErrors() {
        ObfuscationValidator validator = mock(ObfuscationValidator.class);
        when(validator.validate(anyString())).thenReturn(
                new ValidationReport(List.of(), List.of("[Syntax] Block structure error: unbalanced")));
        LuaObfuscator strict = new LuaObfuscator(LuaVocabulary.standard(), validator);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> strict.obfuscate("local x = 1"));
        assertTrue(e.getMessage().contains("unbalanced"));
    }

    @Test
    void testEncodeString_EscapesEveryByte() {
        assertEquals("\"\\97\\10\"", LuaObfuscator.encodeString(new Token(TokenType.STRING, "'a\\n'")));
        assertEquals("\"\\195\\169\"", LuaObfuscator.encodeString(new Token(TokenType.STRING, "\"\u00e9\"")));
        assertEquals("\"\"", LuaObfuscator.encodeString(new Token(TokenType.STRING, "\"\"")));
    }

    @Test
    void testEncodeString_SkipsLongBracketsAndMalformedLiterals() {
        assertNull(LuaObfuscator.encodeString(new Token(TokenType.STRING, "[[raw]]")));
        assertNull(LuaObfuscator.encodeString(new Token(TokenType.STRING, "\"\\q\"")));
        assertNull(LuaObfuscator.encodeString(new Token(TokenType.STRING, "\"open")));
        assertNull(LuaObfuscator.encodeString(new Token(TokenType.IDENTIFIER, "name")));
    }
}
