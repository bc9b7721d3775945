package com.raditha.luakit.minify;

import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.model.Token;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LuaMinifierTest {

    private final LuaMinifier minifier = new LuaMinifier();
    private final LuaLexer lexer = new LuaLexer();

    @Test
    void testMinify_RenamesLocalsDeterministically() {
        String source = "local HelloWorld = 1\nprint(HelloWorld)";

        String first = minifier.minify(source, true, true);
        String second = minifier.minify(source, true, true);

        assertEquals("local a=1 print(a)", first);
        assertEquals(first, second);
    }

    @Test
    void testMinify_StripsCommentsAndLayout() {
        String source = """
                -- header
                local x = 1 --[[ inline ]]
                if x > 0 then
                    print( x )
                end
                """;

        assertEquals("local x=1 if x>0 then print(x)end", minifier.minify(source, false, false));
    }

    @Test
    void testMinify_KeepsSeparatorsThatChangeLexing() {
        assertEquals("x=a .. b", minifier.minify("x = a .. b", false, false));
        assertEquals("x=1 .. 2", minifier.minify("x = 1 .. 2", false, false));
        assertEquals("x=- -y", minifier.minify("x = - -y", false, false));
        assertEquals("t[ [[s]]]=1", minifier.minify("t[ [[s]] ] = 1", false, false));
    }

    @Test
    void testMinify_GlobalsAndFieldsAreNotRenamed() {
        String source = "local count = 0\ngame.Players.count = count\nprint(count)";

        assertEquals("local a=0 game.Players.count=a print(a)", minifier.minify(source, true, false));
    }

    @Test
    void testMinify_AggressiveRewritesLiterals() {
        assertEquals("x=.5 y=\"abc\"z=1000", minifier.minify("x = 0.50 y = 'abc' z = 1_000", false, true));
    }

    @Test
    void testMinify_AggressiveDropsSemicolons() {
        assertEquals("a()b()", minifier.minify("a();b();", false, true));
        assertEquals("a();(f)()", minifier.minify("a();(f)()", false, true));
        assertEquals("local t={1;2}", minifier.minify("local t = {1; 2};", false, true));
    }

    @Test
    void testMinify_BasicModeKeepsLiterals() {
        assertEquals("x=0.50;", minifier.minify("x = 0.50;", false, false));
    }

    @Test
    void testMinify_NewlineKeptAfterUnterminatedString() {
        assertEquals("x=\"open\ny=1", minifier.minify("x = \"open\ny = 1", false, false));
    }

    @Test
    void testMinifyWithStats() {
        MinifyResult result = minifier.minifyWithStats("local x = 1\n-- hi\nprint(x)\n", true, true);

        assertEquals("local a=1 print(a)", result.output());
        assertEquals(27, result.originalBytes());
        assertEquals(18, result.minifiedBytes());
        assertEquals(3, result.originalLines());
        assertEquals(1, result.minifiedLines());
        assertEquals(1, result.renamedLocals());
        assertEquals(100.0 * 9 / 27, result.reductionPercent(), 0.001);
    }

    @Test
    void testCanonicalNumber() {
        assertEquals("1.5", LuaMinifier.canonicalNumber("1.50"));
        assertEquals(".5", LuaMinifier.canonicalNumber("0.5"));
        assertEquals("3", LuaMinifier.canonicalNumber("3.0"));
        assertEquals("0", LuaMinifier.canonicalNumber("0.0"));
        assertEquals("1000", LuaMinifier.canonicalNumber("1_000"));
        assertEquals("0x10", LuaMinifier.canonicalNumber("0x10"));
        assertEquals("1e10", LuaMinifier.canonicalNumber("1e10"));
    }

    @Test
    void testShortestQuote() {
        assertEquals("\"abc\"", LuaMinifier.shortestQuote("'abc'"));
        assertEquals("\"it's\"", LuaMinifier.shortestQuote("'it\\'s'"));
        assertEquals("'say \"hi\"'", LuaMinifier.shortestQuote("'say \"hi\"'"));
        assertEquals("\"A\"", LuaMinifier.shortestQuote("\"\\65\""));
        assertEquals("[[raw]]", LuaMinifier.shortestQuote("[[raw]]"));
    }

    @Property(tries = 100)
    void minifyingKeepsTheTokenSequence(@ForAll("programs") String source) {
        String minified = minifier.minify(source, false, false);

        assertEquals(significant(source), significant(minified));
    }

    @Property(tries = 100)
    void minifiedOutputIsStable(@ForAll("programs") String source) {
        String minified = minifier.minify(source, true, true);
        assertEquals(minified, minifier.minify(minified, false, true));
    }

    private List<String> significant(String source) {
        return lexer.tokenize(source).stream()
                .filter(t -> !t.isTrivia())
                .map(Token::lexeme)
                .toList();
    }

    @Provide
    Arbitrary<String> programs() {
        return Arbitraries.of(
                        "local x = 1",
                        "x = x + 1 -- bump",
                        "print(\"hi\", x)",
                        "if x > 1 then",
                        "else",
                        "end",
                        "for i = 1, 10 do",
                        "local function f(a, b)",
                        "return a .. b",
                        "t = {1, 2, [\"k\"] = 3}",
                        "local s = [[long\ntext]]",
                        "f = function() return -1 end",
                        "x = not y and #t",
                        "y = x - -x",
                        "z = 1 .. 2",
                        "obj:call(1):next()")
                .list().ofMaxSize(12)
                .map(lines -> String.join("\n", lines));
    }
}
