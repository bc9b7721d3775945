package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.lexer.Tokens;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConcatMergePassTest {

    private final LuaLexer lexer = new LuaLexer();
    private final ConcatMergePass pass = new ConcatMergePass();

    private String merge(String source) {
        return Tokens.join(pass.apply(lexer.tokenize(source), new RewriteContext(3)));
    }

    @Test
    void testMerge_ChainOfLiterals() {
        assertEquals("x = \"abc\"", merge("x = \"a\" .. \"b\" .. \"c\""));
    }

    @Test
    void testMerge_KeepsLeftQuoteStyle() {
        assertEquals("x = 'ab'", merge("x = 'a' .. \"b\""));
        assertEquals("x = \"xy\"", merge("x = [[x]] .. 'y'"));
    }

    @Test
    void testMerge_ContentWithOtherQuote() {
        assertEquals("x = 'say \"hi\"'", merge("x = 'say \"' .. 'hi\"'"));
    }

    @Test
    void testMerge_LiteralsNextToNames() {
        assertEquals("x = \"ab\" .. y", merge("x = \"a\" .. \"b\" .. y"));
        assertEquals("x = y .. \"ab\"", merge("x = y .. \"a\" .. \"b\""));
    }

    @Test
    void testMerge_LeavesPairsSplitByTighterOperators() {
        assertEquals("n = #\"a\" .. \"b\"", merge("n = #\"a\" .. \"b\""));
        assertEquals("s = \"a\" .. \"b\":upper()", merge("s = \"a\" .. \"b\":upper()"));
        assertEquals("f \"a\" .. \"b\"", merge("f \"a\" .. \"b\""));
        assertEquals("x = 1 + \"2\" .. \"3\"", merge("x = 1 + \"2\" .. \"3\""));
    }

    @Test
    void testTableConcat_WithAndWithoutSeparator() {
        assertEquals("s = \"a, b, c\"", merge("s = table.concat({\"a\", \"b\", \"c\"}, \", \")"));
        assertEquals("s = 'xy'", merge("s = table.concat({'x', 'y'})"));
    }

    @Test
    void testTableConcat_LeavesNonLiteralItems() {
        assertEquals("s = table.concat({a, \"b\"})", merge("s = table.concat({a, \"b\"})"));
        assertEquals("s = table.concat(t, \",\")", merge("s = table.concat(t, \",\")"));
    }
}
