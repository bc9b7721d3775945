package com.raditha.luakit.format;

import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LuaFormatterTest {

    private final LuaFormatter formatter = new LuaFormatter();

    @Test
    void testFormat_IndentsBlocks() {
        String source = """
                local function f(x)
                if x then
                return 1
                else
                return 2
                end
                end
                """;
        String expected = """
                local function f(x)
                  if x then
                    return 1
                  else
                    return 2
                  end
                end
                """;

        assertEquals(expected, formatter.format(source, "  "));
    }

    @Test
    void testFormat_ElseifBranchesShareIndentation() {
        String source = "if a then\nx()\nelseif b then\ny()\nelse\nz()\nend\nafter()";
        String expected = "if a then\n\tx()\nelseif b then\n\ty()\nelse\n\tz()\nend\nafter()\n";

        assertEquals(expected, formatter.format(source, "\t"));
    }

    @Test
    void testFormat_CarriageReturnLineBreaks() {
        assertEquals("-- note\nprint(1)\n", formatter.format("-- note\rprint(1)\r", "\t"));
        assertEquals("do\n\tx()\nend\n", formatter.format("do\r\nx()\r\nend\r\n", "\t"));
    }

    @Test
    void testFormat_KeywordsNextToBrackets() {
        assertEquals("if (x) then\n\treturn -1\nend\n", formatter.format("if(x)then\nreturn-1\nend", "\t"));
    }

    @Test
    void testFormat_TabIndentation() {
        assertEquals("while true do\n\tstep()\nend\n", formatter.format("while true do\nstep()\nend", "\t"));
    }

    @Test
    void testFormat_SpacesAroundBinaryOperators() {
        assertEquals("local a = 1 + 2 * 3\n", formatter.format("local a=1+2*3", "\t"));
        assertEquals("s = a .. b\n", formatter.format("s=a..b", "\t"));
    }

    @Test
    void testFormat_UnaryOperatorsStayAttached() {
        assertEquals("x = -y\n", formatter.format("x = - y", "\t"));
        assertEquals("n = #t\n", formatter.format("n=# t", "\t"));
        assertEquals("return -1\n", formatter.format("return -1", "\t"));
    }

    @Test
    void testFormat_CallsAndTables() {
        assertEquals("print(\"a\", {1, 2})\n", formatter.format("print( \"a\" ,{1,2} )", "\t"));
        assertEquals("obj:method(x).field = 1\n", formatter.format("obj : method ( x ) . field=1", "\t"));
    }

    @Test
    void testFormat_CollapsesBlankLines() {
        assertEquals("a()\n\nb()\n", formatter.format("\n\na()\n\n\n\nb()\n\n", "\t"));
    }

    @Test
    void testFormat_AnonymousFunctionStaysInline() {
        assertEquals("f = function() return 1 end\n", formatter.format("f = function() return 1 end", "\t"));
    }

    @Test
    void testFormat_StatementKeywordStartsLine() {
        assertEquals("x = 1\nif x then y() end\n", formatter.format("x = 1 if x then y() end", "\t"));
    }

    @Test
    void testFormat_CommentsAndStringsVerbatim() {
        String source = "-- keep   this\nlocal s = [[a   b\n  c]]\n";
        assertEquals(source, formatter.format(source, "\t"));
    }

    @Test
    void testFormat_EmptyInput() {
        assertEquals("\n", formatter.format("", "\t"));
    }

    @Property(tries = 100)
    void formattingIsIdempotent(@ForAll("programs") String source) {
        String once = formatter.format(source, "    ");
        assertEquals(once, formatter.format(once, "    "));
    }

    @Provide
    Arbitrary<String> programs() {
        return Arbitraries.of(
                        "local x = 1",
                        "x = x + 1",
                        "print(\"hi\", x)",
                        "if x > 1 then",
                        "elseif x < 0 then",
                        "else",
                        "end",
                        "for i = 1, 10 do",
                        "while true do",
                        "local function f(a, b)",
                        "return a .. b",
                        "-- comment",
                        "t = {1, 2, [\"k\"] = 3}",
                        "local s = [[long\ntext]]",
                        "repeat",
                        "until x",
                        "f = function() return -1 end",
                        "x = not y and #t",
                        "obj:call(1):next()",
                        "")
                .list().ofMaxSize(15)
                .map(lines -> String.join("\n", lines));
    }
}
