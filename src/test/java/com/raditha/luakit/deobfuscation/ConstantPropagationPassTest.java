package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.lexer.Tokens;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConstantPropagationPassTest {

    private final LuaLexer lexer = new LuaLexer();
    private final ConstantPropagationPass pass = new ConstantPropagationPass();

    private String propagate(String source) {
        return Tokens.join(pass.apply(lexer.tokenize(source), new RewriteContext(3)));
    }

    @Test
    void testPropagate_SingleBinding() {
        assertEquals("local x = 5\nprint(5)", propagate("local x = 5\nprint(x)"));
    }

    @Test
    void testPropagate_StringsBooleansAndNil() {
        assertEquals("local s = \"hi\"\nprint(\"hi\", \"hi\")", propagate("local s = \"hi\"\nprint(s, s)"));
        assertEquals("local flag = true\nif true then end", propagate("local flag = true\nif flag then end"));
        assertEquals("local v = nil\nreturn nil", propagate("local v = nil\nreturn v"));
    }

    @Test
    void testPropagate_SkipsReassignedNames() {
        assertEquals("local x = 5\nx = 6\nprint(x)", propagate("local x = 5\nx = 6\nprint(x)"));
        assertEquals("local x = 5\nx += 1\nprint(x)", propagate("local x = 5\nx += 1\nprint(x)"));
        assertEquals("local a = 1\nlocal b = 2\nb, a = a, b\nprint(a)",
                propagate("local a = 1\nlocal b = 2\nb, a = a, b\nprint(a)"));
    }

    @Test
    void testPropagate_RedeclarationStartsNewBinding() {
        assertEquals("local x = 1\nlocal x = 2\nprint(2)", propagate("local x = 1\nlocal x = 2\nprint(x)"));
        assertEquals("local x = 1\nlocal x = f()\nprint(x)", propagate("local x = 1\nlocal x = f()\nprint(x)"));
    }

    @Test
    void testPropagate_UsesBeforeReassignmentAreReplaced() {
        assertEquals("local x = 5\nprint(5)\nx = 6\nprint(x)", propagate("local x = 5\nprint(x)\nx = 6\nprint(x)"));
    }

    @Test
    void testPropagate_MultipleAssignmentWithIndexedOrCalledTargets() {
        String indexed = "local x = 1\nlocal t = {}\nx, t[1] = 2, 3\nprint(x)";
        assertEquals(indexed, propagate(indexed));

        String called = "local x = 1\nx, f().y = 2, 3\nprint(x)";
        assertEquals(called, propagate(called));

        String leading = "local x = 1\nt[i].k, x = 2, 3\nprint(x)";
        assertEquals(leading, propagate(leading));
    }

    @Test
    void testPropagate_AssignmentInLoopInvalidatesWholeLoop() {
        String whileLoop = "local x = 1\nwhile c do\nprint(x)\nx = 2\nend";
        assertEquals(whileLoop, propagate(whileLoop));

        String forLoop = "local x = 1\nfor i = 1, 3 do\nif i > 1 then\nprint(x)\nend\nx = i\nend";
        assertEquals(forLoop, propagate(forLoop));

        String repeatLoop = "local x = 1\nrepeat\nprint(x)\nx = 2\nuntil done";
        assertEquals(repeatLoop, propagate(repeatLoop));
    }

    @Test
    void testPropagate_UsesBeforeLoopAreReplaced() {
        assertEquals("local x = 1\nprint(1)\nwhile c do\nx = 2\nend\nprint(x)",
                propagate("local x = 1\nprint(x)\nwhile c do\nx = 2\nend\nprint(x)"));
    }

    @Test
    void testPropagate_BindingDeclaredInsideLoopBody() {
        assertEquals("while c do\nlocal x = 1\nprint(1)\nx = 2\nprint(x)\nend",
                propagate("while c do\nlocal x = 1\nprint(x)\nx = 2\nprint(x)\nend"));
    }

    @Test
    void testPropagate_ClosuresOverReassignedNames() {
        String reassigned = "local x = 1\nlocal function f() return x end\nx = 2\nprint(f())";
        assertEquals(reassigned, propagate(reassigned));

        assertEquals("local x = 1\nlocal function f() return 1 end",
                propagate("local x = 1\nlocal function f() return x end"));
    }

    @Test
    void testPropagate_GotoDisablesAssignedNames() {
        String source = "local x = 1\n::top::\nprint(x)\nx = 2\ngoto top";
        assertEquals(source, propagate(source));
    }

    @Test
    void testPropagate_AttributedDeclaration() {
        assertEquals("local x <const> = 3\nprint(3)", propagate("local x <const> = 3\nprint(x)"));
    }

    @Test
    void testPropagate_SkipsParametersLoopVariablesAndFunctionNames() {
        String parameter = "local n = 1\nlocal function f(n) return n end\nprint(n)";
        assertEquals(parameter, propagate(parameter));

        String loop = "local i = 0\nfor i = 1, 3 do print(i) end";
        assertEquals(loop, propagate(loop));

        String function = "local g = 1\nfunction g() end\nprint(g)";
        assertEquals(function, propagate(function));
    }

    @Test
    void testPropagate_BindingExpiresWithItsBlock() {
        assertEquals("do\nlocal y = \"s\"\nprint(\"s\")\nend\nprint(y)",
                propagate("do\nlocal y = \"s\"\nprint(y)\nend\nprint(y)"));
    }

    @Test
    void testPropagate_BindingExpiresAfterElseifChain() {
        String source = """
                function f()
                local q = 1
                if a then
                elseif b then
                end
                end
                print(q)""";
        String expected = """
                function f()
                local q = 1
                if a then
                elseif b then
                end
                end
                print(q)""";

        assertEquals(expected, propagate(source));
    }

    @Test
    void testPropagate_ElseBranchDoesNotSeeThenBranchBinding() {
        String source = "if a then\nlocal z = 1\nprint(z)\nelse\nprint(z)\nend";
        assertEquals("if a then\nlocal z = 1\nprint(1)\nelse\nprint(z)\nend", propagate(source));
    }

    @Test
    void testPropagate_LeavesFieldsKeysAndSuffixes() {
        assertEquals("local k = 1\nt.k = 1\nlocal u = {k = 1}",
                propagate("local k = 1\nt.k = k\nlocal u = {k = k}"));
        assertEquals("local s = \"abc\"\nprint(s:upper(), s[1])",
                propagate("local s = \"abc\"\nprint(s:upper(), s[1])"));
    }

    @Test
    void testPropagate_OnlyWholeLiteralExpressions() {
        String source = "local z = 1 + y\nprint(z)";
        assertEquals(source, propagate(source));
    }
}
