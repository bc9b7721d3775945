package com.raditha.luakit.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DiffGenerator - unified diff creation.
 */
class DiffGeneratorTest {

    private DiffGenerator diffGenerator;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        diffGenerator = new DiffGenerator();
    }

    @Test
    void testUnifiedDiffGeneration() throws IOException {
        Path originalFile = tempDir.resolve("main.lua");
        Files.writeString(originalFile, "local x=1\nprint(x)\n");

        String diff = diffGenerator.generateUnifiedDiff(originalFile, "local x = 1\nprint(x)\n");

        assertTrue(diff.startsWith("--- a/main.lua\n+++ b/main.lua"), diff);
        assertTrue(diff.contains("-local x=1"));
        assertTrue(diff.contains("+local x = 1"));
        assertTrue(diff.contains(" print(x)"));
    }

    @Test
    void testNoChangesGiveEmptyDiff() {
        assertEquals("", diffGenerator.generateUnifiedDiff("same.lua", "a()\nb()", "a()\nb()\n", 3));
    }

    @Test
    void testContextLines() {
        String original = "a()\nb()\nc()\nd()\ne()";
        String revised = "a()\nb()\nC()\nd()\ne()";

        String narrow = diffGenerator.generateUnifiedDiff("f.lua", original, revised, 1);

        assertTrue(narrow.contains(" b()"));
        assertFalse(narrow.contains(" a()"));
        assertTrue(diffGenerator.generateUnifiedDiff("f.lua", original, revised, 3).contains(" a()"));
    }
}
