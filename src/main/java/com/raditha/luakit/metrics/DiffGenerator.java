package com.raditha.luakit.metrics;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Generates unified diffs previewing a transformation.
 * Uses java-diff-utils library.
 */
public class DiffGenerator {

    private static final int DEFAULT_CONTEXT_LINES = 3;

    /**
     * Generate a unified diff between a file and its transformed text.
     *
     * @param originalFile    path to the original file
     * @param transformedCode transformed source
     * @return unified diff, empty when nothing changed
     */
    public String generateUnifiedDiff(Path originalFile, String transformedCode) throws IOException {
        return generateUnifiedDiff(originalFile, transformedCode, DEFAULT_CONTEXT_LINES);
    }

    /**
     * Generate diff with custom context lines.
     */
    public String generateUnifiedDiff(Path originalFile, String transformedCode, int contextLines)
            throws IOException {
        String name = originalFile.getFileName().toString();
        return generateUnifiedDiff(name, Files.readString(originalFile), transformedCode, contextLines);
    }

    /**
     * Diff two texts under the given file name.
     */
    public String generateUnifiedDiff(String fileName, String original, String transformed, int contextLines) {
        List<String> originalLines = original.lines().toList();
        List<String> revisedLines = transformed.lines().toList();

        Patch<String> patch = DiffUtils.diff(originalLines, revisedLines);
        if (patch.getDeltas().isEmpty()) {
            return "";
        }

        List<String> unifiedDiff = UnifiedDiffUtils.generateUnifiedDiff(
                "a/" + fileName,
                "b/" + fileName,
                originalLines,
                patch,
                contextLines);

        return String.join("\n", unifiedDiff);
    }
}
