package com.raditha.luakit.minify;

/**
 * Size statistics for one minification.
 */
public record MinifyResult(
        String output,
        int originalBytes,
        int minifiedBytes,
        int originalLines,
        int minifiedLines,
        int renamedLocals) {

    /**
     * Percentage of bytes removed, 0 for empty input.
     */
    public double reductionPercent() {
        if (originalBytes == 0) {
            return 0.0;
        }
        return (originalBytes - minifiedBytes) * 100.0 / originalBytes;
    }
}
