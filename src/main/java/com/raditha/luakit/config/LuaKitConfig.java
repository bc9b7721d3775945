package com.raditha.luakit.config;

import java.util.List;

/**
 * Settings for formatting, minification and deobfuscation.
 *
 * @param indent          indentation unit used by the formatter, tab or spaces
 * @param renameLocals    shorten local names when minifying
 * @param aggressive      rewrite literals and drop semicolons when minifying
 * @param maxInlineDepth  nesting levels of {@code load} payloads to inline
 * @param renameVars      rename machine-generated locals after deobfuscation
 * @param formatOutput    format deobfuscated code
 * @param extraGlobals    names added to the global allow-list
 * @param excludePatterns file patterns skipped when a directory is processed (glob format)
 */
public record LuaKitConfig(
        String indent,
        boolean renameLocals,
        boolean aggressive,
        int maxInlineDepth,
        boolean renameVars,
        boolean formatOutput,
        List<String> extraGlobals,
        List<String> excludePatterns) {
    /**
     * Validate configuration.
     */
    public LuaKitConfig {
        if (indent == null || indent.isEmpty() || !indent.isBlank()) {
            throw new IllegalArgumentException("indent must be a non-empty run of spaces or tabs");
        }
        if (maxInlineDepth < 0) {
            throw new IllegalArgumentException("maxInlineDepth must be >= 0");
        }
        extraGlobals = extraGlobals == null ? List.of() : List.copyOf(extraGlobals);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Default preset: tab indentation, full minification, inlining three
     * levels deep, formatted deobfuscation output.
     */
    public static LuaKitConfig defaults() {
        return new LuaKitConfig(
                "\t",
                true, // renameLocals
                true, // aggressive
                3, // maxInlineDepth
                false, // renameVars
                true, // formatOutput
                List.of(),
                List.of());
    }

    /**
     * Readable preset: four-space indentation, minification keeps names and
     * literals, deobfuscation renames generated locals.
     */
    public static LuaKitConfig readable() {
        return new LuaKitConfig(
                "    ",
                false,
                false,
                3,
                true,
                true,
                List.of(),
                List.of());
    }

    /**
     * Compact preset: smallest output, deobfuscated code left unformatted.
     */
    public static LuaKitConfig compact() {
        return new LuaKitConfig(
                "\t",
                true,
                true,
                3,
                false,
                false,
                List.of(),
                List.of());
    }

    /**
     * Vocabulary with {@link #extraGlobals()} added to the allow-list.
     */
    public LuaVocabulary vocabulary() {
        return LuaVocabulary.standard().withExtraGlobals(extraGlobals);
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(filePath.replace('\\', '/'), pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards.
     */
    private boolean matchesGlobPattern(String path, String pattern) {
        String regex = pattern
                .replace(".", "\\.")
                .replace("**", "\u0000")
                .replace("*", "[^/]*")
                .replace("\u0000", ".*");
        return path.matches(regex);
    }
}
