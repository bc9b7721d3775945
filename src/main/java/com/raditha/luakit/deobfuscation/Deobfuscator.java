package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.lexer.LuaLexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the deobfuscation passes over a chunk.
 * <p>
 * Passes run in a fixed order: string decoding, payload inlining, constant
 * folding, concatenation merging, constant propagation and parenthesis
 * removal, followed by a cleanup pass. Each pass sees the previous pass's
 * output re-tokenized. A pass that throws is logged and skipped; its input
 * flows on unchanged.
 */
public class Deobfuscator {
    private static final Logger logger = LoggerFactory.getLogger(Deobfuscator.class);

    public static final int DEFAULT_MAX_INLINE_DEPTH = 3;

    private final LuaLexer lexer;
    private final List<RewritePass> passes;
    private final ObfuscatedNameRenamer renamer;

    public Deobfuscator() {
        this(LuaVocabulary.standard());
    }

    public Deobfuscator(LuaVocabulary vocabulary) {
        this.lexer = new LuaLexer(vocabulary);
        this.renamer = new ObfuscatedNameRenamer(vocabulary);
        this.passes = List.of(
                new StringCharDecodePass(),
                new StringByteDecodePass(),
                new EscapeNormalizationPass(),
                new PayloadInlinePass(this, lexer),
                new ConstantFoldPass(),
                new ConcatMergePass(),
                new ConstantPropagationPass(),
                new RedundantParenPass(),
                new CleanupPass());
    }

    /**
     * Pipeline with custom passes.
     */
    public Deobfuscator(LuaVocabulary vocabulary, List<RewritePass> passes) {
        this.lexer = new LuaLexer(vocabulary);
        this.renamer = new ObfuscatedNameRenamer(vocabulary);
        this.passes = new ArrayList<>(passes);
    }

    public String deobfuscate(String source) {
        return deobfuscate(source, DEFAULT_MAX_INLINE_DEPTH, false);
    }

    /**
     * Deobfuscate a chunk.
     *
     * @param source         Lua source
     * @param maxInlineDepth how many nested {@code load} payloads to inline
     * @param renameVars     also rename machine-generated local names
     * @return the rewritten source, trimmed, without formatting
     * @throws IllegalArgumentException if {@code maxInlineDepth} is negative
     */
    public String deobfuscate(String source, int maxInlineDepth, boolean renameVars) {
        RewriteContext context = new RewriteContext(maxInlineDepth);
        String text = source == null ? "" : source;
        for (RewritePass pass : passes) {
            text = runPass(pass, text, context);
        }
        if (renameVars) {
            try {
                text = TokenEdits.join(renamer.rename(lexer.tokenize(text)));
            } catch (RuntimeException e) {
                logger.warn("Renaming failed, keeping original names: {}", e.getMessage());
            }
        }
        return text;
    }

    private String runPass(RewritePass pass, String text, RewriteContext context) {
        try {
            return TokenEdits.join(pass.apply(lexer.tokenize(text), context));
        } catch (RuntimeException e) {
            logger.warn("Pass '{}' failed, keeping its input: {}", pass.name(), e.getMessage());
            logger.debug("Pass failure", e);
            return text;
        }
    }

    public List<RewritePass> passes() {
        return List.copyOf(passes);
    }
}
