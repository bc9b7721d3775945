package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.model.Token;

import java.util.List;

/**
 * One step of the deobfuscation pipeline.
 * <p>
 * A pass receives the whole chunk as tokens and returns the rewritten
 * tokens. Returning the input unchanged is always allowed. The pipeline
 * re-tokenizes the result before handing it to the next pass, so a pass may
 * emit tokens whose positions are not meaningful.
 */
public interface RewritePass {

    /**
     * Short name used in log messages.
     */
    String name();

    List<Token> apply(List<Token> tokens, RewriteContext context);
}
