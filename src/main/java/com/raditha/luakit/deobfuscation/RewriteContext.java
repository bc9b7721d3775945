package com.raditha.luakit.deobfuscation;

/**
 * Per-invocation settings passed to every pass.
 *
 * @param inlineBudget remaining levels of {@code load} payloads that may be
 *                     inlined; 0 disables inlining
 */
public record RewriteContext(int inlineBudget) {

    public RewriteContext {
        if (inlineBudget < 0) {
            throw new IllegalArgumentException("inlineBudget must be non-negative");
        }
    }
}
