package com.raditha.luakit.model;

/**
 * Processing mode reported by the block engine.
 */
public enum BlockMode {
    /** All characters were recognised */
    NORMAL,

    /**
     * Unrecognised characters were seen. Collaborators should avoid
     * aggressive rewrites; the flag never resets.
     */
    SAFE
}
