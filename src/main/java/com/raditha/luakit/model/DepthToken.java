package com.raditha.luakit.model;

/**
 * A token annotated with the block nesting depth it was emitted at.
 *
 * @param token The token
 * @param depth Nesting depth, never negative
 */
public record DepthToken(Token token, int depth) {
}
