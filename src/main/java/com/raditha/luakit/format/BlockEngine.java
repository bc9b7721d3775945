package com.raditha.luakit.format;

import com.raditha.luakit.model.BlockMode;
import com.raditha.luakit.model.DepthToken;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Assigns a block nesting depth to every token.
 * <p>
 * Depth drops before {@code end}, {@code until}, {@code else} and
 * {@code elseif} and rises after {@code function}, {@code do}, {@code then},
 * {@code repeat} and {@code else}. An {@code elseif} is re-opened by its own
 * {@code then}. Depth never goes below zero, so unmatched closers are
 * harmless. Whitespace and newline tokens take the current depth.
 * <p>
 * Two rules differ from the plain "{@code function}, {@code do} and
 * {@code then} open" reading. {@code repeat} opens a level so that its
 * {@code until} has one to close, and {@code elseif} does not re-open by
 * itself, because counting both it and its {@code then} would leave every
 * {@code elseif} chain one level too deep.
 * <p>
 * An {@link TokenType#UNKNOWN} token switches the engine to
 * {@link BlockMode#SAFE} for the rest of the run. The engine itself does not
 * behave differently in safe mode; the flag is read by collaborators.
 */
public class BlockEngine {

    private static final Set<String> OPENERS = Set.of("function", "do", "then", "repeat", "else");
    private static final Set<String> CLOSERS = Set.of("end", "until", "else", "elseif");

    private int depth;
    private BlockMode mode = BlockMode.NORMAL;

    /**
     * Annotate a token stream. Resets depth but keeps the mode from earlier
     * runs, since safe mode is sticky.
     */
    public List<DepthToken> process(List<Token> tokens) {
        depth = 0;
        List<DepthToken> output = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() == TokenType.UNKNOWN) {
                mode = BlockMode.SAFE;
            }
            if (token.type() != TokenType.KEYWORD) {
                output.add(new DepthToken(token, depth));
                continue;
            }
            String keyword = token.lexeme();
            if (CLOSERS.contains(keyword)) {
                depth = Math.max(0, depth - 1);
            }
            output.add(new DepthToken(token, depth));
            if (OPENERS.contains(keyword)) {
                depth++;
            }
        }
        return output;
    }

    public BlockMode mode() {
        return mode;
    }

    /**
     * Depth after the last processed token.
     */
    public int depth() {
        return depth;
    }
}
