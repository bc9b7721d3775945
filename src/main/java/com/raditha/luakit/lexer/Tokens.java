package com.raditha.luakit.lexer;

import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;

import java.util.Deque;
import java.util.List;

/**
 * Navigation helpers over token lists that skip whitespace, newlines and
 * comments.
 */
public final class Tokens {

    private Tokens() {
    }

    /**
     * Index of the first non-trivia token at or after {@code from}, or -1.
     */
    public static int nextSignificant(List<Token> tokens, int from) {
        for (int i = Math.max(from, 0); i < tokens.size(); i++) {
            if (!tokens.get(i).isTrivia()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Index of the last non-trivia token at or before {@code from}, or -1.
     */
    public static int previousSignificant(List<Token> tokens, int from) {
        for (int i = Math.min(from, tokens.size() - 1); i >= 0; i--) {
            if (!tokens.get(i).isTrivia()) {
                return i;
            }
        }
        return -1;
    }

    /**
     * The token at {@code index}, or null when the index is out of range.
     */
    public static @Nullable Token at(List<Token> tokens, int index) {
        return index >= 0 && index < tokens.size() ? tokens.get(index) : null;
    }

    /**
     * True when the token at {@code index} exists and is the given operator
     * or punctuation.
     */
    public static boolean isSymbolAt(List<Token> tokens, int index, String symbol) {
        Token token = at(tokens, index);
        return token != null && token.isSymbol(symbol);
    }

    public static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token token : tokens) {
            sb.append(token.lexeme());
        }
        return sb.toString();
    }

    /**
     * Maintain a stack of open brackets while walking a token list.
     */
    public static void trackBrackets(Token token, Deque<String> brackets) {
        if (token.type() != TokenType.PUNCTUATION) {
            return;
        }
        switch (token.lexeme()) {
            case "{", "(", "[" -> brackets.push(token.lexeme());
            case "}", ")", "]" -> {
                if (!brackets.isEmpty()) {
                    brackets.pop();
                }
            }
            default -> {
                // separators do not nest
            }
        }
    }

    /**
     * True when the identifier at {@code index} is the key of a
     * {@code { key = value }} entry. {@code brackets} must hold the brackets
     * open at {@code index}.
     */
    public static boolean isTableKey(List<Token> tokens, int index, Deque<String> brackets) {
        if (!"{".equals(brackets.peek())) {
            return false;
        }
        int prev = previousSignificant(tokens, index - 1);
        boolean afterSeparator = isSymbolAt(tokens, prev, "{")
                || isSymbolAt(tokens, prev, ",")
                || isSymbolAt(tokens, prev, ";");
        return afterSeparator && isSymbolAt(tokens, nextSignificant(tokens, index + 1), "=");
    }
}
