package com.raditha.luakit.minify;

import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

/**
 * Decides when two adjacent tokens need a separating space so that
 * re-tokenizing the output yields the same tokens.
 */
public final class TokenSpacing {

    private TokenSpacing() {
    }

    /**
     * True if printing {@code prev} immediately followed by {@code curr} would
     * merge them into different tokens.
     */
    public static boolean needsSeparator(Token prev, Token curr) {
        if (isWord(prev) && isWord(curr)) {
            return true;
        }
        String a = prev.lexeme();
        String b = curr.lexeme();
        if (a.isEmpty() || b.isEmpty()) {
            return false;
        }
        // "a..b" would lex as one number or lose the operator
        if ((a.equals("..") || a.equals("...")) && (isNameOrNumber(curr) || b.startsWith("."))) {
            return true;
        }
        if ((b.equals("..") || b.equals("...")) && isNameOrNumber(prev)) {
            return true;
        }
        if (prev.type() == TokenType.NUMBER && (b.startsWith(".") || Character.isLetterOrDigit(b.charAt(0)) || b.charAt(0) == '_')) {
            return true;
        }
        if (a.endsWith(".") && b.startsWith(".")) {
            return true;
        }
        // two dashes start a comment
        if (a.endsWith("-") && b.startsWith("-")) {
            return true;
        }
        // "[" followed by "[" or "=" can open a long bracket
        if (a.endsWith("[") && (b.startsWith("[") || b.startsWith("="))) {
            return true;
        }
        // operator characters that would fuse into a longer operator
        return isSymbol(prev) && isSymbol(curr) && fuses(a, b);
    }

    private static boolean fuses(String a, String b) {
        String joined = a + b;
        char last = a.charAt(a.length() - 1);
        char first = b.charAt(0);
        if (first == '=' && "=~<>+-*/%^.".indexOf(last) >= 0) {
            return true;
        }
        if (last == '/' && first == '/') {
            return true;
        }
        if (last == ':' && first == ':') {
            return true;
        }
        return joined.contains("...") && !a.equals("...") && !b.equals("...");
    }

    private static boolean isSymbol(Token token) {
        return token.type() == TokenType.OPERATOR || token.type() == TokenType.PUNCTUATION;
    }

    /**
     * Keywords, identifiers and numbers: tokens made of name characters.
     */
    public static boolean isWord(Token token) {
        return token.type() == TokenType.KEYWORD
                || token.type() == TokenType.IDENTIFIER
                || token.type() == TokenType.NUMBER;
    }

    private static boolean isNameOrNumber(Token token) {
        return token.type() == TokenType.IDENTIFIER || token.type() == TokenType.NUMBER;
    }
}
