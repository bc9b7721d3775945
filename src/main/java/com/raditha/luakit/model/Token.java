package com.raditha.luakit.model;

/**
 * A single lexical token of Lua source.
 * Concatenating the lexemes of a token stream in order reproduces the
 * original text exactly.
 *
 * @param type   Token type category
 * @param lexeme Exact source text of the token
 * @param line   1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(
        TokenType type,
        String lexeme,
        int line,
        int column) {

    /**
     * Create a synthetic token that has no source position.
     */
    public Token(TokenType type, String lexeme) {
        this(type, lexeme, 0, 0);
    }

    public boolean is(TokenType expected, String text) {
        return type == expected && lexeme.equals(text);
    }

    public boolean isKeyword(String text) {
        return is(TokenType.KEYWORD, text);
    }

    /**
     * True for operators and punctuation with the given text.
     */
    public boolean isSymbol(String text) {
        return (type == TokenType.OPERATOR || type == TokenType.PUNCTUATION) && lexeme.equals(text);
    }

    public boolean isTrivia() {
        return type.isTrivia();
    }

    /**
     * Copy of this token with a different lexeme, keeping type and position.
     */
    public Token withLexeme(String text) {
        return new Token(type, text, line, column);
    }
}
