package com.raditha.luakit.model;

/**
 * Lexical category of a Lua token.
 * Every character of the source belongs to exactly one token, so whitespace
 * and newlines are token types of their own.
 */
public enum TokenType {
    /** Reserved word (and, end, function, local, continue, ...) */
    KEYWORD,

    /** Name that is not a keyword */
    IDENTIFIER,

    /** Arithmetic, comparison, concatenation and assignment operators */
    OPERATOR,

    /** Brackets, separators and the field/method access dots */
    PUNCTUATION,

    /** Decimal or hexadecimal numeric literal */
    NUMBER,

    /** Quoted or long-bracket string literal, delimiters included */
    STRING,

    /** Line or long-bracket comment, leading dashes included */
    COMMENT,

    /** A single line feed */
    NEWLINE,

    /** Run of blanks that does not contain a line feed */
    WHITESPACE,

    /** Character the lexer does not recognise; kept so nothing is dropped */
    UNKNOWN;

    /**
     * Whether tokens of this type carry no meaning for the program.
     */
    public boolean isTrivia() {
        return this == WHITESPACE || this == NEWLINE || this == COMMENT;
    }
}
