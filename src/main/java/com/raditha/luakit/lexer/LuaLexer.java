package com.raditha.luakit.lexer;

import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits Lua and Luau source into tokens.
 * <p>
 * The lexer is total: it never throws, and every input character ends up in
 * exactly one token, so joining the lexemes gives back the input. Unterminated
 * strings and long brackets run to the end of the input, and characters that
 * start no token become single-character {@link TokenType#UNKNOWN} tokens.
 * A {@code \n}, {@code \r} or {@code \r\n} line break is one
 * {@link TokenType#NEWLINE} token.
 */
public class LuaLexer {

    private static final String[] THREE_CHAR_OPERATORS = { "...", "..=", "//=" };

    private static final String[] TWO_CHAR_OPERATORS = {
            "==", "~=", "<=", ">=", "..", "//", "::", "+=", "-=", "*=", "/=", "%=", "^=" };

    private static final String SINGLE_CHAR_OPERATORS = "+-*/%^#&~|<>=";

    private static final String PUNCTUATION = "(){}[];:,.";

    private final LuaVocabulary vocabulary;

    public LuaLexer() {
        this(LuaVocabulary.standard());
    }

    public LuaLexer(LuaVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Tokenize the whole text.
     *
     * @param text Lua source, may be empty
     * @return tokens in source order
     */
    public List<Token> tokenize(String text) {
        return new Scan(text == null ? "" : text).run();
    }

    /**
     * Level of a long bracket opening at {@code pos}, or -1 if the text at
     * {@code pos} is not {@code [=*[}.
     */
    public static int longBracketLevel(String text, int pos) {
        if (pos >= text.length() || text.charAt(pos) != '[') {
            return -1;
        }
        int i = pos + 1;
        while (i < text.length() && text.charAt(i) == '=') {
            i++;
        }
        if (i < text.length() && text.charAt(i) == '[') {
            return i - pos - 1;
        }
        return -1;
    }

    static boolean isBlank(char c) {
        return c == ' ' || c == '\t' || c == '\f' || c == '\u000B';
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    /**
     * Scanner state for one invocation.
     */
    private final class Scan {
        private final String text;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;
        private int line = 1;
        private int column = 1;

        Scan(String text) {
            this.text = text;
        }

        List<Token> run() {
            while (pos < text.length()) {
                int start = pos;
                int startLine = line;
                int startColumn = column;
                TokenType type = scanToken();
                tokens.add(new Token(type, text.substring(start, pos), startLine, startColumn));
            }
            return tokens;
        }

        private char peek(int offset) {
            int p = pos + offset;
            return p < text.length() ? text.charAt(p) : '\0';
        }

        private boolean has(int offset) {
            return pos + offset < text.length();
        }

        private void advance(int count) {
            for (int n = 0; n < count && pos < text.length(); n++) {
                char c = text.charAt(pos);
                if (c == '\n' || (c == '\r' && !(pos + 1 < text.length() && text.charAt(pos + 1) == '\n'))) {
                    line++;
                    column = 1;
                } else {
                    column++;
                }
                pos++;
            }
        }

        private void advanceTo(int end) {
            advance(end - pos);
        }

        private TokenType scanToken() {
            char c = peek(0);

            if (c == '\n' || c == '\r') {
                advance(c == '\r' && peek(1) == '\n' ? 2 : 1);
                return TokenType.NEWLINE;
            }
            if (isBlank(c)) {
                while (has(0) && isBlank(peek(0))) {
                    advance(1);
                }
                return TokenType.WHITESPACE;
            }
            if (c == '-' && peek(1) == '-') {
                scanComment();
                return TokenType.COMMENT;
            }
            if (c == '"' || c == '\'') {
                scanQuoted(c);
                return TokenType.STRING;
            }
            if (c == '[') {
                int level = longBracketLevel(text, pos);
                if (level >= 0) {
                    scanLongBracket(level + 2, level);
                    return TokenType.STRING;
                }
            }
            if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
                scanNumber();
                return TokenType.NUMBER;
            }
            if (isIdentifierStart(c)) {
                int start = pos;
                while (has(0) && isIdentifierPart(peek(0))) {
                    advance(1);
                }
                return vocabulary.isKeyword(text.substring(start, pos)) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
            }
            return scanSymbol();
        }

        private void scanComment() {
            int level = longBracketLevel(text, pos + 2);
            if (level >= 0) {
                scanLongBracket(level + 4, level);
                return;
            }
            while (has(0) && peek(0) != '\n' && peek(0) != '\r') {
                advance(1);
            }
        }

        /**
         * Consume a long bracket span whose opener is {@code openLength}
         * characters long. Only the closer of the same level ends the span.
         */
        private void scanLongBracket(int openLength, int level) {
            String closer = "]" + "=".repeat(level) + "]";
            int close = text.indexOf(closer, pos + openLength);
            advanceTo(close < 0 ? text.length() : close + closer.length());
        }

        private void scanQuoted(char quote) {
            advance(1);
            while (has(0)) {
                char c = peek(0);
                if (c == '\\') {
                    boolean crlf = peek(1) == '\r' && peek(2) == '\n';
                    advance(crlf ? 3 : 2);
                } else if (c == quote) {
                    advance(1);
                    return;
                } else if (c == '\n' || c == '\r') {
                    return;
                } else {
                    advance(1);
                }
            }
        }

        private void scanNumber() {
            char c = peek(0);
            char x = peek(1);
            if (c == '0' && (x == 'x' || x == 'X')) {
                advance(2);
                while (has(0) && (isHexDigit(peek(0)) || peek(0) == '.' || peek(0) == '_')) {
                    advance(1);
                }
                scanExponent('p', 'P');
                return;
            }
            if (c == '0' && (x == 'b' || x == 'B') && (peek(2) == '0' || peek(2) == '1')) {
                advance(2);
                while (has(0) && (peek(0) == '0' || peek(0) == '1' || peek(0) == '_')) {
                    advance(1);
                }
                return;
            }
            while (has(0) && (isDigit(peek(0)) || peek(0) == '.' || peek(0) == '_')) {
                advance(1);
            }
            scanExponent('e', 'E');
        }

        private void scanExponent(char lower, char upper) {
            char c = peek(0);
            if (c != lower && c != upper) {
                return;
            }
            char next = peek(1);
            if (isDigit(next)) {
                advance(1);
            } else if ((next == '+' || next == '-') && isDigit(peek(2))) {
                advance(2);
            } else {
                return;
            }
            while (has(0) && isDigit(peek(0))) {
                advance(1);
            }
        }

        private TokenType scanSymbol() {
            for (String op : THREE_CHAR_OPERATORS) {
                if (text.startsWith(op, pos)) {
                    advance(3);
                    return TokenType.OPERATOR;
                }
            }
            for (String op : TWO_CHAR_OPERATORS) {
                if (text.startsWith(op, pos)) {
                    advance(2);
                    return op.equals("::") ? TokenType.PUNCTUATION : TokenType.OPERATOR;
                }
            }
            char c = peek(0);
            advance(1);
            if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
                return TokenType.OPERATOR;
            }
            if (PUNCTUATION.indexOf(c) >= 0) {
                return TokenType.PUNCTUATION;
            }
            return TokenType.UNKNOWN;
        }
    }
}
