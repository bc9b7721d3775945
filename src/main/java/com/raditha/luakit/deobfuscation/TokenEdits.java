package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.minify.TokenSpacing;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Token matching helpers shared by the rewrite passes.
 */
final class TokenEdits {

    /** Tokens that, placed after a value, index or call it. */
    private static final Set<String> SUFFIX_STARTS = Set.of(".", ":", "[", "(", "{");

    private static final Map<String, String> CLOSING = Map.of("(", ")", "[", "]", "{", "}");

    private TokenEdits() {
    }

    static int next(List<Token> tokens, int index) {
        return Tokens.nextSignificant(tokens, index + 1);
    }

    static int previous(List<Token> tokens, int index) {
        return Tokens.previousSignificant(tokens, index - 1);
    }

    static boolean isName(@Nullable Token token, String name) {
        return token != null && token.type() == TokenType.IDENTIFIER && token.lexeme().equals(name);
    }

    /**
     * True when a {@code (} or a string placed after this token would call
     * the value the token ends.
     */
    static boolean endsCallable(@Nullable Token token) {
        if (token == null) {
            return false;
        }
        return token.type() == TokenType.IDENTIFIER
                || token.type() == TokenType.STRING
                || token.isSymbol(")") || token.isSymbol("]") || token.isSymbol("}");
    }

    /**
     * True when this token would index or call a value placed before it.
     */
    static boolean startsSuffix(@Nullable Token token) {
        if (token == null) {
            return false;
        }
        return token.type() == TokenType.STRING
                || (token.type() == TokenType.PUNCTUATION && SUFFIX_STARTS.contains(token.lexeme()));
    }

    /**
     * True when the token at {@code index} follows {@code .} or {@code :}.
     */
    static boolean isFieldAccess(List<Token> tokens, int index) {
        int prev = previous(tokens, index);
        return Tokens.isSymbolAt(tokens, prev, ".") || Tokens.isSymbolAt(tokens, prev, ":");
    }

    /**
     * Index of the bracket closing the {@code (}, {@code [} or {@code {} at
     * {@code open}, or -1.
     */
    static int matchingClose(List<Token> tokens, int open) {
        Token opener = Tokens.at(tokens, open);
        String close = opener == null ? null : CLOSING.get(opener.lexeme());
        if (close == null) {
            return -1;
        }
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isSymbol(opener.lexeme())) {
                depth++;
            } else if (token.isSymbol(close)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Match {@code object.member(} starting at {@code index}.
     *
     * @return index of the opening parenthesis, or -1
     */
    static int libraryCall(List<Token> tokens, int index, String object, String member) {
        if (!isName(Tokens.at(tokens, index), object) || isFieldAccess(tokens, index)) {
            return -1;
        }
        int dot = next(tokens, index);
        int name = next(tokens, dot);
        int open = next(tokens, name);
        if (Tokens.isSymbolAt(tokens, dot, ".") && isName(Tokens.at(tokens, name), member)
                && Tokens.isSymbolAt(tokens, open, "(")) {
            return open;
        }
        return -1;
    }

    /**
     * True when the expression ending at {@code last} cannot continue: the
     * next token is a line break, comment, end of input, a keyword, an
     * identifier or one of {@code ; , ) }}.
     */
    static boolean endsExpression(List<Token> tokens, int last) {
        for (int i = last + 1; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case WHITESPACE:
                    continue;
                case NEWLINE:
                case COMMENT:
                case KEYWORD:
                case IDENTIFIER:
                    return true;
                default:
                    return token.isSymbol(";") || token.isSymbol(",")
                            || token.isSymbol(")") || token.isSymbol("}");
            }
        }
        return true;
    }

    /**
     * Join tokens back into text, adding a space wherever two neighbours
     * would otherwise lex as one token.
     */
    static String join(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && !previous.isTrivia() && !token.isTrivia()
                    && TokenSpacing.needsSeparator(previous, token)) {
                sb.append(' ');
            }
            sb.append(token.lexeme());
            previous = token;
        }
        return sb.toString();
    }
}
