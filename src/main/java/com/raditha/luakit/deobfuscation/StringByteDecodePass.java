package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.LuaStrings;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Replaces {@code string.byte("A")} and {@code ("A"):byte()} with the byte
 * value of the one-character literal.
 */
public class StringByteDecodePass implements RewritePass {

    @Override
    public String name() {
        return "string.byte decoding";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            int end = matchFunctionForm(tokens, i);
            if (end < 0) {
                end = matchMethodForm(tokens, i);
            }
            if (end >= 0) {
                result.add(new Token(TokenType.NUMBER, Integer.toString(singleByte(literalIn(tokens, i)))));
                i = end;
                continue;
            }
            result.add(tokens.get(i));
        }
        return result;
    }

    /** {@code string.byte(LIT)}; returns the index of the closing parenthesis. */
    private static int matchFunctionForm(List<Token> tokens, int i) {
        int open = TokenEdits.libraryCall(tokens, i, "string", "byte");
        if (open < 0) {
            return -1;
        }
        int literal = TokenEdits.next(tokens, open);
        int close = TokenEdits.next(tokens, literal);
        if (isSingleByte(Tokens.at(tokens, literal)) && Tokens.isSymbolAt(tokens, close, ")")
                && !TokenEdits.startsSuffix(Tokens.at(tokens, TokenEdits.next(tokens, close)))) {
            return close;
        }
        return -1;
    }

    /** {@code (LIT):byte()}; returns the index of the final parenthesis. */
    private static int matchMethodForm(List<Token> tokens, int i) {
        if (!Tokens.isSymbolAt(tokens, i, "(")
                || TokenEdits.endsCallable(Tokens.at(tokens, TokenEdits.previous(tokens, i)))) {
            return -1;
        }
        int literal = TokenEdits.next(tokens, i);
        int close = TokenEdits.next(tokens, literal);
        int colon = TokenEdits.next(tokens, close);
        int method = TokenEdits.next(tokens, colon);
        int open = TokenEdits.next(tokens, method);
        int end = TokenEdits.next(tokens, open);
        boolean shape = isSingleByte(Tokens.at(tokens, literal))
                && Tokens.isSymbolAt(tokens, close, ")")
                && Tokens.isSymbolAt(tokens, colon, ":")
                && TokenEdits.isName(Tokens.at(tokens, method), "byte")
                && Tokens.isSymbolAt(tokens, open, "(")
                && Tokens.isSymbolAt(tokens, end, ")");
        if (shape && !TokenEdits.startsSuffix(Tokens.at(tokens, TokenEdits.next(tokens, end)))) {
            return end;
        }
        return -1;
    }

    private static Token literalIn(List<Token> tokens, int start) {
        for (int i = start; i < tokens.size(); i++) {
            if (tokens.get(i).type() == TokenType.STRING) {
                return tokens.get(i);
            }
        }
        throw new IllegalStateException("matched call has no literal");
    }

    private static boolean isSingleByte(@Nullable Token token) {
        if (token == null || token.type() != TokenType.STRING) {
            return false;
        }
        byte[] bytes = LuaStrings.decode(token.lexeme());
        return bytes != null && bytes.length == 1;
    }

    private static int singleByte(Token literal) {
        byte[] bytes = LuaStrings.decode(literal.lexeme());
        if (bytes == null || bytes.length != 1) {
            throw new IllegalStateException("not a one-byte literal: " + literal.lexeme());
        }
        return bytes[0] & 0xFF;
    }
}
