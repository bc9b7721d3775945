package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.LuaStrings;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Replaces {@code string.char(72, 105)} with the literal {@code "Hi"} when
 * every argument is an integer literal between 0 and 255. The literal is
 * parenthesized when a method call or index follows it.
 */
public class StringCharDecodePass implements RewritePass {

    @Override
    public String name() {
        return "string.char decoding";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            int open = TokenEdits.libraryCall(tokens, i, "string", "char");
            if (open >= 0) {
                int close = TokenEdits.matchingClose(tokens, open);
                byte[] bytes = close < 0 ? null : decodeArguments(tokens, open, close);
                if (bytes != null) {
                    Token literal = new Token(TokenType.STRING, LuaStrings.quote(bytes, '"'));
                    if (TokenEdits.startsSuffix(Tokens.at(tokens, TokenEdits.next(tokens, close)))) {
                        result.add(new Token(TokenType.PUNCTUATION, "("));
                        result.add(literal);
                        result.add(new Token(TokenType.PUNCTUATION, ")"));
                    } else {
                        result.add(literal);
                    }
                    i = close;
                    continue;
                }
            }
            result.add(tokens.get(i));
        }
        return result;
    }

    /**
     * Byte values of a comma-separated list of integer literals, or null if
     * any argument is something else or out of range.
     */
    private static byte @Nullable [] decodeArguments(List<Token> tokens, int open, int close) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int i = TokenEdits.next(tokens, open);
        if (i == close) {
            return out.toByteArray();
        }
        while (true) {
            Token arg = Tokens.at(tokens, i);
            if (arg == null || arg.type() != TokenType.NUMBER) {
                return null;
            }
            Long value = parseInteger(arg.lexeme());
            if (value == null || value < 0 || value > 255) {
                return null;
            }
            out.write(value.intValue());
            i = TokenEdits.next(tokens, i);
            if (i == close) {
                return out.toByteArray();
            }
            if (!Tokens.isSymbolAt(tokens, i, ",")) {
                return null;
            }
            i = TokenEdits.next(tokens, i);
        }
    }

    /**
     * Value of a decimal or hexadecimal integer literal, or null.
     */
    static @Nullable Long parseInteger(String lexeme) {
        String digits = lexeme.replace("_", "");
        int radix = 10;
        if (digits.startsWith("0x") || digits.startsWith("0X")) {
            digits = digits.substring(2);
            radix = 16;
        }
        if (digits.isEmpty() || digits.length() > 12) {
            return null;
        }
        for (int k = 0; k < digits.length(); k++) {
            if (Character.digit(digits.charAt(k), radix) < 0) {
                return null;
            }
        }
        return Long.parseLong(digits, radix);
    }
}
