package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.LuaStrings;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Merges concatenations of string literals.
 * <p>
 * {@code "a" .. "b"} becomes {@code "ab"}; sweeps repeat until nothing changes
 * or the iteration cap is reached. A pair is left alone when a neighbouring
 * operator binds tighter than {@code ..}, since the literals would then
 * belong to different subexpressions. {@code table.concat} over a table of
 * literals with an optional literal separator is folded as well.
 */
public class ConcatMergePass implements RewritePass {

    static final int MAX_ITERATIONS = 100;

    /** Operators binding tighter than {@code ..}, binary or unary. */
    private static final Set<String> TIGHTER = Set.of("+", "-", "*", "/", "//", "%", "^", "#", "~");

    @Override
    public String name() {
        return "concatenation merge";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        List<Token> current = new ArrayList<>(foldTableConcat(tokens));
        for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
            if (mergeSweep(current) == 0) {
                break;
            }
        }
        return current;
    }

    /**
     * Merge mergeable pairs from left to right, in place.
     *
     * @return number of merges made
     */
    private static int mergeSweep(List<Token> tokens) {
        int merges = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token left = tokens.get(i);
            if (left.type() != TokenType.STRING) {
                continue;
            }
            int op = TokenEdits.next(tokens, i);
            int rightIndex = TokenEdits.next(tokens, op);
            Token right = Tokens.at(tokens, rightIndex);
            if (!Tokens.isSymbolAt(tokens, op, "..") || right == null || right.type() != TokenType.STRING) {
                continue;
            }
            if (!safeBefore(tokens, i) || !safeAfter(tokens, rightIndex)) {
                continue;
            }
            byte[] a = LuaStrings.decode(left.lexeme());
            byte[] b = LuaStrings.decode(right.lexeme());
            if (a == null || b == null) {
                continue;
            }
            Token merged = new Token(TokenType.STRING, LuaStrings.quote(concat(a, b), quoteOf(left)));
            tokens.subList(i, rightIndex + 1).clear();
            tokens.add(i, merged);
            merges++;
            // look at the merged literal again
            i--;
        }
        return merges;
    }

    private static boolean safeBefore(List<Token> tokens, int literal) {
        Token before = Tokens.at(tokens, TokenEdits.previous(tokens, literal));
        if (before == null) {
            return true;
        }
        if (TokenEdits.endsCallable(before) || before.type() == TokenType.NUMBER || before.isKeyword("not")) {
            return false;
        }
        return !(before.type() == TokenType.OPERATOR && TIGHTER.contains(before.lexeme()));
    }

    private static boolean safeAfter(List<Token> tokens, int literal) {
        Token after = Tokens.at(tokens, TokenEdits.next(tokens, literal));
        if (after == null) {
            return true;
        }
        if (TokenEdits.startsSuffix(after)) {
            return false;
        }
        return !(after.type() == TokenType.OPERATOR && TIGHTER.contains(after.lexeme()));
    }

    /**
     * Replace {@code table.concat({"a", "b"}, ", ")} with {@code "a, b"}.
     */
    private static List<Token> foldTableConcat(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            int open = TokenEdits.libraryCall(tokens, i, "table", "concat");
            if (open >= 0) {
                int close = TokenEdits.matchingClose(tokens, open);
                Token folded = close < 0 ? null : foldCall(tokens, open, close);
                if (folded != null && !TokenEdits.startsSuffix(Tokens.at(tokens, TokenEdits.next(tokens, close)))) {
                    result.add(folded);
                    i = close;
                    continue;
                }
            }
            result.add(tokens.get(i));
        }
        return result;
    }

    private static @Nullable Token foldCall(List<Token> tokens, int open, int close) {
        int brace = TokenEdits.next(tokens, open);
        if (!Tokens.isSymbolAt(tokens, brace, "{")) {
            return null;
        }
        List<byte[]> items = new ArrayList<>();
        char quote = '"';
        int i = TokenEdits.next(tokens, brace);
        while (!Tokens.isSymbolAt(tokens, i, "}")) {
            Token item = Tokens.at(tokens, i);
            byte[] bytes = item == null || item.type() != TokenType.STRING ? null : LuaStrings.decode(item.lexeme());
            if (bytes == null) {
                return null;
            }
            if (items.isEmpty()) {
                quote = quoteOf(item);
            }
            items.add(bytes);
            i = TokenEdits.next(tokens, i);
            if (Tokens.isSymbolAt(tokens, i, ",") || Tokens.isSymbolAt(tokens, i, ";")) {
                i = TokenEdits.next(tokens, i);
            } else if (!Tokens.isSymbolAt(tokens, i, "}")) {
                return null;
            }
        }

        byte[] separator = new byte[0];
        int after = TokenEdits.next(tokens, i);
        if (Tokens.isSymbolAt(tokens, after, ",")) {
            Token sep = Tokens.at(tokens, TokenEdits.next(tokens, after));
            separator = sep == null || sep.type() != TokenType.STRING ? null : LuaStrings.decode(sep.lexeme());
            if (separator == null || TokenEdits.next(tokens, TokenEdits.next(tokens, after)) != close) {
                return null;
            }
        } else if (after != close) {
            return null;
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (int k = 0; k < items.size(); k++) {
            if (k > 0) {
                out.writeBytes(separator);
            }
            out.writeBytes(items.get(k));
        }
        return new Token(TokenType.STRING, LuaStrings.quote(out.toByteArray(), quote));
    }

    private static char quoteOf(Token literal) {
        char first = literal.lexeme().charAt(0);
        return first == '\'' ? '\'' : '"';
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] joined = new byte[a.length + b.length];
        System.arraycopy(a, 0, joined, 0, a.length);
        System.arraycopy(b, 0, joined, a.length, b.length);
        return joined;
    }
}
