package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Evaluates purely numeric expressions.
 * <p>
 * Two shapes are folded: a parenthesized expression that is not a call's
 * argument list, and the right-hand side of {@code name = expr} when the
 * expression visibly ends there. A negative result keeps its parentheses so
 * that a following {@code ^} still applies to the whole value.
 */
public class ConstantFoldPass implements RewritePass {

    private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "//", "%", "^");

    @Override
    public String name() {
        return "constant folding";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        return foldAssignments(foldParentheses(tokens));
    }

    private static List<Token> foldParentheses(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token before = Tokens.at(tokens, TokenEdits.previous(tokens, i));
            boolean parameterList = before != null && before.isKeyword("function");
            if (token.isSymbol("(") && !TokenEdits.endsCallable(before) && !parameterList) {
                int close = TokenEdits.matchingClose(tokens, i);
                if (close > 0 && !TokenEdits.startsSuffix(Tokens.at(tokens, TokenEdits.next(tokens, close)))) {
                    String value = ExpressionEvaluator.evaluate(tokens.subList(i + 1, close));
                    if (value != null) {
                        if (value.startsWith("-")) {
                            result.add(token);
                            result.add(new Token(TokenType.OPERATOR, "-"));
                            result.add(new Token(TokenType.NUMBER, value.substring(1)));
                            result.add(tokens.get(close));
                        } else {
                            result.add(new Token(TokenType.NUMBER, value));
                        }
                        i = close;
                        continue;
                    }
                }
            }
            result.add(token);
        }
        return result;
    }

    private static List<Token> foldAssignments(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            result.add(token);
            if (!token.isSymbol("=")) {
                continue;
            }
            int start = TokenEdits.next(tokens, i);
            int end = numericRunEnd(tokens, start);
            if (end <= start || !TokenEdits.endsExpression(tokens, end)) {
                continue;
            }
            String value = ExpressionEvaluator.evaluate(tokens.subList(start, end + 1));
            if (value != null) {
                result.addAll(tokens.subList(i + 1, start));
                result.add(new Token(TokenType.NUMBER, value));
                i = end;
            }
        }
        return result;
    }

    /**
     * Index of the last token of the longest run of numbers, arithmetic
     * operators and balanced parentheses starting at {@code start}, or -1.
     */
    private static int numericRunEnd(List<Token> tokens, int start) {
        int last = -1;
        int depth = 0;
        for (int i = start; i >= 0 && i < tokens.size(); i = TokenEdits.next(tokens, i)) {
            Token token = tokens.get(i);
            if (token.isSymbol("(")) {
                depth++;
            } else if (token.isSymbol(")")) {
                if (depth == 0) {
                    break;
                }
                depth--;
            } else if (token.type() != TokenType.NUMBER
                    && !(token.type() == TokenType.OPERATOR && ARITHMETIC.contains(token.lexeme()))) {
                break;
            }
            last = i;
        }
        return depth == 0 ? last : -1;
    }
}
