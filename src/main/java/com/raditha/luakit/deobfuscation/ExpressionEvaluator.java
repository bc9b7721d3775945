package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates arithmetic over decimal number literals.
 * <p>
 * Precedence follows Lua: {@code ^} binds tightest and is right
 * associative, then unary minus, then {@code * / // %}, then {@code + -}.
 * Anything else (names, strings, hex literals, other operators) makes the
 * expression unevaluable.
 */
public final class ExpressionEvaluator {

    /** Integers beyond this magnitude lose precision as doubles. */
    private static final double MAX_EXACT = 9007199254740992.0;

    private final List<String> parts;
    private int pos;

    private ExpressionEvaluator(List<String> parts) {
        this.parts = parts;
    }

    /**
     * Evaluate the non-trivia tokens of an expression.
     *
     * @return the value as a Lua literal, or null if the tokens are not a
     *         purely numeric expression or the result cannot be written as a
     *         plain decimal literal
     */
    public static @Nullable String evaluate(List<Token> tokens) {
        List<String> parts = new ArrayList<>();
        for (Token token : tokens) {
            if (token.isTrivia()) {
                continue;
            }
            if (token.type() == TokenType.NUMBER) {
                if (!isDecimal(token.lexeme())) {
                    return null;
                }
            } else if (token.type() != TokenType.OPERATOR && token.type() != TokenType.PUNCTUATION) {
                return null;
            }
            parts.add(token.lexeme());
        }
        if (parts.isEmpty()) {
            return null;
        }

        ExpressionEvaluator evaluator = new ExpressionEvaluator(parts);
        Double value = evaluator.additive();
        if (value == null || evaluator.pos != parts.size()) {
            return null;
        }
        return toLiteral(value);
    }

    static @Nullable String toLiteral(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return null;
        }
        if (value == Math.rint(value)) {
            if (Math.abs(value) >= MAX_EXACT) {
                return null;
            }
            return Long.toString((long) value);
        }
        String text = Double.toString(value);
        return text.contains("E") ? null : text;
    }

    private static boolean isDecimal(String lexeme) {
        if (lexeme.isEmpty() || lexeme.startsWith("0x") || lexeme.startsWith("0X")
                || lexeme.startsWith("0b") || lexeme.startsWith("0B")) {
            return false;
        }
        for (int i = 0; i < lexeme.length(); i++) {
            char c = lexeme.charAt(i);
            boolean allowed = (c >= '0' && c <= '9') || c == '.' || c == 'e' || c == 'E' || c == '+' || c == '-';
            if (!allowed) {
                return false;
            }
        }
        return true;
    }

    private @Nullable String peek() {
        return pos < parts.size() ? parts.get(pos) : null;
    }

    private boolean accept(String symbol) {
        if (symbol.equals(peek())) {
            pos++;
            return true;
        }
        return false;
    }

    private @Nullable Double additive() {
        Double left = multiplicative();
        while (left != null) {
            if (accept("+")) {
                Double right = multiplicative();
                left = right == null ? null : left + right;
            } else if (accept("-")) {
                Double right = multiplicative();
                left = right == null ? null : left - right;
            } else {
                break;
            }
        }
        return left;
    }

    private @Nullable Double multiplicative() {
        Double left = unary();
        while (left != null) {
            String op = peek();
            if (!"*".equals(op) && !"/".equals(op) && !"//".equals(op) && !"%".equals(op)) {
                break;
            }
            pos++;
            Double right = unary();
            if (right == null) {
                return null;
            }
            left = switch (op) {
                case "*" -> left * right;
                case "/" -> left / right;
                case "//" -> Math.floor(left / right);
                default -> left - Math.floor(left / right) * right;
            };
        }
        return left;
    }

    private @Nullable Double unary() {
        if (accept("-")) {
            Double operand = unary();
            return operand == null ? null : -operand;
        }
        return power();
    }

    private @Nullable Double power() {
        Double base = primary();
        if (base == null || !accept("^")) {
            return base;
        }
        Double exponent = unary();
        return exponent == null ? null : Math.pow(base, exponent);
    }

    private @Nullable Double primary() {
        String part = peek();
        if (part == null) {
            return null;
        }
        if (accept("(")) {
            Double inner = additive();
            return inner != null && accept(")") ? inner : null;
        }
        if (part.isEmpty() || !(Character.isDigit(part.charAt(0)) || part.charAt(0) == '.')) {
            return null;
        }
        pos++;
        try {
            return Double.parseDouble(part);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
