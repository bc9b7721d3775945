package com.raditha.luakit.format;

import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.minify.TokenSpacing;
import com.raditha.luakit.model.DepthToken;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.List;
import java.util.Set;

/**
 * Pretty-prints a token stream with block indentation.
 * <p>
 * Existing line breaks are kept (runs of blank lines collapse to one), a
 * line break is added before statement keywords that do not already start a
 * line, and every line is indented by its first token's block depth.
 * Comments and strings are copied verbatim. Formatting formatted output
 * returns it unchanged.
 * <p>
 * Spacing goes beyond separating words, commas and binary operators. A
 * keyword is followed by a space unless a closing bracket, separator or
 * member access comes next, and preceded by one unless it follows an
 * opening bracket, member access or {@code #}, so {@code if(x)then} becomes
 * {@code if (x) then}. A comment is always preceded by a space. Unary
 * operators stay attached to their operand, and {@code function(} keeps its
 * parenthesis. The binary set also covers {@code //} and the Luau compound
 * assignments.
 */
public class LuaFormatter {

    private static final Set<String> LINE_START_KEYWORDS = Set.of(
            "function", "if", "for", "while", "repeat", "else", "elseif");

    private static final Set<String> BINARY_OPERATORS = Set.of(
            "=", "==", "~=", "<=", ">=", "<", ">", "+", "-", "*", "/", "//", "%", "^", "..",
            "and", "or", "+=", "-=", "*=", "/=", "//=", "%=", "^=", "..=");

    private static final Set<String> UNARY_OPERATORS = Set.of("-", "#", "~", "not");

    /** Tokens after which no space follows a keyword. */
    private static final Set<String> CLOSE_OR_ACCESS = Set.of(",", ";", ")", "]", "}", ".", ":");

    /** Tokens after which no space precedes a keyword. */
    private static final Set<String> OPEN_OR_ACCESS = Set.of("(", "[", "{", ".", ":", "#");

    private static final Set<String> EXPRESSION_KEYWORDS = Set.of("local", "return", "and", "or", "not", "in");

    private static final Set<String> VALUE_KEYWORDS = Set.of("end", "true", "false", "nil");

    private final LuaLexer lexer;

    public LuaFormatter() {
        this(new LuaLexer());
    }

    public LuaFormatter(LuaLexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Tokenize and format source text.
     */
    public String format(String source, String indentUnit) {
        return format(lexer.tokenize(source), indentUnit);
    }

    /**
     * Format a token stream.
     *
     * @param tokens     tokens from {@link LuaLexer}
     * @param indentUnit text repeated once per depth level, e.g. a tab
     * @return formatted text ending in exactly one newline
     */
    public String format(List<Token> tokens, String indentUnit) {
        return formatAnnotated(new BlockEngine().process(tokens), indentUnit);
    }

    /**
     * Format tokens that already carry their block depth.
     */
    public String formatAnnotated(List<DepthToken> annotated, String indentUnit) {
        StringBuilder out = new StringBuilder();
        boolean atLineStart = true;
        int pendingNewlines = 0;
        Token previous = null;
        boolean previousUnary = false;
        Token previousCode = null;

        for (DepthToken dt : annotated) {
            Token token = dt.token();
            if (token.type() == TokenType.WHITESPACE) {
                continue;
            }
            if (token.type() == TokenType.NEWLINE) {
                if (previous != null) {
                    pendingNewlines = Math.min(pendingNewlines + 1, 2);
                }
                continue;
            }

            boolean unary = isUnary(token, previousCode);
            if (previous != null && (pendingNewlines > 0 || (!atLineStart && startsLine(token, previousCode)))) {
                out.append("\n".repeat(Math.max(1, pendingNewlines)));
                atLineStart = true;
            }
            pendingNewlines = 0;

            if (atLineStart) {
                out.append(indentUnit.repeat(dt.depth()));
            } else if (needsSpace(previous, previousUnary, token, unary)) {
                out.append(' ');
            }
            out.append(token.lexeme());

            atLineStart = false;
            previous = token;
            previousUnary = unary;
            if (token.type() != TokenType.COMMENT) {
                previousCode = token;
            }
        }

        int end = out.length();
        while (end > 0 && Character.isWhitespace(out.charAt(end - 1))) {
            end--;
        }
        out.setLength(end);
        return out.append('\n').toString();
    }

    private static boolean startsLine(Token token, Token previousCode) {
        if (token.type() != TokenType.KEYWORD || !LINE_START_KEYWORDS.contains(token.lexeme())) {
            return false;
        }
        boolean expressionKeyword = token.isKeyword("function") || token.isKeyword("if");
        return !(expressionKeyword && inExpressionPosition(previousCode));
    }

    private static boolean inExpressionPosition(Token previousCode) {
        if (previousCode == null) {
            return false;
        }
        return switch (previousCode.type()) {
            case OPERATOR -> !previousCode.lexeme().equals("...");
            case PUNCTUATION -> Set.of("(", ",", "{", "[").contains(previousCode.lexeme());
            case KEYWORD -> EXPRESSION_KEYWORDS.contains(previousCode.lexeme());
            default -> false;
        };
    }

    /**
     * A prefix operator: one that follows an operator, an opening bracket, a
     * separator or a statement keyword rather than a value.
     */
    private static boolean isUnary(Token token, Token previousCode) {
        boolean operator = token.type() == TokenType.OPERATOR || token.type() == TokenType.KEYWORD;
        if (!operator || !UNARY_OPERATORS.contains(token.lexeme())) {
            return false;
        }
        if (previousCode == null) {
            return true;
        }
        return switch (previousCode.type()) {
            case OPERATOR -> !previousCode.lexeme().equals("...");
            case PUNCTUATION -> !Set.of(")", "]", "}").contains(previousCode.lexeme());
            case KEYWORD -> !VALUE_KEYWORDS.contains(previousCode.lexeme());
            default -> false;
        };
    }

    private static boolean needsSpace(Token prev, boolean prevUnary, Token curr, boolean currUnary) {
        if (TokenSpacing.needsSeparator(prev, curr) || curr.type() == TokenType.COMMENT) {
            return true;
        }
        if (isWord(prev) && isWord(curr)) {
            return true;
        }
        if (prev.isSymbol(",") || prev.isSymbol(";")) {
            return true;
        }
        if (isBinary(prev) && !prevUnary) {
            return true;
        }
        if (isBinary(curr) && !currUnary) {
            return true;
        }
        if (prev.type() == TokenType.KEYWORD && !prevUnary
                && !CLOSE_OR_ACCESS.contains(curr.lexeme())
                && !(prev.isKeyword("function") && curr.isSymbol("("))) {
            return true;
        }
        return curr.type() == TokenType.KEYWORD && !OPEN_OR_ACCESS.contains(prev.lexeme());
    }

    private static boolean isBinary(Token token) {
        return (token.type() == TokenType.OPERATOR || token.type() == TokenType.KEYWORD)
                && BINARY_OPERATORS.contains(token.lexeme());
    }

    private static boolean isWord(Token token) {
        return TokenSpacing.isWord(token) || token.type() == TokenType.STRING || token.lexeme().equals("...");
    }
}
