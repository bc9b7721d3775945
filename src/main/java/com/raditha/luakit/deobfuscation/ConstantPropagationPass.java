package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.analysis.ScopeAnalyzer;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Substitutes uses of {@code local NAME = LITERAL} bindings with the literal.
 * <p>
 * A binding holds from its declaration until the name is assigned again
 * (plain, compound, as one target of a multiple assignment, or by a
 * {@code function NAME} statement), declared again, or shadowed by a
 * parameter or loop variable, and at the latest until its block closes.
 * An assignment inside a loop body invalidates the name from the opening
 * of the outermost enclosing loop, since the body may run again. With a
 * {@code goto} anywhere in the chunk, an assigned name is never
 * propagated. A name that is assigned anywhere is not substituted inside a
 * function nested below its declaration, as the function may run after the
 * assignment. Declaration sites, assignment targets, field names and table
 * keys are never replaced.
 */
public class ConstantPropagationPass implements RewritePass {

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "//=", "%=", "^=", "..=");

    private static final Set<String> OPENERS = Set.of("function", "do", "then", "repeat");
    private static final Set<String> CLOSERS = Set.of("end", "until", "elseif");

    private record Binding(Token literal, int depth, int functionDepth) {
    }

    /** An open block during the pre-scan; {@code opener} is the loop keyword for loops. */
    private record Block(boolean loop, int opener) {
    }

    /**
     * What the pre-scan learns about names: where they are declared or
     * assigned and from which token on each assignment invalidates them.
     */
    private static final class Bindings {
        final Set<Integer> declarationSites = new HashSet<>();
        final Map<Integer, Token> literalDeclarations = new HashMap<>();
        final Set<Integer> assignmentSites = new HashSet<>();
        final Set<String> assigned = new HashSet<>();
        final Map<Integer, List<String>> invalidations = new HashMap<>();
        boolean hasGoto;

        void invalidate(int index, String name) {
            invalidations.computeIfAbsent(index, k -> new ArrayList<>()).add(name);
        }
    }

    @Override
    public String name() {
        return "constant propagation";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        Bindings bindings = scanBindings(tokens);

        List<Token> result = new ArrayList<>(tokens.size());
        Map<String, Binding> constants = new HashMap<>();
        Deque<String> brackets = new ArrayDeque<>();
        Deque<Boolean> blocks = new ArrayDeque<>();
        int functionDepth = 0;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            List<String> invalidated = bindings.invalidations.get(i);
            if (invalidated != null) {
                invalidated.forEach(constants::remove);
            }
            Tokens.trackBrackets(token, brackets);

            if (token.type() == TokenType.KEYWORD) {
                String keyword = token.lexeme();
                if (CLOSERS.contains(keyword)) {
                    if (!blocks.isEmpty() && blocks.pop()) {
                        functionDepth--;
                    }
                    expire(constants, blocks.size());
                } else if (keyword.equals("else")) {
                    expire(constants, blocks.size() - 1);
                } else if (OPENERS.contains(keyword)) {
                    boolean function = keyword.equals("function");
                    blocks.push(function);
                    if (function) {
                        functionDepth++;
                    }
                }
                result.add(token);
                continue;
            }

            if (token.type() == TokenType.IDENTIFIER && bindings.declarationSites.contains(i)) {
                constants.remove(token.lexeme());
                Token literal = bindings.literalDeclarations.get(i);
                if (literal != null && !(bindings.hasGoto && bindings.assigned.contains(token.lexeme()))) {
                    constants.put(token.lexeme(), new Binding(literal, blocks.size(), functionDepth));
                }
                result.add(token);
                continue;
            }

            Binding binding = token.type() == TokenType.IDENTIFIER ? constants.get(token.lexeme()) : null;
            if (binding != null && !bindings.assignmentSites.contains(i) && isUse(tokens, i, brackets)
                    && !(bindings.assigned.contains(token.lexeme()) && functionDepth > binding.functionDepth())) {
                result.add(new Token(binding.literal().type(), binding.literal().lexeme()));
            } else {
                result.add(token);
            }
        }
        return result;
    }

    private static void expire(Map<String, Binding> constants, int depth) {
        constants.values().removeIf(binding -> binding.depth() > depth);
    }

    private static boolean isLiteral(@Nullable Token token) {
        if (token == null) {
            return false;
        }
        return token.type() == TokenType.NUMBER || token.type() == TokenType.STRING
                || token.isKeyword("true") || token.isKeyword("false") || token.isKeyword("nil");
    }

    private static boolean isUse(List<Token> tokens, int i, Deque<String> brackets) {
        if (TokenEdits.isFieldAccess(tokens, i) || Tokens.isTableKey(tokens, i, brackets)) {
            return false;
        }
        Token before = Tokens.at(tokens, TokenEdits.previous(tokens, i));
        if (before != null && (before.isKeyword("goto") || before.isSymbol("::"))) {
            return false;
        }
        Token after = Tokens.at(tokens, TokenEdits.next(tokens, i));
        return !TokenEdits.startsSuffix(after) && !(after != null && after.isSymbol("::"));
    }

    /**
     * Find declaration sites, literal declarations and assignments, and
     * where each assignment starts to invalidate its name.
     */
    private static Bindings scanBindings(List<Token> tokens) {
        Bindings bindings = new Bindings();
        bindings.hasGoto = tokens.stream().anyMatch(t -> t.isKeyword("goto"));
        Deque<String> brackets = new ArrayDeque<>();
        Deque<Block> blocks = new ArrayDeque<>();
        int pendingLoop = -1;
        int pendingLevel = -1;

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Tokens.trackBrackets(token, brackets);

            if (token.type() == TokenType.KEYWORD) {
                switch (token.lexeme()) {
                    case "local" -> scanLocal(tokens, i, bindings);
                    case "function" -> {
                        blocks.push(new Block(false, i));
                        scanFunction(tokens, i, bindings, assignmentStart(blocks, i));
                    }
                    case "for" -> {
                        pendingLoop = i;
                        pendingLevel = blocks.size();
                        for (int j = TokenEdits.next(tokens, i); j >= 0; j = TokenEdits.next(tokens, j)) {
                            Token t = tokens.get(j);
                            if (t.type() == TokenType.IDENTIFIER) {
                                bindings.declarationSites.add(j);
                            } else if (!t.isSymbol(",")) {
                                break;
                            }
                        }
                    }
                    case "while" -> {
                        pendingLoop = i;
                        pendingLevel = blocks.size();
                    }
                    case "do" -> {
                        if (pendingLoop >= 0 && pendingLevel == blocks.size()) {
                            blocks.push(new Block(true, pendingLoop));
                            pendingLoop = -1;
                        } else {
                            blocks.push(new Block(false, i));
                        }
                    }
                    case "repeat" -> blocks.push(new Block(true, i));
                    case "then" -> blocks.push(new Block(false, i));
                    case "end", "until", "elseif" -> {
                        if (!blocks.isEmpty()) {
                            blocks.pop();
                        }
                    }
                    default -> {
                        // other keywords open no block
                    }
                }
            } else if (token.type() == TokenType.IDENTIFIER && !bindings.declarationSites.contains(i)
                    && !TokenEdits.isFieldAccess(tokens, i) && !Tokens.isTableKey(tokens, i, brackets)
                    && isAssignmentTarget(tokens, i)) {
                assign(bindings, i, token.lexeme(), assignmentStart(blocks, i));
            }
        }
        return bindings;
    }

    private static void assign(Bindings bindings, int site, String name, int start) {
        bindings.assignmentSites.add(site);
        bindings.assigned.add(name);
        bindings.invalidate(site, name);
        if (start != site) {
            bindings.invalidate(start, name);
        }
    }

    /**
     * First token from which an assignment at {@code site} can be observed:
     * the opener of the outermost enclosing loop, or the site itself.
     */
    private static int assignmentStart(Deque<Block> blocks, int site) {
        int start = site;
        for (Block block : blocks) {
            if (block.loop()) {
                start = block.opener();
            }
        }
        return start;
    }

    /**
     * Declaration sites of a {@code local} statement, and the literal
     * bound by {@code local NAME = LITERAL}.
     */
    private static void scanLocal(List<Token> tokens, int local, Bindings bindings) {
        int j = TokenEdits.next(tokens, local);
        Token first = Tokens.at(tokens, j);
        if (first != null && first.isKeyword("function")) {
            declare(tokens, TokenEdits.next(tokens, j), bindings);
            return;
        }
        int firstName = j;
        int names = 0;
        while (declare(tokens, j, bindings)) {
            names++;
            j = ScopeAnalyzer.skipAnnotations(tokens, TokenEdits.next(tokens, j));
            if (!Tokens.isSymbolAt(tokens, j, ",")) {
                break;
            }
            j = TokenEdits.next(tokens, j);
        }
        if (names != 1 || !Tokens.isSymbolAt(tokens, j, "=")) {
            return;
        }
        int literalIndex = TokenEdits.next(tokens, j);
        Token literal = Tokens.at(tokens, literalIndex);
        if (isLiteral(literal) && TokenEdits.endsExpression(tokens, literalIndex)) {
            bindings.literalDeclarations.put(firstName, literal);
        }
    }

    private static boolean declare(List<Token> tokens, int index, Bindings bindings) {
        Token name = Tokens.at(tokens, index);
        if (name == null || name.type() != TokenType.IDENTIFIER) {
            return false;
        }
        bindings.declarationSites.add(index);
        return true;
    }

    /**
     * A {@code function NAME(...)} statement assigns NAME; every parameter
     * is a fresh binding.
     */
    private static void scanFunction(List<Token> tokens, int function, Bindings bindings, int start) {
        Token before = Tokens.at(tokens, TokenEdits.previous(tokens, function));
        boolean isLocal = before != null && before.isKeyword("local");
        int j = TokenEdits.next(tokens, function);
        Token first = Tokens.at(tokens, j);
        if (first != null && first.type() == TokenType.IDENTIFIER) {
            int after = TokenEdits.next(tokens, j);
            if (!isLocal && Tokens.isSymbolAt(tokens, after, "(")) {
                assign(bindings, j, first.lexeme(), start == function ? j : start);
            }
            while (Tokens.at(tokens, j) != null && !Tokens.isSymbolAt(tokens, j, "(")) {
                j = TokenEdits.next(tokens, j);
            }
        }
        if (!Tokens.isSymbolAt(tokens, j, "(")) {
            return;
        }
        for (int k = TokenEdits.next(tokens, j); k >= 0 && !tokens.get(k).isSymbol(")"); k = TokenEdits.next(tokens, k)) {
            if (tokens.get(k).type() == TokenType.IDENTIFIER) {
                bindings.declarationSites.add(k);
            }
        }
    }

    /**
     * True when the identifier at {@code i} is a whole assignment target:
     * followed by an assignment operator, directly or after further
     * comma-separated targets such as {@code t[1]} or {@code f().y}.
     */
    private static boolean isAssignmentTarget(List<Token> tokens, int i) {
        int j = TokenEdits.next(tokens, i);
        Token next = Tokens.at(tokens, j);
        if (next != null && next.type() == TokenType.OPERATOR && ASSIGNMENT_OPERATORS.contains(next.lexeme())) {
            return true;
        }
        while (Tokens.isSymbolAt(tokens, j, ",")) {
            j = skipTarget(tokens, TokenEdits.next(tokens, j));
            if (Tokens.isSymbolAt(tokens, j, "=")) {
                return true;
            }
        }
        return false;
    }

    /**
     * Skip one assignable expression (a name or parenthesized expression
     * followed by any field, index or call suffixes).
     *
     * @return index of the token after it, or -1
     */
    private static int skipTarget(List<Token> tokens, int start) {
        Token first = Tokens.at(tokens, start);
        int j;
        if (first != null && first.type() == TokenType.IDENTIFIER) {
            j = TokenEdits.next(tokens, start);
        } else if (first != null && first.isSymbol("(")) {
            j = afterBracket(tokens, start);
        } else {
            return -1;
        }
        while (j >= 0) {
            Token t = tokens.get(j);
            if (t.isSymbol(".") || t.isSymbol(":")) {
                int member = TokenEdits.next(tokens, j);
                Token name = Tokens.at(tokens, member);
                if (name == null || name.type() != TokenType.IDENTIFIER) {
                    return -1;
                }
                j = TokenEdits.next(tokens, member);
            } else if (t.isSymbol("[") || t.isSymbol("(") || t.isSymbol("{")) {
                j = afterBracket(tokens, j);
            } else if (t.type() == TokenType.STRING) {
                j = TokenEdits.next(tokens, j);
            } else {
                return j;
            }
        }
        return -1;
    }

    private static int afterBracket(List<Token> tokens, int open) {
        int close = TokenEdits.matchingClose(tokens, open);
        return close < 0 ? -1 : TokenEdits.next(tokens, close);
    }
}
