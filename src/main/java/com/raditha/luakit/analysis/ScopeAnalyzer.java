package com.raditha.luakit.analysis;

import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds the local variables of a chunk that may safely be renamed.
 * <p>
 * Scoping is approximated by a stack of name sets: a scope is pushed at
 * {@code function}, {@code do}, {@code if}, {@code for}, {@code while} and
 * {@code repeat} and popped at {@code end} or {@code until}. A popped scope is
 * merged into its parent rather than discarded, so a block's locals stay
 * known after the block ends. This can only over-report locals, never miss
 * one that a rename has to follow.
 */
public class ScopeAnalyzer {

    private static final Set<String> SCOPE_OPENERS = Set.of("function", "do", "if", "for", "while", "repeat");
    private static final Set<String> SCOPE_CLOSERS = Set.of("end", "until");

    private final LuaVocabulary vocabulary;

    public ScopeAnalyzer() {
        this(LuaVocabulary.standard());
    }

    public ScopeAnalyzer(LuaVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Collect every name declared with {@code local}, minus allow-listed
     * globals.
     *
     * @param tokens full token stream
     * @return declared local names in sorted order
     */
    public Set<String> analyze(List<Token> tokens) {
        Deque<Set<String>> scopes = new ArrayDeque<>();
        scopes.push(new HashSet<>());

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != TokenType.KEYWORD) {
                continue;
            }
            String keyword = token.lexeme();
            if (SCOPE_OPENERS.contains(keyword)) {
                scopes.push(new HashSet<>());
            } else if (SCOPE_CLOSERS.contains(keyword)) {
                if (scopes.size() > 1) {
                    Set<String> closed = scopes.pop();
                    scopes.peek().addAll(closed);
                }
            } else if (keyword.equals("local")) {
                collectDeclaredNames(tokens, i + 1, scopes.peek());
            }
        }

        Set<String> locals = new TreeSet<>();
        for (Set<String> scope : scopes) {
            locals.addAll(scope);
        }
        return locals;
    }

    /**
     * Read the names following a {@code local} keyword: either
     * {@code function NAME} or a comma-separated name list.
     */
    private void collectDeclaredNames(List<Token> tokens, int from, Set<String> scope) {
        int j = Tokens.nextSignificant(tokens, from);
        Token first = Tokens.at(tokens, j);
        if (first != null && first.isKeyword("function")) {
            Token name = Tokens.at(tokens, Tokens.nextSignificant(tokens, j + 1));
            if (name != null && name.type() == TokenType.IDENTIFIER) {
                declare(name.lexeme(), scope);
            }
            return;
        }

        while (j >= 0) {
            Token name = tokens.get(j);
            if (name.type() != TokenType.IDENTIFIER) {
                return;
            }
            declare(name.lexeme(), scope);
            j = skipAnnotations(tokens, Tokens.nextSignificant(tokens, j + 1));
            if (!Tokens.isSymbolAt(tokens, j, ",")) {
                return;
            }
            j = Tokens.nextSignificant(tokens, j + 1);
        }
    }

    /**
     * Skip a Lua 5.4 attribute ({@code <const>}) or a Luau type annotation
     * ({@code : type}) after a declared name.
     *
     * @return index of the token after the annotation
     */
    public static int skipAnnotations(List<Token> tokens, int j) {
        if (Tokens.isSymbolAt(tokens, j, "<")) {
            int close = Tokens.nextSignificant(tokens, Tokens.nextSignificant(tokens, j + 1) + 1);
            return Tokens.isSymbolAt(tokens, close, ">") ? Tokens.nextSignificant(tokens, close + 1) : j;
        }
        if (!Tokens.isSymbolAt(tokens, j, ":")) {
            return j;
        }
        int depth = 0;
        for (int k = j + 1; k < tokens.size(); k++) {
            Token t = tokens.get(k);
            if (t.type() == TokenType.NEWLINE && depth == 0) {
                return Tokens.nextSignificant(tokens, k);
            }
            String s = t.lexeme();
            if (t.type() == TokenType.PUNCTUATION || t.type() == TokenType.OPERATOR) {
                if (s.equals("(") || s.equals("{") || s.equals("[") || s.equals("<")) {
                    depth++;
                } else if (s.equals(")") || s.equals("}") || s.equals("]") || s.equals(">")) {
                    depth--;
                } else if (depth == 0 && (s.equals(",") || s.equals("="))) {
                    return k;
                }
            }
        }
        return -1;
    }

    private void declare(String name, Set<String> scope) {
        if (!vocabulary.isGlobal(name)) {
            scope.add(name);
        }
    }
}
