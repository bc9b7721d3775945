package com.raditha.luakit.minify;

import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Renames local variables to short generated names.
 * <p>
 * The rename map is built over the sorted local names, so the same input
 * always yields the same output. Generated names never coincide with an
 * identifier that already appears in the chunk, which keeps the map
 * injective and stops a renamed local from capturing a global.
 */
public class LocalRenamer {

    private final LuaVocabulary vocabulary;

    public LocalRenamer(LuaVocabulary vocabulary) {
        this.vocabulary = vocabulary;
    }

    /**
     * Assign a short name to every local.
     *
     * @param locals names reported by the scope analyzer
     * @param tokens the chunk the names come from
     * @return old name to new name, in sorted key order
     */
    public Map<String, String> buildRenameMap(Set<String> locals, List<Token> tokens) {
        Set<String> taken = new HashSet<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.IDENTIFIER) {
                taken.add(token.lexeme());
            }
        }
        ShortNameGenerator names = new ShortNameGenerator(vocabulary, taken);

        Map<String, String> renames = new LinkedHashMap<>();
        for (String local : new TreeSet<>(locals)) {
            if (!vocabulary.isReserved(local)) {
                renames.put(local, names.next());
            }
        }
        return renames;
    }

    /**
     * Replace identifiers according to the map. Field names after {@code .}
     * or {@code :} and keys in {@code { key = value }} are left alone.
     */
    public List<Token> apply(List<Token> tokens, Map<String, String> renames) {
        List<Token> result = new ArrayList<>(tokens.size());
        Deque<String> brackets = new ArrayDeque<>();

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Tokens.trackBrackets(token, brackets);

            String replacement = token.type() == TokenType.IDENTIFIER ? renames.get(token.lexeme()) : null;
            if (replacement == null || isFieldName(tokens, i) || Tokens.isTableKey(tokens, i, brackets)) {
                result.add(token);
            } else {
                result.add(token.withLexeme(replacement));
            }
        }
        return result;
    }

    public static boolean isFieldName(List<Token> tokens, int i) {
        int prev = Tokens.previousSignificant(tokens, i - 1);
        return Tokens.isSymbolAt(tokens, prev, ".") || Tokens.isSymbolAt(tokens, prev, ":");
    }
}
