package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.analysis.ScopeAnalyzer;
import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.minify.LocalRenamer;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Gives readable names to locals whose names look machine-generated.
 * <p>
 * Names are assigned in order of first appearance: {@code func_N} for a
 * name declared right after {@code function}, {@code var_N} otherwise.
 * Numbers already used by an identifier in the chunk are skipped.
 */
public class ObfuscatedNameRenamer {

    private static final Pattern CONFUSABLE = Pattern.compile("^[lI1O0_]{3,}$");
    private static final Pattern VOWEL = Pattern.compile("[aeiouAEIOU]");

    private final ScopeAnalyzer scopeAnalyzer;
    private final LocalRenamer renamer;

    public ObfuscatedNameRenamer(LuaVocabulary vocabulary) {
        this.scopeAnalyzer = new ScopeAnalyzer(vocabulary);
        this.renamer = new LocalRenamer(vocabulary);
    }

    /**
     * Heuristic for generated names: a single character, only underscores,
     * three or more of the look-alike characters {@code l I 1 O 0 _}, or
     * longer than fifteen characters without a vowel.
     */
    public static boolean isObfuscated(String name) {
        if (name.length() == 1) {
            return true;
        }
        if (name.chars().allMatch(c -> c == '_')) {
            return true;
        }
        if (CONFUSABLE.matcher(name).matches()) {
            return true;
        }
        return name.length() > 15 && !VOWEL.matcher(name).find();
    }

    public Map<String, String> buildRenameMap(List<Token> tokens) {
        Set<String> candidates = scopeAnalyzer.analyze(tokens);
        Set<String> taken = new HashSet<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.IDENTIFIER) {
                taken.add(token.lexeme());
            }
        }

        Map<String, String> renames = new LinkedHashMap<>();
        int vars = 0;
        int funcs = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            String name = token.lexeme();
            if (token.type() != TokenType.IDENTIFIER || renames.containsKey(name)
                    || !candidates.contains(name) || !isObfuscated(name) || LocalRenamer.isFieldName(tokens, i)) {
                continue;
            }
            Token before = Tokens.at(tokens, Tokens.previousSignificant(tokens, i - 1));
            boolean function = before != null && before.isKeyword("function");
            String replacement;
            do {
                replacement = function ? "func_" + (++funcs) : "var_" + (++vars);
            } while (taken.contains(replacement));
            renames.put(name, replacement);
        }
        return renames;
    }

    public List<Token> rename(List<Token> tokens) {
        return renamer.apply(tokens, buildRenameMap(tokens));
    }
}
