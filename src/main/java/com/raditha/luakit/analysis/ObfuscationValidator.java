package com.raditha.luakit.analysis;

import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.format.BlockEngine;
import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.lexer.LuaStrings;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.BlockMode;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks whether a chunk is safe to obfuscate.
 * <p>
 * Reports identifier-like words inside quoted strings (renaming a variable
 * would not update them), Roblox API calls whose name argument is computed
 * rather than literal, and input the depth tracker could only handle in
 * safe mode.
 */
public class ObfuscationValidator {
    private static final Logger logger = LoggerFactory.getLogger(ObfuscationValidator.class);

    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> NAME_LOOKUPS = Set.of("GetService", "WaitForChild");

    private final LuaVocabulary vocabulary;
    private final LuaLexer lexer;

    public ObfuscationValidator() {
        this(LuaVocabulary.standard());
    }

    public ObfuscationValidator(LuaVocabulary vocabulary) {
        this.vocabulary = vocabulary;
        this.lexer = new LuaLexer(vocabulary);
    }

    public ValidationReport validate(String source) {
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        List<Token> tokens;
        BlockEngine engine = new BlockEngine();
        try {
            tokens = lexer.tokenize(source);
            engine.process(tokens);
        } catch (RuntimeException e) {
            logger.debug("Block structure check failed", e);
            errors.add("[Syntax] Block structure error: " + e.getMessage());
            return new ValidationReport(warnings, errors);
        }

        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.STRING && LuaStrings.isQuoted(token.lexeme())) {
                checkStringWords(token, warnings);
            } else if (token.type() == TokenType.IDENTIFIER) {
                checkApiCall(tokens, i, warnings);
            }
        }

        if (engine.mode() == BlockMode.SAFE) {
            warnings.add("[Safe Mode] Unrecognized characters found; block structure may be inaccurate.");
        }
        return new ValidationReport(warnings, errors);
    }

    private void checkStringWords(Token literal, List<String> warnings) {
        String lexeme = literal.lexeme();
        String text = LuaStrings.decodeToText(lexeme);
        if (text == null) {
            text = lexeme.substring(1, lexeme.length() - 1);
        }
        Matcher m = WORD.matcher(text);
        while (m.find()) {
            String word = m.group();
            if (!vocabulary.isKeyword(word)) {
                warnings.add(String.format("[Rename Risk] line %d: identifier '%s' appears inside a string literal; "
                        + "ensure renaming does not break logic.", literal.line(), word));
            }
        }
    }

    private static void checkApiCall(List<Token> tokens, int i, List<String> warnings) {
        Token name = tokens.get(i);
        String call;
        int callee = i;
        if (NAME_LOOKUPS.contains(name.lexeme()) && isMemberAccess(tokens, i)) {
            call = name.lexeme();
        } else if (name.lexeme().equals("Instance") && !isMemberAccess(tokens, i)) {
            int dot = Tokens.nextSignificant(tokens, i + 1);
            callee = dot < 0 ? -1 : Tokens.nextSignificant(tokens, dot + 1);
            if (!Tokens.isSymbolAt(tokens, dot, ".") || !isNamed(Tokens.at(tokens, callee), "new")) {
                return;
            }
            call = "Instance.new";
        } else {
            return;
        }
        int open = Tokens.nextSignificant(tokens, callee + 1);
        if (!Tokens.isSymbolAt(tokens, open, "(")) {
            return;
        }
        Token argument = Tokens.at(tokens, Tokens.nextSignificant(tokens, open + 1));
        if (argument == null || argument.type() != TokenType.STRING) {
            warnings.add(String.format("[API] line %d: %s called without a literal string; "
                    + "obfuscation may break this call.", name.line(), call));
        }
    }

    private static boolean isMemberAccess(List<Token> tokens, int i) {
        int prev = Tokens.previousSignificant(tokens, i - 1);
        return Tokens.isSymbolAt(tokens, prev, ":") || Tokens.isSymbolAt(tokens, prev, ".");
    }

    private static boolean isNamed(@Nullable Token token, String name) {
        return token != null && token.type() == TokenType.IDENTIFIER && token.lexeme().equals(name);
    }
}
