package com.raditha.luakit.obfuscate;

import com.raditha.luakit.analysis.ObfuscationValidator;
import com.raditha.luakit.analysis.ScopeAnalyzer;
import com.raditha.luakit.analysis.ValidationReport;
import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.lexer.LuaStrings;
import com.raditha.luakit.minify.LocalRenamer;
import com.raditha.luakit.minify.LuaMinifier;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Makes a chunk harder to read.
 * <p>
 * The chunk is checked by {@link ObfuscationValidator} first and rejected if
 * the check reports errors. Locals then get short generated names, every
 * quoted string literal is rewritten as decimal escapes, and the result is
 * minified without touching literals. Long-bracket strings, globals and
 * field names keep their text. The same input always gives the same output.
 */
public class LuaObfuscator {
    private static final Logger logger = LoggerFactory.getLogger(LuaObfuscator.class);

    private final LuaLexer lexer;
    private final ObfuscationValidator validator;
    private final ScopeAnalyzer scopeAnalyzer;
    private final LocalRenamer renamer;
    private final LuaMinifier minifier;

    public LuaObfuscator() {
        this(LuaVocabulary.standard());
    }

    public LuaObfuscator(LuaVocabulary vocabulary) {
        this(vocabulary, new ObfuscationValidator(vocabulary));
    }

    public LuaObfuscator(LuaVocabulary vocabulary, ObfuscationValidator validator) {
        this.lexer = new LuaLexer(vocabulary);
        this.validator = validator;
        this.scopeAnalyzer = new ScopeAnalyzer(vocabulary);
        this.renamer = new LocalRenamer(vocabulary);
        this.minifier = new LuaMinifier(vocabulary);
    }

    /**
     * Obfuscate a chunk.
     *
     * @param source Lua source
     * @return the obfuscated text and the validator's warnings
     * @throws IllegalArgumentException if validation reports errors
     */
    public ObfuscationResult obfuscate(String source) {
        String text = source == null ? "" : source;
        ValidationReport report = validator.validate(text);
        if (report.hasErrors()) {
            throw new IllegalArgumentException("Obfuscation aborted: " + String.join("; ", report.errors()));
        }
        report.warnings().forEach(w -> logger.debug("Validator warning: {}", w));

        List<Token> tokens = lexer.tokenize(text);
        Map<String, String> renames = renamer.buildRenameMap(scopeAnalyzer.analyze(tokens), tokens);
        tokens = renamer.apply(tokens, renames);

        List<Token> encoded = new ArrayList<>(tokens.size());
        int strings = 0;
        for (Token token : tokens) {
            String replacement = encodeString(token);
            if (replacement == null) {
                encoded.add(token);
            } else {
                encoded.add(token.withLexeme(replacement));
                strings++;
            }
        }
        logger.debug("Renamed {} locals, encoded {} strings", renames.size(), strings);

        String output = minifier.minify(encoded, false, false);
        return new ObfuscationResult(output, report.warnings(), renames.size(), strings);
    }

    /**
     * Decimal-escape form of a quoted literal, or null for anything else,
     * including malformed literals.
     */
    static @Nullable String encodeString(Token token) {
        if (token.type() != TokenType.STRING || !LuaStrings.isQuoted(token.lexeme())) {
            return null;
        }
        byte[] bytes = LuaStrings.decode(token.lexeme());
        return bytes == null ? null : LuaStrings.encodeDecimal(bytes);
    }
}
