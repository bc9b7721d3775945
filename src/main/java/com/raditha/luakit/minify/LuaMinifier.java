package com.raditha.luakit.minify;

import com.raditha.luakit.analysis.ScopeAnalyzer;
import com.raditha.luakit.config.LuaVocabulary;
import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.lexer.LuaStrings;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Shrinks Lua source while keeping its token sequence.
 * <p>
 * Comments and layout are always removed. Aggressive mode also shortens
 * number and string literals and drops semicolons that carry no meaning.
 * With renaming on, locals found by {@link ScopeAnalyzer} get short names.
 * Tokens are joined with a single space only where two neighbours would
 * otherwise lex differently.
 */
public class LuaMinifier {
    private static final Logger logger = LoggerFactory.getLogger(LuaMinifier.class);

    private final LuaLexer lexer;
    private final ScopeAnalyzer scopeAnalyzer;
    private final LocalRenamer renamer;

    public LuaMinifier() {
        this(LuaVocabulary.standard());
    }

    public LuaMinifier(LuaVocabulary vocabulary) {
        this.lexer = new LuaLexer(vocabulary);
        this.scopeAnalyzer = new ScopeAnalyzer(vocabulary);
        this.renamer = new LocalRenamer(vocabulary);
    }

    public String minify(String source, boolean renameLocals, boolean aggressive) {
        return minify(lexer.tokenize(source), renameLocals, aggressive);
    }

    /**
     * Minify a token stream.
     *
     * @param tokens       tokens from {@link LuaLexer}
     * @param renameLocals shorten local variable names
     * @param aggressive   also rewrite literals and drop semicolons
     * @return minified source without a trailing newline
     */
    public String minify(List<Token> tokens, boolean renameLocals, boolean aggressive) {
        return run(tokens, renameLocals, aggressive).output();
    }

    /**
     * Minify source text and report the size reduction.
     */
    public MinifyResult minifyWithStats(String source, boolean renameLocals, boolean aggressive) {
        MinifyResult result = run(lexer.tokenize(source), renameLocals, aggressive);
        String text = source == null ? "" : source;
        return new MinifyResult(result.output(),
                text.getBytes(StandardCharsets.UTF_8).length,
                result.output().getBytes(StandardCharsets.UTF_8).length,
                countLines(text),
                countLines(result.output()),
                result.renamedLocals());
    }

    private MinifyResult run(List<Token> tokens, boolean renameLocals, boolean aggressive) {
        List<Token> code = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() != TokenType.COMMENT) {
                code.add(token);
            }
        }

        if (aggressive) {
            code = optimizeLiterals(code);
            code = removeSemicolons(code);
        }

        int renamed = 0;
        if (renameLocals) {
            Map<String, String> renames = renamer.buildRenameMap(scopeAnalyzer.analyze(code), code);
            logger.debug("Renaming {} locals", renames.size());
            code = renamer.apply(code, renames);
            renamed = renames.size();
        }

        String joined = serialize(code);
        String output = serialize(lexer.tokenize(joined));
        return new MinifyResult(output, 0, 0, 0, 0, renamed);
    }

    /**
     * Join significant tokens, separated by a space only where needed. A
     * line break is kept after an unterminated quoted string, which the
     * newline ends.
     */
    static String serialize(List<Token> tokens) {
        StringBuilder out = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (token.isTrivia()) {
                continue;
            }
            if (previous != null) {
                if (isOpenQuote(previous)) {
                    out.append('\n');
                } else if (TokenSpacing.needsSeparator(previous, token)) {
                    out.append(' ');
                }
            }
            out.append(token.lexeme());
            previous = token;
        }
        return out.toString();
    }

    private static List<Token> optimizeLiterals(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() == TokenType.NUMBER) {
                result.add(token.withLexeme(canonicalNumber(token.lexeme())));
            } else if (token.type() == TokenType.STRING) {
                result.add(token.withLexeme(shortestQuote(token.lexeme())));
            } else {
                result.add(token);
            }
        }
        return result;
    }

    /**
     * Shortest spelling of a number literal: digit separators removed,
     * trailing fractional zeros dropped and a leading {@code 0.} shortened
     * to {@code .}.
     */
    static String canonicalNumber(String lexeme) {
        String value = lexeme.replace("_", "");
        String lower = value.toLowerCase();
        boolean prefixed = lower.startsWith("0x") || lower.startsWith("0b");
        if (!prefixed && value.contains(".") && !lower.contains("e")) {
            int end = value.length();
            while (end > 0 && value.charAt(end - 1) == '0') {
                end--;
            }
            value = value.substring(0, end);
            if (value.endsWith(".")) {
                value = value.substring(0, value.length() - 1);
            }
        }
        if (value.startsWith("0.")) {
            value = value.substring(1);
        }
        return value.isEmpty() || value.equals(".") ? "0" : value;
    }

    /**
     * Re-quote a string literal when that makes it strictly shorter, or
     * switch single quotes to double quotes at equal length. Long brackets
     * and malformed literals are kept.
     */
    static String shortestQuote(String lexeme) {
        if (!LuaStrings.isQuoted(lexeme) || isOpenQuote(new Token(TokenType.STRING, lexeme))) {
            return lexeme;
        }
        byte[] bytes = LuaStrings.decode(lexeme);
        if (bytes == null) {
            return lexeme;
        }
        String doubleQuoted = LuaStrings.quote(bytes, '"');
        String singleQuoted = LuaStrings.quote(bytes, '\'');
        String best = singleQuoted.length() < doubleQuoted.length() ? singleQuoted : doubleQuoted;

        if (best.length() < lexeme.length()) {
            return best;
        }
        boolean sameLength = best.length() == lexeme.length();
        if (sameLength && lexeme.charAt(0) == '\'' && best.charAt(0) == '"'
                && backslashes(best) <= backslashes(lexeme)) {
            return best;
        }
        return lexeme;
    }

    /**
     * Drop semicolons unless the next significant token is a keyword or an
     * opening parenthesis. Separators inside table constructors are kept.
     */
    private static List<Token> removeSemicolons(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size());
        Deque<String> brackets = new ArrayDeque<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Tokens.trackBrackets(token, brackets);
            if (token.isSymbol(";") && !"{".equals(brackets.peek())) {
                Token next = Tokens.at(tokens, Tokens.nextSignificant(tokens, i + 1));
                boolean needed = next != null && (next.type() == TokenType.KEYWORD || next.isSymbol("("));
                if (!needed) {
                    continue;
                }
            }
            result.add(token);
        }
        return result;
    }

    /**
     * A quoted string that the lexer ended at a newline or end of input.
     */
    static boolean isOpenQuote(Token token) {
        String s = token.lexeme();
        if (token.type() != TokenType.STRING || s.isEmpty() || (s.charAt(0) != '"' && s.charAt(0) != '\'')) {
            return false;
        }
        if (s.length() < 2 || s.charAt(s.length() - 1) != s.charAt(0)) {
            return true;
        }
        int escapes = 0;
        for (int i = s.length() - 2; i > 0 && s.charAt(i) == '\\'; i--) {
            escapes++;
        }
        return escapes % 2 == 1;
    }

    private static int backslashes(String s) {
        int count = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\\') {
                count++;
            }
        }
        return count;
    }

    static int countLines(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n' && i < text.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
