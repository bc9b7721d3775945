package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.LuaLexer;
import com.raditha.luakit.lexer.LuaStrings;
import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Inlines {@code load("...")} and {@code loadstring("...")} calls whose only
 * argument is a string literal.
 * <p>
 * The payload is deobfuscated itself with one level less of budget and then
 * wrapped as {@code (function() ... end)}, which is the value {@code load}
 * would have returned. With no budget left the calls are kept.
 */
public class PayloadInlinePass implements RewritePass {
    private static final Logger logger = LoggerFactory.getLogger(PayloadInlinePass.class);

    private static final Set<String> LOADERS = Set.of("load", "loadstring");

    private final Deobfuscator deobfuscator;
    private final LuaLexer lexer;

    public PayloadInlinePass(Deobfuscator deobfuscator, LuaLexer lexer) {
        this.deobfuscator = deobfuscator;
        this.lexer = lexer;
    }

    @Override
    public String name() {
        return "payload inlining";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        if (context.inlineBudget() <= 0) {
            return tokens;
        }
        List<Token> result = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (isLoader(tokens, i)) {
                int open = TokenEdits.next(tokens, i);
                int literal = TokenEdits.next(tokens, open);
                int close = TokenEdits.next(tokens, literal);
                Token argument = Tokens.at(tokens, literal);
                if (Tokens.isSymbolAt(tokens, open, "(") && Tokens.isSymbolAt(tokens, close, ")")
                        && argument != null && argument.type() == TokenType.STRING) {
                    String payload = LuaStrings.decodeToText(argument.lexeme());
                    if (payload != null) {
                        String body = deobfuscator.deobfuscate(payload, context.inlineBudget() - 1, false);
                        logger.debug("Inlined {} payload of {} characters", token.lexeme(), payload.length());
                        result.addAll(lexer.tokenize("(function()\n" + body + "\nend)"));
                        i = close;
                        continue;
                    }
                }
            }
            result.add(token);
        }
        return result;
    }

    private static boolean isLoader(List<Token> tokens, int i) {
        Token token = tokens.get(i);
        return token.type() == TokenType.IDENTIFIER && LOADERS.contains(token.lexeme())
                && !TokenEdits.isFieldAccess(tokens, i);
    }
}
