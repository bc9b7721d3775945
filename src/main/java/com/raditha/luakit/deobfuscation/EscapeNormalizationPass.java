package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.LuaStrings;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites quoted literals that use hex, decimal or unicode escapes into
 * their plain form, escaping only what Lua requires. The quote character
 * is kept. Literals that fail to decode are left as they are.
 */
public class EscapeNormalizationPass implements RewritePass {

    @Override
    public String name() {
        return "escape normalization";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            if (token.type() == TokenType.STRING && LuaStrings.hasNumericEscape(token.lexeme())) {
                byte[] bytes = LuaStrings.decode(token.lexeme());
                if (bytes != null) {
                    result.add(token.withLexeme(LuaStrings.quote(bytes, token.lexeme().charAt(0))));
                    continue;
                }
            }
            result.add(token);
        }
        return result;
    }
}
