package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.lexer.Tokens;
import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes parentheses around a lone string literal, {@code ("x")} to
 * {@code "x"}, except where they form a call's argument list or where a
 * method call or index follows.
 */
public class RedundantParenPass implements RewritePass {

    @Override
    public String name() {
        return "redundant parentheses";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        List<Token> result = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isSymbol("(")) {
                int literal = TokenEdits.next(tokens, i);
                int close = TokenEdits.next(tokens, literal);
                Token inner = Tokens.at(tokens, literal);
                Token before = Tokens.at(tokens, TokenEdits.previous(tokens, i));
                boolean wrapsLiteral = inner != null && inner.type() == TokenType.STRING
                        && Tokens.isSymbolAt(tokens, close, ")");
                boolean callArguments = TokenEdits.endsCallable(before)
                        || (before != null && before.isKeyword("function"));
                if (wrapsLiteral && !callArguments
                        && !TokenEdits.startsSuffix(Tokens.at(tokens, TokenEdits.next(tokens, close)))) {
                    result.add(inner);
                    i = close;
                    continue;
                }
            }
            result.add(token);
        }
        return result;
    }
}
