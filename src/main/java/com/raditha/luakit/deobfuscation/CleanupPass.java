package com.raditha.luakit.deobfuscation;

import com.raditha.luakit.model.Token;
import com.raditha.luakit.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Final tidy-up: repeated semicolons become one, blank runs inside a line
 * become a single space, trailing blanks are dropped, at most one empty
 * line is kept between lines and the chunk is trimmed. Indentation at the
 * start of a line is kept.
 */
public class CleanupPass implements RewritePass {

    @Override
    public String name() {
        return "cleanup";
    }

    @Override
    public List<Token> apply(List<Token> tokens, RewriteContext context) {
        List<Token> result = new ArrayList<>(tokens.size());
        int newlines = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            Token last = result.isEmpty() ? null : result.get(result.size() - 1);

            switch (token.type()) {
                case NEWLINE -> {
                    if (!result.isEmpty() && newlines < 2) {
                        result.add(token);
                    }
                    newlines++;
                }
                case WHITESPACE -> {
                    boolean lineEnd = i + 1 >= tokens.size() || tokens.get(i + 1).type() == TokenType.NEWLINE;
                    if (result.isEmpty() || lineEnd) {
                        continue;
                    }
                    boolean lineStart = last.type() == TokenType.NEWLINE;
                    result.add(lineStart ? token : token.withLexeme(" "));
                }
                default -> {
                    boolean repeatedSemicolon = token.isSymbol(";") && last != null && last.isSymbol(";");
                    if (!repeatedSemicolon) {
                        result.add(token);
                    }
                    newlines = 0;
                }
            }
        }

        while (!result.isEmpty() && result.get(result.size() - 1).isTrivia()
                && result.get(result.size() - 1).type() != TokenType.COMMENT) {
            result.remove(result.size() - 1);
        }
        return result;
    }
}
