package org.pragmatica.layout.printer;

import org.pragmatica.layout.token.Token;
import org.pragmatica.layout.token.Token.CloseGroup;
import org.pragmatica.layout.token.Token.OpenGroup;
import org.pragmatica.layout.token.TokenStream;

/**
 * Human readable listing of a token stream, one token per line, indented by group depth.
 */
public final class TokenDumper {
    private TokenDumper() {}

    public static String dump(TokenStream stream) {
        var sb = new StringBuilder();
        int depth = 0;

        for (int i = 0; i < stream.size(); i++) {
            var token = stream.get(i);

            if (token instanceof CloseGroup) {
                depth = Math.max(0, depth - 1);
            }
            sb.append(String.format("%5d ", i))
              .append("  ".repeat(depth))
              .append(describe(token))
              .append('\n');
            if (token instanceof OpenGroup) {
                depth++;
            }
        }
        return sb.toString();
    }

    static String describe(Token token) {
        if (token instanceof Token.Text text) {
            return "text \"" + text.content() + "\"";
        }
        return token.toString();
    }
}
