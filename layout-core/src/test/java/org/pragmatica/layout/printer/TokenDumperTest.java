package org.pragmatica.layout.printer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.pragmatica.layout.token.TokenStream.tokenStream;
import static org.pragmatica.layout.token.Tokens.close;
import static org.pragmatica.layout.token.Tokens.open;
import static org.pragmatica.layout.token.Tokens.space;
import static org.pragmatica.layout.token.Tokens.text;

class TokenDumperTest {

    @Test
    void dump_listsTokensIndentedByGroupDepth() {
        var dump = TokenDumper.dump(tokenStream(open(), text("a"), close()));

        assertThat(dump).isEqualTo("""
                                       0 OpenGroup[style=INCONSISTENT]
                                       1   text "a"
                                       2 CloseGroup[]
                                   """);
    }

    @Test
    void describe_usesRecordFormForNonTextTokens() {
        assertThat(TokenDumper.describe(space(2))).isEqualTo("Space[size=2, flexible=false]");
    }
}
