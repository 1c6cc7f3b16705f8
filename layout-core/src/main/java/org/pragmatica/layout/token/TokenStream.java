package org.pragmatica.layout.token;

import org.pragmatica.layout.LayoutError;
import org.pragmatica.layout.token.Token.Break;
import org.pragmatica.layout.token.Token.CloseGroup;
import org.pragmatica.layout.token.Token.CommaRegionEnd;
import org.pragmatica.layout.token.Token.CommaRegionStart;
import org.pragmatica.layout.token.Token.OpenGroup;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

/**
 * Immutable, validated sequence of layout tokens.
 * <p>
 * Nesting of groups, comma regions and open/close breaks is checked once on construction, so a
 * malformed stream is rejected before a single character is emitted. The matching close index of
 * every group is kept for the width analyzer.
 */
public final class TokenStream implements Iterable<Token> {
    private static final int NO_MATCH = -1;

    private final List<Token> tokens;
    private final int[] matchingClose;

    private TokenStream(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
        this.matchingClose = validate(this.tokens);
    }

    /**
     * Factory method for a stream over the given tokens.
     *
     * @throws LayoutError if the tokens do not nest properly
     */
    public static TokenStream tokenStream(List<Token> tokens) {
        return new TokenStream(tokens);
    }

    public static TokenStream tokenStream(Token... tokens) {
        return new TokenStream(Arrays.asList(tokens));
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public List<Token> tokens() {
        return tokens;
    }

    /**
     * Index of the {@link CloseGroup} matching the {@link OpenGroup} at {@code openIndex}.
     */
    public int matchingClose(int openIndex) {
        int index = matchingClose[openIndex];

        if (index == NO_MATCH) {
            throw LayoutError.unbalancedGroup(openIndex, "token is not an open group");
        }

        return index;
    }

    @Override
    public Iterator<Token> iterator() {
        return tokens.iterator();
    }

    private static int[] validate(List<Token> tokens) {
        var matches = new int[tokens.size()];
        Arrays.fill(matches, NO_MATCH);

        var groups = new ArrayDeque<Integer>();
        // group depth at which each open comma region started
        var regions = new ArrayDeque<Integer>();
        int openBreaks = 0;

        for (int i = 0; i < tokens.size(); i++) {
            var token = tokens.get(i);

            if (token instanceof OpenGroup) {
                groups.push(i);
            } else if (token instanceof CloseGroup) {
                if (groups.isEmpty()) {
                    throw LayoutError.unbalancedGroup(i, "close without matching open");
                }
                if (!regions.isEmpty() && regions.peek() == groups.size()) {
                    throw LayoutError.commaRegionCrossesGroup(i);
                }
                matches[groups.pop()] = i;
            } else if (token instanceof CommaRegionStart) {
                regions.push(groups.size());
            } else if (token instanceof CommaRegionEnd) {
                if (regions.isEmpty()) {
                    throw LayoutError.unbalancedCommaRegion(i, "end without matching start");
                }
                if (regions.pop() != groups.size()) {
                    throw LayoutError.commaRegionCrossesGroup(i);
                }
            } else if (token instanceof Break breakToken) {
                if (breakToken.kind() instanceof BreakKind.Open) {
                    openBreaks++;
                } else if (breakToken.kind() instanceof BreakKind.Close) {
                    if (openBreaks == 0) {
                        throw LayoutError.unbalancedBreak(i);
                    }
                    openBreaks--;
                }
            }
        }

        if (!groups.isEmpty()) {
            throw LayoutError.unbalancedGroup(groups.peek(), "open without matching close");
        }
        if (!regions.isEmpty()) {
            throw LayoutError.unbalancedCommaRegion(tokens.size(), "start without matching end");
        }

        return matches;
    }

    /**
     * Collects tokens in order; the stream is validated by {@link #build()}.
     */
    public static final class Builder {
        private final List<Token> tokens = new ArrayList<>();

        private Builder() {}

        public Builder append(Token token) {
            tokens.add(token);
            return this;
        }

        public Builder appendAll(Iterable<? extends Token> more) {
            more.forEach(tokens::add);
            return this;
        }

        public TokenStream build() {
            return new TokenStream(tokens);
        }
    }
}
