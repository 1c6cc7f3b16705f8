package org.pragmatica.layout.printer;

import org.pragmatica.layout.text.DisplayWidth;
import org.pragmatica.layout.token.PrinterControlKind;
import org.pragmatica.layout.token.Token;
import org.pragmatica.layout.token.Token.Break;
import org.pragmatica.layout.token.Token.CloseGroup;
import org.pragmatica.layout.token.Token.CommaRegionEnd;
import org.pragmatica.layout.token.Token.CommaRegionStart;
import org.pragmatica.layout.token.Token.CommentToken;
import org.pragmatica.layout.token.Token.OpenGroup;
import org.pragmatica.layout.token.Token.PrinterControl;
import org.pragmatica.layout.token.Token.Space;
import org.pragmatica.layout.token.Token.Text;
import org.pragmatica.layout.token.Token.VerbatimToken;

/**
 * Read-only lookahead over the token stream, measuring how much room content needs when rendered
 * on a single line.
 * <p>
 * The scans never touch printer state; the disable-breaking counter is tracked locally, seeded from
 * the live counter.
 */
final class WidthAnalyzer {
    private final PrinterContext context;

    WidthAnalyzer(PrinterContext context) {
        this.context = context;
    }

    /**
     * Whether the group opened at {@code openIndex} renders flat within {@code remainingColumns}.
     * Content which can never be flat (forced newlines, end-of-line comments, multi-line comments
     * or verbatim text) makes the group not fit.
     */
    boolean fitsFlat(int openIndex, int remainingColumns) {
        var stream = context.stream;
        int close = stream.matchingClose(openIndex);
        int disabled = context.control.depth();
        int width = 0;

        for (int i = openIndex + 1; i < close; i++) {
            var token = stream.get(i);

            if (token instanceof Break breakToken) {
                if (NewlinePolicy.alwaysFires(breakToken, disabled == 0, context.config)) {
                    return false;
                }
                width += breakToken.size();
            } else if (token instanceof CommentToken comment) {
                if (forcesLineEnd(comment) || comment.comment().isMultiline()) {
                    return false;
                }
                width += DisplayWidth.of(comment.comment().text());
            } else if (token instanceof VerbatimToken verbatim) {
                if (verbatim.verbatim().isMultiline()) {
                    return false;
                }
                width += DisplayWidth.of(verbatim.verbatim().text());
            } else if (token instanceof PrinterControl control) {
                disabled = adjust(disabled, control);
            } else {
                width += flatWidth(token);
            }

            if (width > remainingColumns) {
                return false;
            }
        }
        return true;
    }

    /**
     * Columns needed if the break at {@code breakIndex} does not fire: its own size plus everything
     * up to the next break at the same or an enclosing level. Nested groups count as a whole. A
     * newline which is certain to happen ends the measurement early.
     */
    int segmentWidth(int breakIndex) {
        var stream = context.stream;
        var breakToken = (Break) stream.get(breakIndex);
        int disabled = context.control.depth();
        int line = context.emitter.lineNumber();
        int depth = 0;
        int nestedRegions = 0;
        int closedRegions = 0;
        int width = breakToken.size();

        for (int i = breakIndex + 1; i < stream.size(); i++) {
            var token = stream.get(i);

            if (token instanceof Break next) {
                if (depth <= 0 || NewlinePolicy.alwaysFires(next, disabled == 0, context.config)) {
                    return width;
                }
                width += next.size();
            } else if (token instanceof OpenGroup) {
                depth++;
            } else if (token instanceof CloseGroup) {
                depth--;
            } else if (token instanceof CommentToken comment) {
                width += DisplayWidth.of(firstLine(comment.comment().text()));
                if (forcesLineEnd(comment) || comment.comment().isMultiline()) {
                    return width;
                }
            } else if (token instanceof VerbatimToken verbatim) {
                width += DisplayWidth.of(firstLine(verbatim.verbatim().text()));
                if (verbatim.verbatim().isMultiline()) {
                    return width;
                }
            } else if (token instanceof PrinterControl control) {
                disabled = adjust(disabled, control);
            } else if (token instanceof CommaRegionStart) {
                nestedRegions++;
            } else if (token instanceof CommaRegionEnd) {
                if (nestedRegions > 0) {
                    nestedRegions--;
                } else if (context.regions.spansMultipleLines(closedRegions++, line)) {
                    // the trailing comma which will be written there
                    width++;
                }
            } else {
                width += flatWidth(token);
            }
        }
        return width;
    }

    private static int flatWidth(Token token) {
        if (token instanceof Text text) {
            return DisplayWidth.of(text.content());
        }
        if (token instanceof Space space) {
            return space.size();
        }
        return 0;
    }

    /**
     * Whether nothing may follow the comment on its line.
     */
    static boolean forcesLineEnd(CommentToken comment) {
        return comment.wasEndOfLine() || comment.comment().kind().isLineComment();
    }

    private static int adjust(int disabled, PrinterControl control) {
        if (control.kind() == PrinterControlKind.DISABLE_BREAKING) {
            return disabled + 1;
        }
        return Math.max(0, disabled - 1);
    }

    private static String firstLine(String text) {
        int newline = text.indexOf('\n');

        return newline < 0
               ? text
               : text.substring(0, newline);
    }
}
