package org.pragmatica.layout.printer;

import org.pragmatica.layout.LayoutConfig;
import org.pragmatica.layout.LayoutResult;
import org.pragmatica.layout.token.BreakKind;
import org.pragmatica.layout.token.GroupBreakStyle;
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
import org.pragmatica.layout.token.TokenStream;
import org.pragmatica.layout.token.Verbatim;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides where breaks fire and renders a token stream.
 * <p>
 * One greedy left-to-right pass, no backtracking:
 * - a consistent group is measured once when it opens; if it does not fit, all its direct breaks fire
 * - an inconsistent group fires a break only when the content up to the next break would overflow
 * - hard newlines always fire, other breaks only while breaking is not disabled
 * - comma regions get a trailing comma exactly when they span multiple lines
 */
public class LayoutPrinter {
    private static final Logger log = LoggerFactory.getLogger(LayoutPrinter.class);

    private final LayoutConfig config;

    private LayoutPrinter(LayoutConfig config) {
        this.config = config;
    }

    /**
     * Factory method to create a layout printer.
     */
    public static LayoutPrinter layoutPrinter(LayoutConfig config) {
        return new LayoutPrinter(config);
    }

    /**
     * Print the token stream to formatted text.
     */
    public LayoutResult print(TokenStream stream) {
        if (config.dumpTokens() && log.isDebugEnabled()) {
            log.debug("Token stream:\n{}", TokenDumper.dump(stream));
        }
        log.debug("Printing {} tokens, max line width {}", stream.size(), config.maxLineWidth());

        var context = new PrinterContext(config, stream);
        var analyzer = new WidthAnalyzer(context);

        for (int i = 0; i < stream.size(); i++) {
            printToken(context, analyzer, i, stream.get(i));
        }

        var text = context.emitter.result();
        log.debug("Printed {} lines, {} trailing commas added, {} removed",
                  context.emitter.lineNumber(), context.trailingCommasAdded, context.trailingCommasRemoved);
        return new LayoutResult(text, context.trailingCommasAdded, context.trailingCommasRemoved);
    }

    private void printToken(PrinterContext context, WidthAnalyzer analyzer, int index, Token token) {
        if (token instanceof Text text) {
            endPendingLine(context);
            context.emitter.write(text.content());
        } else if (token instanceof OpenGroup open) {
            printOpenGroup(context, analyzer, index, open);
        } else if (token instanceof CloseGroup) {
            context.closeGroup(index);
        } else if (token instanceof Break breakToken) {
            printBreak(context, analyzer, index, breakToken);
        } else if (token instanceof Space space) {
            printSpace(context, space);
        } else if (token instanceof CommentToken comment) {
            printComment(context, comment);
        } else if (token instanceof VerbatimToken verbatim) {
            printVerbatim(context, verbatim.verbatim());
        } else if (token instanceof PrinterControl control) {
            context.control.apply(control.kind(), index);
        } else if (token instanceof CommaRegionStart) {
            context.regions.start(context.emitter.lineNumber(), context.emitter.contentEnd());
        } else if (token instanceof CommaRegionEnd regionEnd) {
            printCommaRegionEnd(context, index, regionEnd);
        }
    }

    private void printOpenGroup(PrinterContext context, WidthAnalyzer analyzer, int index, OpenGroup open) {
        var consistent = open.style() == GroupBreakStyle.CONSISTENT;
        var forcedBroken = consistent && !analyzer.fitsFlat(index, context.remainingColumns());

        context.openGroup(new GroupFrame(open.style(), context.emitter.column(), forcedBroken));
    }

    private void printBreak(PrinterContext context, WidthAnalyzer analyzer, int index, Break token) {
        var emitter = context.emitter;
        var indentation = context.indentation;
        var kind = token.kind();
        var forcedByComment = context.lineEndPending;
        var fires = decideFiring(context, analyzer, index, token, forcedByComment);

        if (kind instanceof BreakKind.Open open) {
            indentation.open(open.kind(), fires, emitter.lineNumber());
        } else if (kind instanceof BreakKind.Close) {
            indentation.close(index);
        } else if (kind instanceof BreakKind.Continue) {
            if (fires) {
                indentation.continueLine();
            }
        } else if (kind instanceof BreakKind.Reset) {
            if (fires) {
                indentation.resetContinuation();
            }
        } else if (fires) {
            indentation.endContinuation();
        }

        if (fires) {
            emitter.newlines(NewlinePolicy.newlineCount(token, emitter.consecutiveNewlines(), forcedByComment, config),
                             indentation.lineIndent());
            context.lineEndPending = false;
        } else if (!emitter.isAtStartOfLine()) {
            emitter.enqueueSpaces(token.size());
        }
    }

    private boolean decideFiring(PrinterContext context,
                                 WidthAnalyzer analyzer,
                                 int index,
                                 Break token,
                                 boolean forcedByComment) {
        // nothing may share a line with an end-of-line comment
        if (token.isHard() || forcedByComment) {
            return true;
        }
        if (!context.control.isBreakingEnabled()) {
            return false;
        }
        if (NewlinePolicy.alwaysFires(token, true, config) || mustBreakForKind(context, index, token.kind())) {
            return true;
        }

        var group = context.currentGroup();

        if (group.forcedBroken()) {
            return true;
        }
        return !group.isConsistent()
               && context.emitter.column() + analyzer.segmentWidth(index) > config.maxLineWidth();
    }

    private static boolean mustBreakForKind(PrinterContext context, int index, BreakKind kind) {
        if (kind instanceof BreakKind.Close close) {
            return close.mustBreakIfDifferentLine()
                   && context.indentation.innermost(index).openLine() != context.emitter.lineNumber();
        }
        if (kind instanceof BreakKind.Reset) {
            return context.indentation.isContinuation();
        }
        return false;
    }

    private void printSpace(PrinterContext context, Space space) {
        if (context.lineEndPending) {
            return;
        }
        if (space.flexible() && context.emitter.isAtStartOfLine()) {
            return;
        }
        context.emitter.enqueueSpaces(space.size());
    }

    private void printComment(PrinterContext context, CommentToken token) {
        endPendingLine(context);

        var emitter = context.emitter;
        var lines = token.comment().lines();

        emitter.writeComment(lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            emitter.newlines(1, context.indentation.lineIndent());
            emitter.writeComment(lines.get(i));
        }

        if (WidthAnalyzer.forcesLineEnd(token)) {
            context.lineEndPending = true;
        }
    }

    private void printVerbatim(PrinterContext context, Verbatim verbatim) {
        endPendingLine(context);

        var emitter = context.emitter;
        var lines = verbatim.lines();
        var allLines = verbatim.indenting() == Verbatim.IndentingBehavior.ALL_LINES;

        if (verbatim.indenting() == Verbatim.IndentingBehavior.NONE) {
            // drops the indentation of a fresh line, keeps position otherwise
            emitter.newlines(0, 0);
        }

        emitter.write(lines.get(0));
        for (int i = 1; i < lines.size(); i++) {
            emitter.newlines(1, allLines
                                ? context.indentation.lineIndent()
                                : 0);
            emitter.write(lines.get(i));
        }
    }

    private void printCommaRegionEnd(PrinterContext context, int index, CommaRegionEnd regionEnd) {
        var emitter = context.emitter;
        var region = context.regions.end(index);

        // a region without content of its own has nothing to put the comma after
        if (region.spansMultipleLines(emitter.lineNumber()) && region.hasContent(emitter.contentEnd())) {
            emitter.insertAtContentEnd(",");
            if (!regionEnd.hadTrailingCommaInSource()) {
                context.trailingCommasAdded++;
                log.debug("Added trailing comma to multi-line region ending at token {}", index);
            }
        } else if (regionEnd.hadTrailingCommaInSource()) {
            context.trailingCommasRemoved++;
            log.debug("Removed trailing comma from region ending at token {}", index);
        }
    }

    private void endPendingLine(PrinterContext context) {
        if (context.lineEndPending) {
            context.emitter.newlines(1, context.indentation.lineIndent());
            context.lineEndPending = false;
        }
    }
}
