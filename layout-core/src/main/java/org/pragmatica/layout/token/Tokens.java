package org.pragmatica.layout.token;

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
 * Factory methods for tokens, with the defaults producers use most often.
 */
public final class Tokens {
    private static final CloseGroup CLOSE_GROUP = new CloseGroup();
    private static final CommaRegionStart COMMA_REGION_START = new CommaRegionStart();

    private Tokens() {}

    public static Token text(String content) {
        return new Text(content);
    }

    /**
     * Inconsistent group.
     */
    public static Token open() {
        return new OpenGroup(GroupBreakStyle.INCONSISTENT);
    }

    public static Token open(GroupBreakStyle style) {
        return new OpenGroup(style);
    }

    public static Token close() {
        return CLOSE_GROUP;
    }

    /**
     * Continue break of size 1 with elective newline.
     */
    public static Token breakToken() {
        return breakToken(BreakKind.CONTINUE, 1);
    }

    public static Token breakToken(BreakKind kind) {
        return breakToken(kind, 1);
    }

    public static Token breakToken(BreakKind kind, int size) {
        return new Break(kind, size, NewlineBehavior.ELECTIVE);
    }

    public static Token breakToken(BreakKind kind, NewlineBehavior newlines) {
        return new Break(kind, 1, newlines);
    }

    public static Token breakToken(BreakKind kind, int size, NewlineBehavior newlines) {
        return new Break(kind, size, newlines);
    }

    /**
     * Break carrying the number of newlines the producer found at this position in the source.
     */
    public static Token breakToken(BreakKind kind, int size, NewlineBehavior newlines, int sourceNewlines) {
        return new Break(kind, size, newlines, sourceNewlines);
    }

    /**
     * Formatter-inserted line break at the base indentation.
     */
    public static Token newline() {
        return new Break(BreakKind.SAME, 0, NewlineBehavior.SOFT);
    }

    /**
     * Source newlines preserved at the base indentation, subject to the blank line limit.
     */
    public static Token discretionaryNewlines(int count) {
        return new Break(BreakKind.SAME, 0, NewlineBehavior.soft(count, true), count);
    }

    public static Token hardNewline(int count) {
        return new Break(BreakKind.SAME, 0, NewlineBehavior.hard(count));
    }

    public static Token space() {
        return new Space(1, false);
    }

    public static Token space(int size) {
        return new Space(size, false);
    }

    public static Token flexibleSpace(int size) {
        return new Space(size, true);
    }

    public static Token lineComment(String text, boolean wasEndOfLine) {
        return new CommentToken(Comment.comment(Comment.Kind.LINE, text), wasEndOfLine);
    }

    public static Token blockComment(String text, boolean wasEndOfLine) {
        return new CommentToken(Comment.comment(Comment.Kind.BLOCK, text), wasEndOfLine);
    }

    public static Token comment(Comment comment, boolean wasEndOfLine) {
        return new CommentToken(comment, wasEndOfLine);
    }

    public static Token verbatim(String text) {
        return new VerbatimToken(Verbatim.verbatim(text));
    }

    public static Token verbatim(String text, Verbatim.IndentingBehavior indenting) {
        return new VerbatimToken(Verbatim.verbatim(text, indenting));
    }

    public static Token disableBreaking() {
        return new PrinterControl(PrinterControlKind.DISABLE_BREAKING);
    }

    public static Token enableBreaking() {
        return new PrinterControl(PrinterControlKind.ENABLE_BREAKING);
    }

    public static Token commaRegionStart() {
        return COMMA_REGION_START;
    }

    public static Token commaRegionEnd(boolean hadTrailingCommaInSource) {
        return new CommaRegionEnd(hadTrailingCommaInSource);
    }
}
