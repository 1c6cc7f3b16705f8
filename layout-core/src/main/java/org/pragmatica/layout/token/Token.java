package org.pragmatica.layout.token;

import org.pragmatica.layout.LayoutError;

/**
 * Layout instruction consumed by the printer.
 * <p>
 * Producers translate a syntax tree into a flat sequence of these tokens. Groups and comma regions
 * must nest like brackets, every comma region must stay inside the group it was opened in, and open
 * and close breaks must pair up. Any violation is a producer bug and aborts the layout.
 */
public sealed interface Token {
    /**
     * Literal characters, emitted as-is. Must not contain newlines; use {@link Verbatim} for that.
     */
    record Text(String content) implements Token {
        public Text {
            if (content == null) {
                throw LayoutError.invalidToken("text content must not be null");
            }
            if (content.indexOf('\n') >= 0) {
                throw LayoutError.invalidToken("text must not contain newlines: " + content);
            }
        }
    }

    /**
     * Begins a group whose direct breaks are decided according to {@code style}.
     */
    record OpenGroup(GroupBreakStyle style) implements Token {
        public OpenGroup {
            if (style == null) {
                throw LayoutError.invalidToken("group style must not be null");
            }
        }
    }

    /**
     * Ends the innermost open group.
     */
    record CloseGroup() implements Token {}

    /**
     * A point where a newline may or must occur.
     *
     * @param kind           indentation effect
     * @param size           spaces printed when the break does not fire
     * @param newlines       newline behavior when the break fires
     * @param sourceNewlines newlines found at this position in the original source, 0 if unknown
     */
    record Break(BreakKind kind, int size, NewlineBehavior newlines, int sourceNewlines) implements Token {
        public Break {
            if (kind == null || newlines == null) {
                throw LayoutError.invalidToken("break kind and newline behavior must not be null");
            }
            if (size < 0) {
                throw LayoutError.invalidToken("break size must not be negative, got " + size);
            }
            if (sourceNewlines < 0) {
                throw LayoutError.invalidToken("source newline count must not be negative, got " + sourceNewlines);
            }
        }

        public Break(BreakKind kind, int size, NewlineBehavior newlines) {
            this(kind, size, newlines, 0);
        }

        public boolean isHard() {
            return newlines instanceof NewlineBehavior.Hard;
        }
    }

    /**
     * Literal spacing. A flexible space collapses when it would be the first content on a line.
     */
    record Space(int size, boolean flexible) implements Token {
        public Space {
            if (size < 0) {
                throw LayoutError.invalidToken("space size must not be negative, got " + size);
            }
        }
    }

    /**
     * Source comment. When {@code wasEndOfLine} is set nothing else may follow on its line.
     */
    record CommentToken(Comment comment, boolean wasEndOfLine) implements Token {
        public CommentToken {
            if (comment == null) {
                throw LayoutError.invalidToken("comment must not be null");
            }
        }
    }

    /**
     * Multi-line content emitted without break decisions.
     */
    record VerbatimToken(Verbatim verbatim) implements Token {
        public VerbatimToken {
            if (verbatim == null) {
                throw LayoutError.invalidToken("verbatim must not be null");
            }
        }
    }

    record PrinterControl(PrinterControlKind kind) implements Token {
        public PrinterControl {
            if (kind == null) {
                throw LayoutError.invalidToken("printer control kind must not be null");
            }
        }
    }

    /**
     * Start of a comma delimited collection.
     */
    record CommaRegionStart() implements Token {}

    /**
     * End of a comma delimited collection. A trailing comma is written here if and only if the
     * collection spans multiple lines; the source's own trailing comma is never part of the stream.
     */
    record CommaRegionEnd(boolean hadTrailingCommaInSource) implements Token {}
}
