package org.pragmatica.layout.printer;

import org.pragmatica.layout.Indentation;
import org.pragmatica.layout.text.DisplayWidth;

/**
 * Output buffer with column and line tracking.
 * <p>
 * Spaces and indentation are written lazily, together with the next printable text, so that lines
 * never end with whitespace and blank lines stay empty.
 */
final class OutputEmitter {
    private final StringBuilder output = new StringBuilder();
    private final String unitText;
    private final int unitWidth;

    private int column;
    private int lineNumber;
    private int consecutiveNewlines;
    private int pendingSpaces;
    private int pendingIndent;
    private boolean atStartOfLine = true;
    private int contentEnd;
    private int contentEndLine;

    OutputEmitter(Indentation indentation, int tabWidth) {
        this.unitText = indentation.text();
        this.unitWidth = indentation.width(tabWidth);
    }

    /**
     * Append text which contains no newline.
     */
    void write(String text) {
        if (text.isEmpty()) {
            return;
        }
        writeRaw(text);
        contentEnd = output.length();
        contentEndLine = lineNumber;
    }

    /**
     * Append comment text. Comments do not move the content cursor used by {@link #insertAtContentEnd}.
     */
    void writeComment(String text) {
        if (!text.isEmpty()) {
            writeRaw(text);
        }
    }

    /**
     * Insert text right after the last non-comment content, which may lie before comments or on an
     * earlier line.
     */
    void insertAtContentEnd(String text) {
        output.insert(contentEnd, text);
        contentEnd += text.length();

        if (contentEndLine == lineNumber) {
            column += DisplayWidth.of(text);
        }
    }

    void enqueueSpaces(int count) {
        pendingSpaces += count;
        column += count;
    }

    /**
     * End the current line {@code count} times and position the next line at {@code indentUnits}.
     * With a count of zero only the indentation of a freshly started line is adjusted. Newlines
     * before the first output are dropped, the output never starts with blank lines.
     */
    void newlines(int count, int indentUnits) {
        if (count > 0 && output.length() > 0) {
            output.append("\n".repeat(count));
            lineNumber += count;
            consecutiveNewlines += count;
            atStartOfLine = true;
        }
        if (atStartOfLine) {
            pendingSpaces = 0;
            pendingIndent = indentUnits;
            column = indentUnits * unitWidth;
        }
    }

    int column() {
        return column;
    }

    int lineNumber() {
        return lineNumber;
    }

    int consecutiveNewlines() {
        return consecutiveNewlines;
    }

    /**
     * Output offset right after the last non-comment content.
     */
    int contentEnd() {
        return contentEnd;
    }

    boolean isAtStartOfLine() {
        return atStartOfLine;
    }

    /**
     * Output so far with exactly one trailing newline, or empty if nothing was written.
     */
    String result() {
        int end = output.length();

        while (end > 0 && output.charAt(end - 1) == '\n') {
            end--;
        }
        if (end == 0) {
            return "";
        }
        return output.substring(0, end) + "\n";
    }

    private void writeRaw(String text) {
        flushPending();
        output.append(text);
        column += DisplayWidth.of(text);
        consecutiveNewlines = 0;
        atStartOfLine = false;
    }

    private void flushPending() {
        if (pendingIndent > 0) {
            output.append(unitText.repeat(pendingIndent));
            pendingIndent = 0;
        }
        if (pendingSpaces > 0) {
            output.append(" ".repeat(pendingSpaces));
            pendingSpaces = 0;
        }
    }
}
