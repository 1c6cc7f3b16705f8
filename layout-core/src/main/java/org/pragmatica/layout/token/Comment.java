package org.pragmatica.layout.token;

import org.pragmatica.layout.LayoutError;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Comment text as it appeared in the source, delimiters included.
 * <p>
 * Line comments may hold several consecutive lines; each is placed on its own output line at the
 * current indentation. Block comments keep the relative indentation of their inner lines, shifted
 * to the current indentation.
 *
 * @param kind comment flavour
 * @param text comment text, lines separated by {@code \n}
 */
public record Comment(Kind kind, String text) {
    public enum Kind {
        LINE,
        DOC_LINE,
        BLOCK,
        DOC_BLOCK;

        public boolean isLineComment() {
            return this == LINE || this == DOC_LINE;
        }
    }

    public Comment {
        if (kind == null || text == null) {
            throw LayoutError.invalidToken("comment kind and text must not be null");
        }
    }

    public static Comment comment(Kind kind, String text) {
        return new Comment(kind, text);
    }

    public boolean isMultiline() {
        return text.indexOf('\n') >= 0;
    }

    /**
     * Lines ready to be placed one below another, without indentation.
     */
    public List<String> lines() {
        var raw = text.split("\n", -1);

        if (kind.isLineComment()) {
            return Arrays.stream(raw)
                         .map(String::strip)
                         .toList();
        }

        int common = Integer.MAX_VALUE;

        for (int i = 1; i < raw.length; i++) {
            if (!raw[i].isBlank()) {
                common = Math.min(common, leadingWhitespace(raw[i]));
            }
        }

        var result = new ArrayList<String>(raw.length);
        result.add(raw[0].stripTrailing());

        for (int i = 1; i < raw.length; i++) {
            var line = raw[i].isBlank()
                       ? ""
                       : raw[i].substring(common).stripTrailing();
            // Javadoc-style continuation lines line up one column right of "/"
            result.add(line.startsWith("*") ? " " + line : line);
        }

        return result;
    }

    private static int leadingWhitespace(String line) {
        int count = 0;

        while (count < line.length() && Character.isWhitespace(line.charAt(count))) {
            count++;
        }

        return count;
    }
}
