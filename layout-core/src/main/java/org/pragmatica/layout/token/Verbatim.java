package org.pragmatica.layout.token;

import org.pragmatica.layout.LayoutError;

import java.util.List;

/**
 * Multi-line literal content which bypasses break decisions.
 *
 * @param text     content, lines separated by {@code \n}
 * @param indenting which lines follow the current indentation
 */
public record Verbatim(String text, IndentingBehavior indenting) {
    public enum IndentingBehavior {
        /**
         * Every line is emitted exactly as given; lines after the first start at column zero.
         */
        NONE,
        /**
         * The first line starts at the current position, the rest at column zero.
         */
        FIRST_LINE,
        /**
         * Every line after the first is prefixed with the current line indentation.
         */
        ALL_LINES
    }

    public Verbatim {
        if (text == null || indenting == null) {
            throw LayoutError.invalidToken("verbatim text and indenting behavior must not be null");
        }
    }

    public static Verbatim verbatim(String text) {
        return new Verbatim(text, IndentingBehavior.ALL_LINES);
    }

    public static Verbatim verbatim(String text, IndentingBehavior indenting) {
        return new Verbatim(text, indenting);
    }

    public boolean isMultiline() {
        return text.indexOf('\n') >= 0;
    }

    public List<String> lines() {
        return List.of(text.split("\n", -1));
    }
}
