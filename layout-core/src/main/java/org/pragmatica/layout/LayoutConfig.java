package org.pragmatica.layout;

/**
 * Configuration consumed by the layout engine.
 *
 * @param maxLineWidth                  maximum number of columns per line
 * @param indentation                   indentation unit
 * @param tabWidth                      columns taken by a tab when indenting with tabs
 * @param maxConsecutiveBlankLines      upper bound for blank lines produced by soft and elective breaks
 * @param respectsDiscretionaryNewlines whether newlines present in the source are preserved
 * @param dumpTokens                    log every token at debug level before printing
 */
public record LayoutConfig(int maxLineWidth,
                           Indentation indentation,
                           int tabWidth,
                           int maxConsecutiveBlankLines,
                           boolean respectsDiscretionaryNewlines,
                           boolean dumpTokens) {
    /**
     * Default configuration: 100 columns, two-space indent, at most one blank line.
     */
    public static final LayoutConfig DEFAULT = new LayoutConfig(100, Indentation.spaces(2), 8, 1, true, false);

    public LayoutConfig {
        if (maxLineWidth < 1) {
            throw LayoutError.invalidConfig("maxLineWidth", maxLineWidth);
        }
        if (indentation == null) {
            throw LayoutError.invalidConfig("indentation", null);
        }
        if (tabWidth < 1) {
            throw LayoutError.invalidConfig("tabWidth", tabWidth);
        }
        if (maxConsecutiveBlankLines < 0) {
            throw LayoutError.invalidConfig("maxConsecutiveBlankLines", maxConsecutiveBlankLines);
        }
    }

    /**
     * Factory method for default config.
     */
    public static LayoutConfig defaultConfig() {
        return DEFAULT;
    }

    /**
     * Columns taken by one indentation unit.
     */
    public int indentationWidth() {
        return indentation.width(tabWidth);
    }

    public LayoutConfig withMaxLineWidth(int maxLineWidth) {
        return new LayoutConfig(maxLineWidth, indentation, tabWidth, maxConsecutiveBlankLines,
                                respectsDiscretionaryNewlines, dumpTokens);
    }

    public LayoutConfig withIndentation(Indentation indentation) {
        return new LayoutConfig(maxLineWidth, indentation, tabWidth, maxConsecutiveBlankLines,
                                respectsDiscretionaryNewlines, dumpTokens);
    }

    public LayoutConfig withTabWidth(int tabWidth) {
        return new LayoutConfig(maxLineWidth, indentation, tabWidth, maxConsecutiveBlankLines,
                                respectsDiscretionaryNewlines, dumpTokens);
    }

    public LayoutConfig withMaxConsecutiveBlankLines(int maxConsecutiveBlankLines) {
        return new LayoutConfig(maxLineWidth, indentation, tabWidth, maxConsecutiveBlankLines,
                                respectsDiscretionaryNewlines, dumpTokens);
    }

    public LayoutConfig withRespectsDiscretionaryNewlines(boolean respectsDiscretionaryNewlines) {
        return new LayoutConfig(maxLineWidth, indentation, tabWidth, maxConsecutiveBlankLines,
                                respectsDiscretionaryNewlines, dumpTokens);
    }

    public LayoutConfig withDumpTokens(boolean dumpTokens) {
        return new LayoutConfig(maxLineWidth, indentation, tabWidth, maxConsecutiveBlankLines,
                                respectsDiscretionaryNewlines, dumpTokens);
    }
}
