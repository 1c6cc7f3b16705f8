package org.pragmatica.layout;

/**
 * One indentation unit: {@code count} spaces or {@code count} tabs.
 *
 * @param kind  spaces or tabs
 * @param count characters per unit
 */
public record Indentation(Kind kind, int count) {
    public enum Kind {
        SPACES,
        TABS
    }

    public Indentation {
        if (kind == null) {
            throw LayoutError.invalidConfig("indentation.kind", null);
        }
        if (count < 1) {
            throw LayoutError.invalidConfig("indentation.count", count);
        }
    }

    public static Indentation spaces(int count) {
        return new Indentation(Kind.SPACES, count);
    }

    public static Indentation tabs(int count) {
        return new Indentation(Kind.TABS, count);
    }

    /**
     * Text written for one unit.
     */
    public String text() {
        return (kind == Kind.SPACES
                ? " "
                : "\t").repeat(count);
    }

    /**
     * Columns taken by one unit.
     */
    public int width(int tabWidth) {
        return kind == Kind.SPACES
               ? count
               : count * tabWidth;
    }
}
