package org.pragmatica.layout;

/**
 * Fatal layout failures.
 * <p>
 * The token stream is a producer contract, not untrusted input, so every error here signals a bug
 * in the code that built the stream (or in the configuration handed to the engine). Nothing is
 * recovered or retried.
 */
public abstract sealed class LayoutError extends RuntimeException
        permits LayoutError.UnbalancedGroup,
                LayoutError.UnbalancedCommaRegion,
                LayoutError.CommaRegionCrossesGroup,
                LayoutError.UnbalancedBreak,
                LayoutError.InvalidToken,
                LayoutError.InvalidConfig {

    private LayoutError(String message) {
        super(message);
    }

    public static UnbalancedGroup unbalancedGroup(int index, String detail) {
        return new UnbalancedGroup(index, detail);
    }

    public static UnbalancedCommaRegion unbalancedCommaRegion(int index, String detail) {
        return new UnbalancedCommaRegion(index, detail);
    }

    public static CommaRegionCrossesGroup commaRegionCrossesGroup(int index) {
        return new CommaRegionCrossesGroup(index);
    }

    public static UnbalancedBreak unbalancedBreak(int index) {
        return new UnbalancedBreak(index);
    }

    public static InvalidToken invalidToken(String detail) {
        return new InvalidToken(detail);
    }

    public static InvalidConfig invalidConfig(String field, Object value) {
        return new InvalidConfig(field, value);
    }

    /**
     * Open and close group tokens do not nest like brackets.
     */
    public static final class UnbalancedGroup extends LayoutError {
        private final int index;

        private UnbalancedGroup(int index, String detail) {
            super("Unbalanced group at token " + index + ": " + detail);
            this.index = index;
        }

        public int index() {
            return index;
        }
    }

    /**
     * Comma region start and end tokens do not nest like brackets.
     */
    public static final class UnbalancedCommaRegion extends LayoutError {
        private final int index;

        private UnbalancedCommaRegion(int index, String detail) {
            super("Unbalanced comma region at token " + index + ": " + detail);
            this.index = index;
        }

        public int index() {
            return index;
        }
    }

    /**
     * A comma region was closed in a different group than the one it was opened in.
     */
    public static final class CommaRegionCrossesGroup extends LayoutError {
        private final int index;

        private CommaRegionCrossesGroup(int index) {
            super("Comma region ending at token " + index + " crosses a group boundary");
            this.index = index;
        }

        public int index() {
            return index;
        }
    }

    /**
     * A close break without a matching open break.
     */
    public static final class UnbalancedBreak extends LayoutError {
        private final int index;

        private UnbalancedBreak(int index) {
            super("Close break at token " + index + " has no matching open break");
            this.index = index;
        }

        public int index() {
            return index;
        }
    }

    public static final class InvalidToken extends LayoutError {
        private InvalidToken(String detail) {
            super("Invalid token: " + detail);
        }
    }

    public static final class InvalidConfig extends LayoutError {
        private final String field;

        private InvalidConfig(String field, Object value) {
            super("Invalid layout configuration: " + field + " = " + value);
            this.field = field;
        }

        public String field() {
            return field;
        }
    }
}
