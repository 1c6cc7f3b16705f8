package org.pragmatica.layout.token;

import org.pragmatica.layout.LayoutError;

/**
 * How many newlines a break produces and whether it is allowed to not fire at all.
 */
public sealed interface NewlineBehavior {
    /**
     * Elective newline that respects discretionary newlines from the source.
     */
    NewlineBehavior ELECTIVE = new Elective(false);

    /**
     * Single soft newline inserted by the formatter.
     */
    NewlineBehavior SOFT = new Soft(1, false);

    /**
     * Single hard newline.
     */
    NewlineBehavior HARD = new Hard(1);

    /**
     * Breaking is allowed when needed, never required. With {@code ignoresDiscretionary} the
     * newlines the user had in the source at this position are not preserved.
     */
    record Elective(boolean ignoresDiscretionary) implements NewlineBehavior {}

    /**
     * Breaking {@code count} times is required, but blank lines above the configured limit are
     * dropped. {@code discretionary} marks newlines that come from the user's source.
     */
    record Soft(int count, boolean discretionary) implements NewlineBehavior {
        public Soft {
            if (count < 1) {
                throw LayoutError.invalidToken("soft newline count must be positive, got " + count);
            }
        }
    }

    /**
     * Exactly {@code count} newlines, ignoring blank line limits and disabled breaking.
     */
    record Hard(int count) implements NewlineBehavior {
        public Hard {
            if (count < 0) {
                throw LayoutError.invalidToken("hard newline count must not be negative, got " + count);
            }
        }
    }

    static NewlineBehavior elective(boolean ignoresDiscretionary) {
        return new Elective(ignoresDiscretionary);
    }

    static NewlineBehavior soft(int count, boolean discretionary) {
        return new Soft(count, discretionary);
    }

    static NewlineBehavior hard(int count) {
        return new Hard(count);
    }
}
