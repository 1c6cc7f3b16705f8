package org.pragmatica.layout.token;

import org.pragmatica.layout.LayoutError;

/**
 * What a break does to indentation when it fires.
 */
public sealed interface BreakKind {
    /**
     * Open break with block indentation.
     */
    BreakKind OPEN = new Open(OpenBreakKind.BLOCK);

    /**
     * Close break that always breaks when it ends up on a different line than its open break.
     */
    BreakKind CLOSE = new Close(true);

    BreakKind CONTINUE = new Continue();
    BreakKind SAME = new Same();
    BreakKind RESET = new Reset();

    /**
     * Starts an indentation scope which lasts until the matching {@link Close}.
     */
    record Open(OpenBreakKind kind) implements BreakKind {
        public Open {
            if (kind == null) {
                throw LayoutError.invalidToken("open break kind must not be null");
            }
        }
    }

    /**
     * Ends the scope of the matching {@link Open}. When {@code mustBreakIfDifferentLine} is set, the
     * break always fires if the content since the open break already spans more than one line.
     */
    record Close(boolean mustBreakIfDifferentLine) implements BreakKind {}

    /**
     * The next line, if the break fires, is a continuation line of the current scope.
     */
    record Continue() implements BreakKind {}

    /**
     * The next line, if the break fires, starts at the base indentation of the current scope.
     */
    record Same() implements BreakKind {}

    /**
     * Forces a line break when met on a continuation line and returns to the base indentation.
     */
    record Reset() implements BreakKind {}

    static BreakKind open(OpenBreakKind kind) {
        return new Open(kind);
    }

    static BreakKind close(boolean mustBreakIfDifferentLine) {
        return new Close(mustBreakIfDifferentLine);
    }
}
