package org.pragmatica.layout.printer;

import org.pragmatica.layout.LayoutError;
import org.pragmatica.layout.token.OpenBreakKind;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Indentation scopes opened by open breaks and the continuation state of the current line.
 * <p>
 * Indentation is counted in units. A line starts at the base of the innermost scope, plus one unit
 * when it is a continuation line. A fired continuation open counts its unit in the base of the new
 * scope instead, so its first line is a continuation line without being indented twice.
 */
final class IndentationTracker {
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private int base;
    private boolean continuation;
    private boolean scopeContinuation;

    /**
     * State saved by an open break, restored by its close break.
     *
     * @param savedBase         base before the open break
     * @param savedContinuation      continuation state before the open break
     * @param savedScopeContinuation scope continuation state before the open break
     * @param openLine               output line on which the open break was met
     */
    record Scope(int savedBase, boolean savedContinuation, boolean savedScopeContinuation, int openLine) {}

    /**
     * Indentation, in units, of a line starting now.
     */
    int lineIndent() {
        return continuation
               ? base + 1
               : base;
    }

    /**
     * Whether the current line continues a logical line, either through a continue break or as
     * the first lines of a fired continuation open.
     */
    boolean isContinuation() {
        return continuation || scopeContinuation;
    }

    int depth() {
        return scopes.size();
    }

    /**
     * Enter the scope of an open break. Must be called after the firing decision is known.
     */
    void open(OpenBreakKind kind, boolean fires, int line) {
        scopes.push(new Scope(base, continuation, scopeContinuation, line));

        base = switch (kind) {
            case BLOCK -> lineIndent() + 1;
            case CONTINUATION -> continuation || fires
                                 ? base + 1
                                 : base;
        };
        scopeContinuation = kind == OpenBreakKind.CONTINUATION && fires;
        continuation = false;
    }

    /**
     * Scope the next close break would leave.
     */
    Scope innermost(int index) {
        var scope = scopes.peek();

        if (scope == null) {
            throw LayoutError.unbalancedBreak(index);
        }
        return scope;
    }

    /**
     * Leave the innermost scope, restoring base and continuation state of the line that opened it.
     */
    Scope close(int index) {
        var scope = innermost(index);
        scopes.pop();
        base = scope.savedBase();
        continuation = scope.savedContinuation();
        scopeContinuation = scope.savedScopeContinuation();
        return scope;
    }

    /**
     * The next line continues the current logical line.
     */
    void continueLine() {
        continuation = true;
    }

    /**
     * The next line starts at the base indentation.
     */
    void endContinuation() {
        continuation = false;
        scopeContinuation = false;
    }

    /**
     * End the continuation and return to the indentation the continued line started at. Drops the
     * unit a fired continuation open added to the base.
     */
    void resetContinuation() {
        if (scopeContinuation) {
            base--;
        }
        endContinuation();
    }
}
