package org.pragmatica.layout.printer;

import org.pragmatica.layout.LayoutConfig;
import org.pragmatica.layout.LayoutError;
import org.pragmatica.layout.token.TokenStream;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Mutable state of one printing pass. Created per pass and never shared.
 */
final class PrinterContext {
    final LayoutConfig config;
    final TokenStream stream;
    final OutputEmitter emitter;
    final IndentationTracker indentation = new IndentationTracker();
    final BreakingControl control = new BreakingControl();
    final CommaRegionTracker regions = new CommaRegionTracker();

    private final Deque<GroupFrame> groups = new ArrayDeque<>();

    /**
     * An end-of-line comment was written and its line has not been ended yet.
     */
    boolean lineEndPending;
    int trailingCommasAdded;
    int trailingCommasRemoved;

    PrinterContext(LayoutConfig config, TokenStream stream) {
        this.config = config;
        this.stream = stream;
        this.emitter = new OutputEmitter(config.indentation(), config.tabWidth());
        groups.push(GroupFrame.root());
    }

    GroupFrame currentGroup() {
        return groups.peek();
    }

    void openGroup(GroupFrame frame) {
        groups.push(frame);
    }

    void closeGroup(int index) {
        // the root frame is never popped
        if (groups.size() == 1) {
            throw LayoutError.unbalancedGroup(index, "close without matching open");
        }
        groups.pop();
    }

    int remainingColumns() {
        return config.maxLineWidth() - emitter.column();
    }
}
