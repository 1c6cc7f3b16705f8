package org.pragmatica.layout.printer;

import org.pragmatica.layout.LayoutError;

import java.util.ArrayList;
import java.util.List;

/**
 * Open comma delimited regions, innermost last.
 * <p>
 * A region spans multiple lines when the output line at its end differs from the line it started
 * on. A newline written inside a nested region is seen by every enclosing region as well.
 */
final class CommaRegionTracker {
    private final List<Region> frames = new ArrayList<>();

    /**
     * Open region.
     *
     * @param startLine    output line at the region start
     * @param contentStart output offset of the content cursor at the region start
     */
    record Region(int startLine, int contentStart) {
        boolean spansMultipleLines(int line) {
            return startLine != line;
        }

        /**
         * Whether content was written inside the region, i.e. the content cursor moved past its start.
         */
        boolean hasContent(int contentEnd) {
            return contentEnd > contentStart;
        }
    }

    void start(int line, int contentEnd) {
        frames.add(new Region(line, contentEnd));
    }

    /**
     * Close the innermost region.
     */
    Region end(int index) {
        if (frames.isEmpty()) {
            throw LayoutError.unbalancedCommaRegion(index, "end without matching start");
        }
        return frames.remove(frames.size() - 1);
    }

    /**
     * Whether the region {@code fromInnermost} levels out from the innermost one already spans
     * multiple lines. Regions which are not open are reported as single-line.
     */
    boolean spansMultipleLines(int fromInnermost, int line) {
        int position = frames.size() - 1 - fromInnermost;

        return position >= 0 && frames.get(position).spansMultipleLines(line);
    }

    int depth() {
        return frames.size();
    }
}
