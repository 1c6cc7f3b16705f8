package org.pragmatica.layout.printer;

import org.pragmatica.layout.token.GroupBreakStyle;

/**
 * Open group as seen by the printer.
 *
 * @param style        break style of the group
 * @param startColumn  column at which the group opened
 * @param forcedBroken every direct break of the group fires
 */
record GroupFrame(GroupBreakStyle style, int startColumn, boolean forcedBroken) {
    /**
     * Implicit frame around the whole stream.
     */
    static GroupFrame root() {
        return new GroupFrame(GroupBreakStyle.INCONSISTENT, 0, false);
    }

    boolean isConsistent() {
        return style == GroupBreakStyle.CONSISTENT;
    }
}
