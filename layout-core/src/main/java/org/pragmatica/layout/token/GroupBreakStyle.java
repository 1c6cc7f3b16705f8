package org.pragmatica.layout.token;

/**
 * How the breaks directly inside a group are decided.
 */
public enum GroupBreakStyle {
    /**
     * All direct breaks fire if the group does not fit on the current line, none fire otherwise.
     */
    CONSISTENT,
    /**
     * Each direct break fires only when the content following it would overflow the line.
     */
    INCONSISTENT
}
