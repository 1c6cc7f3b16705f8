package org.pragmatica.layout.token;

/**
 * Indentation applied to the scope of an open break.
 */
public enum OpenBreakKind {
    /**
     * Block indent for the scope; a continuation indent is carried along when the open break
     * sits on a continuation line.
     */
    BLOCK,
    /**
     * At most one continuation indent, applied when the line of the open break is a continuation
     * line or when the open break itself fires. Never applies a block indent.
     */
    CONTINUATION
}
