package org.pragmatica.layout;

import java.util.List;

/**
 * Outcome of one layout pass.
 *
 * @param text                  formatted text
 * @param trailingCommasAdded   comma regions that got a trailing comma the source did not have
 * @param trailingCommasRemoved comma regions whose source trailing comma was dropped
 */
public record LayoutResult(String text, int trailingCommasAdded, int trailingCommasRemoved) {
    public List<String> lines() {
        return text.lines().toList();
    }

    /**
     * Whether the formatted text differs from the given original, i.e. whether a file needs rewriting.
     */
    public boolean differsFrom(String original) {
        return !text.equals(original);
    }
}
