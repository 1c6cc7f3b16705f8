package org.pragmatica.layout.token;

public enum PrinterControlKind {
    /**
     * Suppress firing of non-hard breaks until a matching {@link #ENABLE_BREAKING}. Nests.
     */
    DISABLE_BREAKING,
    ENABLE_BREAKING
}
