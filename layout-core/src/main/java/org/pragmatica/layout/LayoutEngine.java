package org.pragmatica.layout;

import org.pragmatica.layout.printer.LayoutPrinter;
import org.pragmatica.layout.token.TokenStream;

/**
 * Layout engine of the source formatter.
 * <p>
 * Takes the token stream produced for one formatting unit and lays it out:
 * - lines never exceed the configured width unless a single token is wider or breaking is disabled
 * - blank lines are capped at the configured maximum, except for hard newlines
 * - multi-line comma delimited collections always end with a trailing comma, single-line never do
 * <p>
 * Instances are immutable; each call runs a fresh printer, so one engine may serve several threads.
 */
public final class LayoutEngine {
    private final LayoutConfig config;

    private LayoutEngine(LayoutConfig config) {
        this.config = config;
    }

    /**
     * Factory method for creating an engine with default config.
     */
    public static LayoutEngine layoutEngine() {
        return new LayoutEngine(LayoutConfig.defaultConfig());
    }

    /**
     * Factory method for creating an engine with custom config.
     */
    public static LayoutEngine layoutEngine(LayoutConfig config) {
        if (config == null) {
            throw LayoutError.invalidConfig("config", null);
        }
        return new LayoutEngine(config);
    }

    /**
     * Lay out the token stream.
     *
     * @throws LayoutError if the stream is malformed
     */
    public LayoutResult format(TokenStream stream) {
        return LayoutPrinter.layoutPrinter(config)
                            .print(stream);
    }

    /**
     * Whether laying out the stream reproduces {@code original} exactly.
     */
    public boolean isFormatted(TokenStream stream, String original) {
        return !format(stream).differsFrom(original);
    }

    public LayoutConfig config() {
        return config;
    }
}
