package org.pragmatica.layout.printer;

import org.pragmatica.layout.token.PrinterControlKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counter of unmatched disable-breaking controls. Breaks, except hard ones, fire only at zero.
 */
final class BreakingControl {
    private static final Logger log = LoggerFactory.getLogger(BreakingControl.class);

    private int disabled;

    void apply(PrinterControlKind kind, int index) {
        switch (kind) {
            case DISABLE_BREAKING -> disabled++;
            case ENABLE_BREAKING -> {
                if (disabled == 0) {
                    log.debug("Ignoring unmatched enable-breaking control at token {}", index);
                } else {
                    disabled--;
                }
            }
        }
    }

    boolean isBreakingEnabled() {
        return disabled == 0;
    }

    int depth() {
        return disabled;
    }
}
