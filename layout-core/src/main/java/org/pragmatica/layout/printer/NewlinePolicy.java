package org.pragmatica.layout.printer;

import org.pragmatica.layout.LayoutConfig;
import org.pragmatica.layout.token.NewlineBehavior.Elective;
import org.pragmatica.layout.token.NewlineBehavior.Hard;
import org.pragmatica.layout.token.NewlineBehavior.Soft;
import org.pragmatica.layout.token.Token.Break;

/**
 * Newline semantics of breaks: which breaks fire regardless of width and how many newlines a fired
 * break writes.
 */
final class NewlinePolicy {
    private NewlinePolicy() {}

    /**
     * Whether the break fires no matter how much room is left on the line.
     */
    static boolean alwaysFires(Break token, boolean breakingEnabled, LayoutConfig config) {
        if (token.newlines() instanceof Hard) {
            return true;
        }
        if (!breakingEnabled) {
            return false;
        }
        if (token.newlines() instanceof Soft soft) {
            return !soft.discretionary() || config.respectsDiscretionaryNewlines() || soft.count() > 1;
        }
        return honorsSourceNewlines(token, config);
    }

    /**
     * Number of newlines a fired break writes, given the run of newlines written right before it.
     * Never negative; zero means the break reuses the line already started.
     *
     * @param forcedByComment the break ends the line of an end-of-line comment
     */
    static int newlineCount(Break token, int consecutiveNewlines, boolean forcedByComment, LayoutConfig config) {
        int count = declaredCount(token, consecutiveNewlines, config);

        if (forcedByComment && !(token.newlines() instanceof Hard)) {
            return Math.max(count, consecutiveNewlines == 0 ? 1 : 0);
        }
        return count;
    }

    private static int declaredCount(Break token, int consecutiveNewlines, LayoutConfig config) {
        var newlines = token.newlines();

        if (newlines instanceof Hard hard) {
            return hard.count();
        }
        if (newlines instanceof Soft soft) {
            int requested = soft.discretionary() && config.respectsDiscretionaryNewlines() && token.sourceNewlines() > 0
                            ? token.sourceNewlines()
                            : soft.count();

            if (soft.discretionary() && !config.respectsDiscretionaryNewlines() && requested == 1) {
                return electiveCount(consecutiveNewlines);
            }
            return capped(requested, consecutiveNewlines, config);
        }
        if (honorsSourceNewlines(token, config)) {
            return capped(token.sourceNewlines(), consecutiveNewlines, config);
        }
        return electiveCount(consecutiveNewlines);
    }

    private static boolean honorsSourceNewlines(Break token, LayoutConfig config) {
        return token.newlines() instanceof Elective elective
               && !elective.ignoresDiscretionary()
               && config.respectsDiscretionaryNewlines()
               && token.sourceNewlines() > 0;
    }

    // one more newline than blank lines: the first newline only ends the line
    private static int capped(int requested, int consecutiveNewlines, LayoutConfig config) {
        return Math.max(0, Math.min(requested, config.maxConsecutiveBlankLines() + 1) - consecutiveNewlines);
    }

    private static int electiveCount(int consecutiveNewlines) {
        return consecutiveNewlines == 0
               ? 1
               : 0;
    }
}
