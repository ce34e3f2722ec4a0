// file: editor/src/main/java/io/pagetree/editor/EditLogger.java
package io.pagetree.editor;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Single place that logs the outcome and latency of editor operations.
 *
 * Levels:
 *  - COMMITTED -> INFO
 *  - NO_OP     -> FINE    (operation did not apply: unknown node, last node, ...)
 *  - REJECTED  -> WARNING (mutation produced an invalid tree and was discarded)
 *  - FAILED    -> SEVERE  (stored data could not be read)
 */
public final class EditLogger {
    private static final Logger log = Logger.getLogger(EditLogger.class.getName());

    public enum Outcome { COMMITTED, NO_OP, REJECTED, FAILED }

    private EditLogger() {
        // utility
    }

    /**
     * @param operation   operation name (addBranch, drop:insert, undo, ...)
     * @param outcome     what happened
     * @param totalMicros wall-clock latency of the operation, or -1 if not measured
     * @param detail      short free-form context, may be null
     * @param error       cause for FAILED outcomes, null otherwise
     */
    public static void logEdit(String operation, Outcome outcome, long totalMicros, String detail, Throwable error) {
        Level level = switch (outcome) {
            case COMMITTED -> Level.INFO;
            case NO_OP -> Level.FINE;
            case REJECTED -> Level.WARNING;
            case FAILED -> Level.SEVERE;
        };
        if (!log.isLoggable(level)) return;

        String msg = String.format(
                "EDIT %s -> %s%s%s",
                operation,
                outcome,
                totalMicros >= 0 ? " (" + totalMicros + "us)" : "",
                detail != null && !detail.isEmpty() ? ": " + detail : ""
        );
        if (error != null) {
            log.log(level, msg, error);
        } else {
            log.log(level, msg);
        }
    }

    public static long micros(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000L;
    }
}
