// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for ledger traces.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.teambalance.debug");

    private DebugLogger() {
    }

    public static void logWithdraw(final String message, final Object... args) {
        if (!LedgerDebug.isWithdrawLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logQuery(final String message, final Object... args) {
        if (!LedgerDebug.isQueryLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!LedgerDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Colored output goes straight to stdout on a TTY, everything else through SLF4J.
     * Messages are always sanitized first.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        final String sanitized = LogSanitizer.sanitize(formatted);

        if (AnsiColors.IS_TTY) {
            System.out.println(sanitized);
        } else {
            LOG.info(sanitized);
        }
    }
}
