// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core;

/**
 * Global toggle for verbose debug logging of ledger activity.
 *
 * <p>Thread safety: the flags are volatile. {@link #isEnabled()} reads them non-atomically,
 * which only matters for best-effort logging.
 */
public final class LedgerDebug {

    private static volatile boolean withdrawLogging = false;
    private static volatile boolean queryLogging = false;

    private LedgerDebug() {
    }

    /**
     * @return true if either withdrawal or query logging is enabled
     */
    public static boolean isEnabled() {
        return withdrawLogging || queryLogging;
    }

    public static void setEnabled(final boolean enabled) {
        withdrawLogging = enabled;
        queryLogging = enabled;
    }

    public static void setWithdrawLogging(final boolean enabled) {
        withdrawLogging = enabled;
    }

    public static boolean isWithdrawLoggingEnabled() {
        return withdrawLogging;
    }

    public static void setQueryLogging(final boolean enabled) {
        queryLogging = enabled;
    }

    public static boolean isQueryLoggingEnabled() {
        return queryLogging;
    }
}
