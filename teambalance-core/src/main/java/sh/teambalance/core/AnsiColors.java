// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core;

/**
 * ANSI color palette for debug traces, disabled automatically off a TTY.
 *
 * <p>
 * Set {@code FORCE_COLOR=true} to keep colors when output is redirected.
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** Clears all formatting. */
    public static final String RESET = ansi("0");

    /** Success. */
    public static final String TEAL = ansi("38;5;44");

    /** Failure. */
    public static final String CORAL = ansi("38;5;204");

    /** Read-only queries. */
    public static final String INDIGO = ansi("38;5;99");

    /** Withdrawals. */
    public static final String LAVENDER = ansi("38;5;183");

    /** Secondary fields. */
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
