// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

import java.util.Objects;

/**
 * A ledger rule rejected the call before any state changed.
 *
 * <p>
 * {@link #kind()} identifies the rule; {@link #reason()} is the human-readable
 * message, which defaults to {@link LedgerError#reason()}.
 *
 * @since 0.1.0
 */
public abstract sealed class LedgerRevertException extends TeamBalanceException
        permits TeamSetupException,
        UnauthorizedException,
        WithdrawException {

    private final LedgerError kind;
    private final String reason;

    protected LedgerRevertException(final LedgerError kind, final String reason) {
        super(messageFor(kind, reason));
        this.kind = Objects.requireNonNull(kind, "kind");
        this.reason = reason;
    }

    private static String messageFor(final LedgerError kind, final String reason) {
        return "Ledger revert [" + kind + "]: " + reason;
    }

    public LedgerError kind() {
        return kind;
    }

    public String reason() {
        return reason;
    }
}
