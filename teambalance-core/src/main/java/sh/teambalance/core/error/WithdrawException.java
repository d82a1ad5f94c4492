// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

/**
 * Thrown when a withdrawal is rejected for the requested member and asset.
 * <p>
 * These are expected outcomes, not faults: the member has no share, has nothing new to
 * withdraw, has already withdrawn more than the share allows, or another withdrawal is
 * still running on the same ledger.
 *
 * @since 0.1.0
 */
public final class WithdrawException extends LedgerRevertException {

    public WithdrawException(final LedgerError kind) {
        this(kind, kind.reason());
    }

    public WithdrawException(final LedgerError kind, final String reason) {
        super(kind, reason);
    }
}
