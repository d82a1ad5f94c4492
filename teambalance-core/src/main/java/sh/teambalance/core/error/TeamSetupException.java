// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

/**
 * Thrown when a ledger cannot be created from the given team and proportions.
 *
 * @since 0.1.0
 */
public final class TeamSetupException extends LedgerRevertException {

    public TeamSetupException(final LedgerError kind) {
        this(kind, kind.reason());
    }

    public TeamSetupException(final LedgerError kind, final String reason) {
        super(kind, reason);
    }
}
