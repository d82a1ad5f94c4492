// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

/**
 * Receives {@link Withdrawn} events once the transfer has completed.
 *
 * <p>
 * Runs on the withdrawing thread while the ledger is locked. Exceptions are logged
 * and do not undo the withdrawal.
 */
@FunctionalInterface
public interface WithdrawalListener {

    void onWithdrawn(Withdrawn event);
}
