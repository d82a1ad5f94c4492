// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

/**
 * Base runtime exception for all ledger failures.
 *
 * <p>
 * Sealed so that every failure the ledger can raise is one of a known set:
 * <pre>
 * TeamBalanceException
 * ├── {@link LedgerRevertException} - a ledger rule rejected the call, see {@link LedgerError}
 * │   ├── {@link TeamSetupException} - invalid team or proportions at creation
 * │   ├── {@link UnauthorizedException} - caller is not the owner
 * │   └── {@link WithdrawException} - nothing (or too much) to withdraw
 * ├── {@link TransferException} - the external asset transfer failed, withdrawal rolled back
 * └── {@link InsufficientFundsException} - an in-memory holder tried to send more than it holds
 * </pre>
 *
 * <p>
 * <strong>Usage:</strong>
 *
 * <pre>{@code
 * try {
 *     ledger.withdraw(owner, asset, member);
 * } catch (WithdrawException e) {
 *     if (e.kind() == LedgerError.NO_BALANCE_TO_WITHDRAW) {
 *         // nothing new since the last withdrawal
 *     }
 * } catch (TeamBalanceException e) {
 *     // any other ledger failure
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public sealed class TeamBalanceException extends RuntimeException
        permits LedgerRevertException,
        TransferException,
        InsufficientFundsException {

    public TeamBalanceException(final String message) {
        super(message);
    }

    public TeamBalanceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
