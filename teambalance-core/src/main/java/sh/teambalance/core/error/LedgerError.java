// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

/**
 * Rule violations the ledger reports, each with its default reason.
 *
 * @since 0.1.0
 */
public enum LedgerError {
    EMPTY_TEAM("Team length must be bigger than 0"),
    LENGTH_MISMATCH("Team and proportions length mismatch"),
    INVALID_ADDRESS("Team member cannot be the zero address"),
    BAD_PROPORTION("Total proportion must equal 100"),
    NOT_OWNER("Caller is not the owner"),
    NO_USER_PROPORTION("User has no proportion assigned"),
    NO_BALANCE_TO_WITHDRAW("No balance available to withdraw"),
    /** Withdrawn amount already exceeds the share of lifetime inflow. */
    INSUFFICIENT_ENTITLEMENT("Withdrawn amount exceeds entitlement"),
    REENTRANT_CALL("Withdrawal already in progress");

    private final String reason;

    LedgerError(final String reason) {
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
