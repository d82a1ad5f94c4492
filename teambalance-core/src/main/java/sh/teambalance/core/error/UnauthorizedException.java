// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

import sh.teambalance.core.types.Address;

/**
 * Thrown when someone other than the owner attempts a withdrawal.
 *
 * @since 0.1.0
 */
public final class UnauthorizedException extends LedgerRevertException {

    private final Address caller;

    public UnauthorizedException(final Address caller) {
        super(LedgerError.NOT_OWNER, LedgerError.NOT_OWNER.reason() + ": " + caller);
        this.caller = caller;
    }

    public Address caller() {
        return caller;
    }
}
