// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

import java.math.BigInteger;

import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

/**
 * Thrown when a holder tries to move more of an asset than it holds.
 *
 * @since 0.1.0
 */
public final class InsufficientFundsException extends TeamBalanceException {

    private final Address holder;
    private final BigInteger available;
    private final BigInteger requested;

    public InsufficientFundsException(
            final Asset asset,
            final Address holder,
            final BigInteger available,
            final BigInteger requested) {
        super("Insufficient " + asset + " balance for " + holder + ": has " + available + ", needs " + requested);
        this.holder = holder;
        this.available = available;
        this.requested = requested;
    }

    public Address holder() {
        return holder;
    }

    public BigInteger available() {
        return available;
    }

    public BigInteger requested() {
        return requested;
    }
}
