// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

import java.math.BigInteger;

import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

/**
 * Thrown when the external asset transfer of a withdrawal fails.
 * <p>
 * The ledger has already restored its counters when this is thrown; no amount is
 * recorded as paid.
 *
 * @since 0.1.0
 */
public final class TransferException extends TeamBalanceException {

    private final Asset asset;
    private final Address to;
    private final BigInteger amount;

    public TransferException(final Asset asset, final Address to, final BigInteger amount, final Throwable cause) {
        super("Transfer of " + amount + " " + asset + " to " + to + " failed", cause);
        this.asset = asset;
        this.to = to;
        this.amount = amount;
    }

    public Asset asset() {
        return asset;
    }

    public Address to() {
        return to;
    }

    public BigInteger amount() {
        return amount;
    }
}
