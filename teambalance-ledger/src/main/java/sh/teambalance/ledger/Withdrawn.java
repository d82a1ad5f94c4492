// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

import java.math.BigInteger;
import java.util.Objects;

import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

/**
 * Emitted after a successful withdrawal.
 *
 * @param beneficiary the member who received the funds
 * @param asset       the asset paid out
 * @param amount      the amount transferred
 * @since 0.1.0
 */
public record Withdrawn(Address beneficiary, Asset asset, BigInteger amount) {

    public Withdrawn {
        Objects.requireNonNull(beneficiary, "beneficiary cannot be null");
        Objects.requireNonNull(asset, "asset cannot be null");
        Objects.requireNonNull(amount, "amount cannot be null");
    }
}
