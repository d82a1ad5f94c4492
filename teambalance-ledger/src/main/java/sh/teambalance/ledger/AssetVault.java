// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

import java.math.BigInteger;

import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

/**
 * External custody of the assets a {@link TeamBalance} distributes.
 *
 * <p>
 * Deposits happen outside the ledger: anyone may credit the vault directly, and the
 * ledger discovers new inflow through {@link #balanceOf(Asset)}. Implementations back
 * onto a chain client, a custodial account, or {@link InMemoryAssetBook}.
 *
 * <p>
 * {@link #transfer} may run arbitrary code, including code that calls back into the
 * ledger before it returns. Such code must only run after the transferred amount has left
 * {@link #balanceOf(Asset)}, as it does for native and token transfers on chain.
 */
public interface AssetVault {

    /**
     * Returns how much of {@code asset} the ledger currently holds.
     *
     * @param asset the asset to query
     * @return the held amount, never negative
     */
    BigInteger balanceOf(Asset asset);

    /**
     * Moves {@code amount} of {@code asset} out of the ledger's holdings.
     *
     * @param asset  the asset to send
     * @param to     the recipient
     * @param amount a positive amount
     * @throws RuntimeException if the transfer did not happen
     */
    void transfer(Asset asset, Address to, BigInteger amount);
}
