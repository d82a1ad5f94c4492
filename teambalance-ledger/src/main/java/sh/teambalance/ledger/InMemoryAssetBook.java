// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

import sh.teambalance.core.error.InsufficientFundsException;
import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

/**
 * In-memory balances of any number of assets across any number of holders.
 *
 * <p>
 * Plays the role of the token contracts (and the native balance) around a ledger:
 * deposit into a ledger with {@link #transfer(Asset, Address, Address, BigInteger)} or
 * {@link #mint}, and hand the ledger {@link #vaultFor(Address)} as its custody.
 *
 * <pre>{@code
 * var book = new InMemoryAssetBook();
 * book.mint(usdc, treasury, BigInteger.valueOf(1_000));
 * var ledger = TeamBalance.create(members, owner, book.vaultFor(ledgerAddress));
 * book.transfer(usdc, treasury, ledgerAddress, BigInteger.TEN);
 * }</pre>
 *
 * <p>Thread safety: all methods synchronize on the book.
 */
public final class InMemoryAssetBook {

    private final Map<Asset, Map<Address, BigInteger>> balances = new HashMap<>();

    /**
     * Credits {@code amount} of {@code asset} to {@code holder} out of thin air.
     */
    public synchronized void mint(final Asset asset, final Address holder, final BigInteger amount) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(holder, "holder");
        requireNonNegative(amount);
        holdings(asset).merge(holder, amount, BigInteger::add);
    }

    /**
     * Moves {@code amount} of {@code asset} between two holders.
     *
     * @throws InsufficientFundsException if {@code from} holds less than {@code amount}
     */
    public synchronized void transfer(
            final Asset asset, final Address from, final Address to, final BigInteger amount) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        requireNonNegative(amount);

        final Map<Address, BigInteger> holdings = holdings(asset);
        final BigInteger available = holdings.getOrDefault(from, BigInteger.ZERO);
        if (available.compareTo(amount) < 0) {
            throw new InsufficientFundsException(asset, from, available, amount);
        }
        holdings.put(from, available.subtract(amount));
        holdings.merge(to, amount, BigInteger::add);
    }

    public synchronized BigInteger balanceOf(final Asset asset, final Address holder) {
        final Map<Address, BigInteger> holdings = balances.get(asset);
        return holdings == null ? BigInteger.ZERO : holdings.getOrDefault(holder, BigInteger.ZERO);
    }

    /**
     * Returns a vault view over {@code holder}'s balances, for use as a ledger's custody.
     */
    public AssetVault vaultFor(final Address holder) {
        Objects.requireNonNull(holder, "holder");
        return new AssetVault() {
            @Override
            public BigInteger balanceOf(final Asset asset) {
                return InMemoryAssetBook.this.balanceOf(asset, holder);
            }

            @Override
            public void transfer(final Asset asset, final Address to, final BigInteger amount) {
                InMemoryAssetBook.this.transfer(asset, holder, to, amount);
            }
        };
    }

    private Map<Address, BigInteger> holdings(final Asset asset) {
        return balances.computeIfAbsent(asset, a -> new HashMap<>());
    }

    private static void requireNonNegative(final BigInteger amount) {
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative: " + amount);
        }
    }
}
