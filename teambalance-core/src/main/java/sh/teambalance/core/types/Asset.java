// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.types;

import java.util.Objects;

/**
 * Fungible asset whose balances the ledger tracks.
 * <p>
 * An asset is identified by the address of its token contract. The native balance of the
 * chain has no contract and is represented by {@link #NATIVE}, whose token address is
 * {@link Address#ZERO}. Balances of distinct assets are never mixed.
 *
 * @param token the token contract address, or {@link Address#ZERO} for the native balance
 * @since 0.1.0
 */
public record Asset(@com.fasterxml.jackson.annotation.JsonValue Address token) {

    /** Sentinel for the chain's native balance. */
    public static final Asset NATIVE = new Asset(Address.ZERO);

    public Asset {
        Objects.requireNonNull(token, "token");
    }

    public static Asset token(final Address token) {
        return new Asset(token);
    }

    public static Asset token(final String token) {
        return new Asset(new Address(token));
    }

    public boolean isNative() {
        return token.isZero();
    }

    @Override
    public String toString() {
        return isNative() ? "NATIVE" : token.value();
    }
}
