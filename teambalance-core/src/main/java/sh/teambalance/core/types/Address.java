// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.types;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import sh.teambalance.core.crypto.Keccak256;

/**
 * Hex-encoded 20-byte account identity.
 * <p>
 * Identifies team members, the ledger owner, and the token contract behind an {@link Asset}.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so two addresses differing only in case are equal.
 *
 * @since 0.1.0
 */
public record Address(@com.fasterxml.jackson.annotation.JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * Never a valid team member. Also used as the token address of {@link Asset#NATIVE}.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Parses an address from its hex form.
     *
     * @param value {@code 0x}-prefixed 40 digit hex string, any case
     * @return the address
     * @throws IllegalArgumentException if the value is malformed
     */
    public static Address from(final String value) {
        return new Address(value);
    }

    public boolean isZero() {
        return ZERO.equals(this);
    }

    /**
     * Returns the mixed-case EIP-55 checksum form of this address.
     * <p>
     * A hex letter is uppercased when the matching nibble of the Keccak-256 hash of the
     * lowercase address digits is 8 or higher.
     *
     * @return checksummed address with {@code 0x} prefix
     */
    public String toChecksum() {
        final String digits = value.substring(2);
        final byte[] hash = Keccak256.hash(digits.getBytes(StandardCharsets.US_ASCII));
        final StringBuilder sb = new StringBuilder(42).append("0x");
        for (int i = 0; i < digits.length(); i++) {
            final char c = digits.charAt(i);
            final int nibble = (i % 2 == 0) ? (hash[i / 2] >>> 4) & 0x0F : hash[i / 2] & 0x0F;
            sb.append(nibble >= 8 ? Character.toUpperCase(c) : c);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return value;
    }
}
