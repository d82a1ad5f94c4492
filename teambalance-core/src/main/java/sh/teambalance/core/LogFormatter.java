// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core;

import static sh.teambalance.core.AnsiColors.*;

import java.math.BigInteger;

import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

/**
 * Formats one-line ledger traces for {@link DebugLogger}.
 *
 * <p>
 * Status symbols (✓ ✗) mark outcome, a bracketed tag names the operation, and addresses
 * are shortened to {@code 0xAbCd...eF01} in checksum case.
 *
 * <pre>{@code
 * DebugLogger.logWithdraw(LogFormatter.formatWithdraw(member, asset, amount, inflow));
 * // ✓ [WITHDRAW] to=0x7099...79C8 asset=NATIVE amount=5 inflow=10
 * }</pre>
 *
 * @see AnsiColors
 */
public final class LogFormatter {

    /** Characters kept at the start of a shortened address, including "0x". */
    private static final int PREFIX_LENGTH = 6;

    private static final int SUFFIX_LENGTH = 4;

    private LogFormatter() {
    }

    /**
     * Format: ✓ [WITHDRAW] to=0x7099...79C8 asset=NATIVE amount=5 inflow=10
     */
    public static String formatWithdraw(Address to, Asset asset, BigInteger amount, BigInteger inflow) {
        return String.format(
                "%s✓%s %s[WITHDRAW]%s to=%s asset=%s amount=%s %sinflow=%s%s",
                TEAL, RESET,
                LAVENDER, RESET,
                shorten(to),
                formatAsset(asset),
                amount,
                SLATE, inflow, RESET);
    }

    /**
     * Format: ✗ [TRANSFER-FAILED] to=0x7099...79C8 asset=0x5FbD...0aa3 amount=5 reason=...
     */
    public static String formatTransferFailure(Address to, Asset asset, BigInteger amount, String reason) {
        return String.format(
                "%s✗%s %s[TRANSFER-FAILED]%s to=%s asset=%s amount=%s reason=%s%s%s",
                CORAL, RESET,
                CORAL, RESET,
                shorten(to),
                formatAsset(asset),
                amount,
                CORAL, reason, RESET);
    }

    /**
     * Format: [ENTITLEMENT] member=0x7099...79C8 asset=NATIVE share=50 inflow=10 withdrawn=0 result=5
     */
    public static String formatEntitlement(
            Address member, Asset asset, int share, BigInteger inflow, BigInteger withdrawn, BigInteger result) {
        return String.format(
                "%s[ENTITLEMENT]%s member=%s asset=%s share=%d inflow=%s withdrawn=%s result=%s",
                INDIGO, RESET,
                shorten(member),
                formatAsset(asset),
                share, inflow, withdrawn, result);
    }

    private static String formatAsset(Asset asset) {
        return asset.isNative() ? "NATIVE" : shorten(asset.token());
    }

    private static String shorten(Address address) {
        String full = address.toChecksum();
        return full.substring(0, PREFIX_LENGTH) + "..." + full.substring(full.length() - SUFFIX_LENGTH);
    }
}
