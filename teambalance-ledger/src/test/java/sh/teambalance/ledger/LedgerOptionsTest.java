// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LedgerOptionsTest {

    @Test
    void defaultsUsePerAssetAccountingWithGuard() {
        LedgerOptions options = LedgerOptions.defaults();

        assertEquals(LedgerOptions.Accounting.PER_ASSET, options.accounting());
        assertEquals(LedgerOptions.UnderflowPolicy.FAIL, options.underflowPolicy());
        assertTrue(options.reentrancyGuard());
        assertEquals(options, LedgerOptions.builder().build());
    }

    @Test
    void legacyUsesSharedCounter() {
        assertEquals(LedgerOptions.Accounting.SHARED, LedgerOptions.legacy().accounting());
        assertEquals(LedgerOptions.UnderflowPolicy.FAIL, LedgerOptions.legacy().underflowPolicy());
    }

    @Test
    void builderOverridesEachField() {
        LedgerOptions options = LedgerOptions.builder()
                .accounting(LedgerOptions.Accounting.SHARED)
                .underflowPolicy(LedgerOptions.UnderflowPolicy.SATURATE)
                .reentrancyGuard(false)
                .build();

        assertEquals(LedgerOptions.Accounting.SHARED, options.accounting());
        assertEquals(LedgerOptions.UnderflowPolicy.SATURATE, options.underflowPolicy());
        assertFalse(options.reentrancyGuard());
        assertNotEquals(LedgerOptions.defaults(), options);
        assertTrue(options.toString().contains("accounting=SHARED"));
    }

    @Test
    void builderRejectsNulls() {
        assertThrows(NullPointerException.class, () -> LedgerOptions.builder().accounting(null));
        assertThrows(NullPointerException.class, () -> LedgerOptions.builder().underflowPolicy(null));
    }
}
