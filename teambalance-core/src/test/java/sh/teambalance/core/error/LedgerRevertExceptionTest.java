// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.core.error;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;

import org.junit.jupiter.api.Test;

import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

class LedgerRevertExceptionTest {

    private static final Address MEMBER = new Address("0x" + "1".repeat(40));

    @Test
    void setupErrorUsesDefaultReason() {
        TeamSetupException ex = new TeamSetupException(LedgerError.BAD_PROPORTION);

        assertEquals(LedgerError.BAD_PROPORTION, ex.kind());
        assertEquals("Total proportion must equal 100", ex.reason());
        assertEquals("Ledger revert [BAD_PROPORTION]: Total proportion must equal 100", ex.getMessage());
    }

    @Test
    void withdrawErrorKeepsCustomReason() {
        WithdrawException ex = new WithdrawException(LedgerError.INSUFFICIENT_ENTITLEMENT, "over by 3");

        assertEquals(LedgerError.INSUFFICIENT_ENTITLEMENT, ex.kind());
        assertEquals("over by 3", ex.reason());
    }

    @Test
    void unauthorizedCarriesCaller() {
        UnauthorizedException ex = new UnauthorizedException(MEMBER);

        assertEquals(LedgerError.NOT_OWNER, ex.kind());
        assertEquals(MEMBER, ex.caller());
        assertTrue(ex.getMessage().contains(MEMBER.value()));
    }

    @Test
    void transferFailureKeepsCause() {
        IllegalStateException cause = new IllegalStateException("reverted");
        TransferException ex = new TransferException(Asset.NATIVE, MEMBER, BigInteger.TEN, cause);

        assertSame(cause, ex.getCause());
        assertEquals(BigInteger.TEN, ex.amount());
        assertEquals(MEMBER, ex.to());
        assertEquals(Asset.NATIVE, ex.asset());
    }

    @Test
    void allLedgerFailuresShareOneBase() {
        TeamBalanceException setup = new TeamSetupException(LedgerError.EMPTY_TEAM);
        TeamBalanceException funds = new InsufficientFundsException(
                Asset.NATIVE, MEMBER, BigInteger.ONE, BigInteger.TWO);

        assertInstanceOf(LedgerRevertException.class, setup);
        assertInstanceOf(RuntimeException.class, funds);
        assertTrue(funds.getMessage().contains("has 1, needs 2"));
    }
}
