// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.teambalance.core.error.LedgerError;
import sh.teambalance.core.error.WithdrawException;
import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

/**
 * A recipient that calls back into the ledger while its transfer is in flight.
 */
class TeamBalanceReentrancyTest {

    private static final Address LEDGER = new Address("0x" + "f".repeat(40));
    private static final Address OWNER = new Address("0x" + "a".repeat(40));
    private static final Address ALICE = new Address("0x" + "1".repeat(40));
    private static final Address BOB = new Address("0x" + "2".repeat(40));
    private static final Asset TOKEN = Asset.token("0x" + "e".repeat(40));

    private InMemoryAssetBook book;
    private CallbackVault vault;
    private final List<LedgerError> nestedFailures = new ArrayList<>();

    @BeforeEach
    void setUp() {
        book = new InMemoryAssetBook();
        book.mint(TOKEN, LEDGER, BigInteger.TEN);
        vault = new CallbackVault(book.vaultFor(LEDGER));
    }

    @Test
    void guardRejectsNestedWithdrawal() {
        TeamBalance ledger = create(LedgerOptions.defaults());
        vault.onTransfer = to -> tryWithdraw(ledger, ALICE);

        assertEquals(BigInteger.valueOf(5), ledger.withdraw(OWNER, TOKEN, ALICE));

        assertEquals(List.of(LedgerError.REENTRANT_CALL), nestedFailures);
        assertEquals(BigInteger.valueOf(5), book.balanceOf(TOKEN, ALICE));
        assertEquals(BigInteger.valueOf(5), book.balanceOf(TOKEN, LEDGER));
    }

    @Test
    void guardIsReleasedAfterWithdrawal() {
        TeamBalance ledger = create(LedgerOptions.defaults());

        ledger.withdraw(OWNER, TOKEN, ALICE);

        assertEquals(BigInteger.valueOf(5), ledger.withdraw(OWNER, TOKEN, BOB));
    }

    @Test
    void committedCountersStopReplayWithoutGuard() {
        TeamBalance ledger = create(LedgerOptions.builder().reentrancyGuard(false).build());
        vault.onTransfer = to -> {
            vault.onTransfer = null;
            tryWithdraw(ledger, ALICE);
        };

        ledger.withdraw(OWNER, TOKEN, ALICE);

        assertEquals(List.of(LedgerError.NO_BALANCE_TO_WITHDRAW), nestedFailures);
        assertEquals(BigInteger.valueOf(5), book.balanceOf(TOKEN, ALICE));
        assertEquals(BigInteger.valueOf(5), ledger.withdrawn(ALICE));
    }

    @Test
    void nestedWithdrawalForAnotherMemberSeesConsistentBooks() {
        TeamBalance ledger = create(LedgerOptions.builder().reentrancyGuard(false).build());
        vault.onTransfer = to -> {
            vault.onTransfer = null;
            tryWithdraw(ledger, BOB);
        };

        ledger.withdraw(OWNER, TOKEN, ALICE);

        assertTrue(nestedFailures.isEmpty());
        assertEquals(BigInteger.valueOf(5), book.balanceOf(TOKEN, ALICE));
        assertEquals(BigInteger.valueOf(5), book.balanceOf(TOKEN, BOB));
        assertEquals(BigInteger.ZERO, book.balanceOf(TOKEN, LEDGER));
        assertEquals(BigInteger.TEN, ledger.totalBalance(TOKEN));
        assertEquals(2, ledger.withdrawals().size());
    }

    private TeamBalance create(LedgerOptions options) {
        return TeamBalance.create(List.of(ALICE, BOB), List.of(50, 50), OWNER, vault, options);
    }

    private void tryWithdraw(TeamBalance ledger, Address member) {
        try {
            ledger.withdraw(OWNER, TOKEN, member);
        } catch (WithdrawException e) {
            nestedFailures.add(e.kind());
        }
    }

    /** Moves the funds, then hands control to the recipient. */
    private static final class CallbackVault implements AssetVault {
        private final AssetVault delegate;
        private Consumer<Address> onTransfer;

        CallbackVault(AssetVault delegate) {
            this.delegate = delegate;
        }

        @Override
        public BigInteger balanceOf(Asset asset) {
            return delegate.balanceOf(asset);
        }

        @Override
        public void transfer(Asset asset, Address to, BigInteger amount) {
            delegate.transfer(asset, to, amount);
            if (onTransfer != null) {
                onTransfer.accept(to);
            }
        }
    }
}
