// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.teambalance.core.DebugLogger;
import sh.teambalance.core.LogFormatter;
import sh.teambalance.core.error.LedgerError;
import sh.teambalance.core.error.TeamSetupException;
import sh.teambalance.core.error.TransferException;
import sh.teambalance.core.error.UnauthorizedException;
import sh.teambalance.core.error.WithdrawException;
import sh.teambalance.core.types.Address;
import sh.teambalance.core.types.Asset;

/**
 * Ledger that splits every asset it receives among a fixed team by percentage.
 *
 * <p>
 * Funds arrive by being credited to the {@link AssetVault} directly; the ledger is never
 * told about deposits. Instead it remembers, per asset, how much it has paid out
 * ({@link #totalBalance(Asset)}). Paid-out plus currently held is everything the vault ever
 * received, so a member's entitlement is
 *
 * <pre>
 * floor((totalBalance[asset] + vault.balanceOf(asset)) * share / 100) - withdrawn
 * </pre>
 *
 * <p>
 * A withdrawal adds the paid amount to {@code totalBalance} and to the member's withdrawn
 * counters, and only then calls {@link AssetVault#transfer}. Members withdraw independently,
 * in any order and as often as they like. Integer-division remainders stay in the vault and
 * are paid out by later withdrawals once enough inflow accumulates.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * TeamBalance ledger = TeamBalance.create(
 *         List.of(alice, bob), List.of(60, 40), owner, vault);
 *
 * BigInteger owed = ledger.entitlement(usdc, alice);
 * ledger.withdraw(owner, usdc, alice);   // transfers `owed` to alice
 * }</pre>
 *
 * <p>
 * <strong>Thread safety:</strong> all operations synchronize on the ledger. A withdrawal
 * holds the lock while the vault transfers, so listeners and vault callbacks on the same
 * thread may call back in; see {@link LedgerOptions#reentrancyGuard()}.
 *
 * @see LedgerOptions
 * @since 0.1.0
 */
public final class TeamBalance {

    private static final Logger LOG = LoggerFactory.getLogger(TeamBalance.class);

    /** Shares of a valid team add up to exactly this. */
    public static final int TOTAL_PROPORTION = 100;

    private static final BigInteger HUNDRED = BigInteger.valueOf(TOTAL_PROPORTION);

    private final Address owner;
    private final Map<Address, Integer> proportions;
    private final AssetVault vault;
    private final LedgerOptions options;

    private final Map<Asset, BigInteger> totalBalance = new HashMap<>();
    private final Map<Address, BigInteger> withdrawn = new HashMap<>();
    private final Map<Address, Map<Asset, BigInteger>> withdrawnByAsset = new HashMap<>();
    private final List<Withdrawn> history = new ArrayList<>();
    private final List<WithdrawalListener> listeners = new CopyOnWriteArrayList<>();

    private int activeWithdrawals;

    private TeamBalance(
            final Address owner,
            final Map<Address, Integer> proportions,
            final AssetVault vault,
            final LedgerOptions options) {
        this.owner = owner;
        this.proportions = Collections.unmodifiableMap(proportions);
        this.vault = vault;
        this.options = options;
    }

    /**
     * Creates a ledger from parallel lists of members and proportions, with default options.
     *
     * @see #create(List, List, Address, AssetVault, LedgerOptions)
     */
    public static TeamBalance create(
            final List<Address> team,
            final List<Integer> proportions,
            final Address creator,
            final AssetVault vault) {
        return create(team, proportions, creator, vault, null);
    }

    /**
     * Creates a ledger from parallel lists of members and proportions.
     *
     * @param team        the members, in order
     * @param proportions each member's percentage, matched by index
     * @param creator     becomes the owner, the only identity allowed to withdraw
     * @param vault       custody of the distributed assets
     * @param options     ledger options, or null for {@link LedgerOptions#defaults()}
     * @return the new ledger
     * @throws TeamSetupException       {@code EMPTY_TEAM} if {@code team} is empty,
     *                                  {@code LENGTH_MISMATCH} if the lists differ in size,
     *                                  {@code INVALID_ADDRESS} for a null or zero-address member,
     *                                  {@code BAD_PROPORTION} if proportions do not sum to 100
     * @throws IllegalArgumentException if a proportion is negative
     */
    public static TeamBalance create(
            final List<Address> team,
            final List<Integer> proportions,
            final Address creator,
            final AssetVault vault,
            final @Nullable LedgerOptions options) {
        Objects.requireNonNull(team, "team");
        Objects.requireNonNull(proportions, "proportions");
        if (team.isEmpty()) {
            throw new TeamSetupException(LedgerError.EMPTY_TEAM);
        }
        if (team.size() != proportions.size()) {
            throw new TeamSetupException(LedgerError.LENGTH_MISMATCH);
        }
        final List<TeamMember> members = new ArrayList<>(team.size());
        for (int i = 0; i < team.size(); i++) {
            final Address member = team.get(i);
            if (member == null) {
                throw new TeamSetupException(LedgerError.INVALID_ADDRESS);
            }
            members.add(new TeamMember(member, Objects.requireNonNull(proportions.get(i), "proportion")));
        }
        return create(members, creator, vault, options);
    }

    /**
     * Creates a ledger from team entries, with default options.
     *
     * @see #create(List, Address, AssetVault, LedgerOptions)
     */
    public static TeamBalance create(
            final List<TeamMember> members,
            final Address creator,
            final AssetVault vault) {
        return create(members, creator, vault, null);
    }

    /**
     * Creates a ledger from team entries.
     * <p>
     * A member listed more than once keeps the proportion of its last entry, while the
     * 100 total is checked against every entry as given. A proportion of 0 leaves the member
     * without a share.
     *
     * @param members the team table, in order
     * @param creator becomes the owner, the only identity allowed to withdraw
     * @param vault   custody of the distributed assets
     * @param options ledger options, or null for {@link LedgerOptions#defaults()}
     * @return the new ledger
     * @throws TeamSetupException {@code EMPTY_TEAM}, {@code INVALID_ADDRESS} or {@code BAD_PROPORTION}
     */
    public static TeamBalance create(
            final List<TeamMember> members,
            final Address creator,
            final AssetVault vault,
            final @Nullable LedgerOptions options) {
        Objects.requireNonNull(members, "members");
        Objects.requireNonNull(creator, "creator");
        Objects.requireNonNull(vault, "vault");
        if (members.isEmpty()) {
            throw new TeamSetupException(LedgerError.EMPTY_TEAM);
        }

        final Map<Address, Integer> table = new LinkedHashMap<>();
        long total = 0;
        for (TeamMember entry : members) {
            Objects.requireNonNull(entry, "member");
            if (entry.member().isZero()) {
                throw new TeamSetupException(LedgerError.INVALID_ADDRESS);
            }
            if (table.containsKey(entry.member())) {
                LOG.warn("Team member {} listed more than once, keeping proportion {} of the last entry",
                        entry.member(), entry.proportion());
            }
            if (entry.proportion() == 0) {
                table.remove(entry.member());
            } else {
                table.put(entry.member(), entry.proportion());
            }
            total += entry.proportion();
        }
        if (total != TOTAL_PROPORTION) {
            throw new TeamSetupException(LedgerError.BAD_PROPORTION,
                    LedgerError.BAD_PROPORTION.reason() + ", got " + total);
        }

        final TeamBalance ledger = new TeamBalance(
                creator, table, vault, options != null ? options : LedgerOptions.defaults());
        DebugLogger.log("[TEAM] owner=%s members=%d options=%s", creator, table.size(), ledger.options);
        return ledger;
    }

    /**
     * Returns how much of {@code asset} {@code beneficiary} could withdraw right now.
     * <p>
     * Never fails for unknown members, who are owed nothing. When the member has already
     * withdrawn more than the share of lifetime inflow the result is zero; see
     * {@link #rawEntitlement(Asset, Address)} for the signed value.
     *
     * @param asset       the asset
     * @param beneficiary the member
     * @return the withdrawable amount, never negative
     */
    public synchronized BigInteger entitlement(final Asset asset, final Address beneficiary) {
        final BigInteger raw = rawEntitlement(asset, beneficiary);
        return raw.signum() < 0 ? BigInteger.ZERO : raw;
    }

    /**
     * Returns the entitlement without clamping at zero.
     * <p>
     * Negative when the withdrawn counter exceeds the member's share of lifetime inflow, which
     * {@link LedgerOptions.Accounting#SHARED} accounting makes possible across assets.
     *
     * @param asset       the asset
     * @param beneficiary the member
     * @return entitled amount minus withdrawn amount, possibly negative
     */
    public synchronized BigInteger rawEntitlement(final Asset asset, final Address beneficiary) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(beneficiary, "beneficiary");
        return compute(asset, beneficiary, share(beneficiary), vault.balanceOf(asset));
    }

    public BigInteger entitlementNative(final Address beneficiary) {
        return entitlement(Asset.NATIVE, beneficiary);
    }

    /**
     * Pays {@code beneficiary} everything currently owed in {@code asset}.
     *
     * @param caller      the identity making the call, must be the owner
     * @param asset       the asset to pay out
     * @param beneficiary the member to pay
     * @return the amount transferred
     * @throws UnauthorizedException if {@code caller} is not the owner
     * @throws WithdrawException     {@code NO_USER_PROPORTION} for a member without a share,
     *                               {@code NO_BALANCE_TO_WITHDRAW} when nothing is owed,
     *                               {@code INSUFFICIENT_ENTITLEMENT} when withdrawals exceed
     *                               the share and the policy is {@code FAIL},
     *                               {@code REENTRANT_CALL} from inside another withdrawal
     * @throws TransferException     if the vault transfer failed; the ledger is unchanged
     *                               (an {@link Error} from the vault is rethrown as is, also
     *                               leaving the ledger unchanged)
     */
    public synchronized BigInteger withdraw(final Address caller, final Asset asset, final Address beneficiary) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(beneficiary, "beneficiary");

        if (!owner.equals(caller)) {
            throw new UnauthorizedException(caller);
        }
        if (options.reentrancyGuard() && activeWithdrawals > 0) {
            throw new WithdrawException(LedgerError.REENTRANT_CALL);
        }
        final int share = share(beneficiary);
        if (share == 0) {
            throw new WithdrawException(LedgerError.NO_USER_PROPORTION);
        }

        final BigInteger observed = vault.balanceOf(asset);
        BigInteger amount = compute(asset, beneficiary, share, observed);
        if (amount.signum() < 0) {
            if (options.underflowPolicy() == LedgerOptions.UnderflowPolicy.FAIL) {
                throw new WithdrawException(LedgerError.INSUFFICIENT_ENTITLEMENT,
                        LedgerError.INSUFFICIENT_ENTITLEMENT.reason() + " by " + amount.negate());
            }
            amount = BigInteger.ZERO;
        }
        if (amount.signum() == 0) {
            throw new WithdrawException(LedgerError.NO_BALANCE_TO_WITHDRAW);
        }

        final BigInteger inflow = totalBalance(asset).add(observed);

        // Counters are committed before the vault runs any external code.
        totalBalance.merge(asset, amount, BigInteger::add);
        withdrawn.merge(beneficiary, amount, BigInteger::add);
        withdrawnByAsset.computeIfAbsent(beneficiary, b -> new HashMap<>()).merge(asset, amount, BigInteger::add);

        activeWithdrawals++;
        try {
            vault.transfer(asset, beneficiary, amount);
        } catch (RuntimeException e) {
            rollback(asset, beneficiary, amount);
            LOG.warn("Transfer of {} {} to {} failed, withdrawal rolled back", amount, asset, beneficiary, e);
            DebugLogger.logWithdraw(LogFormatter.formatTransferFailure(beneficiary, asset, amount, e.getMessage()));
            throw new TransferException(asset, beneficiary, amount, e);
        } catch (Error e) {
            // Errors propagate unwrapped, but nothing was paid either.
            rollback(asset, beneficiary, amount);
            LOG.error("Transfer of {} {} to {} aborted, withdrawal rolled back", amount, asset, beneficiary, e);
            throw e;
        } finally {
            activeWithdrawals--;
        }

        DebugLogger.logWithdraw(LogFormatter.formatWithdraw(beneficiary, asset, amount, inflow));
        publish(new Withdrawn(beneficiary, asset, amount));
        return amount;
    }

    public BigInteger withdrawNative(final Address caller, final Address beneficiary) {
        return withdraw(caller, Asset.NATIVE, beneficiary);
    }

    public Address owner() {
        return owner;
    }

    /**
     * Returns the member's percentage, or 0 if it has none.
     */
    public int share(final Address member) {
        return proportions.getOrDefault(member, 0);
    }

    /**
     * Returns the recorded shares in the order members were first listed. Members whose
     * last entry had proportion 0 are absent.
     */
    public Map<Address, Integer> team() {
        return proportions;
    }

    /**
     * Returns the lifetime inflow of {@code asset}: paid out so far plus currently held.
     */
    public synchronized BigInteger lifetimeInflow(final Asset asset) {
        Objects.requireNonNull(asset, "asset");
        return totalBalance(asset).add(vault.balanceOf(asset));
    }

    /**
     * Returns how much of {@code asset} the ledger has paid out so far. Together with what the
     * vault holds this is the asset's lifetime inflow.
     */
    public synchronized BigInteger totalBalance(final Asset asset) {
        return totalBalance.getOrDefault(asset, BigInteger.ZERO);
    }

    /**
     * Returns everything ever paid to {@code member}, summed across assets.
     */
    public synchronized BigInteger withdrawn(final Address member) {
        return withdrawn.getOrDefault(member, BigInteger.ZERO);
    }

    public synchronized BigInteger withdrawn(final Address member, final Asset asset) {
        final Map<Asset, BigInteger> byAsset = withdrawnByAsset.get(member);
        return byAsset == null ? BigInteger.ZERO : byAsset.getOrDefault(asset, BigInteger.ZERO);
    }

    /**
     * Returns every successful withdrawal, oldest first.
     * <p>
     * The history is kept in memory for the life of the ledger and is never trimmed. Embedders
     * that need a bounded record should consume events through {@link #addListener} instead.
     */
    public synchronized List<Withdrawn> withdrawals() {
        return List.copyOf(history);
    }

    public void addListener(final WithdrawalListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(final WithdrawalListener listener) {
        listeners.remove(listener);
    }

    public LedgerOptions options() {
        return options;
    }

    private BigInteger compute(
            final Asset asset, final Address beneficiary, final int share, final BigInteger observed) {
        final BigInteger inflow = totalBalance(asset).add(observed);
        final BigInteger entitled = inflow.multiply(BigInteger.valueOf(share)).divide(HUNDRED);
        final BigInteger paid = options.accounting() == LedgerOptions.Accounting.SHARED
                ? withdrawn(beneficiary)
                : withdrawn(beneficiary, asset);
        final BigInteger result = entitled.subtract(paid);
        DebugLogger.logQuery(LogFormatter.formatEntitlement(beneficiary, asset, share, inflow, paid, result));
        return result;
    }

    // Undo by subtraction: the counters may already include a nested withdrawal.
    private void rollback(final Asset asset, final Address beneficiary, final BigInteger amount) {
        totalBalance.merge(asset, amount.negate(), BigInteger::add);
        withdrawn.merge(beneficiary, amount.negate(), BigInteger::add);
        withdrawnByAsset.get(beneficiary).merge(asset, amount.negate(), BigInteger::add);
    }

    private void publish(final Withdrawn event) {
        history.add(event);
        for (WithdrawalListener listener : listeners) {
            try {
                listener.onWithdrawn(event);
            } catch (RuntimeException e) {
                LOG.warn("Withdrawal listener {} failed for {}", listener, event, e);
            }
        }
    }
}
