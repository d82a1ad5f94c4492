// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

import java.util.Objects;

/**
 * Configuration options for a {@link TeamBalance}.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * var options = LedgerOptions.builder()
 *     .accounting(LedgerOptions.Accounting.SHARED)
 *     .underflowPolicy(LedgerOptions.UnderflowPolicy.SATURATE)
 *     .build();
 * }</pre>
 */
public final class LedgerOptions {

    /**
     * How withdrawn amounts are counted against entitlements.
     */
    public enum Accounting {
        /** One withdrawn counter per member and asset. Assets cannot affect each other. */
        PER_ASSET,
        /**
         * One withdrawn counter per member, summed over every asset. Withdrawing one asset
         * lowers the entitlement computed for all others.
         */
        SHARED
    }

    /**
     * What a withdrawal does when the member has already withdrawn more than the
     * share of lifetime inflow. Happens with {@link Accounting#SHARED}, or when funds
     * leave the vault without going through the ledger.
     */
    public enum UnderflowPolicy {
        /** Reject with {@code INSUFFICIENT_ENTITLEMENT}. */
        FAIL,
        /** Treat the entitlement as zero and reject with {@code NO_BALANCE_TO_WITHDRAW}. */
        SATURATE
    }

    public static final Accounting DEFAULT_ACCOUNTING = Accounting.PER_ASSET;

    public static final UnderflowPolicy DEFAULT_UNDERFLOW_POLICY = UnderflowPolicy.FAIL;

    public static final boolean DEFAULT_REENTRANCY_GUARD = true;

    private static final LedgerOptions DEFAULTS = new LedgerOptions(
            DEFAULT_ACCOUNTING,
            DEFAULT_UNDERFLOW_POLICY,
            DEFAULT_REENTRANCY_GUARD);

    private final Accounting accounting;
    private final UnderflowPolicy underflowPolicy;
    private final boolean reentrancyGuard;

    private LedgerOptions(
            final Accounting accounting,
            final UnderflowPolicy underflowPolicy,
            final boolean reentrancyGuard) {
        this.accounting = accounting;
        this.underflowPolicy = underflowPolicy;
        this.reentrancyGuard = reentrancyGuard;
    }

    /**
     * Returns an instance with all default values.
     *
     * @return default options
     */
    public static LedgerOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Options reproducing the legacy single-counter ledger: shared withdrawn counter,
     * failing on underflow.
     *
     * @return legacy options
     */
    public static LedgerOptions legacy() {
        return builder().accounting(Accounting.SHARED).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Accounting accounting() {
        return accounting;
    }

    public UnderflowPolicy underflowPolicy() {
        return underflowPolicy;
    }

    /**
     * Whether a withdrawal started from inside another withdrawal's transfer is rejected.
     *
     * @return true if nested withdrawals are rejected
     */
    public boolean reentrancyGuard() {
        return reentrancyGuard;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof LedgerOptions other)) {
            return false;
        }
        return accounting == other.accounting
                && underflowPolicy == other.underflowPolicy
                && reentrancyGuard == other.reentrancyGuard;
    }

    @Override
    public int hashCode() {
        return Objects.hash(accounting, underflowPolicy, reentrancyGuard);
    }

    @Override
    public String toString() {
        return "LedgerOptions{"
                + "accounting=" + accounting
                + ", underflowPolicy=" + underflowPolicy
                + ", reentrancyGuard=" + reentrancyGuard
                + '}';
    }

    /**
     * Builder for creating LedgerOptions instances.
     */
    public static final class Builder {
        private Accounting accounting = DEFAULT_ACCOUNTING;
        private UnderflowPolicy underflowPolicy = DEFAULT_UNDERFLOW_POLICY;
        private boolean reentrancyGuard = DEFAULT_REENTRANCY_GUARD;

        private Builder() {
        }

        public Builder accounting(final Accounting accounting) {
            this.accounting = Objects.requireNonNull(accounting, "accounting");
            return this;
        }

        public Builder underflowPolicy(final UnderflowPolicy underflowPolicy) {
            this.underflowPolicy = Objects.requireNonNull(underflowPolicy, "underflowPolicy");
            return this;
        }

        public Builder reentrancyGuard(final boolean reentrancyGuard) {
            this.reentrancyGuard = reentrancyGuard;
            return this;
        }

        public LedgerOptions build() {
            return new LedgerOptions(accounting, underflowPolicy, reentrancyGuard);
        }
    }
}
