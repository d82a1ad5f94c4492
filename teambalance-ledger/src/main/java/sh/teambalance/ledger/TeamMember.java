// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.teambalance.ledger;

import java.util.Objects;

import sh.teambalance.core.types.Address;

/**
 * One entry of the team table passed to {@link TeamBalance#create}.
 *
 * @param member     the beneficiary
 * @param proportion percentage of lifetime inflow owed to the member; values that break the
 *                   100 total are rejected by {@link TeamBalance#create}
 * @since 0.1.0
 */
public record TeamMember(Address member, int proportion) {

    public TeamMember {
        Objects.requireNonNull(member, "member");
        if (proportion < 0) {
            throw new IllegalArgumentException("proportion must not be negative: " + proportion);
        }
    }

    public static TeamMember of(final Address member, final int proportion) {
        return new TeamMember(member, proportion);
    }
}
