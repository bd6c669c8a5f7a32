package com.flagship.agent_settlement.exchange;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a negotiated exchange.
 *
 * <pre>
 * PROPOSED -> ACCEPTED -> VERIFIED -> COMPLETED
 *     any non-terminal state -> DECLINED | EXPIRED | CANCELLED | FAILED
 * </pre>
 *
 * The store enforces each edge with a conditional update; this enum is the
 * single description of which edges exist.
 */
public enum ExchangeStatus {
    PROPOSED,
    ACCEPTED,
    VERIFIED,
    COMPLETED,
    DECLINED,
    EXPIRED,
    CANCELLED,
    FAILED;

    private static final Set<ExchangeStatus> EXITS = EnumSet.of(DECLINED, EXPIRED, CANCELLED, FAILED);

    public boolean isTerminal() {
        return this == COMPLETED || EXITS.contains(this);
    }

    /**
     * Still waiting on the counterparty; the only states lazy expiry applies to.
     */
    public boolean isExpirable() {
        return this == PROPOSED || this == ACCEPTED;
    }

    public boolean canTransitionTo(ExchangeStatus next) {
        if (isTerminal()) {
            return false;
        }
        if (EXITS.contains(next)) {
            return true;
        }
        return switch (this) {
            case PROPOSED -> next == ACCEPTED;
            case ACCEPTED -> next == VERIFIED;
            case VERIFIED -> next == COMPLETED;
            default -> false;
        };
    }

    /**
     * Whether {@code target} is reachable from this state through one or more
     * transitions. Used to tell a race loss (someone moved the record ahead)
     * from a request that is simply out of order.
     */
    public boolean canReach(ExchangeStatus target) {
        Set<ExchangeStatus> seen = EnumSet.noneOf(ExchangeStatus.class);
        Deque<ExchangeStatus> queue = new ArrayDeque<>();
        queue.add(this);
        while (!queue.isEmpty()) {
            ExchangeStatus current = queue.poll();
            for (ExchangeStatus next : values()) {
                if (current.canTransitionTo(next) && seen.add(next)) {
                    if (next == target) {
                        return true;
                    }
                    queue.add(next);
                }
            }
        }
        return false;
    }
}
