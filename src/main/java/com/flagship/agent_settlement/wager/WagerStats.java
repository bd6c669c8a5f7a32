package com.flagship.agent_settlement.wager;

import java.math.BigDecimal;

/**
 * Totals over a requester's wagers that reached an outcome.
 */
public record WagerStats(
        String requesterId,
        long totalWagers,
        BigDecimal totalStaked,
        long wins,
        long losses,
        BigDecimal totalPaidOut
) {

    /** What the requester is up (positive) or down (negative) overall. */
    public BigDecimal netResult() {
        return totalPaidOut.subtract(totalStaked);
    }
}
