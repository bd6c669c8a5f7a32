package com.flagship.agent_settlement.jackpot;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Snapshot of the single jackpot row.
 */
public record JackpotState(
        BigDecimal accumulatedAmount,
        String lastWinnerId,
        Instant lastAwardedAt,
        BigDecimal lastAwardAmount,
        long version
) {
}
