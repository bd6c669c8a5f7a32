package com.flagship.agent_settlement.jackpot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A won award, together with the winner fields it replaced so that it can
 * be rolled back if the payout fails.
 */
public record JackpotAward(
        UUID awardId,
        String winnerId,
        BigDecimal amount,
        Instant awardedAt,
        String previousWinnerId,
        Instant previousAwardedAt,
        BigDecimal previousAwardAmount
) {
}
