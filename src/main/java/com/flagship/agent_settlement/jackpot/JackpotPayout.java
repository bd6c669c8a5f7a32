package com.flagship.agent_settlement.jackpot;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

public record JackpotPayout(UUID awardId, String winnerId, BigDecimal amount,
                            String externalTransferId, Instant paidAt) {
}
