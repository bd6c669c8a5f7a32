package com.flagship.agent_settlement.jackpot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.jackpot.JackpotPayout;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class JackpotPayoutResponse {

    @JsonProperty("award_id")
    UUID awardId;

    @JsonProperty("winner_id")
    String winnerId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("external_transfer_id")
    String externalTransferId;

    @JsonProperty("paid_at")
    Instant paidAt;

    public static JackpotPayoutResponse from(JackpotPayout payout) {
        return new JackpotPayoutResponse(payout.awardId(), payout.winnerId(), payout.amount(),
                payout.externalTransferId(), payout.paidAt());
    }
}
