package com.flagship.agent_settlement.jackpot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.jackpot.JackpotState;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class JackpotStateResponse {

    @JsonProperty("accumulated_amount")
    BigDecimal accumulatedAmount;

    @JsonProperty("last_winner_id")
    String lastWinnerId;

    @JsonProperty("last_awarded_at")
    Instant lastAwardedAt;

    @JsonProperty("last_award_amount")
    BigDecimal lastAwardAmount;

    @JsonProperty("eligible")
    boolean eligible;

    public static JackpotStateResponse from(JackpotState state, boolean eligible) {
        return JackpotStateResponse.builder()
                .accumulatedAmount(state.accumulatedAmount())
                .lastWinnerId(state.lastWinnerId())
                .lastAwardedAt(state.lastAwardedAt())
                .lastAwardAmount(state.lastAwardAmount())
                .eligible(eligible)
                .build();
    }
}
