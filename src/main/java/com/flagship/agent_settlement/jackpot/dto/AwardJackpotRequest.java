package com.flagship.agent_settlement.jackpot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class AwardJackpotRequest {

    @NotBlank(message = "Winner id is required")
    @JsonProperty("winner_id")
    String winnerId;

    @NotBlank(message = "Winner address is required")
    @JsonProperty("winner_address")
    String winnerAddress;

    @NotBlank(message = "Channel is required")
    @JsonProperty("channel")
    String channel;
}
