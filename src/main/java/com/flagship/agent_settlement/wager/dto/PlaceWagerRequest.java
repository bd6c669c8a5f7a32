package com.flagship.agent_settlement.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.wager.PlaceWagerCommand;
import com.flagship.agent_settlement.wager.WagerGame;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PlaceWagerRequest {

    @NotBlank(message = "Requester id is required")
    @JsonProperty("requester_id")
    String requesterId;

    @NotBlank(message = "Memo tag is required")
    @JsonProperty("memo_tag")
    String memoTag;

    @NotBlank(message = "Channel is required")
    @JsonProperty("channel")
    String channel;

    @NotNull(message = "Game is required")
    @JsonProperty("game")
    WagerGame game;

    @NotNull(message = "Stake is required")
    @DecimalMin(value = "0", inclusive = false, message = "Stake must be greater than 0")
    @JsonProperty("stake")
    BigDecimal stake;

    public PlaceWagerCommand toCommand() {
        return new PlaceWagerCommand(requesterId, memoTag, channel, game, stake);
    }
}
