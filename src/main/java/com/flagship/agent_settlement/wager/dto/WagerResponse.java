package com.flagship.agent_settlement.wager.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.wager.Wager;
import com.flagship.agent_settlement.wager.WagerGame;
import com.flagship.agent_settlement.wager.WagerStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WagerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("requester_id")
    String requesterId;

    @JsonProperty("memo_tag")
    String memoTag;

    @JsonProperty("game")
    WagerGame game;

    @JsonProperty("stake")
    BigDecimal stake;

    @JsonProperty("status")
    WagerStatus status;

    @JsonProperty("outcome")
    Integer outcome;

    @JsonProperty("multiplier")
    BigDecimal multiplier;

    @JsonProperty("payout")
    BigDecimal payout;

    @JsonProperty("matched_transfer_id")
    String matchedTransferId;

    @JsonProperty("external_transfer_id")
    String externalTransferId;

    @JsonProperty("failure_note")
    String failureNote;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("settled_at")
    Instant settledAt;

    public static WagerResponse from(Wager wager) {
        return WagerResponse.builder()
                .id(wager.getId())
                .requesterId(wager.getRequesterId())
                .memoTag(wager.getMemoTag())
                .game(wager.getGame())
                .stake(wager.getStake())
                .status(wager.getStatus())
                .outcome(wager.getOutcomeValue())
                .multiplier(wager.getMultiplier())
                .payout(wager.getPayout())
                .matchedTransferId(wager.getMatchedTransferId())
                .externalTransferId(wager.getExternalTransferId())
                .failureNote(wager.getFailureNote())
                .createdAt(wager.getCreatedAt())
                .expiresAt(wager.getExpiresAt())
                .settledAt(wager.getSettledAt())
                .build();
    }
}
