package com.flagship.agent_settlement.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.wager.WagerStats;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class WagerStatsResponse {

    @JsonProperty("requester_id")
    String requesterId;

    @JsonProperty("total_wagers")
    long totalWagers;

    @JsonProperty("total_staked")
    BigDecimal totalStaked;

    @JsonProperty("wins")
    long wins;

    @JsonProperty("losses")
    long losses;

    @JsonProperty("total_paid_out")
    BigDecimal totalPaidOut;

    @JsonProperty("net_result")
    BigDecimal netResult;

    public static WagerStatsResponse from(WagerStats stats) {
        return new WagerStatsResponse(stats.requesterId(), stats.totalWagers(), stats.totalStaked(),
                stats.wins(), stats.losses(), stats.totalPaidOut(), stats.netResult());
    }
}
