package com.flagship.agent_settlement.wager.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.wager.LeaderboardType;
import com.flagship.agent_settlement.wager.WagerStats;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Value
public class LeaderboardResponse {

    @JsonProperty("type")
    String type;

    @JsonProperty("players")
    List<Entry> players;

    @Value
    public static class Entry {

        @JsonProperty("rank")
        int rank;

        @JsonProperty("stats")
        WagerStatsResponse stats;

        @JsonProperty("win_rate")
        BigDecimal winRate;
    }

    public static LeaderboardResponse from(LeaderboardType type, List<WagerStats> ranked) {
        List<Entry> players = new ArrayList<>(ranked.size());
        for (int i = 0; i < ranked.size(); i++) {
            WagerStats stats = ranked.get(i);
            players.add(new Entry(i + 1, WagerStatsResponse.from(stats), winRate(stats)));
        }
        return new LeaderboardResponse(type.name().toLowerCase(Locale.ROOT), players);
    }

    /** Percentage of wins, two decimals. */
    private static BigDecimal winRate(WagerStats stats) {
        if (stats.totalWagers() == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(stats.wins())
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(stats.totalWagers()), 2, RoundingMode.HALF_UP);
    }
}
