package com.flagship.agent_settlement.wager;

import java.util.Comparator;
import java.util.Locale;

/**
 * Orderings for the wager leaderboard.
 */
public enum LeaderboardType {

    /** Largest net result first. */
    WINNERS(Comparator.comparing(WagerStats::netResult).reversed()),

    /** Smallest net result first. */
    LOSERS(Comparator.comparing(WagerStats::netResult)),

    /** Most staked first. */
    WAGERED(Comparator.comparing(WagerStats::totalStaked).reversed());

    private final Comparator<WagerStats> ordering;

    LeaderboardType(Comparator<WagerStats> ordering) {
        this.ordering = ordering;
    }

    public Comparator<WagerStats> ordering() {
        return ordering;
    }

    /**
     * @throws IllegalArgumentException for an unknown type name
     */
    public static LeaderboardType parse(String value) {
        if (value == null || value.isBlank()) {
            return WINNERS;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown leaderboard type '" + value + "', expected winners, losers or wagered", e);
        }
    }
}
