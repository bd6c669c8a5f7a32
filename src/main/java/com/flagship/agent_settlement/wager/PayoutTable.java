package com.flagship.agent_settlement.wager;

import java.math.BigDecimal;
import java.util.List;

/**
 * Fixed mapping from a drawn outcome to a payout multiplier.
 * Outcomes not covered by any band pay nothing.
 */
public final class PayoutTable {

    private final List<Band> bands;

    private PayoutTable(List<Band> bands) {
        this.bands = List.copyOf(bands);
    }

    static PayoutTable of(Band... bands) {
        return new PayoutTable(List.of(bands));
    }

    static Band band(int from, int to, String multiplier) {
        return new Band(from, to, new BigDecimal(multiplier));
    }

    public BigDecimal multiplierFor(int outcome) {
        for (Band band : bands) {
            if (outcome >= band.from() && outcome <= band.to()) {
                return band.multiplier();
            }
        }
        return BigDecimal.ZERO;
    }

    public BigDecimal maxMultiplier() {
        return bands.stream()
                .map(Band::multiplier)
                .max(BigDecimal::compareTo)
                .orElse(BigDecimal.ZERO);
    }

    record Band(int from, int to, BigDecimal multiplier) {
    }
}
