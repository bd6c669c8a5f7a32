package com.flagship.agent_settlement.wager;

import java.math.BigDecimal;

import static com.flagship.agent_settlement.wager.PayoutTable.band;

/**
 * Games a requester can stake on, each with its outcome range and payout table.
 */
public enum WagerGame {

    /** Slot machine, outcomes 1..64. 64 is the triple seven. */
    SLOT(1, 64, PayoutTable.of(
            band(64, 64, "5.0"),
            band(60, 63, "2.5"),
            band(55, 59, "1.8"),
            band(43, 54, "1.2"))),

    DICE(1, 6, PayoutTable.of(
            band(6, 6, "2.5"),
            band(5, 5, "1.8"),
            band(4, 4, "1.3")));

    private final int minOutcome;
    private final int maxOutcome;
    private final PayoutTable payoutTable;

    WagerGame(int minOutcome, int maxOutcome, PayoutTable payoutTable) {
        this.minOutcome = minOutcome;
        this.maxOutcome = maxOutcome;
        this.payoutTable = payoutTable;
    }

    public int getMinOutcome() {
        return minOutcome;
    }

    public int getMaxOutcome() {
        return maxOutcome;
    }

    /**
     * @throws IllegalArgumentException for an outcome outside the game's range
     */
    public BigDecimal multiplierFor(int outcome) {
        if (outcome < minOutcome || outcome > maxOutcome) {
            throw new IllegalArgumentException(
                    name() + " outcome must be in " + minOutcome + ".." + maxOutcome + ", got " + outcome);
        }
        return payoutTable.multiplierFor(outcome);
    }

    public BigDecimal maxMultiplier() {
        return payoutTable.maxMultiplier();
    }
}
