package com.flagship.agent_settlement.journal;

import java.math.BigDecimal;

/**
 * Economic outcome from the agent's point of view.
 */
public enum JournalOutcome {
    PROFIT,
    LOSS,
    NEUTRAL;

    public static JournalOutcome fromPnl(BigDecimal pnl) {
        if (pnl == null || pnl.signum() == 0) {
            return NEUTRAL;
        }
        return pnl.signum() > 0 ? PROFIT : LOSS;
    }
}
