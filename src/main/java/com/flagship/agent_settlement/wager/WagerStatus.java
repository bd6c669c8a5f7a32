package com.flagship.agent_settlement.wager;

/**
 * <pre>
 * PENDING_PAYMENT -> VERIFIED -> SETTLED
 *        |              |
 *     EXPIRED         FAILED (payout transfer failed)
 * </pre>
 */
public enum WagerStatus {
    PENDING_PAYMENT,
    VERIFIED,
    SETTLED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == SETTLED || this == FAILED || this == EXPIRED;
    }
}
