package com.flagship.agent_settlement.wager;

/**
 * Verdict of one pre-wager guard.
 */
public record GuardDecision(boolean allowed, String reason) {

    private static final GuardDecision ALLOWED = new GuardDecision(true, null);

    public static GuardDecision allow() {
        return ALLOWED;
    }

    public static GuardDecision deny(String reason) {
        return new GuardDecision(false, reason);
    }
}
