package com.flagship.agent_settlement.common;

/**
 * Classification of every result a settlement operation can report.
 *
 * Only {@link #OK} carries a value. Race losses ({@link #CONFLICT},
 * {@link #ALREADY_CLAIMED}) are benign and callers must not retry them
 * destructively. {@link #NOT_YET_VERIFIED} is the only code that invites
 * a retry.
 */
public enum OutcomeCode {
    OK,
    POLICY_VIOLATION,
    CONFLICT,
    NOT_YET_VERIFIED,
    ALREADY_CONSUMED,
    AMBIGUOUS_MULTIPLE_MATCHES,
    EXPIRED,
    ALREADY_CLAIMED,
    EXTERNAL_TRANSFER_FAILURE,
    INVALID_STATE,
    REJECTED,
    NOT_FOUND;

    public boolean isRetryable() {
        return this == NOT_YET_VERIFIED;
    }

    /**
     * Benign outcomes mean another caller already did (or is doing) the work.
     */
    public boolean isBenign() {
        return this == CONFLICT || this == ALREADY_CLAIMED;
    }
}
