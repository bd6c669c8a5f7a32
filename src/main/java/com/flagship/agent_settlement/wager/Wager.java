package com.flagship.agent_settlement.wager;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A single stake by one requester on one game.
 */
@Value
@Builder
public class Wager {
    UUID id;
    String requesterId;
    /** Memo the requester puts on the stake payment, usually their handle. */
    String memoTag;
    String channel;
    WagerGame game;
    BigDecimal stake;
    WagerStatus status;

    String matchedTransferId;
    String payerAddress;
    Instant verifiedAt;

    Integer outcomeValue;
    BigDecimal multiplier;
    BigDecimal payout;
    BigDecimal jackpotContribution;

    Instant claimedAt;
    Instant settledAt;
    String externalTransferId;
    String failureNote;

    Instant createdAt;
    Instant expiresAt;
    Instant updatedAt;

    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    public boolean hasOutcome() {
        return outcomeValue != null;
    }

    public boolean isWin() {
        return multiplier != null && multiplier.signum() > 0;
    }

    public String purposeTag() {
        return "wager:" + id;
    }
}
