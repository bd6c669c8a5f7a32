package com.flagship.agent_settlement.wager;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistent wager. Inserted once; every later change is a conditional
 * update in {@link WagerRepository}.
 */
@Entity
@Table(
    name = "wagers",
    indexes = {
        @Index(name = "idx_wagers_requester_created", columnList = "requester_id, created_at"),
        @Index(name = "idx_wagers_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WagerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "requester_id", nullable = false, updatable = false)
    private String requesterId;

    @Column(name = "memo_tag", nullable = false, updatable = false)
    private String memoTag;

    @Column(nullable = false, updatable = false)
    private String channel;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private WagerGame game;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal stake;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WagerStatus status;

    @Column(name = "matched_transfer_id")
    private String matchedTransferId;

    @Column(name = "payer_address")
    private String payerAddress;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "outcome_value")
    private Integer outcomeValue;

    @Column(precision = 9, scale = 4)
    private BigDecimal multiplier;

    @Column(precision = 19, scale = 4)
    private BigDecimal payout;

    @Column(name = "jackpot_contribution", precision = 19, scale = 4)
    private BigDecimal jackpotContribution;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "settled_at")
    private Instant settledAt;

    @Column(name = "external_transfer_id")
    private String externalTransferId;

    @Column(name = "failure_note", columnDefinition = "TEXT")
    private String failureNote;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static WagerEntity fromDomain(Wager wager) {
        WagerEntity entity = new WagerEntity();
        entity.id = wager.getId();
        entity.requesterId = wager.getRequesterId();
        entity.memoTag = wager.getMemoTag();
        entity.channel = wager.getChannel();
        entity.game = wager.getGame();
        entity.stake = wager.getStake();
        entity.status = wager.getStatus();
        entity.createdAt = wager.getCreatedAt();
        entity.expiresAt = wager.getExpiresAt();
        entity.updatedAt = wager.getCreatedAt();
        return entity;
    }

    public Wager toDomain() {
        return Wager.builder()
            .id(id)
            .requesterId(requesterId)
            .memoTag(memoTag)
            .channel(channel)
            .game(game)
            .stake(stake)
            .status(status)
            .matchedTransferId(matchedTransferId)
            .payerAddress(payerAddress)
            .verifiedAt(verifiedAt)
            .outcomeValue(outcomeValue)
            .multiplier(multiplier)
            .payout(payout)
            .jackpotContribution(jackpotContribution)
            .claimedAt(claimedAt)
            .settledAt(settledAt)
            .externalTransferId(externalTransferId)
            .failureNote(failureNote)
            .createdAt(createdAt)
            .expiresAt(expiresAt)
            .updatedAt(updatedAt)
            .build();
    }
}
