package com.flagship.agent_settlement.wager;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Wagers and their compare-and-swap transitions. Updates return the
 * affected-row count; 0 means another caller already moved the wager.
 */
@Repository
public interface WagerRepository extends JpaRepository<WagerEntity, UUID> {

    List<WagerEntity> findByRequesterIdOrderByCreatedAtDesc(String requesterId);

    long countByRequesterIdAndCreatedAtAfter(String requesterId, Instant since);

    List<WagerEntity> findByOutcomeValueIsNotNull();

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.status = :expired, w.updatedAt = :now
        WHERE w.id = :id AND w.status = :pending AND w.expiresAt < :now
        """)
    int expire(@Param("id") UUID id,
               @Param("pending") WagerStatus pending,
               @Param("expired") WagerStatus expired,
               @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.status = :verified,
            w.matchedTransferId = :transferId,
            w.payerAddress = :payerAddress,
            w.verifiedAt = :now,
            w.updatedAt = :now
        WHERE w.id = :id AND w.status = :pending AND w.expiresAt >= :now
        """)
    int markVerified(@Param("id") UUID id,
                     @Param("pending") WagerStatus pending,
                     @Param("verified") WagerStatus verified,
                     @Param("transferId") String transferId,
                     @Param("payerAddress") String payerAddress,
                     @Param("now") Instant now);

    /**
     * Fixes the drawn outcome. Succeeds once per wager.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.outcomeValue = :outcome,
            w.multiplier = :multiplier,
            w.payout = :payout,
            w.jackpotContribution = :contribution,
            w.updatedAt = :now
        WHERE w.id = :id AND w.status = :verified AND w.outcomeValue IS NULL
        """)
    int recordOutcome(@Param("id") UUID id,
                      @Param("verified") WagerStatus verified,
                      @Param("outcome") int outcome,
                      @Param("multiplier") BigDecimal multiplier,
                      @Param("payout") BigDecimal payout,
                      @Param("contribution") BigDecimal contribution,
                      @Param("now") Instant now);

    /**
     * Closes a losing wager. Nothing is paid, so there is no claim step.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.status = :settled, w.settledAt = :now, w.updatedAt = :now
        WHERE w.id = :id
          AND w.status = :verified
          AND w.outcomeValue IS NOT NULL
          AND w.payout = 0
        """)
    int settleLoss(@Param("id") UUID id,
                   @Param("verified") WagerStatus verified,
                   @Param("settled") WagerStatus settled,
                   @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.claimedAt = :now, w.updatedAt = :now
        WHERE w.id = :id
          AND w.status = :verified
          AND w.outcomeValue IS NOT NULL
          AND w.claimedAt IS NULL
        """)
    int claim(@Param("id") UUID id,
              @Param("verified") WagerStatus verified,
              @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.status = :settled,
            w.externalTransferId = :externalTransferId,
            w.settledAt = :now,
            w.updatedAt = :now
        WHERE w.id = :id AND w.status = :verified AND w.claimedAt IS NOT NULL
        """)
    int complete(@Param("id") UUID id,
                 @Param("verified") WagerStatus verified,
                 @Param("settled") WagerStatus settled,
                 @Param("externalTransferId") String externalTransferId,
                 @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE WagerEntity w
        SET w.status = :failed,
            w.claimedAt = NULL,
            w.failureNote = :note,
            w.updatedAt = :now
        WHERE w.id = :id AND w.status = :verified AND w.claimedAt IS NOT NULL
        """)
    int failExecution(@Param("id") UUID id,
                      @Param("verified") WagerStatus verified,
                      @Param("failed") WagerStatus failed,
                      @Param("note") String note,
                      @Param("now") Instant now);
}
