package com.flagship.agent_settlement.exchange;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Exchange records and their compare-and-swap transitions.
 *
 * Every update returns the affected-row count. 1 means this caller moved
 * the record; 0 means the expected prior state no longer holds because
 * another caller got there first.
 */
@Repository
public interface ExchangeRecordRepository extends JpaRepository<ExchangeRecordEntity, UUID> {

    List<ExchangeRecordEntity> findByStatusOrderByCreatedAtDesc(ExchangeStatus status);

    List<ExchangeRecordEntity> findTop100ByOrderByCreatedAtDesc();

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ExchangeRecordEntity e
        SET e.status = :next, e.updatedAt = :now
        WHERE e.id = :id AND e.status = :expected
        """)
    int transition(@Param("id") UUID id,
                   @Param("expected") ExchangeStatus expected,
                   @Param("next") ExchangeStatus next,
                   @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ExchangeRecordEntity e
        SET e.status = :expired, e.updatedAt = :now
        WHERE e.id = :id AND e.status IN :expirable AND e.expiresAt < :now
        """)
    int expire(@Param("id") UUID id,
               @Param("expirable") Collection<ExchangeStatus> expirable,
               @Param("expired") ExchangeStatus expired,
               @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ExchangeRecordEntity e
        SET e.status = :cancelled, e.notes = :notes, e.updatedAt = :now
        WHERE e.id = :id AND e.status = :expected
        """)
    int cancel(@Param("id") UUID id,
               @Param("expected") ExchangeStatus expected,
               @Param("cancelled") ExchangeStatus cancelled,
               @Param("notes") String notes,
               @Param("now") Instant now);

    /**
     * ACCEPTED to VERIFIED. Also re-checks the expiry window so an expired
     * record can never become verified, even if it was read as live.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ExchangeRecordEntity e
        SET e.status = :verified,
            e.matchedTransferId = :transferId,
            e.payerAddress = :payerAddress,
            e.verifiedAt = :now,
            e.updatedAt = :now
        WHERE e.id = :id AND e.status = :accepted AND e.expiresAt >= :now
        """)
    int markVerified(@Param("id") UUID id,
                     @Param("accepted") ExchangeStatus accepted,
                     @Param("verified") ExchangeStatus verified,
                     @Param("transferId") String transferId,
                     @Param("payerAddress") String payerAddress,
                     @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ExchangeRecordEntity e
        SET e.claimedAt = :now, e.updatedAt = :now
        WHERE e.id = :id AND e.status = :verified AND e.claimedAt IS NULL
        """)
    int claim(@Param("id") UUID id,
              @Param("verified") ExchangeStatus verified,
              @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ExchangeRecordEntity e
        SET e.status = :completed,
            e.externalTransferId = :externalTransferId,
            e.completedAt = :now,
            e.updatedAt = :now
        WHERE e.id = :id AND e.status = :verified AND e.claimedAt IS NOT NULL
        """)
    int complete(@Param("id") UUID id,
                 @Param("verified") ExchangeStatus verified,
                 @Param("completed") ExchangeStatus completed,
                 @Param("externalTransferId") String externalTransferId,
                 @Param("now") Instant now);

    /**
     * Claimed VERIFIED to FAILED, clearing the claim marker.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ExchangeRecordEntity e
        SET e.status = :failed,
            e.claimedAt = NULL,
            e.failureNote = :note,
            e.updatedAt = :now
        WHERE e.id = :id AND e.status = :verified AND e.claimedAt IS NOT NULL
        """)
    int failExecution(@Param("id") UUID id,
                      @Param("verified") ExchangeStatus verified,
                      @Param("failed") ExchangeStatus failed,
                      @Param("note") String note,
                      @Param("now") Instant now);

    /**
     * Operator retry: FAILED back to VERIFIED, only for a record that was
     * verified and whose execution never completed.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE ExchangeRecordEntity e
        SET e.status = :verified, e.notes = :notes, e.updatedAt = :now
        WHERE e.id = :id
          AND e.status = :failed
          AND e.verifiedAt IS NOT NULL
          AND e.claimedAt IS NULL
          AND e.completedAt IS NULL
        """)
    int reopenFailed(@Param("id") UUID id,
                     @Param("failed") ExchangeStatus failed,
                     @Param("verified") ExchangeStatus verified,
                     @Param("notes") String notes,
                     @Param("now") Instant now);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExchangeRecordEntity e SET e.proposalDelivered = true, e.updatedAt = :now WHERE e.id = :id")
    int markProposalDelivered(@Param("id") UUID id, @Param("now") Instant now);
    long countByStatus(ExchangeStatus status);
}
