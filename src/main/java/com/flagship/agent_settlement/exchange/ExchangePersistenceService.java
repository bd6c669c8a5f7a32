package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.event.ExchangeCancelledEvent;
import com.flagship.agent_settlement.event.ExchangeProposedEvent;
import com.flagship.agent_settlement.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link ExchangeRecord} and its table.
 *
 * Transition methods return {@code true} only when this caller's
 * conditional update affected the row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangePersistenceService {

    static final String SUBJECT_TYPE = "Exchange";

    private final ExchangeRecordRepository repository;
    private final OutboxService outboxService;

    /**
     * Inserts a new record together with its {@code ExchangeProposed} event.
     */
    @Transactional
    public ExchangeRecord create(ExchangeRecord record) {
        ExchangeRecordEntity saved = repository.save(ExchangeRecordEntity.fromDomain(record));

        outboxService.saveEvent(SUBJECT_TYPE, new ExchangeProposedEvent(
                UUID.randomUUID(),
                record.getId(),
                record.getInitiatorChannel(),
                record.getCounterpartyId(),
                record.getOffered().describe(),
                record.getRequested().describe(),
                record.getComplianceResult().getProfit(),
                record.getExpiresAt(),
                record.getCreatedAt()
        ));

        log.debug("Created exchange record {} expiring at {}", saved.getId(), saved.getExpiresAt());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<ExchangeRecord> findById(UUID id) {
        return repository.findById(id).map(ExchangeRecordEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<ExchangeRecord> list(ExchangeStatus status) {
        List<ExchangeRecordEntity> rows = status == null
                ? repository.findTop100ByOrderByCreatedAtDesc()
                : repository.findByStatusOrderByCreatedAtDesc(status);
        return rows.stream().map(ExchangeRecordEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public long countByStatus(ExchangeStatus status) {
        return repository.countByStatus(status);
    }

    public boolean transition(UUID id, ExchangeStatus expected, ExchangeStatus next, Instant now) {
        if (!expected.canTransitionTo(next)) {
            throw new IllegalArgumentException("Illegal exchange transition " + expected + " -> " + next);
        }
        return repository.transition(id, expected, next, now) == 1;
    }

    public boolean expire(UUID id, Instant now) {
        return repository.expire(id, EnumSet.of(ExchangeStatus.PROPOSED, ExchangeStatus.ACCEPTED),
                ExchangeStatus.EXPIRED, now) == 1;
    }

    /**
     * Cancels from {@code expected} and, when that wins, writes the
     * {@code ExchangeCancelled} event in the same transaction.
     */
    @Transactional
    public boolean cancel(ExchangeRecord record, String reason, String notes, Instant now) {
        int rows = repository.cancel(record.getId(), record.getStatus(), ExchangeStatus.CANCELLED, notes, now);
        if (rows != 1) {
            return false;
        }
        outboxService.saveEvent(SUBJECT_TYPE, new ExchangeCancelledEvent(
                UUID.randomUUID(),
                record.getId(),
                record.getInitiatorChannel(),
                reason,
                record.getStatus() == ExchangeStatus.ACCEPTED,
                now
        ));
        return true;
    }

    public boolean markVerified(UUID id, String transferId, String payerAddress, Instant now) {
        return repository.markVerified(id, ExchangeStatus.ACCEPTED, ExchangeStatus.VERIFIED,
                transferId, payerAddress, now) == 1;
    }

    public boolean claim(UUID id, Instant now) {
        return repository.claim(id, ExchangeStatus.VERIFIED, now) == 1;
    }

    public boolean complete(UUID id, String externalTransferId, Instant now) {
        return repository.complete(id, ExchangeStatus.VERIFIED, ExchangeStatus.COMPLETED,
                externalTransferId, now) == 1;
    }

    public boolean failExecution(UUID id, String note, Instant now) {
        return repository.failExecution(id, ExchangeStatus.VERIFIED, ExchangeStatus.FAILED, note, now) == 1;
    }

    public boolean reopenFailed(UUID id, String notes, Instant now) {
        return repository.reopenFailed(id, ExchangeStatus.FAILED, ExchangeStatus.VERIFIED, notes, now) == 1;
    }

    public void markProposalDelivered(UUID id, Instant now) {
        repository.markProposalDelivered(id, now);
    }
}
