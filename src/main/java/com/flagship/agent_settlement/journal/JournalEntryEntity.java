package com.flagship.agent_settlement.journal;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Journal row. Hibernate treats the entity as immutable and every column
 * is {@code updatable = false}; there is no update path.
 */
@Entity
@Immutable
@Table(
    name = "journal_entries",
    indexes = {
        @Index(name = "idx_journal_subject", columnList = "subject_type, subject_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JournalEntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, updatable = false, length = 20)
    private JournalEntryType entryType;

    @Column(nullable = false, updatable = false, length = 50)
    private String action;

    @Column(name = "subject_type", nullable = false, updatable = false, length = 50)
    private String subjectType;

    @Column(name = "subject_id", nullable = false, updatable = false)
    private UUID subjectId;

    @Column(name = "asset_from", updatable = false)
    private String assetFrom;

    @Column(name = "asset_to", updatable = false)
    private String assetTo;

    @Column(name = "amount_from", updatable = false, precision = 19, scale = 4)
    private BigDecimal amountFrom;

    @Column(name = "amount_to", updatable = false, precision = 19, scale = 4)
    private BigDecimal amountTo;

    @Column(updatable = false)
    private String counterparty;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private JournalOutcome outcome;

    @Column(updatable = false, precision = 19, scale = 4)
    private BigDecimal pnl;

    @Column(name = "external_transfer_id", updatable = false)
    private String externalTransferId;

    @Column(updatable = false, columnDefinition = "TEXT")
    private String reasoning;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "closed_at", nullable = false, updatable = false)
    private Instant closedAt;

    static JournalEntryEntity fromDomain(JournalEntry entry) {
        return new JournalEntryEntity(
            entry.getId(),
            entry.getType(),
            entry.getAction(),
            entry.getSubjectType(),
            entry.getSubjectId(),
            entry.getAssetFrom(),
            entry.getAssetTo(),
            entry.getAmountFrom(),
            entry.getAmountTo(),
            entry.getCounterparty(),
            entry.getOutcome(),
            entry.getPnl(),
            entry.getExternalTransferId(),
            entry.getReasoning(),
            entry.getCreatedAt(),
            entry.getClosedAt()
        );
    }

    public JournalEntry toDomain() {
        return JournalEntry.builder()
            .id(id)
            .type(entryType)
            .action(action)
            .subjectType(subjectType)
            .subjectId(subjectId)
            .assetFrom(assetFrom)
            .assetTo(assetTo)
            .amountFrom(amountFrom)
            .amountTo(amountTo)
            .counterparty(counterparty)
            .outcome(outcome)
            .pnl(pnl)
            .externalTransferId(externalTransferId)
            .reasoning(reasoning)
            .createdAt(createdAt)
            .closedAt(closedAt)
            .build();
    }
}
