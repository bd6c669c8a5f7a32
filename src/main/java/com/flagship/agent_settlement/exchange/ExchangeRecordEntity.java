package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.policy.AssetKind;
import com.flagship.agent_settlement.policy.AssetValue;
import com.flagship.agent_settlement.policy.ComplianceResult;
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
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistent exchange record.
 *
 * The entity has no setters and no update method: after the initial insert
 * every change goes through a conditional bulk update in
 * {@link ExchangeRecordRepository}, so the status check and the write happen
 * in one statement.
 */
@Entity
@Table(
    name = "exchange_records",
    indexes = {
        @Index(name = "idx_exchange_records_status", columnList = "status"),
        @Index(name = "idx_exchange_records_counterparty", columnList = "counterparty_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExchangeRecordEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExchangeStatus status;

    @Column(name = "initiator_channel", nullable = false, updatable = false)
    private String initiatorChannel;

    @Column(name = "counterparty_id", nullable = false, updatable = false)
    private String counterpartyId;

    @Column(name = "counterparty_address", updatable = false)
    private String counterpartyAddress;

    @Enumerated(EnumType.STRING)
    @Column(name = "offered_kind", nullable = false, updatable = false, length = 20)
    private AssetKind offeredKind;

    @Column(name = "offered_quantity", updatable = false, precision = 19, scale = 4)
    private BigDecimal offeredQuantity;

    @Column(name = "offered_item_ref", updatable = false)
    private String offeredItemRef;

    @Column(name = "offered_value", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal offeredValue;

    @Enumerated(EnumType.STRING)
    @Column(name = "requested_kind", nullable = false, updatable = false, length = 20)
    private AssetKind requestedKind;

    @Column(name = "requested_quantity", updatable = false, precision = 19, scale = 4)
    private BigDecimal requestedQuantity;

    @Column(name = "requested_item_ref", updatable = false)
    private String requestedItemRef;

    @Column(name = "requested_value", nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal requestedValue;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "compliance_result", nullable = false, updatable = false, columnDefinition = "jsonb")
    private ComplianceResult complianceResult;

    @Column(name = "proposal_delivered", nullable = false)
    private boolean proposalDelivered;

    @Column(name = "matched_transfer_id")
    private String matchedTransferId;

    @Column(name = "payer_address")
    private String payerAddress;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

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

    @Column(columnDefinition = "TEXT")
    private String notes;

    /**
     * Only way to build an entity; used once, for the initial insert.
     */
    static ExchangeRecordEntity fromDomain(ExchangeRecord record) {
        ExchangeRecordEntity entity = new ExchangeRecordEntity();
        entity.id = record.getId();
        entity.status = record.getStatus();
        entity.initiatorChannel = record.getInitiatorChannel();
        entity.counterpartyId = record.getCounterpartyId();
        entity.counterpartyAddress = record.getCounterpartyAddress();
        entity.offeredKind = record.getOffered().getKind();
        entity.offeredQuantity = record.getOffered().getQuantity();
        entity.offeredItemRef = record.getOffered().getItemRef();
        entity.offeredValue = record.getOffered().referenceValue();
        entity.requestedKind = record.getRequested().getKind();
        entity.requestedQuantity = record.getRequested().getQuantity();
        entity.requestedItemRef = record.getRequested().getItemRef();
        entity.requestedValue = record.getRequested().referenceValue();
        entity.complianceResult = record.getComplianceResult();
        entity.proposalDelivered = record.isProposalDelivered();
        entity.createdAt = record.getCreatedAt();
        entity.expiresAt = record.getExpiresAt();
        entity.updatedAt = record.getCreatedAt();
        entity.notes = record.getNotes();
        return entity;
    }

    public ExchangeRecord toDomain() {
        return ExchangeRecord.builder()
            .id(id)
            .status(status)
            .initiatorChannel(initiatorChannel)
            .counterpartyId(counterpartyId)
            .counterpartyAddress(counterpartyAddress)
            .offered(AssetValue.of(offeredKind, offeredQuantity, offeredItemRef, offeredValue))
            .requested(AssetValue.of(requestedKind, requestedQuantity, requestedItemRef, requestedValue))
            .complianceResult(complianceResult)
            .proposalDelivered(proposalDelivered)
            .matchedTransferId(matchedTransferId)
            .payerAddress(payerAddress)
            .verifiedAt(verifiedAt)
            .claimedAt(claimedAt)
            .completedAt(completedAt)
            .externalTransferId(externalTransferId)
            .failureNote(failureNote)
            .createdAt(createdAt)
            .expiresAt(expiresAt)
            .updatedAt(updatedAt)
            .notes(notes)
            .build();
    }
}
