package com.flagship.agent_settlement.exchange.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.exchange.ExchangeRecord;
import com.flagship.agent_settlement.exchange.ExchangeStatus;
import com.flagship.agent_settlement.policy.ComplianceResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Operator view of an exchange record.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExchangeResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("status")
    ExchangeStatus status;

    @JsonProperty("initiator_channel")
    String initiatorChannel;

    @JsonProperty("counterparty_id")
    String counterpartyId;

    @JsonProperty("offered")
    String offered;

    @JsonProperty("requested")
    String requested;

    @JsonProperty("compliance")
    ComplianceResult compliance;

    @JsonProperty("proposal_delivered")
    boolean proposalDelivered;

    @JsonProperty("matched_transfer_id")
    String matchedTransferId;

    @JsonProperty("payer_address")
    String payerAddress;

    @JsonProperty("verified_at")
    Instant verifiedAt;

    @JsonProperty("claimed_at")
    Instant claimedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("external_transfer_id")
    String externalTransferId;

    @JsonProperty("failure_note")
    String failureNote;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("expires_at")
    Instant expiresAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ExchangeResponse from(ExchangeRecord record) {
        return ExchangeResponse.builder()
                .id(record.getId())
                .status(record.getStatus())
                .initiatorChannel(record.getInitiatorChannel())
                .counterpartyId(record.getCounterpartyId())
                .offered(record.getOffered().describe())
                .requested(record.getRequested().describe())
                .compliance(record.getComplianceResult())
                .proposalDelivered(record.isProposalDelivered())
                .matchedTransferId(record.getMatchedTransferId())
                .payerAddress(record.getPayerAddress())
                .verifiedAt(record.getVerifiedAt())
                .claimedAt(record.getClaimedAt())
                .completedAt(record.getCompletedAt())
                .externalTransferId(record.getExternalTransferId())
                .failureNote(record.getFailureNote())
                .notes(record.getNotes())
                .createdAt(record.getCreatedAt())
                .expiresAt(record.getExpiresAt())
                .updatedAt(record.getUpdatedAt())
                .build();
    }
}
