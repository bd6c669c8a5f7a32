package com.flagship.agent_settlement.settlement.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.agent_settlement.settlement.SettlementReceipt;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SettlementReceiptResponse {

    @JsonProperty("subject_id")
    UUID subjectId;

    @JsonProperty("subject_type")
    String subjectType;

    @JsonProperty("sent")
    String sent;

    @JsonProperty("destination")
    String destination;

    @JsonProperty("external_transfer_id")
    String externalTransferId;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static SettlementReceiptResponse from(SettlementReceipt receipt) {
        return SettlementReceiptResponse.builder()
                .subjectId(receipt.getSubjectId())
                .subjectType(receipt.getSubjectType())
                .sent(receipt.getInstruction().describe())
                .destination(receipt.getInstruction().getDestination())
                .externalTransferId(receipt.getExternalTransferId())
                .completedAt(receipt.getCompletedAt())
                .build();
    }
}
