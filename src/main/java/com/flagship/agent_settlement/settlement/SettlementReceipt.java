package com.flagship.agent_settlement.settlement;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class SettlementReceipt {
    UUID subjectId;
    String subjectType;
    String externalTransferId;
    SettlementInstruction instruction;
    Instant completedAt;
}
