package com.flagship.agent_settlement.verification;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Row of the anti-replay ledger. Never updated or deleted.
 */
@Value
public class ConsumedTransfer {
    String transferId;
    String claimantId;
    BigDecimal amount;
    String purposeTag;
    Instant usedAt;
}
