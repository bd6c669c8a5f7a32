package com.flagship.agent_settlement.verification;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A matched inbound transfer or item receipt, already recorded as consumed.
 */
@Value
public class VerifiedTransfer {
    /** Anti-replay key: the ledger transfer id, or {@code item:<itemId>} for receipts. */
    String transferId;
    BigDecimal amount;
    String itemRef;
    String senderAddress;
    Instant matchedAt;
}
