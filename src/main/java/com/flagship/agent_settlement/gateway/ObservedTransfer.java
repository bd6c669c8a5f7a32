package com.flagship.agent_settlement.gateway;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An inbound currency transfer as reported by the ledger.
 */
public record ObservedTransfer(String id, BigDecimal amount, String sender, String memo, Instant timestamp) {
}
