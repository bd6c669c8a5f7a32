package com.flagship.agent_settlement.journal;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a closed settlement: which assets moved, and what
 * the agent made or lost on it.
 */
@Value
@Builder
public class JournalEntry {
    UUID id;
    JournalEntryType type;
    String action;
    String subjectType;
    UUID subjectId;
    String assetFrom;
    String assetTo;
    BigDecimal amountFrom;
    BigDecimal amountTo;
    String counterparty;
    JournalOutcome outcome;
    BigDecimal pnl;
    String externalTransferId;
    String reasoning;
    Instant createdAt;
    Instant closedAt;
}
