package com.flagship.agent_settlement.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact emitted through the outbox.
 *
 * Every event names the subject it is about (an exchange, a wager or the
 * jackpot) and the chat channel the counterparty should hear about it on.
 */
public interface SettlementEvent {

    /** Unique per event instance; consumers deduplicate on it. */
    UUID getEventId();

    UUID getSubjectId();

    String getChannel();

    Instant getOccurredAt();

    String getEventType();
}
