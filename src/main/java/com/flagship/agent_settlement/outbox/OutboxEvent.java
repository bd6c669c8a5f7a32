package com.flagship.agent_settlement.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A settlement event waiting to be (or already) published.
 *
 * Written in the same transaction as the state change it describes, then
 * sent to Kafka by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String subjectType;        // Exchange, Wager, Jackpot
    UUID subjectId;
    String eventType;          // SettlementCompleted, ...
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String subjectType, UUID subjectId, String eventType,
                                     String payload, Instant createdAt) {
        return new OutboxEvent(
            UUID.randomUUID(),
            subjectType,
            subjectId,
            eventType,
            payload,
            createdAt,
            null,
            0,
            null,
            null  // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
