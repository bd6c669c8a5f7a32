package com.flagship.agent_settlement.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One event as handled by one consumer group. Its presence is what makes
 * redelivery of the same event a no-op.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String subjectType;
    UUID subjectId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String note;

    public enum ProcessingResult {
        SUCCESS,
        /** Not relevant to this consumer, recorded so it is not looked at again. */
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String subjectType, UUID subjectId,
                                         String consumerGroup, Instant processedAt) {
        return new ProcessedEvent(eventId, eventType, subjectType, subjectId, consumerGroup, processedAt,
                ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String subjectType, UUID subjectId,
                                         String consumerGroup, Instant processedAt, String reason) {
        return new ProcessedEvent(eventId, eventType, subjectType, subjectId, consumerGroup, processedAt,
                ProcessingResult.SKIPPED, reason);
    }
}
