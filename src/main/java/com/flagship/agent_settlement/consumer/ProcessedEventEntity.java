package com.flagship.agent_settlement.consumer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Row in {@code processed_events}. The unique key on event id and consumer
 * group lets several groups handle the same event independently.
 */
@Entity
@Table(
    name = "processed_events",
    uniqueConstraints = @UniqueConstraint(name = "uk_processed_events_event_group",
            columnNames = {"event_id", "consumer_group"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ProcessedEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, updatable = false)
    private UUID eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(name = "subject_type", length = 50)
    private String subjectType;

    @Column(name = "subject_id")
    private UUID subjectId;

    @Column(name = "consumer_group", nullable = false, length = 100)
    private String consumerGroup;

    @Column(name = "processed_at", nullable = false)
    private Instant processedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_result", nullable = false, length = 20)
    private ProcessedEvent.ProcessingResult processingResult;

    @Column(columnDefinition = "TEXT")
    private String note;

    public static ProcessedEventEntity fromDomain(ProcessedEvent event) {
        ProcessedEventEntity entity = new ProcessedEventEntity();
        entity.eventId = event.getEventId();
        entity.eventType = event.getEventType();
        entity.subjectType = event.getSubjectType();
        entity.subjectId = event.getSubjectId();
        entity.consumerGroup = event.getConsumerGroup();
        entity.processedAt = event.getProcessedAt();
        entity.processingResult = event.getResult();
        entity.note = event.getNote();
        return entity;
    }

    public ProcessedEvent toDomain() {
        return new ProcessedEvent(eventId, eventType, subjectType, subjectId, consumerGroup,
                processedAt, processingResult, note);
    }
}
