package com.flagship.agent_settlement.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;

/**
 * Runs an event handler at most once per consumer group.
 *
 * The handler and the {@code processed_events} row share a transaction. A
 * handler failure rolls both back and propagates, so the message is not
 * acknowledged and Kafka redelivers it. A concurrent duplicate fails on the
 * unique key with a {@link org.springframework.dao.DataIntegrityViolationException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType, String subjectType, UUID subjectId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        // The unique (event_id, consumer_group) row is written first: a concurrent
        // duplicate blocks on it and fails before its handler runs.
        repository.saveAndFlush(ProcessedEventEntity.fromDomain(ProcessedEvent.success(
                eventId, eventType, subjectType, subjectId, consumerGroup, clock.instant())));

        handler.run();
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    @Transactional
    public void skipEvent(UUID eventId, String eventType, String subjectType, UUID subjectId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(ProcessedEvent.skipped(
                eventId, eventType, subjectType, subjectId, consumerGroup, clock.instant(), reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
