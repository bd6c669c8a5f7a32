package com.flagship.agent_settlement.outbox;

import com.flagship.agent_settlement.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes settlement events to Kafka.
 *
 * Events are keyed by subject id so every event of one exchange or wager
 * lands on the same partition in order. Sends are synchronous with a
 * bounded wait; a failed send bumps the retry count, and events past
 * {@code max-retries} stay in the table as dead letters for an operator.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.settlement-events:settlement-events}")
    private String topic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:5000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishable(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", events.size());
            events.forEach(this::publish);
        } catch (Exception e) {
            log.error("Outbox polling failed", e);
        }
    }

    private void publish(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(topic, event.getSubjectId().toString(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event {} ({}) to {}-{}@{}",
                    event.getId(), event.getEventType(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event {} ({}): {}", event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());
            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached {} attempts and is now dead-lettered", event.getId(), maxRetries);
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }
}
