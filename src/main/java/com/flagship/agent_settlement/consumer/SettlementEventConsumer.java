package com.flagship.agent_settlement.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.agent_settlement.event.ExchangeCancelledEvent;
import com.flagship.agent_settlement.event.ExchangeProposedEvent;
import com.flagship.agent_settlement.event.JackpotAwardedEvent;
import com.flagship.agent_settlement.event.SettlementCompletedEvent;
import com.flagship.agent_settlement.event.SettlementFailedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Consumer;

/**
 * Consumes settlement events and turns them into counterparty notifications.
 *
 * Offsets are acknowledged manually, after the event was handled or
 * recorded as skipped. Redelivered events are filtered by
 * {@link IdempotentEventProcessor}.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementEventConsumer {

    static final String CONSUMER_GROUP = "settlement-notifier";

    private final IdempotentEventProcessor eventProcessor;
    private final SettlementNotifier notifier;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.settlement-events:settlement-events}",
        groupId = "${spring.kafka.consumer.group-id:agent-settlement-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        boolean processed = route(envelope, record.value());
        ack.acknowledge();

        if (processed) {
            log.info("Processed event: type={}, eventId={}, subjectId={}",
                    envelope.eventType(), envelope.eventId(), envelope.subjectId());
        }
    }

    boolean route(EventEnvelope envelope, String payload) {
        return switch (envelope.eventType()) {
            case SettlementCompletedEvent.EVENT_TYPE ->
                    handle(envelope, payload, SettlementCompletedEvent.class, notifier::onSettlementCompleted);
            case SettlementFailedEvent.EVENT_TYPE ->
                    handle(envelope, payload, SettlementFailedEvent.class, notifier::onSettlementFailed);
            case ExchangeCancelledEvent.EVENT_TYPE ->
                    handle(envelope, payload, ExchangeCancelledEvent.class, notifier::onExchangeCancelled);
            case JackpotAwardedEvent.EVENT_TYPE ->
                    handle(envelope, payload, JackpotAwardedEvent.class, notifier::onJackpotAwarded);
            case ExchangeProposedEvent.EVENT_TYPE -> {
                // the proposal card is delivered synchronously when the exchange is created
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), envelope.subjectType(),
                        envelope.subjectId(), CONSUMER_GROUP, "Proposal already delivered by the service");
                yield false;
            }
            default -> {
                log.debug("Unknown event type: {}, skipping", envelope.eventType());
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), envelope.subjectType(),
                        envelope.subjectId(), CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    private <T> boolean handle(EventEnvelope envelope, String payload, Class<T> type, Consumer<T> handler) {
        return eventProcessor.processEvent(
            envelope.eventId(), envelope.eventType(), envelope.subjectType(), envelope.subjectId(),
            CONSUMER_GROUP,
            () -> handler.accept(deserialize(payload, type))
        );
    }

    EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("subjectId")) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(node.get("subjectId").asText()),
                node.hasNonNull("eventType") ? node.get("eventType").asText() : "Unknown",
                node.hasNonNull("subjectType") ? node.get("subjectType").asText() : null
            );
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    record EventEnvelope(UUID eventId, UUID subjectId, String eventType, String subjectType) {
    }
}
