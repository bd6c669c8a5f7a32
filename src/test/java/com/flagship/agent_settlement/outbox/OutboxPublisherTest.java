package com.flagship.agent_settlement.outbox;

import com.flagship.agent_settlement.event.SettlementCompletedEvent;
import com.flagship.agent_settlement.gateway.InventoryGateway;
import com.flagship.agent_settlement.gateway.LedgerGateway;
import com.flagship.agent_settlement.gateway.MessagingGateway;
import com.flagship.agent_settlement.gateway.ValueOracle;
import com.flagship.agent_settlement.wager.OutcomeSource;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox events reach Kafka keyed by subject id and are then marked
 * published.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("agent_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("consumer.enabled", () -> "false");
        // Scheduled runs stay out of the way; tests call the publisher directly
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @MockBean
    private LedgerGateway ledgerGateway;

    @MockBean
    private InventoryGateway inventoryGateway;

    @MockBean
    private MessagingGateway messagingGateway;

    @MockBean
    private ValueOracle valueOracle;

    @MockBean
    private OutcomeSource outcomeSource;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Value("${kafka.topic.settlement-events:settlement-events}")
    private String topic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(topic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private UUID writeCompletedEvent(String subjectType) {
        UUID subjectId = UUID.randomUUID();
        transactionTemplate.execute(status -> outboxService.saveEvent(subjectType, new SettlementCompletedEvent(
                UUID.randomUUID(), subjectId, subjectType, "chan-1",
                "12 GOLD", "buyer-wallet", "tx-" + subjectId, Instant.now())));
        return subjectId;
    }

    @Test
    @DisplayName("Publisher sends events to Kafka and marks them published")
    void publishesAndMarks() {
        printTestHeader("Publisher Sends Events to Kafka");

        UUID subjectId = writeCompletedEvent("Exchange");
        assertEquals(1, outboxService.countUnpublished());

        outboxPublisher.publishPendingEvents();

        assertEquals(0, outboxService.countUnpublished(), "Send is synchronous, so the row is marked at once");

        List<ConsumerRecord<String, String>> records = consumeRecords(Set.of(subjectId.toString()), 10000);
        assertEquals(1, records.size());

        ConsumerRecord<String, String> record = records.get(0);
        System.out.println("Record key: " + record.key());
        System.out.println("Record value: " + record.value());
        assertEquals(subjectId.toString(), record.key());
        assertTrue(record.value().contains(SettlementCompletedEvent.EVENT_TYPE));
        assertTrue(record.value().contains("tx-" + subjectId));

        printSuccess("Event published to Kafka and marked as published");
    }

    @Test
    @DisplayName("Every event is keyed by its subject id")
    void keysBySubjectId() {
        printTestHeader("Publisher Uses Subject ID as Partition Key");

        List<String> subjectIds = new ArrayList<>();
        subjectIds.add(writeCompletedEvent("Exchange").toString());
        subjectIds.add(writeCompletedEvent("Wager").toString());
        subjectIds.add(writeCompletedEvent("Exchange").toString());

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = consumeRecords(Set.copyOf(subjectIds), 10000);
        assertEquals(3, records.size());
        for (ConsumerRecord<String, String> record : records) {
            System.out.println("Key: " + record.key() + ", Partition: " + record.partition());
            assertTrue(subjectIds.contains(record.key()));
        }

        printSuccess("Events partitioned by subject ID");
    }

    @Test
    @DisplayName("Already published events are not sent again")
    void publishedEventsNotResent() {
        UUID subjectId = writeCompletedEvent("Wager");

        outboxPublisher.publishPendingEvents();
        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = consumeRecords(Set.of(subjectId.toString()), 3000);
        assertEquals(1, records.size());
        assertNotNull(outboxService.eventsFor("Wager", subjectId).get(0).getPublishedAt());
    }

    /** Polls for the given timeout, keeping only records of the given subjects. */
    private List<ConsumerRecord<String, String>> consumeRecords(Set<String> keys, long timeoutMs) {
        List<ConsumerRecord<String, String>> allRecords = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (keys.contains(record.key())) {
                    allRecords.add(record);
                }
            }
        }

        return allRecords;
    }
}
