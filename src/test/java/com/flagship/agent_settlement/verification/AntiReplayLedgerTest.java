package com.flagship.agent_settlement.verification;

import com.flagship.agent_settlement.gateway.InventoryGateway;
import com.flagship.agent_settlement.gateway.LedgerGateway;
import com.flagship.agent_settlement.gateway.MessagingGateway;
import com.flagship.agent_settlement.gateway.ValueOracle;
import com.flagship.agent_settlement.wager.OutcomeSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The consumed-transfer table is the single arbiter of replay, including
 * under concurrent inserts.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class AntiReplayLedgerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("agent_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
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
    private AntiReplayLedger ledger;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("First consume inserts, the same purpose again is ours, another purpose is refused")
    void consumeOutcomes() {
        String transferId = "tx-" + UUID.randomUUID();
        Instant now = Instant.now();

        assertFalse(ledger.isConsumed(transferId));
        assertEquals(AntiReplayLedger.ConsumeResult.INSERTED,
                ledger.consume(transferId, "alice", new BigDecimal("5"), "exchange:a", now));
        assertEquals(AntiReplayLedger.ConsumeResult.ALREADY_OURS,
                ledger.consume(transferId, "alice", new BigDecimal("5"), "exchange:a", now));
        assertEquals(AntiReplayLedger.ConsumeResult.CONSUMED_ELSEWHERE,
                ledger.consume(transferId, "mallory", new BigDecimal("5"), "wager:b", now));

        ConsumedTransfer stored = ledger.find(transferId).orElseThrow();
        assertEquals("exchange:a", stored.getPurposeTag());
        assertEquals("alice", stored.getClaimantId());
        assertTrue(ledger.isConsumed(transferId));
    }

    @Test
    @DisplayName("Item receipts are stored without an amount")
    void itemReceiptWithoutAmount() {
        String transferId = "item:" + UUID.randomUUID();

        assertEquals(AntiReplayLedger.ConsumeResult.INSERTED,
                ledger.consume(transferId, "bob", null, "exchange:c", Instant.now()));
        assertNull(ledger.find(transferId).orElseThrow().getAmount());
    }

    @Test
    @DisplayName("Concurrent consumers of one transfer: exactly one wins")
    void concurrentConsume() throws InterruptedException {
        printTestHeader("Concurrent Consume - Exactly One Winner");

        String transferId = "tx-" + UUID.randomUUID();
        int threadCount = 10;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        List<AntiReplayLedger.ConsumeResult> results = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        for (int i = 0; i < threadCount; i++) {
            String purpose = "exchange:" + i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    results.add(ledger.consume(transferId, "alice", BigDecimal.ONE, purpose, Instant.now()));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(threadCount, results.size());
        assertEquals(1, results.stream().filter(r -> r == AntiReplayLedger.ConsumeResult.INSERTED).count());
        assertEquals(threadCount - 1,
                results.stream().filter(r -> r == AntiReplayLedger.ConsumeResult.CONSUMED_ELSEWHERE).count());

        printSuccess("One insert, " + (threadCount - 1) + " replays refused");
    }
}
