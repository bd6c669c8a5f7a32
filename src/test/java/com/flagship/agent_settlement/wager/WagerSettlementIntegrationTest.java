package com.flagship.agent_settlement.wager;

import com.flagship.agent_settlement.common.Outcome;
import com.flagship.agent_settlement.common.OutcomeCode;
import com.flagship.agent_settlement.gateway.ExternalTransferException;
import com.flagship.agent_settlement.gateway.InventoryGateway;
import com.flagship.agent_settlement.gateway.LedgerGateway;
import com.flagship.agent_settlement.gateway.MessagingGateway;
import com.flagship.agent_settlement.gateway.ObservedTransfer;
import com.flagship.agent_settlement.gateway.ValueOracle;
import com.flagship.agent_settlement.jackpot.JackpotAccumulator;
import com.flagship.agent_settlement.journal.JournalEntry;
import com.flagship.agent_settlement.journal.JournalEntryType;
import com.flagship.agent_settlement.journal.JournalService;
import org.junit.jupiter.api.BeforeEach;
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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Wager placement and settlement against a real database, with the ledger
 * and the outcome draw mocked.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class WagerSettlementIntegrationTest {

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
    private StringRedisTemplate redisTemplate;

    @MockBean
    private OutcomeSource outcomeSource;

    @Autowired
    private WagerService wagerService;

    @Autowired
    private WagerPersistenceService persistence;

    @Autowired
    private JackpotAccumulator jackpotAccumulator;

    @Autowired
    private JournalService journalService;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        when(ledgerGateway.balanceOf("agent-wallet")).thenReturn(new BigDecimal("1000"));
    }

    private Wager place(String requester, WagerGame game, String stake) {
        Outcome<Wager> placed = wagerService.placeWager(
                new PlaceWagerCommand(requester, "@" + requester, "chat-" + requester, game, new BigDecimal(stake)));
        assertTrue(placed.isOk(), placed.toString());
        return placed.getValue();
    }

    private void stakePaid(Wager wager) {
        when(ledgerGateway.queryTransfers(eq("agent-wallet"), any())).thenReturn(List.of(new ObservedTransfer(
                "tx-" + UUID.randomUUID(), wager.getStake(), wager.getRequesterId() + "-wallet",
                wager.getMemoTag().toUpperCase(), Instant.now())));
    }

    private static String requester() {
        return "player-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Test
    @DisplayName("A winning slot pays stake x multiplier and credits the jackpot")
    void winningSlot() {
        printTestHeader("Winning Slot Wager");
        String requester = requester();
        Wager wager = place(requester, WagerGame.SLOT, "2");
        printInput("Wager", wager.getId());
        assertEquals(WagerStatus.PENDING_PAYMENT, wager.getStatus());

        BigDecimal potBefore = jackpotAccumulator.snapshot().accumulatedAmount();
        stakePaid(wager);
        when(outcomeSource.draw(WagerGame.SLOT, wager.getId())).thenReturn(64);
        when(ledgerGateway.submitTransfer(eq(requester + "-wallet"), any(), anyString())).thenReturn("tx-payout");

        Outcome<Wager> settled = wagerService.settleWager(wager.getId());
        printOutput("Settle", settled);

        assertTrue(settled.isOk(), settled.toString());
        Wager done = settled.getValue();
        assertEquals(WagerStatus.SETTLED, done.getStatus());
        assertEquals(64, done.getOutcomeValue());
        assertEquals(0, new BigDecimal("10").compareTo(done.getPayout()));
        assertEquals("tx-payout", done.getExternalTransferId());
        verify(ledgerGateway).submitTransfer(eq(requester + "-wallet"),
                argThat(amount -> amount.compareTo(new BigDecimal("10")) == 0), anyString());

        BigDecimal credited = jackpotAccumulator.snapshot().accumulatedAmount().subtract(potBefore);
        assertEquals(0, new BigDecimal("0.1").compareTo(credited));

        List<JournalEntry> journal = journalService.entriesFor(WagerPersistenceService.SUBJECT_TYPE, wager.getId());
        assertEquals(1, journal.size());
        assertEquals(JournalEntryType.WAGER, journal.get(0).getType());
        assertEquals(0, new BigDecimal("-8").compareTo(journal.get(0).getPnl()));

        printSuccess("Paid 10 for a stake of 2");
    }

    @Test
    @DisplayName("A losing roll settles locally without any payout")
    void losingDice() {
        Wager wager = place(requester(), WagerGame.DICE, "1");
        stakePaid(wager);
        when(outcomeSource.draw(WagerGame.DICE, wager.getId())).thenReturn(2);

        Outcome<Wager> settled = wagerService.settleWager(wager.getId());

        assertTrue(settled.isOk(), settled.toString());
        assertEquals(WagerStatus.SETTLED, settled.getValue().getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(settled.getValue().getPayout()));
        verify(ledgerGateway, never()).submitTransfer(anyString(), any(), anyString());

        List<JournalEntry> journal = journalService.entriesFor(WagerPersistenceService.SUBJECT_TYPE, wager.getId());
        assertEquals(1, journal.size());
        assertEquals(0, BigDecimal.ONE.compareTo(journal.get(0).getPnl()));
    }

    @Test
    @DisplayName("Settling again after settlement draws nothing new and pays nothing")
    void settleTwice() {
        Wager wager = place(requester(), WagerGame.DICE, "1");
        stakePaid(wager);
        when(outcomeSource.draw(WagerGame.DICE, wager.getId())).thenReturn(6);
        when(ledgerGateway.submitTransfer(anyString(), any(), anyString())).thenReturn("tx-dice");

        assertTrue(wagerService.settleWager(wager.getId()).isOk());
        Outcome<Wager> again = wagerService.settleWager(wager.getId());

        assertEquals(OutcomeCode.ALREADY_CLAIMED, again.getCode());
        verify(outcomeSource, times(1)).draw(any(), any());
        verify(ledgerGateway, times(1)).submitTransfer(anyString(), any(), anyString());
    }

    @Test
    @DisplayName("Without a matching stake payment the wager stays pending")
    void stakeNotPaidYet() {
        Wager wager = place(requester(), WagerGame.DICE, "1");
        when(ledgerGateway.queryTransfers(any(), any())).thenReturn(List.of());

        Outcome<Wager> outcome = wagerService.settleWager(wager.getId());

        assertEquals(OutcomeCode.NOT_YET_VERIFIED, outcome.getCode());
        assertEquals(WagerStatus.PENDING_PAYMENT, wagerService.get(wager.getId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("A failed payout leaves the wager failed with its outcome kept")
    void failedPayout() {
        Wager wager = place(requester(), WagerGame.DICE, "1");
        stakePaid(wager);
        when(outcomeSource.draw(WagerGame.DICE, wager.getId())).thenReturn(5);
        when(ledgerGateway.submitTransfer(anyString(), any(), anyString()))
                .thenThrow(new ExternalTransferException("ledger timeout"));

        Outcome<Wager> outcome = wagerService.settleWager(wager.getId());

        assertEquals(OutcomeCode.EXTERNAL_TRANSFER_FAILURE, outcome.getCode());
        Wager failed = wagerService.get(wager.getId()).orElseThrow();
        assertEquals(WagerStatus.FAILED, failed.getStatus());
        assertEquals(5, failed.getOutcomeValue());
        assertEquals(OutcomeCode.INVALID_STATE, wagerService.settleWager(wager.getId()).getCode());
    }

    @Test
    @DisplayName("A wager past its payment window expires on settlement")
    void expiredWager() {
        Instant past = Instant.now().minusSeconds(3600);
        Wager stale = persistence.create(Wager.builder()
                .id(UUID.randomUUID())
                .requesterId(requester())
                .memoTag("@late")
                .channel("chat-late")
                .game(WagerGame.DICE)
                .stake(BigDecimal.ONE)
                .status(WagerStatus.PENDING_PAYMENT)
                .createdAt(past)
                .expiresAt(past.plusSeconds(300))
                .updatedAt(past)
                .build());

        Outcome<Wager> outcome = wagerService.settleWager(stale.getId());

        assertEquals(OutcomeCode.EXPIRED, outcome.getCode());
        assertEquals(WagerStatus.EXPIRED, wagerService.get(stale.getId()).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("A draw outside the game's range is a host fault and fixes no outcome")
    void drawOutOfRange() {
        Wager wager = place(requester(), WagerGame.DICE, "1");
        stakePaid(wager);
        when(outcomeSource.draw(WagerGame.DICE, wager.getId())).thenReturn(7).thenReturn(4);
        when(ledgerGateway.submitTransfer(anyString(), any(), anyString())).thenReturn("tx-after-fault");

        IllegalStateException fault = assertThrows(IllegalStateException.class,
                () -> wagerService.settleWager(wager.getId()));
        assertTrue(fault.getMessage().contains("returned 7"), fault.getMessage());

        Wager stillVerified = wagerService.get(wager.getId()).orElseThrow();
        assertEquals(WagerStatus.VERIFIED, stillVerified.getStatus());
        assertFalse(stillVerified.hasOutcome());
        verify(ledgerGateway, never()).submitTransfer(anyString(), any(), anyString());

        Outcome<Wager> retried = wagerService.settleWager(wager.getId());
        assertTrue(retried.isOk(), retried.toString());
        assertEquals(4, retried.getValue().getOutcomeValue());
    }

    @Test
    @DisplayName("A second wager inside the cooldown is refused")
    void cooldown() {
        String requester = requester();
        place(requester, WagerGame.DICE, "1");

        Outcome<Wager> second = wagerService.placeWager(
                new PlaceWagerCommand(requester, "@" + requester, "chat", WagerGame.DICE, BigDecimal.ONE));

        assertEquals(OutcomeCode.REJECTED, second.getCode());
        assertTrue(second.getMessage().contains("Cooldown"), second.getMessage());
    }

    @Test
    @DisplayName("A stake above the bankroll limit is refused")
    void stakeTooLarge() {
        Outcome<Wager> outcome = wagerService.placeWager(
                new PlaceWagerCommand(requester(), "@x", "chat", WagerGame.SLOT, new BigDecimal("51")));

        assertEquals(OutcomeCode.REJECTED, outcome.getCode());
        assertTrue(outcome.getMessage().contains("Maximum stake"), outcome.getMessage());
    }

    @Test
    @DisplayName("Stats count only wagers with an outcome")
    void stats() {
        String requester = requester();
        Wager won = place(requester, WagerGame.DICE, "2");
        stakePaid(won);
        when(outcomeSource.draw(WagerGame.DICE, won.getId())).thenReturn(6);
        when(ledgerGateway.submitTransfer(anyString(), any(), anyString())).thenReturn("tx-stats");
        assertTrue(wagerService.settleWager(won.getId()).isOk());

        WagerStats stats = wagerService.stats(requester);

        assertEquals(1, stats.totalWagers());
        assertEquals(1, stats.wins());
        assertEquals(0, new BigDecimal("2").compareTo(stats.totalStaked()));
        assertEquals(0, new BigDecimal("5").compareTo(stats.totalPaidOut()));
    }

    @Test
    @DisplayName("The leaderboard ranks requesters by net result or by amount staked")
    void leaderboard() {
        printTestHeader("Wager Leaderboard");
        when(ledgerGateway.submitTransfer(anyString(), any(), anyString())).thenReturn("tx-board");

        String bigWinner = requester();
        String smallWinner = requester();
        String loser = requester();
        settleWith(place(bigWinner, WagerGame.DICE, "2"), 6);
        settleWith(place(smallWinner, WagerGame.DICE, "1"), 5);
        settleWith(place(loser, WagerGame.DICE, "4"), 1);
        List<String> ours = List.of(bigWinner, smallWinner, loser);

        List<String> winners = ranked(LeaderboardType.WINNERS, ours);
        List<String> losers = ranked(LeaderboardType.LOSERS, ours);
        List<String> wagered = ranked(LeaderboardType.WAGERED, ours);
        printOutput("Winners", winners);

        assertEquals(List.of(bigWinner, smallWinner, loser), winners);
        assertEquals(List.of(loser, smallWinner, bigWinner), losers);
        assertEquals(List.of(loser, bigWinner, smallWinner), wagered);

        WagerStats top = wagerService.leaderboard(LeaderboardType.WINNERS, 50).stream()
                .filter(stats -> stats.requesterId().equals(bigWinner))
                .findFirst()
                .orElseThrow();
        assertEquals(0, new BigDecimal("3").compareTo(top.netResult()));

        assertThrows(IllegalArgumentException.class, () -> wagerService.leaderboard(LeaderboardType.WINNERS, 0));
        assertThrows(IllegalArgumentException.class, () -> wagerService.leaderboard(LeaderboardType.WINNERS, 51));
        assertEquals(1, wagerService.leaderboard(LeaderboardType.WAGERED, 1).size());

        printSuccess("Leaderboard ordered by net result and by stake");
    }

    private void settleWith(Wager wager, int drawn) {
        stakePaid(wager);
        when(outcomeSource.draw(wager.getGame(), wager.getId())).thenReturn(drawn);
        Outcome<Wager> settled = wagerService.settleWager(wager.getId());
        assertTrue(settled.isOk(), settled.toString());
    }

    private List<String> ranked(LeaderboardType type, List<String> requesters) {
        return wagerService.leaderboard(type, 50).stream()
                .map(WagerStats::requesterId)
                .filter(requesters::contains)
                .toList();
    }
}
