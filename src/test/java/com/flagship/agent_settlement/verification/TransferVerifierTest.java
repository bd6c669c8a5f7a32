package com.flagship.agent_settlement.verification;

import com.flagship.agent_settlement.gateway.InventoryGateway;
import com.flagship.agent_settlement.gateway.LedgerGateway;
import com.flagship.agent_settlement.gateway.ObservedTransfer;
import com.flagship.agent_settlement.gateway.ReceivedItem;
import com.flagship.agent_settlement.observability.SettlementMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Matching rules of the verifier, with the gateways and the anti-replay
 * ledger mocked out.
 */
@ExtendWith(MockitoExtension.class)
class TransferVerifierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String AGENT = "agent-wallet";
    private static final String PURPOSE = "exchange:1111";

    @Mock
    private LedgerGateway ledgerGateway;

    @Mock
    private InventoryGateway inventoryGateway;

    @Mock
    private AntiReplayLedger antiReplayLedger;

    private TransferVerifier verifier;

    @BeforeEach
    void setUp() {
        VerificationProperties properties = new VerificationProperties(
                AGENT, "agent-account", new BigDecimal("0.99"), Duration.ofMinutes(10), Duration.ofMinutes(2));
        verifier = new TransferVerifier(ledgerGateway, inventoryGateway, antiReplayLedger, properties,
                new SettlementMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private CurrencyExpectation expectation(String amount, String tag) {
        return new CurrencyExpectation(AGENT, new BigDecimal(amount), NOW.minusSeconds(60), tag, PURPOSE, "alice");
    }

    private static ObservedTransfer transfer(String id, String amount, String memo, Instant at) {
        return new ObservedTransfer(id, new BigDecimal(amount), "alice-wallet", memo, at);
    }

    @Test
    @DisplayName("Memo match ignores case, whitespace and a leading @")
    void memoNormalization() {
        assertEquals("alice", TransferVerifier.normalizeMemo("  @Alice "));
        assertEquals("", TransferVerifier.normalizeMemo(null));
        assertEquals("exchange 42", TransferVerifier.normalizeMemo("EXCHANGE 42"));
    }

    @Test
    @DisplayName("A single matching transfer is consumed and returned")
    void singleMatchIsConsumed() {
        when(ledgerGateway.queryTransfers(eq(AGENT), any())).thenReturn(List.of(
                transfer("tx-1", "9.95", "@ALICE", NOW.minusSeconds(10))));
        when(antiReplayLedger.find("tx-1")).thenReturn(Optional.empty());
        when(antiReplayLedger.consume(eq("tx-1"), eq("alice"), any(), eq(PURPOSE), eq(NOW)))
                .thenReturn(AntiReplayLedger.ConsumeResult.INSERTED);

        VerificationResult result = verifier.verifyCurrency(expectation("10.0", "alice"));

        assertTrue(result.isVerified());
        assertEquals("tx-1", result.getTransfer().getTransferId());
        assertEquals("alice-wallet", result.getTransfer().getSenderAddress());
    }

    @Test
    @DisplayName("Transfers below the tolerance or before the window are ignored")
    void toleranceAndWindow() {
        when(ledgerGateway.queryTransfers(eq(AGENT), any())).thenReturn(List.of(
                transfer("tx-short", "9.89", "alice", NOW.minusSeconds(10)),
                transfer("tx-old", "10.0", "alice", NOW.minusSeconds(3600)),
                transfer("tx-other", "10.0", "bob", NOW.minusSeconds(10))));

        VerificationResult result = verifier.verifyCurrency(expectation("10.0", "alice"));

        assertFalse(result.isVerified());
        assertEquals(VerificationFailure.NOT_FOUND, result.getFailure());
        verify(antiReplayLedger, never()).consume(anyString(), anyString(), any(), anyString(), any());
    }

    @Test
    @DisplayName("Two unused matches are reported as ambiguous and nothing is consumed")
    void ambiguousMatches() {
        when(ledgerGateway.queryTransfers(eq(AGENT), any())).thenReturn(List.of(
                transfer("tx-a", "10.0", "alice", NOW.minusSeconds(20)),
                transfer("tx-b", "10.0", "alice", NOW.minusSeconds(10))));
        when(antiReplayLedger.find(anyString())).thenReturn(Optional.empty());

        VerificationResult result = verifier.verifyCurrency(expectation("10.0", "alice"));

        assertEquals(VerificationFailure.AMBIGUOUS_MULTIPLE_MATCHES, result.getFailure());
        verify(antiReplayLedger, never()).consume(anyString(), anyString(), any(), anyString(), any());
    }

    @Test
    @DisplayName("A transfer consumed by another obligation is rejected as a replay")
    void consumedElsewhere() {
        when(ledgerGateway.queryTransfers(eq(AGENT), any())).thenReturn(List.of(
                transfer("tx-1", "10.0", "alice", NOW.minusSeconds(10))));
        when(antiReplayLedger.find("tx-1")).thenReturn(Optional.of(
                new ConsumedTransfer("tx-1", "alice", new BigDecimal("10.0"), "exchange:9999", NOW.minusSeconds(5))));

        VerificationResult result = verifier.verifyCurrency(expectation("10.0", "alice"));

        assertEquals(VerificationFailure.ALREADY_CONSUMED, result.getFailure());
    }

    @Test
    @DisplayName("Consumed transfers drop out so a single fresh match still verifies")
    void consumedCandidateDoesNotMakeAmbiguity() {
        when(ledgerGateway.queryTransfers(eq(AGENT), any())).thenReturn(List.of(
                transfer("tx-used", "10.0", "alice", NOW.minusSeconds(30)),
                transfer("tx-new", "10.0", "alice", NOW.minusSeconds(10))));
        when(antiReplayLedger.find("tx-used")).thenReturn(Optional.of(
                new ConsumedTransfer("tx-used", "alice", new BigDecimal("10.0"), "wager:abc", NOW.minusSeconds(20))));
        when(antiReplayLedger.find("tx-new")).thenReturn(Optional.empty());
        when(antiReplayLedger.consume(eq("tx-new"), eq("alice"), any(), eq(PURPOSE), eq(NOW)))
                .thenReturn(AntiReplayLedger.ConsumeResult.INSERTED);

        VerificationResult result = verifier.verifyCurrency(expectation("10.0", "alice"));

        assertTrue(result.isVerified());
        assertEquals("tx-new", result.getTransfer().getTransferId());
    }

    @Test
    @DisplayName("A transfer already recorded for the same purpose is adopted again")
    void sameObligationIsAdopted() {
        when(ledgerGateway.queryTransfers(eq(AGENT), any())).thenReturn(List.of(
                transfer("tx-1", "10.0", "alice", NOW.minusSeconds(10))));
        when(antiReplayLedger.find("tx-1")).thenReturn(Optional.of(
                new ConsumedTransfer("tx-1", "alice", new BigDecimal("10.0"), PURPOSE, NOW.minusSeconds(5))));

        VerificationResult result = verifier.verifyCurrency(expectation("10.0", "alice"));

        assertTrue(result.isVerified());
        verify(antiReplayLedger, never()).consume(anyString(), anyString(), any(), anyString(), any());
    }

    @Test
    @DisplayName("Losing the consume race to another obligation is reported as already consumed")
    void lostConsumeRace() {
        when(ledgerGateway.queryTransfers(eq(AGENT), any())).thenReturn(List.of(
                transfer("tx-1", "10.0", "alice", NOW.minusSeconds(10))));
        when(antiReplayLedger.find("tx-1")).thenReturn(Optional.empty());
        when(antiReplayLedger.consume(eq("tx-1"), eq("alice"), any(), eq(PURPOSE), eq(NOW)))
                .thenReturn(AntiReplayLedger.ConsumeResult.CONSUMED_ELSEWHERE);

        VerificationResult result = verifier.verifyCurrency(expectation("10.0", "alice"));

        assertEquals(VerificationFailure.ALREADY_CONSUMED, result.getFailure());
    }

    @Test
    @DisplayName("An item receipt matches on reference, sender and receipt time")
    void itemReceipt() {
        Instant proposedAt = NOW.minusSeconds(120);
        when(inventoryGateway.listRecentlyReceivedItems("agent-account")).thenReturn(List.of(
                new ReceivedItem("i-1", "plush-pepe-17", "mallory", NOW.minusSeconds(30)),
                new ReceivedItem("i-2", "plush-pepe-17", "bob", NOW.minusSeconds(300)),
                new ReceivedItem("i-3", "plush-pepe-17", "bob", NOW.minusSeconds(30))));
        when(antiReplayLedger.find("item:i-3")).thenReturn(Optional.empty());
        when(antiReplayLedger.consume(eq("item:i-3"), eq("bob"), any(), eq(PURPOSE), eq(NOW)))
                .thenReturn(AntiReplayLedger.ConsumeResult.INSERTED);

        VerificationResult result = verifier.verifyItemReceipt(
                new ItemExpectation("agent-account", "plush-pepe-17", "bob", proposedAt, PURPOSE));

        assertTrue(result.isVerified());
        assertEquals("item:i-3", result.getTransfer().getTransferId());
        assertEquals("plush-pepe-17", result.getTransfer().getItemRef());
    }
}
