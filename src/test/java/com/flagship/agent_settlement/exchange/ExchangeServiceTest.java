package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.common.Outcome;
import com.flagship.agent_settlement.common.OutcomeCode;
import com.flagship.agent_settlement.gateway.MessagingGateway;
import com.flagship.agent_settlement.gateway.ValueOracle;
import com.flagship.agent_settlement.observability.SettlementMetrics;
import com.flagship.agent_settlement.policy.AssetValue;
import com.flagship.agent_settlement.policy.ComplianceChecker;
import com.flagship.agent_settlement.settlement.SettlementExecutor;
import com.flagship.agent_settlement.settlement.SettlementReceipt;
import com.flagship.agent_settlement.verification.CurrencyExpectation;
import com.flagship.agent_settlement.verification.TransferVerifier;
import com.flagship.agent_settlement.verification.VerificationFailure;
import com.flagship.agent_settlement.verification.VerificationProperties;
import com.flagship.agent_settlement.verification.VerificationResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Exchange lifecycle decisions with persistence, verification and the
 * executor mocked. Time is driven by a settable clock.
 */
@ExtendWith(MockitoExtension.class)
class ExchangeServiceTest {

    private static final Instant T = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ExchangePersistenceService persistence;

    @Mock
    private ValueOracle valueOracle;

    @Mock
    private MessagingGateway messagingGateway;

    @Mock
    private TransferVerifier transferVerifier;

    @Mock
    private SettlementExecutor settlementExecutor;

    private final SettableClock clock = new SettableClock(T);

    private ExchangeService service;

    @BeforeEach
    void setUp() {
        service = new ExchangeService(
                persistence,
                new ComplianceChecker(new BigDecimal("0.8"), new BigDecimal("1.15")),
                valueOracle,
                messagingGateway,
                transferVerifier,
                settlementExecutor,
                new ExchangeProperties(Duration.ofSeconds(120)),
                new VerificationProperties("agent-wallet", "agent-account", new BigDecimal("0.99"),
                        Duration.ofMinutes(10), Duration.ofMinutes(2)),
                new SettlementMetrics(new SimpleMeterRegistry()),
                clock);
    }

    private static ExchangeRecord record(ExchangeStatus status) {
        return ExchangeRecord.builder()
                .id(UUID.randomUUID())
                .status(status)
                .initiatorChannel("chat-1")
                .counterpartyId("bob")
                .offered(AssetValue.item("plush-pepe-17", new BigDecimal("12.0")))
                .requested(AssetValue.currency(new BigDecimal("14.0")))
                .createdAt(T)
                .expiresAt(T.plusSeconds(120))
                .updatedAt(T)
                .build();
    }

    private static ProposalCommand buyCommand(String price) {
        return new ProposalCommand("chat-1", "bob", "bob-wallet",
                AssetDraft.currency(new BigDecimal(price)),
                AssetDraft.item("plush-pepe-17", null));
    }

    @Test
    @DisplayName("A policy violation returns the compliance result and persists nothing")
    void policyViolation() {
        when(valueOracle.estimateValue("plush-pepe-17")).thenReturn(Optional.of(new BigDecimal("12.0")));

        Outcome<ProposalResult> outcome = service.propose(buyCommand("10.0"));

        assertEquals(OutcomeCode.POLICY_VIOLATION, outcome.getCode());
        assertNull(outcome.getValue().getRecord());
        assertFalse(outcome.getValue().getCompliance().isAcceptable());
        verify(persistence, never()).create(any());
        verifyNoInteractions(messagingGateway);
    }

    @Test
    @DisplayName("An item without any reference value is rejected")
    void unknownItemValue() {
        when(valueOracle.estimateValue("plush-pepe-17")).thenReturn(Optional.empty());

        Outcome<ProposalResult> outcome = service.propose(buyCommand("9.0"));

        assertEquals(OutcomeCode.REJECTED, outcome.getCode());
        verify(persistence, never()).create(any());
    }

    @Test
    @DisplayName("A compliant proposal is persisted with a 120s expiry and the card is sent")
    void compliantProposal() {
        when(valueOracle.estimateValue("plush-pepe-17")).thenReturn(Optional.of(new BigDecimal("12.0")));
        when(persistence.create(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(messagingGateway.deliverProposalCard(eq("chat-1"), any())).thenReturn(true);

        Outcome<ProposalResult> outcome = service.propose(buyCommand("9.0"));

        assertTrue(outcome.isOk());
        ExchangeRecord created = outcome.getValue().getRecord();
        assertEquals(ExchangeStatus.PROPOSED, created.getStatus());
        assertEquals(T.plusSeconds(120), created.getExpiresAt());
        assertEquals(0, new BigDecimal("3.0").compareTo(outcome.getValue().getCompliance().getProfit()));
        verify(persistence).markProposalDelivered(created.getId(), T);
        verify(messagingGateway, never()).notify(anyString(), anyString());
    }

    @Test
    @DisplayName("When the card is refused the proposal falls back to a text message")
    void textFallback() {
        when(valueOracle.estimateValue("plush-pepe-17")).thenReturn(Optional.of(new BigDecimal("12.0")));
        when(persistence.create(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(messagingGateway.deliverProposalCard(eq("chat-1"), any())).thenReturn(false);

        Outcome<ProposalResult> outcome = service.propose(buyCommand("9.0"));

        assertTrue(outcome.isOk());
        ArgumentCaptor<String> text = ArgumentCaptor.forClass(String.class);
        verify(messagingGateway).notify(eq("chat-1"), text.capture());
        assertTrue(text.getValue().contains("item:plush-pepe-17"), text.getValue());
        verify(persistence, never()).markProposalDelivered(any(), any());
    }

    @Test
    @DisplayName("A messaging failure does not undo the proposal")
    void messagingFailure() {
        when(valueOracle.estimateValue("plush-pepe-17")).thenReturn(Optional.of(new BigDecimal("12.0")));
        when(persistence.create(any())).thenAnswer(invocation -> invocation.getArgument(0));
        when(messagingGateway.deliverProposalCard(eq("chat-1"), any())).thenThrow(new IllegalStateException("down"));

        Outcome<ProposalResult> outcome = service.propose(buyCommand("9.0"));

        assertTrue(outcome.isOk());
        assertFalse(outcome.getValue().getRecord().isProposalDelivered());
    }

    @Test
    @DisplayName("Verification at T+121s on a record expiring at T+120s expires it")
    void verifyAfterDeadlineExpires() {
        ExchangeRecord accepted = record(ExchangeStatus.ACCEPTED);
        when(persistence.findById(accepted.getId())).thenReturn(Optional.of(accepted));
        when(persistence.expire(accepted.getId(), T.plusSeconds(121))).thenReturn(true);
        clock.set(T.plusSeconds(121));

        Outcome<ExchangeRecord> outcome = service.verify(accepted.getId());

        assertEquals(OutcomeCode.EXPIRED, outcome.getCode());
        verify(persistence).expire(accepted.getId(), T.plusSeconds(121));
        verifyNoInteractions(transferVerifier);
    }

    @Test
    @DisplayName("Verification exactly at the deadline is still allowed")
    void verifyAtDeadline() {
        ExchangeRecord accepted = record(ExchangeStatus.ACCEPTED);
        when(persistence.findById(accepted.getId())).thenReturn(Optional.of(accepted));
        when(transferVerifier.verifyCurrency(any(CurrencyExpectation.class)))
                .thenReturn(VerificationResult.failed(VerificationFailure.NOT_FOUND, "nothing yet"));
        clock.set(T.plusSeconds(120));

        Outcome<ExchangeRecord> outcome = service.verify(accepted.getId());

        assertEquals(OutcomeCode.NOT_YET_VERIFIED, outcome.getCode());
        verify(persistence, never()).expire(any(), any());
    }

    @Test
    @DisplayName("Currency verification expects the requested amount tagged with the exchange id")
    void currencyExpectationShape() {
        ExchangeRecord accepted = record(ExchangeStatus.ACCEPTED);
        when(persistence.findById(accepted.getId())).thenReturn(Optional.of(accepted));
        when(transferVerifier.verifyCurrency(any(CurrencyExpectation.class)))
                .thenReturn(VerificationResult.failed(VerificationFailure.AMBIGUOUS_MULTIPLE_MATCHES, "two"));

        Outcome<ExchangeRecord> outcome = service.verify(accepted.getId());

        assertEquals(OutcomeCode.AMBIGUOUS_MULTIPLE_MATCHES, outcome.getCode());
        ArgumentCaptor<CurrencyExpectation> captor = ArgumentCaptor.forClass(CurrencyExpectation.class);
        verify(transferVerifier).verifyCurrency(captor.capture());
        CurrencyExpectation expectation = captor.getValue();
        assertEquals("agent-wallet", expectation.recipient());
        assertEquals(0, new BigDecimal("14.0").compareTo(expectation.amount()));
        assertEquals(accepted.getId().toString(), expectation.correlationTag());
        assertEquals("exchange:" + accepted.getId(), expectation.purposeTag());
        assertEquals(T.minus(Duration.ofMinutes(2)), expectation.earliestAcceptableTime());
    }

    @Test
    @DisplayName("Accepting an expired proposal returns EXPIRED")
    void acceptAfterDeadline() {
        ExchangeRecord proposed = record(ExchangeStatus.PROPOSED);
        when(persistence.findById(proposed.getId())).thenReturn(Optional.of(proposed));
        clock.set(T.plusSeconds(500));

        assertEquals(OutcomeCode.EXPIRED, service.accept(proposed.getId()).getCode());
        verify(persistence, never()).transition(any(), any(), any(), any());
    }

    @Test
    @DisplayName("Losing the accept race to a decline reports a conflict")
    void acceptLosesRace() {
        ExchangeRecord proposed = record(ExchangeStatus.PROPOSED);
        ExchangeRecord declined = proposed.toBuilder().status(ExchangeStatus.DECLINED).build();
        when(persistence.findById(proposed.getId()))
                .thenReturn(Optional.of(proposed))
                .thenReturn(Optional.of(declined));
        when(persistence.transition(proposed.getId(), ExchangeStatus.PROPOSED, ExchangeStatus.ACCEPTED, T))
                .thenReturn(false);

        assertEquals(OutcomeCode.CONFLICT, service.accept(proposed.getId()).getCode());
    }

    @Test
    @DisplayName("Execute maps each status to its outcome without touching the executor")
    void executeStatusMapping() {
        assertExecuteCode(record(ExchangeStatus.PROPOSED), OutcomeCode.INVALID_STATE);
        assertExecuteCode(record(ExchangeStatus.ACCEPTED), OutcomeCode.NOT_YET_VERIFIED);
        assertExecuteCode(record(ExchangeStatus.COMPLETED), OutcomeCode.ALREADY_CLAIMED);
        assertExecuteCode(record(ExchangeStatus.DECLINED), OutcomeCode.INVALID_STATE);
        assertExecuteCode(record(ExchangeStatus.VERIFIED).toBuilder().claimedAt(T).build(),
                OutcomeCode.ALREADY_CLAIMED);
        verifyNoInteractions(settlementExecutor);
    }

    @Test
    @DisplayName("A verified, unclaimed exchange is handed to the executor")
    void executeVerified() {
        ExchangeRecord verified = record(ExchangeStatus.VERIFIED);
        when(persistence.findById(verified.getId())).thenReturn(Optional.of(verified));
        when(settlementExecutor.execute(any())).thenReturn(Outcome.failure(OutcomeCode.ALREADY_CLAIMED, "lost"));

        Outcome<SettlementReceipt> outcome = service.execute(verified.getId());

        assertEquals(OutcomeCode.ALREADY_CLAIMED, outcome.getCode());
        verify(settlementExecutor).execute(any(ExchangeSettlementSubject.class));
    }

    @Test
    @DisplayName("Cancelling after verification is refused")
    void cancelAfterVerification() {
        ExchangeRecord verified = record(ExchangeStatus.VERIFIED);
        when(persistence.findById(verified.getId())).thenReturn(Optional.of(verified));

        Outcome<ExchangeRecord> outcome = service.cancel(verified.getId(), "changed my mind");

        assertEquals(OutcomeCode.INVALID_STATE, outcome.getCode());
        verify(persistence, never()).cancel(any(), anyString(), anyString(), any());
    }

    @Test
    @DisplayName("Unknown ids are reported as not found")
    void unknownId() {
        UUID id = UUID.randomUUID();
        when(persistence.findById(id)).thenReturn(Optional.empty());

        assertEquals(OutcomeCode.NOT_FOUND, service.execute(id).getCode());
    }

    private void assertExecuteCode(ExchangeRecord record, OutcomeCode expected) {
        when(persistence.findById(record.getId())).thenReturn(Optional.of(record));
        assertEquals(expected, service.execute(record.getId()).getCode(), "status " + record.getStatus());
    }

    static final class SettableClock extends Clock {

        private Instant instant;

        SettableClock(Instant instant) {
            this.instant = instant;
        }

        void set(Instant instant) {
            this.instant = instant;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
