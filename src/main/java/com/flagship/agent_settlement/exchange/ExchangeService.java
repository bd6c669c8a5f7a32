package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.common.Outcome;
import com.flagship.agent_settlement.common.OutcomeCode;
import com.flagship.agent_settlement.gateway.MessagingGateway;
import com.flagship.agent_settlement.gateway.ValueOracle;
import com.flagship.agent_settlement.observability.CorrelationContext;
import com.flagship.agent_settlement.observability.SettlementMetrics;
import com.flagship.agent_settlement.policy.AssetKind;
import com.flagship.agent_settlement.policy.AssetValue;
import com.flagship.agent_settlement.policy.ComplianceChecker;
import com.flagship.agent_settlement.policy.ComplianceResult;
import com.flagship.agent_settlement.settlement.SettlementExecutor;
import com.flagship.agent_settlement.settlement.SettlementReceipt;
import com.flagship.agent_settlement.verification.CurrencyExpectation;
import com.flagship.agent_settlement.verification.ItemExpectation;
import com.flagship.agent_settlement.verification.TransferVerifier;
import com.flagship.agent_settlement.verification.VerificationProperties;
import com.flagship.agent_settlement.verification.VerificationResult;
import com.flagship.agent_settlement.verification.VerifiedTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives an exchange from proposal to settlement.
 *
 * Every step is a separate, caller-driven operation returning an
 * {@link Outcome}. State changes go through conditional updates in
 * {@link ExchangePersistenceService}, so concurrent callers racing on the
 * same record see {@code CONFLICT} or {@code ALREADY_CLAIMED} instead of
 * double effects.
 *
 * Not transactional: verification and execution talk to external systems
 * and must not hold a database transaction open while doing so.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExchangeService {

    private final ExchangePersistenceService persistence;
    private final ComplianceChecker complianceChecker;
    private final ValueOracle valueOracle;
    private final MessagingGateway messagingGateway;
    private final TransferVerifier transferVerifier;
    private final SettlementExecutor settlementExecutor;
    private final ExchangeProperties exchangeProperties;
    private final VerificationProperties verificationProperties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    /**
     * Checks the proposed terms against policy and, when compliant, opens a
     * new exchange and sends the proposal card to the initiator's channel.
     *
     * A policy rejection returns {@code POLICY_VIOLATION} carrying the
     * compliance result; nothing is persisted.
     */
    public Outcome<ProposalResult> propose(ProposalCommand command) {
        AssetValue offered;
        AssetValue requested;
        try {
            offered = valuate(command.offered());
            requested = valuate(command.requested());
        } catch (IllegalArgumentException e) {
            metrics.recordProposal("invalid");
            return Outcome.failure(OutcomeCode.REJECTED, e.getMessage());
        }

        ComplianceResult compliance = complianceChecker.check(offered, requested);
        if (!compliance.isAcceptable()) {
            metrics.recordProposal("policy_violation");
            log.info("Proposal to {} rejected by policy: {}", command.counterpartyId(), compliance.getReason());
            return Outcome.failure(OutcomeCode.POLICY_VIOLATION,
                    new ProposalResult(null, compliance), compliance.getReason());
        }

        Instant now = clock.instant();
        ExchangeRecord record = persistence.create(ExchangeRecord.builder()
                .id(UUID.randomUUID())
                .status(ExchangeStatus.PROPOSED)
                .initiatorChannel(command.initiatorChannel())
                .counterpartyId(command.counterpartyId())
                .counterpartyAddress(command.counterpartyAddress())
                .offered(offered)
                .requested(requested)
                .complianceResult(compliance)
                .createdAt(now)
                .expiresAt(now.plus(exchangeProperties.expiry()))
                .updatedAt(now)
                .build());

        MDC.put(CorrelationContext.EXCHANGE_ID_MDC_KEY, record.getId().toString());
        try {
            log.info("Proposed exchange: give {} for {}, expected profit {}, expires at {}",
                    offered.describe(), requested.describe(), compliance.getProfit(), record.getExpiresAt());

            if (deliverProposal(record)) {
                persistence.markProposalDelivered(record.getId(), clock.instant());
                record = persistence.findById(record.getId()).orElse(record);
            }
            metrics.recordProposal("created");
            return Outcome.ok(new ProposalResult(record, compliance));
        } finally {
            MDC.remove(CorrelationContext.EXCHANGE_ID_MDC_KEY);
        }
    }

    public Outcome<ExchangeRecord> accept(UUID id) {
        return withRecord(id, "accept", record -> {
            Optional<Outcome<ExchangeRecord>> expired = expireIfDue(record);
            if (expired.isPresent()) {
                return expired.get();
            }
            return transition(record, ExchangeStatus.PROPOSED, ExchangeStatus.ACCEPTED);
        });
    }

    public Outcome<ExchangeRecord> decline(UUID id) {
        return withRecord(id, "decline",
                record -> transition(record, ExchangeStatus.PROPOSED, ExchangeStatus.DECLINED));
    }

    /**
     * Withdraws an exchange that has not been paid for yet. Once payment is
     * verified the agent is committed and cancellation is refused.
     */
    public Outcome<ExchangeRecord> cancel(UUID id, String reason) {
        return withRecord(id, "cancel", record -> {
            if (record.getStatus() != ExchangeStatus.PROPOSED && record.getStatus() != ExchangeStatus.ACCEPTED) {
                return unexpectedStatus(record, ExchangeStatus.ACCEPTED);
            }
            String label = reason == null || reason.isBlank() ? "no reason given" : reason.trim();
            String note = "Cancelled: " + label;
            String notes = record.getNotes() == null ? note : record.getNotes() + "\n" + note;

            if (!persistence.cancel(record, label, notes, clock.instant())) {
                return reloadAfterLostRace(id, ExchangeStatus.CANCELLED);
            }
            log.info("Exchange cancelled from {}: {}", record.getStatus(), label);
            return Outcome.ok(reload(id));
        });
    }

    /**
     * Looks for the counterparty's side of an accepted exchange. Returns
     * {@code NOT_YET_VERIFIED} while nothing matching has arrived; callers
     * poll until the exchange expires.
     */
    public Outcome<ExchangeRecord> verify(UUID id) {
        return withRecord(id, "verify", record -> {
            Optional<Outcome<ExchangeRecord>> expired = expireIfDue(record);
            if (expired.isPresent()) {
                return expired.get();
            }
            if (record.getStatus() != ExchangeStatus.ACCEPTED) {
                return unexpectedStatus(record, ExchangeStatus.ACCEPTED);
            }

            VerificationResult result = record.getRequested().isCurrency()
                    ? transferVerifier.verifyCurrency(currencyExpectation(record))
                    : transferVerifier.verifyItemReceipt(itemExpectation(record));

            if (!result.isVerified()) {
                return switch (result.getFailure()) {
                    case NOT_FOUND -> Outcome.failure(OutcomeCode.NOT_YET_VERIFIED, result.getDetail());
                    case ALREADY_CONSUMED -> Outcome.failure(OutcomeCode.ALREADY_CONSUMED, result.getDetail());
                    case AMBIGUOUS_MULTIPLE_MATCHES ->
                            Outcome.failure(OutcomeCode.AMBIGUOUS_MULTIPLE_MATCHES, result.getDetail());
                };
            }

            VerifiedTransfer transfer = result.getTransfer();
            // An item sender is an inventory account, not a wallet
            String payerAddress = record.getRequested().isCurrency() ? transfer.getSenderAddress() : null;
            Instant now = clock.instant();
            if (!persistence.markVerified(id, transfer.getTransferId(), payerAddress, now)) {
                ExchangeRecord current = reload(id);
                if (current.getStatus() == ExchangeStatus.VERIFIED
                        && transfer.getTransferId().equals(current.getMatchedTransferId())) {
                    return Outcome.ok(current);
                }
                if (current.isExpiredAt(now) && current.getStatus().isExpirable()) {
                    persistence.expire(id, now);
                    return Outcome.failure(OutcomeCode.EXPIRED, "Exchange " + id + " expired before it was verified");
                }
                return unexpectedStatus(current, ExchangeStatus.ACCEPTED);
            }

            log.info("Exchange verified: transferId={}, sender={}", transfer.getTransferId(), transfer.getSenderAddress());
            return Outcome.ok(reload(id));
        });
    }

    /**
     * Sends the agent's side of a verified exchange. Safe to call
     * concurrently: exactly one caller wins the claim and transfers.
     */
    public Outcome<SettlementReceipt> execute(UUID id) {
        return withRecord(id, "execute", record -> {
            Optional<Outcome<ExchangeRecord>> expired = expireIfDue(record);
            if (expired.isPresent()) {
                return expired.get().propagate();
            }
            switch (record.getStatus()) {
                case PROPOSED:
                    return Outcome.failure(OutcomeCode.INVALID_STATE, "Exchange " + id + " has not been accepted");
                case ACCEPTED:
                    return Outcome.failure(OutcomeCode.NOT_YET_VERIFIED,
                            "Exchange " + id + " has no verified payment yet");
                case COMPLETED:
                    return Outcome.failure(OutcomeCode.ALREADY_CLAIMED, "Exchange " + id + " was already settled");
                case VERIFIED:
                    if (record.isClaimed()) {
                        return Outcome.failure(OutcomeCode.ALREADY_CLAIMED,
                                "Exchange " + id + " is being settled by another caller");
                    }
                    return settlementExecutor.execute(new ExchangeSettlementSubject(record, persistence));
                default:
                    return Outcome.failure(OutcomeCode.INVALID_STATE,
                            "Exchange " + id + " is " + record.getStatus() + " and cannot be settled");
            }
        });
    }

    /**
     * Puts a failed exchange back to {@code VERIFIED} after an operator has
     * reconciled the failed transfer by hand. Only possible when the failure
     * cleared the claim.
     */
    public Outcome<ExchangeRecord> reopenFailed(UUID id, String note) {
        return withRecord(id, "reopen", record -> {
            if (record.getStatus() != ExchangeStatus.FAILED) {
                return Outcome.failure(OutcomeCode.INVALID_STATE,
                        "Only failed exchanges can be reopened; " + id + " is " + record.getStatus());
            }
            String entry = "Reopened: " + (note == null || note.isBlank() ? "manual retry" : note.trim());
            String notes = record.getNotes() == null ? entry : record.getNotes() + "\n" + entry;
            if (!persistence.reopenFailed(id, notes, clock.instant())) {
                return Outcome.failure(OutcomeCode.CONFLICT,
                        "Exchange " + id + " cannot be reopened (not verified, still claimed, or changed concurrently)");
            }
            log.warn("Failed exchange reopened for manual retry: {}", entry);
            return Outcome.ok(reload(id));
        });
    }

    public Optional<ExchangeRecord> get(UUID id) {
        return persistence.findById(id);
    }

    public List<ExchangeRecord> list(ExchangeStatus status) {
        return persistence.list(status);
    }

    private <T> Outcome<T> withRecord(UUID id, String operation, RecordStep<T> step) {
        MDC.put(CorrelationContext.EXCHANGE_ID_MDC_KEY, id.toString());
        try {
            Optional<ExchangeRecord> record = persistence.findById(id);
            Outcome<T> outcome = record.isPresent()
                    ? step.apply(record.get())
                    : Outcome.failure(OutcomeCode.NOT_FOUND, "Exchange not found: " + id);
            metrics.recordTransition(operation, outcome.getCode());
            if (!outcome.isOk()) {
                log.info("Exchange {} returned {}: {}", operation, outcome.getCode(), outcome.getMessage());
            }
            return outcome;
        } finally {
            MDC.remove(CorrelationContext.EXCHANGE_ID_MDC_KEY);
        }
    }

    private Outcome<ExchangeRecord> transition(ExchangeRecord record, ExchangeStatus expected, ExchangeStatus next) {
        if (record.getStatus() != expected) {
            return unexpectedStatus(record, expected);
        }
        if (!persistence.transition(record.getId(), expected, next, clock.instant())) {
            return reloadAfterLostRace(record.getId(), next);
        }
        log.info("Exchange moved {} -> {}", expected, next);
        return Outcome.ok(reload(record.getId()));
    }

    /**
     * Lazy expiry: a record past its deadline that is still waiting on the
     * counterparty is moved to {@code EXPIRED} before anything else happens.
     */
    private Optional<Outcome<ExchangeRecord>> expireIfDue(ExchangeRecord record) {
        Instant now = clock.instant();
        if (!record.getStatus().isExpirable() || !record.isExpiredAt(now)) {
            return Optional.empty();
        }
        if (persistence.expire(record.getId(), now)) {
            log.info("Exchange expired at {} (deadline {})", now, record.getExpiresAt());
        }
        return Optional.of(Outcome.failure(OutcomeCode.EXPIRED,
                "Exchange " + record.getId() + " expired at " + record.getExpiresAt()));
    }

    private Outcome<ExchangeRecord> reloadAfterLostRace(UUID id, ExchangeStatus wanted) {
        ExchangeRecord current = reload(id);
        if (current.getStatus() == ExchangeStatus.EXPIRED) {
            return Outcome.failure(OutcomeCode.EXPIRED, "Exchange " + id + " expired");
        }
        return Outcome.failure(OutcomeCode.CONFLICT,
                "Exchange " + id + " changed concurrently; now " + current.getStatus() + ", wanted " + wanted);
    }

    /**
     * Maps a status mismatch to the most useful code: a record that moved past
     * the expected state lost a race, anything else is out of order.
     */
    private <T> Outcome<T> unexpectedStatus(ExchangeRecord record, ExchangeStatus expected) {
        ExchangeStatus actual = record.getStatus();
        if (actual == ExchangeStatus.EXPIRED) {
            return Outcome.failure(OutcomeCode.EXPIRED, "Exchange " + record.getId() + " has expired");
        }
        OutcomeCode code = expected.canReach(actual) ? OutcomeCode.CONFLICT : OutcomeCode.INVALID_STATE;
        return Outcome.failure(code, "Exchange " + record.getId() + " is " + actual + ", expected " + expected);
    }

    private ExchangeRecord reload(UUID id) {
        return persistence.findById(id)
                .orElseThrow(() -> new IllegalStateException("Exchange disappeared after update: " + id));
    }

    private CurrencyExpectation currencyExpectation(ExchangeRecord record) {
        return new CurrencyExpectation(
                verificationProperties.agentAddress(),
                record.getRequested().getQuantity(),
                record.getCreatedAt().minus(verificationProperties.clockSkewTolerance()),
                record.getId().toString(),
                record.purposeTag(),
                record.getCounterpartyId());
    }

    private ItemExpectation itemExpectation(ExchangeRecord record) {
        return new ItemExpectation(
                verificationProperties.agentAccountId(),
                record.getRequested().getItemRef(),
                record.getCounterpartyId(),
                record.getCreatedAt(),
                record.purposeTag());
    }

    private AssetValue valuate(AssetDraft draft) {
        if (draft == null || draft.kind() == null) {
            throw new IllegalArgumentException("Both sides of the exchange must be described");
        }
        if (draft.kind() == AssetKind.CURRENCY) {
            return AssetValue.currency(draft.quantity());
        }
        BigDecimal value = draft.referenceValue();
        if (value == null) {
            value = valueOracle.estimateValue(draft.itemRef())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "No reference value available for item " + draft.itemRef()));
        }
        return AssetValue.item(draft.itemRef(), value);
    }

    /**
     * Best effort: the exchange exists whether or not the counterparty saw it.
     */
    private boolean deliverProposal(ExchangeRecord record) {
        String channel = record.getInitiatorChannel();
        try {
            if (messagingGateway.deliverProposalCard(channel, record.getId())) {
                return true;
            }
            log.info("Proposal card not delivered, falling back to text");
            messagingGateway.notify(channel, String.format(
                    "Offer %s: I give %s for your %s. Accept within %ds.",
                    record.getId(), record.getOffered().describe(), record.getRequested().describe(),
                    exchangeProperties.expiry().toSeconds()));
        } catch (RuntimeException e) {
            log.warn("Could not deliver proposal to channel {}: {}", channel, e.getMessage());
        }
        return false;
    }

    @FunctionalInterface
    private interface RecordStep<T> {
        Outcome<T> apply(ExchangeRecord record);
    }
}
