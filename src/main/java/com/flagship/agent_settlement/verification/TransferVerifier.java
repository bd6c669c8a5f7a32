package com.flagship.agent_settlement.verification;

import com.flagship.agent_settlement.gateway.InventoryGateway;
import com.flagship.agent_settlement.gateway.LedgerGateway;
import com.flagship.agent_settlement.gateway.ObservedTransfer;
import com.flagship.agent_settlement.gateway.ReceivedItem;
import com.flagship.agent_settlement.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Matches an expected obligation against what the ledger or inventory has
 * actually observed.
 *
 * A match is only reported after its id is recorded in the
 * {@link AntiReplayLedger}, so a transfer can settle at most one
 * obligation. A transfer already recorded under the same purpose tag is
 * adopted again, which keeps retries after a partial failure idempotent.
 *
 * Verification is caller-driven polling: a {@code NOT_FOUND} result is
 * stable and may be retried until the obligation expires.
 */
@Service
@Slf4j
public class TransferVerifier {

    private final LedgerGateway ledgerGateway;
    private final InventoryGateway inventoryGateway;
    private final AntiReplayLedger antiReplayLedger;
    private final VerificationProperties properties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public TransferVerifier(LedgerGateway ledgerGateway,
                            InventoryGateway inventoryGateway,
                            AntiReplayLedger antiReplayLedger,
                            VerificationProperties properties,
                            SettlementMetrics metrics,
                            Clock clock) {
        this.ledgerGateway = ledgerGateway;
        this.inventoryGateway = inventoryGateway;
        this.antiReplayLedger = antiReplayLedger;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    public VerificationResult verifyCurrency(CurrencyExpectation expectation) {
        Instant oldestAllowed = clock.instant().minus(properties.maxPaymentAge());
        Instant since = expectation.earliestAcceptableTime().isAfter(oldestAllowed)
                ? expectation.earliestAcceptableTime()
                : oldestAllowed;
        BigDecimal minimum = expectation.amount().multiply(properties.toleranceRatio());
        String tag = normalizeMemo(expectation.correlationTag());

        List<ObservedTransfer> observed = ledgerGateway.queryTransfers(expectation.recipient(), since);

        List<VerifiedTransfer> candidates = new ArrayList<>();
        for (ObservedTransfer transfer : observed) {
            if (transfer.amount() == null || transfer.timestamp() == null) {
                continue;
            }
            if (transfer.amount().compareTo(minimum) < 0 || transfer.timestamp().isBefore(since)) {
                continue;
            }
            if (!tag.equals(normalizeMemo(transfer.memo()))) {
                continue;
            }
            candidates.add(new VerifiedTransfer(
                    transfer.id(), transfer.amount(), null, transfer.sender(), transfer.timestamp()));
        }

        log.debug("Currency verification for {}: {} observed, {} candidates",
                expectation.purposeTag(), observed.size(), candidates.size());

        VerificationResult result = resolve(candidates, expectation.purposeTag(), expectation.claimantId());
        metrics.recordVerification("currency", result);
        return result;
    }

    public VerificationResult verifyItemReceipt(ItemExpectation expectation) {
        List<ReceivedItem> received = inventoryGateway.listRecentlyReceivedItems(expectation.agentAccountId());

        List<VerifiedTransfer> candidates = new ArrayList<>();
        for (ReceivedItem item : received) {
            if (!expectation.itemRef().equals(item.itemRef())) {
                continue;
            }
            if (!expectation.senderId().equals(item.senderId())) {
                continue;
            }
            if (item.receivedAt() == null || !item.receivedAt().isAfter(expectation.receivedAfter())) {
                continue;
            }
            candidates.add(new VerifiedTransfer(
                    "item:" + item.itemId(), null, item.itemRef(), item.senderId(), item.receivedAt()));
        }

        VerificationResult result = resolve(candidates, expectation.purposeTag(), expectation.senderId());
        metrics.recordVerification("item", result);
        return result;
    }

    private VerificationResult resolve(List<VerifiedTransfer> candidates, String purposeTag, String claimantId) {
        if (candidates.isEmpty()) {
            return VerificationResult.failed(VerificationFailure.NOT_FOUND, "No matching transfer observed yet");
        }

        List<VerifiedTransfer> open = new ArrayList<>();
        int consumedElsewhere = 0;
        for (VerifiedTransfer candidate : candidates) {
            Optional<ConsumedTransfer> existing = antiReplayLedger.find(candidate.getTransferId());
            if (existing.isEmpty()) {
                open.add(candidate);
            } else if (purposeTag.equals(existing.get().getPurposeTag())) {
                log.info("Transfer {} already recorded for {}, adopting it again",
                        candidate.getTransferId(), purposeTag);
                return VerificationResult.verified(candidate);
            } else {
                consumedElsewhere++;
            }
        }

        if (open.isEmpty()) {
            return VerificationResult.failed(VerificationFailure.ALREADY_CONSUMED,
                    consumedElsewhere + " matching transfer(s) already used by other obligations");
        }
        if (open.size() > 1) {
            return VerificationResult.failed(VerificationFailure.AMBIGUOUS_MULTIPLE_MATCHES,
                    open.size() + " unused transfers match; refusing to guess");
        }

        VerifiedTransfer match = open.get(0);
        AntiReplayLedger.ConsumeResult consumed = antiReplayLedger.consume(
                match.getTransferId(), claimantId, match.getAmount(), purposeTag, clock.instant());

        if (consumed == AntiReplayLedger.ConsumeResult.CONSUMED_ELSEWHERE) {
            return VerificationResult.failed(VerificationFailure.ALREADY_CONSUMED,
                    "Transfer " + match.getTransferId() + " was consumed concurrently by another obligation");
        }
        return VerificationResult.verified(match);
    }

    /**
     * Memo comparison ignores case, surrounding whitespace and a leading {@code @}.
     */
    static String normalizeMemo(String memo) {
        if (memo == null) {
            return "";
        }
        String normalized = memo.trim().toLowerCase(Locale.ROOT);
        return normalized.startsWith("@") ? normalized.substring(1) : normalized;
    }
}
