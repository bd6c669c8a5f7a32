package com.flagship.agent_settlement.settlement;

import com.flagship.agent_settlement.common.Outcome;
import com.flagship.agent_settlement.common.OutcomeCode;
import com.flagship.agent_settlement.observability.SettlementMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Executes the agent's side of a verified settlement exactly once.
 *
 * <ol>
 *   <li>Claim: a conditional update that commits before anything leaves
 *       the process. Losing the claim is a benign no-op.</li>
 *   <li>Transfer: currency or item, through {@link AssetMover}.</li>
 *   <li>Success: completed state, journal row and event in one local
 *       transaction.</li>
 *   <li>Failure: failed state with the claim cleared and a note for the
 *       operator. Never retried automatically.</li>
 * </ol>
 *
 * Not transactional itself; the external call must not sit inside a
 * database transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SettlementExecutor {

    private final AssetMover assetMover;
    private final SettlementRecorder recorder;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public Outcome<SettlementReceipt> execute(SettlementSubject subject) {
        long startTime = System.currentTimeMillis();
        String type = subject.subjectType();

        if (!subject.claim(clock.instant())) {
            log.info("{} {} already claimed for execution, skipping", type, subject.subjectId());
            metrics.recordSettlement(type, OutcomeCode.ALREADY_CLAIMED);
            return Outcome.failure(OutcomeCode.ALREADY_CLAIMED,
                    type + " " + subject.subjectId() + " is already claimed or not verified");
        }

        SettlementInstruction instruction;
        String externalTransferId;
        try {
            instruction = subject.instruction();
            externalTransferId = assetMover.move(instruction);
        } catch (RuntimeException e) {
            String note = "Transfer failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            log.error("{} {} settlement failed, marking failed for manual follow-up: {}",
                    type, subject.subjectId(), note, e);
            recorder.recordFailure(subject, note, clock.instant());
            metrics.recordSettlement(type, OutcomeCode.EXTERNAL_TRANSFER_FAILURE);
            metrics.recordSettlementLatency(type, System.currentTimeMillis() - startTime);
            return Outcome.failure(OutcomeCode.EXTERNAL_TRANSFER_FAILURE, note);
        }

        Instant completedAt = clock.instant();
        try {
            recorder.recordCompletion(subject, instruction, externalTransferId, completedAt);
        } catch (RuntimeException e) {
            // The transfer went out; the claim stays set so nothing re-sends it.
            log.error("{} {} transfer {} succeeded but recording it failed; left claimed for reconciliation",
                    type, subject.subjectId(), externalTransferId, e);
            throw e;
        }

        long duration = System.currentTimeMillis() - startTime;
        metrics.recordSettlement(type, OutcomeCode.OK);
        metrics.recordSettlementLatency(type, duration);
        log.info("{} {} settled: sent {} to {}, transferId={}, duration={}ms",
                type, subject.subjectId(), instruction.describe(), instruction.getDestination(),
                externalTransferId, duration);

        return Outcome.ok(new SettlementReceipt(
                subject.subjectId(), type, externalTransferId, instruction, completedAt));
    }
}
