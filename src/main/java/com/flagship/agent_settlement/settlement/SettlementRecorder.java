package com.flagship.agent_settlement.settlement;

import com.flagship.agent_settlement.event.SettlementCompletedEvent;
import com.flagship.agent_settlement.event.SettlementFailedEvent;
import com.flagship.agent_settlement.journal.JournalService;
import com.flagship.agent_settlement.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Local bookkeeping after the external transfer has been attempted.
 *
 * Each method is one transaction: the subject's terminal update, the
 * journal row and the outbox event commit together or not at all.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementRecorder {

    private final JournalService journalService;
    private final OutboxService outboxService;

    @Transactional
    public void recordCompletion(SettlementSubject subject, SettlementInstruction instruction,
                                 String externalTransferId, Instant completedAt) {
        if (!subject.markCompleted(externalTransferId, completedAt)) {
            throw new IllegalStateException(String.format(
                    "%s %s is no longer claimed; transfer %s needs manual reconciliation",
                    subject.subjectType(), subject.subjectId(), externalTransferId));
        }

        journalService.append(subject.journalEntry(instruction, externalTransferId, completedAt));

        outboxService.saveEvent(subject.subjectType(), new SettlementCompletedEvent(
                UUID.randomUUID(),
                subject.subjectId(),
                subject.subjectType(),
                subject.channel(),
                instruction.describe(),
                instruction.getDestination(),
                externalTransferId,
                completedAt
        ));
    }

    @Transactional
    public void recordFailure(SettlementSubject subject, String failureNote, Instant failedAt) {
        if (!subject.markFailed(failureNote, failedAt)) {
            log.warn("{} {} was not in a claimed state when recording failure: {}",
                    subject.subjectType(), subject.subjectId(), failureNote);
            return;
        }

        outboxService.saveEvent(subject.subjectType(), new SettlementFailedEvent(
                UUID.randomUUID(),
                subject.subjectId(),
                subject.subjectType(),
                subject.channel(),
                failureNote,
                failedAt
        ));
    }
}
