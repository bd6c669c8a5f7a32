package com.flagship.agent_settlement.jackpot;

import com.flagship.agent_settlement.event.JackpotAwardedEvent;
import com.flagship.agent_settlement.journal.JournalEntry;
import com.flagship.agent_settlement.journal.JournalEntryType;
import com.flagship.agent_settlement.journal.JournalService;
import com.flagship.agent_settlement.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Journal row and outbox event for a paid award, in one transaction.
 */
@Component
@RequiredArgsConstructor
class JackpotAwardRecorder {

    static final String SUBJECT_TYPE = "Jackpot";

    private final JournalService journalService;
    private final OutboxService outboxService;

    @Transactional
    public void recordPayout(JackpotAward award, String channel, String externalTransferId, Instant paidAt) {
        journalService.append(JournalEntry.builder()
                .type(JournalEntryType.JACKPOT)
                .action("award")
                .subjectType(SUBJECT_TYPE)
                .subjectId(award.awardId())
                .assetFrom(award.amount().stripTrailingZeros().toPlainString())
                .amountFrom(award.amount())
                .counterparty(award.winnerId())
                .pnl(award.amount().negate())
                .externalTransferId(externalTransferId)
                .reasoning("Jackpot pot paid out")
                .closedAt(paidAt)
                .build());

        outboxService.saveEvent(SUBJECT_TYPE, new JackpotAwardedEvent(
                UUID.randomUUID(),
                award.awardId(),
                channel,
                award.winnerId(),
                award.amount(),
                externalTransferId,
                paidAt
        ));
    }
}
