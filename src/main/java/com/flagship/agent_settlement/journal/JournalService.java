package com.flagship.agent_settlement.journal;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Append-only sink for closed settlements.
 *
 * Entries are written in the caller's transaction so the journal row and
 * the terminal status of its subject commit together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalService {

    private final JournalEntryRepository repository;
    private final Clock clock;

    /**
     * Appends an entry. Id and timestamps are assigned here; {@code closedAt}
     * defaults to now when the caller left it empty.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public JournalEntry append(JournalEntry draft) {
        Instant now = clock.instant();
        JournalEntry entry = JournalEntry.builder()
            .id(UUID.randomUUID())
            .type(draft.getType())
            .action(draft.getAction())
            .subjectType(draft.getSubjectType())
            .subjectId(draft.getSubjectId())
            .assetFrom(draft.getAssetFrom())
            .assetTo(draft.getAssetTo())
            .amountFrom(draft.getAmountFrom())
            .amountTo(draft.getAmountTo())
            .counterparty(draft.getCounterparty())
            .outcome(draft.getOutcome() != null ? draft.getOutcome() : JournalOutcome.fromPnl(draft.getPnl()))
            .pnl(draft.getPnl())
            .externalTransferId(draft.getExternalTransferId())
            .reasoning(draft.getReasoning())
            .createdAt(now)
            .closedAt(draft.getClosedAt() != null ? draft.getClosedAt() : now)
            .build();

        repository.save(JournalEntryEntity.fromDomain(entry));
        log.debug("Journal {} {} for {} {}: pnl={}",
                entry.getType(), entry.getAction(), entry.getSubjectType(), entry.getSubjectId(), entry.getPnl());
        return entry;
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> entriesFor(String subjectType, UUID subjectId) {
        return repository.findBySubjectTypeAndSubjectIdOrderByCreatedAtAsc(subjectType, subjectId)
            .stream()
            .map(JournalEntryEntity::toDomain)
            .toList();
    }
}
