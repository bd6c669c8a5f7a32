package com.flagship.agent_settlement.wager;

import com.flagship.agent_settlement.jackpot.JackpotAccumulator;
import com.flagship.agent_settlement.journal.JournalEntry;
import com.flagship.agent_settlement.journal.JournalEntryType;
import com.flagship.agent_settlement.journal.JournalService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link Wager} and its table. Transition methods return
 * {@code true} only when this caller's conditional update took effect.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WagerPersistenceService {

    static final String SUBJECT_TYPE = "Wager";

    private final WagerRepository repository;
    private final JackpotAccumulator jackpotAccumulator;
    private final JournalService journalService;

    @Transactional
    public Wager create(Wager wager) {
        return repository.save(WagerEntity.fromDomain(wager)).toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Wager> findById(UUID id) {
        return repository.findById(id).map(WagerEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Wager> findByRequester(String requesterId) {
        return repository.findByRequesterIdOrderByCreatedAtDesc(requesterId).stream()
                .map(WagerEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Wager> findWithOutcome() {
        return repository.findByOutcomeValueIsNotNull().stream()
                .map(WagerEntity::toDomain)
                .toList();
    }

    public boolean expire(UUID id, Instant now) {
        return repository.expire(id, WagerStatus.PENDING_PAYMENT, WagerStatus.EXPIRED, now) == 1;
    }

    public boolean markVerified(UUID id, String transferId, String payerAddress, Instant now) {
        return repository.markVerified(id, WagerStatus.PENDING_PAYMENT, WagerStatus.VERIFIED,
                transferId, payerAddress, now) == 1;
    }

    /**
     * Fixes the outcome and, for the caller that wins, credits the house
     * edge to the jackpot in the same transaction.
     */
    @Transactional
    public boolean recordOutcome(UUID id, int outcome, BigDecimal multiplier, BigDecimal payout,
                                 BigDecimal contribution, Instant now) {
        int rows = repository.recordOutcome(id, WagerStatus.VERIFIED, outcome, multiplier, payout, contribution, now);
        if (rows != 1) {
            return false;
        }
        jackpotAccumulator.credit(contribution);
        return true;
    }

    /**
     * Closes a losing wager and journals the stake as the agent's gain.
     */
    @Transactional
    public boolean settleLoss(Wager wager, Instant now) {
        if (repository.settleLoss(wager.getId(), WagerStatus.VERIFIED, WagerStatus.SETTLED, now) != 1) {
            return false;
        }
        journalService.append(JournalEntry.builder()
                .type(JournalEntryType.WAGER)
                .action(WagerSettlementSubject.action(wager))
                .subjectType(SUBJECT_TYPE)
                .subjectId(wager.getId())
                .assetFrom("0")
                .assetTo(wager.getStake().stripTrailingZeros().toPlainString())
                .amountFrom(BigDecimal.ZERO)
                .amountTo(wager.getStake())
                .counterparty(wager.getRequesterId())
                .pnl(wager.getStake())
                .externalTransferId(wager.getMatchedTransferId())
                .reasoning("Outcome " + wager.getOutcomeValue() + " pays nothing")
                .closedAt(now)
                .build());
        return true;
    }

    public boolean claim(UUID id, Instant now) {
        return repository.claim(id, WagerStatus.VERIFIED, now) == 1;
    }

    public boolean complete(UUID id, String externalTransferId, Instant now) {
        return repository.complete(id, WagerStatus.VERIFIED, WagerStatus.SETTLED, externalTransferId, now) == 1;
    }

    public boolean failExecution(UUID id, String note, Instant now) {
        return repository.failExecution(id, WagerStatus.VERIFIED, WagerStatus.FAILED, note, now) == 1;
    }
}
