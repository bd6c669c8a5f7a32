package com.flagship.agent_settlement.wager;

import com.flagship.agent_settlement.journal.JournalEntry;
import com.flagship.agent_settlement.journal.JournalEntryType;
import com.flagship.agent_settlement.settlement.SettlementInstruction;
import com.flagship.agent_settlement.settlement.SettlementSubject;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Payout of a winning wager to the wallet the stake came from.
 */
class WagerSettlementSubject implements SettlementSubject {

    private final Wager wager;
    private final WagerPersistenceService persistence;

    WagerSettlementSubject(Wager wager, WagerPersistenceService persistence) {
        this.wager = wager;
        this.persistence = persistence;
    }

    static String action(Wager wager) {
        return wager.getGame().name().toLowerCase(Locale.ROOT) + (wager.isWin() ? " win" : " loss");
    }

    @Override
    public String subjectType() {
        return WagerPersistenceService.SUBJECT_TYPE;
    }

    @Override
    public UUID subjectId() {
        return wager.getId();
    }

    @Override
    public String channel() {
        return wager.getChannel();
    }

    @Override
    public boolean claim(Instant now) {
        return persistence.claim(wager.getId(), now);
    }

    @Override
    public SettlementInstruction instruction() {
        return SettlementInstruction.currency(wager.getPayout(), wager.getPayerAddress(),
                "wager " + wager.getId() + " payout");
    }

    @Override
    public boolean markCompleted(String externalTransferId, Instant completedAt) {
        return persistence.complete(wager.getId(), externalTransferId, completedAt);
    }

    @Override
    public boolean markFailed(String failureNote, Instant at) {
        return persistence.failExecution(wager.getId(), failureNote, at);
    }

    @Override
    public JournalEntry journalEntry(SettlementInstruction instruction, String externalTransferId, Instant closedAt) {
        return JournalEntry.builder()
                .type(JournalEntryType.WAGER)
                .action(action(wager))
                .subjectType(subjectType())
                .subjectId(wager.getId())
                .assetFrom(instruction.describe())
                .assetTo(wager.getStake().stripTrailingZeros().toPlainString())
                .amountFrom(wager.getPayout())
                .amountTo(wager.getStake())
                .counterparty(wager.getRequesterId())
                .pnl(wager.getStake().subtract(wager.getPayout()))
                .externalTransferId(externalTransferId)
                .reasoning("Outcome " + wager.getOutcomeValue() + " pays "
                        + wager.getMultiplier().stripTrailingZeros().toPlainString() + "x")
                .closedAt(closedAt)
                .build();
    }
}
