package com.flagship.agent_settlement.exchange;

import com.flagship.agent_settlement.journal.JournalEntry;
import com.flagship.agent_settlement.journal.JournalEntryType;
import com.flagship.agent_settlement.policy.AssetValue;
import com.flagship.agent_settlement.settlement.SettlementInstruction;
import com.flagship.agent_settlement.settlement.SettlementSubject;

import java.time.Instant;
import java.util.UUID;

/**
 * The agent's side of one verified exchange, as seen by the executor.
 */
class ExchangeSettlementSubject implements SettlementSubject {

    private final ExchangeRecord record;
    private final ExchangePersistenceService persistence;

    ExchangeSettlementSubject(ExchangeRecord record, ExchangePersistenceService persistence) {
        this.record = record;
        this.persistence = persistence;
    }

    @Override
    public String subjectType() {
        return ExchangePersistenceService.SUBJECT_TYPE;
    }

    @Override
    public UUID subjectId() {
        return record.getId();
    }

    @Override
    public String channel() {
        return record.getInitiatorChannel();
    }

    @Override
    public boolean claim(Instant now) {
        return persistence.claim(record.getId(), now);
    }

    /**
     * Currency goes to the wallet the counterparty paid from when the agent
     * was paid in currency, otherwise to the address given with the
     * proposal. Items go to the counterparty's account.
     */
    @Override
    public SettlementInstruction instruction() {
        AssetValue owed = record.getOffered();
        if (owed.isItem()) {
            return SettlementInstruction.item(owed.getItemRef(), record.getCounterpartyId());
        }
        String destination = record.getRequested().isCurrency() && record.getPayerAddress() != null
                ? record.getPayerAddress()
                : record.getCounterpartyAddress();
        return SettlementInstruction.currency(owed.getQuantity(), destination, "exchange " + record.getId());
    }

    @Override
    public boolean markCompleted(String externalTransferId, Instant completedAt) {
        return persistence.complete(record.getId(), externalTransferId, completedAt);
    }

    @Override
    public boolean markFailed(String failureNote, Instant at) {
        return persistence.failExecution(record.getId(), failureNote, at);
    }

    @Override
    public JournalEntry journalEntry(SettlementInstruction instruction, String externalTransferId, Instant closedAt) {
        return JournalEntry.builder()
                .type(JournalEntryType.TRADE)
                .action(action(record.getOffered(), record.getRequested()))
                .subjectType(subjectType())
                .subjectId(record.getId())
                .assetFrom(record.getOffered().describe())
                .assetTo(record.getRequested().describe())
                .amountFrom(record.getOffered().referenceValue())
                .amountTo(record.getRequested().referenceValue())
                .counterparty(record.getCounterpartyId())
                .pnl(record.getComplianceResult().getProfit())
                .externalTransferId(externalTransferId)
                .reasoning(record.getComplianceResult().getRule())
                .closedAt(closedAt)
                .build();
    }

    private static String action(AssetValue given, AssetValue received) {
        if (given.isCurrency() && received.isItem()) {
            return "BUY";
        }
        if (given.isItem() && received.isCurrency()) {
            return "SELL";
        }
        return given.isItem() ? "SWAP" : "CONVERT";
    }
}
