package com.flagship.agent_settlement.journal;

public enum JournalEntryType {
    TRADE,
    WAGER,
    JACKPOT
}
