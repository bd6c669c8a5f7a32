package com.flagship.agent_settlement.settlement;

import com.flagship.agent_settlement.journal.JournalEntry;

import java.time.Instant;
import java.util.UUID;

/**
 * Something the agent owes after a verified inbound transfer: the agent's
 * side of an exchange, or a wager payout.
 *
 * Every state change is a single conditional update against the subject's
 * own row. The boolean results report whether this caller's update took
 * effect (exactly one row affected).
 */
public interface SettlementSubject {

    String subjectType();

    UUID subjectId();

    /** Chat channel for counterparty notifications. */
    String channel();

    /**
     * Sets the claim marker on a verified, unclaimed row.
     *
     * @return false when another caller already claimed it
     */
    boolean claim(Instant now);

    /**
     * Describes the outbound transfer. May throw {@link IllegalArgumentException}
     * when the row lacks what the transfer needs (for example a payer address);
     * the executor treats that as a failed transfer.
     */
    SettlementInstruction instruction();

    /**
     * Moves a claimed row to its completed state with the transfer receipt.
     */
    boolean markCompleted(String externalTransferId, Instant completedAt);

    /**
     * Moves a claimed row to its failed state, clears the claim marker and
     * stores an operator-facing note.
     */
    boolean markFailed(String failureNote, Instant at);

    /**
     * Journal entry describing the closed settlement.
     */
    JournalEntry journalEntry(SettlementInstruction instruction, String externalTransferId, Instant closedAt);
}
