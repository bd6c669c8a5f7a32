package com.flagship.agent_settlement.verification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Append-only set of consumed external transfer ids.
 *
 * The primary key on {@code consumed_transfers.transfer_id} is the only
 * thing that decides whether a transfer was already used. {@link #consume}
 * inserts with {@code ON CONFLICT DO NOTHING} and reads the affected-row
 * count, so a losing concurrent insert never aborts a surrounding
 * transaction.
 *
 * Plain JDBC, like the rest of the compare-and-swap stores: the statement
 * itself is the invariant.
 */
@Service
@Slf4j
public class AntiReplayLedger {

    private static final RowMapper<ConsumedTransfer> ROW_MAPPER = (rs, rowNum) -> new ConsumedTransfer(
            rs.getString("transfer_id"),
            rs.getString("claimant_id"),
            rs.getBigDecimal("amount"),
            rs.getString("purpose_tag"),
            rs.getTimestamp("used_at").toInstant()
    );

    private final JdbcTemplate jdbcTemplate;

    public AntiReplayLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public enum ConsumeResult {
        /** This call recorded the transfer. */
        INSERTED,
        /** Already recorded for the same purpose by an earlier attempt. */
        ALREADY_OURS,
        /** Already recorded for a different purpose. */
        CONSUMED_ELSEWHERE
    }

    /**
     * Records a transfer as consumed by {@code purposeTag}.
     */
    public ConsumeResult consume(String transferId, String claimantId, BigDecimal amount,
                                 String purposeTag, Instant usedAt) {
        Objects.requireNonNull(transferId, "transferId");
        Objects.requireNonNull(purposeTag, "purposeTag");

        int inserted = jdbcTemplate.update(
            "INSERT INTO consumed_transfers (transfer_id, claimant_id, amount, purpose_tag, used_at) " +
            "VALUES (?, ?, ?, ?, ?) ON CONFLICT (transfer_id) DO NOTHING",
            transferId,
            claimantId,
            amount,
            purposeTag,
            Timestamp.from(usedAt)
        );

        if (inserted == 1) {
            log.debug("Consumed transfer {} for {}", transferId, purposeTag);
            return ConsumeResult.INSERTED;
        }

        ConsumedTransfer existing = find(transferId)
            .orElseThrow(() -> new IllegalStateException(
                "Transfer " + transferId + " conflicted on insert but is not recorded"));

        if (purposeTag.equals(existing.getPurposeTag())) {
            return ConsumeResult.ALREADY_OURS;
        }
        log.warn("Replay detected: transfer {} already consumed by {}, rejected for {}",
                transferId, existing.getPurposeTag(), purposeTag);
        return ConsumeResult.CONSUMED_ELSEWHERE;
    }

    public Optional<ConsumedTransfer> find(String transferId) {
        List<ConsumedTransfer> rows = jdbcTemplate.query(
            "SELECT transfer_id, claimant_id, amount, purpose_tag, used_at FROM consumed_transfers WHERE transfer_id = ?",
            ROW_MAPPER,
            transferId
        );
        return rows.stream().findFirst();
    }

    public boolean isConsumed(String transferId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM consumed_transfers WHERE transfer_id = ?",
            Integer.class,
            transferId
        );
        return count != null && count > 0;
    }
}
