package com.flagship.agent_settlement.jackpot;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * The shared jackpot pot, stored as one row ({@code jackpot_state.id = 1}).
 *
 * Credits are additive updates and never conflict. An award is a single
 * conditional update on the row version that also re-checks the floor and
 * the cooldown, so two concurrent awards cannot both win.
 */
@Component
@Slf4j
public class JackpotAccumulator {

    private static final RowMapper<JackpotState> ROW_MAPPER = (rs, rowNum) -> new JackpotState(
            rs.getBigDecimal("accumulated_amount"),
            rs.getString("last_winner_id"),
            toInstant(rs.getTimestamp("last_awarded_at")),
            rs.getBigDecimal("last_award_amount"),
            rs.getLong("version")
    );

    private final JdbcTemplate jdbcTemplate;
    private final JackpotProperties properties;

    public JackpotAccumulator(JdbcTemplate jdbcTemplate, JackpotProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    public void credit(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return;
        }
        int rows = jdbcTemplate.update(
            "UPDATE jackpot_state SET accumulated_amount = accumulated_amount + ? WHERE id = 1",
            amount
        );
        if (rows != 1) {
            throw new IllegalStateException("Jackpot row is missing");
        }
    }

    public JackpotState snapshot() {
        return jdbcTemplate.queryForObject(
            "SELECT accumulated_amount, last_winner_id, last_awarded_at, last_award_amount, version " +
            "FROM jackpot_state WHERE id = 1",
            ROW_MAPPER
        );
    }

    /**
     * Whether an award would currently pass the floor and cooldown checks.
     */
    public boolean isEligible(JackpotState state, Instant now) {
        if (state.accumulatedAmount().compareTo(properties.floor()) < 0) {
            return false;
        }
        return state.lastAwardedAt() == null
                || !state.lastAwardedAt().isAfter(now.minus(properties.cooldown()));
    }

    /**
     * Awards the whole pot seen in the snapshot to {@code winnerId}.
     *
     * @return the award, or empty when not eligible or another award won the race
     */
    public Optional<JackpotAward> tryAward(String winnerId, Instant now) {
        Objects.requireNonNull(winnerId, "winnerId");
        JackpotState state = snapshot();
        if (!isEligible(state, now)) {
            return Optional.empty();
        }

        BigDecimal amount = state.accumulatedAmount();
        // rollback matches on this value, so keep it at the column's precision
        Instant awardedAt = now.truncatedTo(ChronoUnit.MICROS);
        int rows = jdbcTemplate.update(
            "UPDATE jackpot_state SET " +
            "  accumulated_amount = accumulated_amount - ?, " +
            "  last_winner_id = ?, last_awarded_at = ?, last_award_amount = ?, " +
            "  version = version + 1 " +
            "WHERE id = 1 AND version = ? AND accumulated_amount >= ? " +
            "  AND (last_awarded_at IS NULL OR last_awarded_at <= ?)",
            amount,
            winnerId,
            Timestamp.from(awardedAt),
            amount,
            state.version(),
            properties.floor(),
            Timestamp.from(now.minus(properties.cooldown()))
        );
        if (rows != 1) {
            log.info("Jackpot award to {} lost a race at version {}", winnerId, state.version());
            return Optional.empty();
        }

        return Optional.of(new JackpotAward(UUID.randomUUID(), winnerId, amount, awardedAt,
                state.lastWinnerId(), state.lastAwardedAt(), state.lastAwardAmount()));
    }

    /**
     * Undoes an award whose payout failed: the amount goes back into the pot
     * and the previous winner fields are restored. Guarded by the winner and
     * time the award set, so it applies at most once.
     *
     * @return whether the rollback took effect
     */
    public boolean rollbackAward(JackpotAward award) {
        int rows = jdbcTemplate.update(
            "UPDATE jackpot_state SET " +
            "  accumulated_amount = accumulated_amount + ?, " +
            "  last_winner_id = ?, last_awarded_at = ?, last_award_amount = ?, " +
            "  version = version + 1 " +
            "WHERE id = 1 AND last_winner_id = ? AND last_awarded_at = ?",
            award.amount(),
            award.previousWinnerId(),
            award.previousAwardedAt() != null ? Timestamp.from(award.previousAwardedAt()) : null,
            award.previousAwardAmount(),
            award.winnerId(),
            Timestamp.from(award.awardedAt())
        );
        if (rows != 1) {
            log.error("Jackpot rollback for award {} to {} did not apply; pot needs manual correction",
                    award.awardId(), award.winnerId());
            return false;
        }
        return true;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
