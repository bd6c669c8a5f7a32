package com.flagship.agent_settlement.wager;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Minimum gap between two wagers of the same requester.
 *
 * Check and mark are one conditional upsert: the row is inserted, or
 * moved forward only when the previous wager is older than the cooldown.
 * Two concurrent attempts cannot both pass.
 */
@Component
@Slf4j
public class CooldownGuard {

    private final JdbcTemplate jdbcTemplate;
    private final WagerProperties properties;

    public CooldownGuard(JdbcTemplate jdbcTemplate, WagerProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    public GuardDecision tryEnter(String requesterId, Instant now) {
        Instant cutoff = now.minus(properties.cooldown());
        int rows = jdbcTemplate.update(
            "INSERT INTO wager_cooldowns (requester_id, last_wager_at) VALUES (?, ?) " +
            "ON CONFLICT (requester_id) DO UPDATE SET last_wager_at = EXCLUDED.last_wager_at " +
            "WHERE wager_cooldowns.last_wager_at <= ?",
            requesterId,
            Timestamp.from(now),
            Timestamp.from(cutoff)
        );
        if (rows == 1) {
            return GuardDecision.allow();
        }

        long remaining = remainingSeconds(requesterId, now);
        log.debug("Requester {} is cooling down for {}s", requesterId, remaining);
        return GuardDecision.deny("Cooldown active, wait " + remaining + "s before the next wager");
    }

    private long remainingSeconds(String requesterId, Instant now) {
        List<Timestamp> last = jdbcTemplate.queryForList(
            "SELECT last_wager_at FROM wager_cooldowns WHERE requester_id = ?",
            Timestamp.class,
            requesterId
        );
        if (last.isEmpty()) {
            return properties.cooldown().toSeconds();
        }
        Duration left = Duration.between(now, last.get(0).toInstant().plus(properties.cooldown()));
        return Math.max(1, (long) Math.ceil(left.toMillis() / 1000.0));
    }
}
