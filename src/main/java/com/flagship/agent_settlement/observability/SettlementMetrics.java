package com.flagship.agent_settlement.observability;

import com.flagship.agent_settlement.common.OutcomeCode;
import com.flagship.agent_settlement.verification.VerificationFailure;
import com.flagship.agent_settlement.verification.VerificationResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counters and timers for the settlement core.
 *
 * <ul>
 *   <li>{@code exchange.proposals} by result</li>
 *   <li>{@code exchange.transitions} by operation and outcome</li>
 *   <li>{@code verification.attempts} by flavor and result</li>
 *   <li>{@code settlement.executions} and {@code settlement.duration} by subject type</li>
 *   <li>{@code wager.placements}, {@code wager.settlements} by game</li>
 *   <li>{@code jackpot.awards} by result</li>
 *   <li>gauges {@code exchange.failed.pending} and {@code jackpot.accumulated}, refreshed by
 *       {@link MetricsScheduler}</li>
 * </ul>
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;
    private final Counter replayRejections;
    private final AtomicLong failedExchanges = new AtomicLong();
    private final AtomicReference<BigDecimal> jackpotAccumulated = new AtomicReference<>(BigDecimal.ZERO);

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("exchange.failed.pending", failedExchanges, AtomicLong::get)
                .description("Failed exchanges waiting for operator reconciliation")
                .register(registry);
        Gauge.builder("jackpot.accumulated", jackpotAccumulated, ref -> ref.get().doubleValue())
                .description("Current jackpot pot")
                .register(registry);
        this.replayRejections = Counter.builder("verification.replay_rejections")
                .description("Matching transfers rejected because another obligation already consumed them")
                .register(registry);
    }

    public void refreshGauges(long failedExchangeCount, BigDecimal jackpotAmount) {
        failedExchanges.set(failedExchangeCount);
        jackpotAccumulated.set(jackpotAmount != null ? jackpotAmount : BigDecimal.ZERO);
    }

    public void recordProposal(String result) {
        registry.counter("exchange.proposals", "result", sanitizeTag(result)).increment();
    }

    public void recordTransition(String operation, OutcomeCode code) {
        registry.counter("exchange.transitions",
                "operation", sanitizeTag(operation),
                "outcome", code.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    public void recordVerification(String flavor, VerificationResult result) {
        String tag = result.isVerified() ? "verified" : result.getFailure().name().toLowerCase(Locale.ROOT);
        registry.counter("verification.attempts",
                "flavor", sanitizeTag(flavor),
                "result", tag
        ).increment();
        if (!result.isVerified() && result.getFailure() == VerificationFailure.ALREADY_CONSUMED) {
            replayRejections.increment();
        }
    }

    public void recordSettlement(String subjectType, OutcomeCode code) {
        registry.counter("settlement.executions",
                "subject_type", sanitizeTag(subjectType),
                "outcome", code.name().toLowerCase(Locale.ROOT)
        ).increment();
    }

    public void recordSettlementLatency(String subjectType, long durationMs) {
        Timer.builder("settlement.duration")
                .description("Claim to terminal state, including the external transfer")
                .tag("subject_type", sanitizeTag(subjectType))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(Duration.ofMillis(durationMs));
    }

    public void recordWagerPlacement(String game, String result) {
        registry.counter("wager.placements",
                "game", sanitizeTag(game),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordWagerSettled(String game, String result) {
        registry.counter("wager.settlements",
                "game", sanitizeTag(game),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordJackpotAward(String result) {
        registry.counter("jackpot.awards", "result", sanitizeTag(result)).increment();
    }

    /**
     * Keeps tag cardinality bounded.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
