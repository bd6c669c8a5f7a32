package com.flagship.agent_settlement.observability;

import com.flagship.agent_settlement.exchange.ExchangePersistenceService;
import com.flagship.agent_settlement.exchange.ExchangeStatus;
import com.flagship.agent_settlement.jackpot.JackpotAccumulator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the gauges that need a database read, off the scrape path.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SettlementMetrics settlementMetrics;
    private final ExchangePersistenceService exchangePersistence;
    private final JackpotAccumulator jackpotAccumulator;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            settlementMetrics.refreshGauges(
                    exchangePersistence.countByStatus(ExchangeStatus.FAILED),
                    jackpotAccumulator.snapshot().accumulatedAmount());
        } catch (Exception e) {
            log.warn("Failed to refresh settlement gauges: {}", e.getMessage());
        }
    }
}
