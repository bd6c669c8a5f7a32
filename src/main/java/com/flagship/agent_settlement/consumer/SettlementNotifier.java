package com.flagship.agent_settlement.consumer;

import com.flagship.agent_settlement.event.ExchangeCancelledEvent;
import com.flagship.agent_settlement.event.JackpotAwardedEvent;
import com.flagship.agent_settlement.event.SettlementCompletedEvent;
import com.flagship.agent_settlement.event.SettlementFailedEvent;
import com.flagship.agent_settlement.gateway.MessagingGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Tells the counterparty about settlement events on their chat channel.
 *
 * Notifications are best effort: the settlement has already happened, so
 * a messaging failure is logged and the event still counts as handled.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class SettlementNotifier {

    private final MessagingGateway messagingGateway;

    public void onSettlementCompleted(SettlementCompletedEvent event) {
        send(event.getChannel(), String.format("%s %s settled: sent %s to %s (transfer %s).",
                event.getSubjectType(), event.getSubjectId(), event.getDelivered(),
                event.getDestination(), event.getExternalTransferId()));
    }

    public void onSettlementFailed(SettlementFailedEvent event) {
        send(event.getChannel(), String.format(
                "%s %s could not be settled automatically. An operator will follow up.",
                event.getSubjectType(), event.getSubjectId()));
    }

    /**
     * Only a counterparty who already accepted is told; an unanswered
     * proposal just disappears.
     */
    public void onExchangeCancelled(ExchangeCancelledEvent event) {
        if (!event.isWasAccepted()) {
            log.debug("Exchange {} cancelled before acceptance, no notification", event.getSubjectId());
            return;
        }
        send(event.getChannel(), String.format("Exchange %s was cancelled: %s. Do not send payment.",
                event.getSubjectId(), event.getReason()));
    }

    public void onJackpotAwarded(JackpotAwardedEvent event) {
        send(event.getChannel(), String.format("Jackpot! %s won %s (transfer %s).",
                event.getWinnerId(), event.getAmount().stripTrailingZeros().toPlainString(),
                event.getExternalTransferId()));
    }

    private void send(String channel, String text) {
        if (channel == null || channel.isBlank()) {
            log.debug("No channel for notification, dropping: {}", text);
            return;
        }
        try {
            messagingGateway.notify(channel, text);
        } catch (RuntimeException e) {
            log.warn("Notification to channel {} failed: {}", channel, e.getMessage());
        }
    }
}
