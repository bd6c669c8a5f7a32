package com.flagship.agent_settlement.jackpot;

import com.flagship.agent_settlement.common.Outcome;
import com.flagship.agent_settlement.common.OutcomeCode;
import com.flagship.agent_settlement.observability.SettlementMetrics;
import com.flagship.agent_settlement.settlement.AssetMover;
import com.flagship.agent_settlement.settlement.SettlementInstruction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Awards the jackpot and pays it out.
 *
 * The conditional award is the claim: it commits before the payout leaves
 * the process. A failed payout is compensated by rolling the award back,
 * which returns the pot and the previous winner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JackpotService {

    private final JackpotAccumulator accumulator;
    private final AssetMover assetMover;
    private final JackpotAwardRecorder recorder;
    private final JackpotProperties properties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public JackpotState state() {
        return accumulator.snapshot();
    }

    public boolean isEligible() {
        return accumulator.isEligible(accumulator.snapshot(), clock.instant());
    }

    public Outcome<JackpotPayout> award(String winnerId, String winnerAddress, String channel) {
        if (winnerAddress == null || winnerAddress.isBlank()) {
            return Outcome.failure(OutcomeCode.REJECTED, "Winner address is required");
        }

        Instant now = clock.instant();
        Optional<JackpotAward> won = accumulator.tryAward(winnerId, now);
        if (won.isEmpty()) {
            metrics.recordJackpotAward("not_eligible");
            return Outcome.failure(OutcomeCode.REJECTED, notEligibleReason(now));
        }
        JackpotAward award = won.get();

        String transferId;
        try {
            transferId = assetMover.move(SettlementInstruction.currency(
                    award.amount(), winnerAddress, "jackpot " + award.awardId()));
        } catch (RuntimeException e) {
            boolean restored = accumulator.rollbackAward(award);
            metrics.recordJackpotAward("payout_failed");
            log.error("Jackpot payout of {} to {} failed, award rolled back={}",
                    award.amount(), winnerId, restored, e);
            return Outcome.failure(OutcomeCode.EXTERNAL_TRANSFER_FAILURE,
                    "Jackpot payout failed: " + e.getMessage());
        }

        Instant paidAt = clock.instant();
        recorder.recordPayout(award, channel, transferId, paidAt);
        metrics.recordJackpotAward("awarded");
        log.info("Jackpot of {} awarded to {}: transferId={}", award.amount(), winnerId, transferId);
        return Outcome.ok(new JackpotPayout(award.awardId(), winnerId, award.amount(), transferId, paidAt));
    }

    private String notEligibleReason(Instant now) {
        JackpotState state = accumulator.snapshot();
        BigDecimal floor = properties.floor();
        if (state.accumulatedAmount().compareTo(floor) < 0) {
            return "Jackpot " + state.accumulatedAmount().toPlainString()
                    + " is below the award floor " + floor.toPlainString();
        }
        if (state.lastAwardedAt() != null && state.lastAwardedAt().isAfter(now.minus(properties.cooldown()))) {
            return "Jackpot was awarded at " + state.lastAwardedAt() + "; next award after "
                    + state.lastAwardedAt().plus(properties.cooldown());
        }
        return "Jackpot was awarded concurrently";
    }
}
