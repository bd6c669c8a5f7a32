package com.flagship.agent_settlement.wager;

import com.flagship.agent_settlement.common.Outcome;
import com.flagship.agent_settlement.common.OutcomeCode;
import com.flagship.agent_settlement.observability.CorrelationContext;
import com.flagship.agent_settlement.observability.SettlementMetrics;
import com.flagship.agent_settlement.settlement.SettlementExecutor;
import com.flagship.agent_settlement.settlement.SettlementReceipt;
import com.flagship.agent_settlement.verification.CurrencyExpectation;
import com.flagship.agent_settlement.verification.TransferVerifier;
import com.flagship.agent_settlement.verification.VerificationProperties;
import com.flagship.agent_settlement.verification.VerificationResult;
import com.flagship.agent_settlement.verification.VerifiedTransfer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Wager flow in two caller-driven steps.
 *
 * <ol>
 *   <li>{@link #placeWager}: rate limit, bankroll and cooldown guards, then
 *       a {@code PENDING_PAYMENT} wager waiting for the stake.</li>
 *   <li>{@link #settleWager}: verify the stake, draw once, fix the outcome,
 *       then close a loss locally or pay a win through the
 *       {@link SettlementExecutor}.</li>
 * </ol>
 *
 * {@code settleWager} can be called repeatedly; each step is a conditional
 * update, so a retry resumes where the previous call stopped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WagerService {

    private static final BigDecimal HUNDRED = new BigDecimal("100");
    static final int MAX_LEADERBOARD_SIZE = 50;

    private final WagerPersistenceService persistence;
    private final WagerRateLimiter rateLimiter;
    private final BankrollGuard bankrollGuard;
    private final CooldownGuard cooldownGuard;
    private final OutcomeSource outcomeSource;
    private final TransferVerifier transferVerifier;
    private final SettlementExecutor settlementExecutor;
    private final WagerProperties properties;
    private final VerificationProperties verificationProperties;
    private final SettlementMetrics metrics;
    private final Clock clock;

    public Outcome<Wager> placeWager(PlaceWagerCommand command) {
        String game = command.game() != null ? command.game().name() : "unknown";
        if (command.game() == null || command.stake() == null || command.stake().signum() <= 0) {
            metrics.recordWagerPlacement(game, "invalid");
            return Outcome.failure(OutcomeCode.REJECTED, "A game and a positive stake are required");
        }
        if (command.memoTag() == null || command.memoTag().isBlank()) {
            metrics.recordWagerPlacement(game, "invalid");
            return Outcome.failure(OutcomeCode.REJECTED, "A memo tag is required to match the stake payment");
        }

        Instant now = clock.instant();

        GuardDecision decision = rateLimiter.tryAcquire(command.requesterId(), now);
        if (decision.allowed()) {
            decision = bankrollGuard.check(command.game(), command.stake());
        }
        if (decision.allowed()) {
            decision = cooldownGuard.tryEnter(command.requesterId(), now);
        }
        if (!decision.allowed()) {
            metrics.recordWagerPlacement(game, "rejected");
            log.info("Wager by {} rejected: {}", command.requesterId(), decision.reason());
            return Outcome.failure(OutcomeCode.REJECTED, decision.reason());
        }

        Wager wager = persistence.create(Wager.builder()
                .id(UUID.randomUUID())
                .requesterId(command.requesterId())
                .memoTag(command.memoTag().trim())
                .channel(command.channel())
                .game(command.game())
                .stake(command.stake())
                .status(WagerStatus.PENDING_PAYMENT)
                .createdAt(now)
                .expiresAt(now.plus(properties.paymentWindow()))
                .updatedAt(now)
                .build());

        metrics.recordWagerPlacement(game, "placed");
        log.info("Wager {} placed: {} on {} by {}, awaiting payment until {}",
                wager.getId(), wager.getStake(), wager.getGame(), wager.getRequesterId(), wager.getExpiresAt());
        return Outcome.ok(wager);
    }

    public Outcome<Wager> settleWager(UUID id) {
        MDC.put(CorrelationContext.WAGER_ID_MDC_KEY, id.toString());
        try {
            Optional<Wager> found = persistence.findById(id);
            if (found.isEmpty()) {
                return Outcome.failure(OutcomeCode.NOT_FOUND, "Wager not found: " + id);
            }
            Wager wager = found.get();

            if (wager.getStatus() == WagerStatus.PENDING_PAYMENT) {
                Outcome<Wager> verified = verifyStake(wager);
                if (!verified.isOk()) {
                    metrics.recordWagerSettled(wager.getGame().name(), verified.getCode().name());
                    return verified;
                }
                wager = verified.getValue();
            }

            Outcome<Wager> outcome = switch (wager.getStatus()) {
                case VERIFIED -> resolve(wager);
                case SETTLED -> Outcome.failure(OutcomeCode.ALREADY_CLAIMED, "Wager " + id + " is already settled");
                case EXPIRED -> Outcome.failure(OutcomeCode.EXPIRED, "Wager " + id + " expired unpaid");
                case FAILED -> Outcome.failure(OutcomeCode.INVALID_STATE,
                        "Wager " + id + " payout failed and needs manual reconciliation");
                case PENDING_PAYMENT -> Outcome.failure(OutcomeCode.CONFLICT, "Wager " + id + " is still pending");
            };
            metrics.recordWagerSettled(wager.getGame().name(), outcome.isOk() ? resultTag(outcome.getValue())
                    : outcome.getCode().name());
            return outcome;
        } finally {
            MDC.remove(CorrelationContext.WAGER_ID_MDC_KEY);
        }
    }

    public Optional<Wager> get(UUID id) {
        return persistence.findById(id);
    }

    public WagerStats stats(String requesterId) {
        return aggregate(requesterId, persistence.findByRequester(requesterId).stream()
                .filter(Wager::hasOutcome)
                .toList());
    }

    /**
     * Ranks requesters over their wagers with an outcome. Ties keep
     * requester id order.
     *
     * @throws IllegalArgumentException when {@code limit} is outside 1..{@value #MAX_LEADERBOARD_SIZE}
     */
    public List<WagerStats> leaderboard(LeaderboardType type, int limit) {
        if (limit < 1 || limit > MAX_LEADERBOARD_SIZE) {
            throw new IllegalArgumentException("Leaderboard limit must be in 1.." + MAX_LEADERBOARD_SIZE);
        }
        Map<String, List<Wager>> byRequester = persistence.findWithOutcome().stream()
                .collect(Collectors.groupingBy(Wager::getRequesterId, TreeMap::new, Collectors.toList()));

        return byRequester.entrySet().stream()
                .map(entry -> aggregate(entry.getKey(), entry.getValue()))
                .sorted(type.ordering())
                .limit(limit)
                .toList();
    }

    private static WagerStats aggregate(String requesterId, List<Wager> wagers) {
        BigDecimal staked = BigDecimal.ZERO;
        BigDecimal paidOut = BigDecimal.ZERO;
        long wins = 0;
        for (Wager wager : wagers) {
            staked = staked.add(wager.getStake());
            if (wager.isWin()) {
                wins++;
                if (wager.getStatus() == WagerStatus.SETTLED) {
                    paidOut = paidOut.add(wager.getPayout());
                }
            }
        }
        return new WagerStats(requesterId, wagers.size(), staked, wins, wagers.size() - wins, paidOut);
    }

    private Outcome<Wager> verifyStake(Wager wager) {
        Instant now = clock.instant();
        if (wager.isExpiredAt(now)) {
            persistence.expire(wager.getId(), now);
            return Outcome.failure(OutcomeCode.EXPIRED, "Wager " + wager.getId() + " expired at " + wager.getExpiresAt());
        }

        VerificationResult result = transferVerifier.verifyCurrency(new CurrencyExpectation(
                verificationProperties.agentAddress(),
                wager.getStake(),
                wager.getCreatedAt().minus(properties.paymentWindow()),
                wager.getMemoTag(),
                wager.purposeTag(),
                wager.getRequesterId()));

        if (!result.isVerified()) {
            return switch (result.getFailure()) {
                case NOT_FOUND -> Outcome.failure(OutcomeCode.NOT_YET_VERIFIED, result.getDetail());
                case ALREADY_CONSUMED -> Outcome.failure(OutcomeCode.ALREADY_CONSUMED, result.getDetail());
                case AMBIGUOUS_MULTIPLE_MATCHES ->
                        Outcome.failure(OutcomeCode.AMBIGUOUS_MULTIPLE_MATCHES, result.getDetail());
            };
        }

        VerifiedTransfer transfer = result.getTransfer();
        Instant verifiedAt = clock.instant();
        if (!persistence.markVerified(wager.getId(), transfer.getTransferId(), transfer.getSenderAddress(), verifiedAt)) {
            Wager current = reload(wager.getId());
            if (current.getStatus() == WagerStatus.PENDING_PAYMENT && current.isExpiredAt(verifiedAt)) {
                persistence.expire(wager.getId(), verifiedAt);
                return Outcome.failure(OutcomeCode.EXPIRED, "Wager " + wager.getId() + " expired before verification");
            }
            if (current.getStatus() == WagerStatus.EXPIRED) {
                return Outcome.failure(OutcomeCode.EXPIRED, "Wager " + wager.getId() + " has expired");
            }
            return Outcome.ok(current);
        }

        log.info("Stake verified: transferId={}, payer={}", transfer.getTransferId(), transfer.getSenderAddress());
        return Outcome.ok(reload(wager.getId()));
    }

    private Outcome<Wager> resolve(Wager wager) {
        if (!wager.hasOutcome()) {
            WagerGame game = wager.getGame();
            int drawn = outcomeSource.draw(game, wager.getId());
            if (drawn < game.getMinOutcome() || drawn > game.getMaxOutcome()) {
                throw new IllegalStateException("Outcome source returned " + drawn + " for " + game
                        + ", outside " + game.getMinOutcome() + ".." + game.getMaxOutcome());
            }
            BigDecimal multiplier = game.multiplierFor(drawn);
            BigDecimal payout = wager.getStake().multiply(multiplier).setScale(4, RoundingMode.DOWN);
            BigDecimal contribution = wager.getStake().multiply(properties.houseEdgePercent())
                    .divide(HUNDRED, 4, RoundingMode.DOWN);

            if (persistence.recordOutcome(wager.getId(), drawn, multiplier, payout, contribution, clock.instant())) {
                log.info("Wager outcome {} on {}: multiplier {}, payout {}", drawn, wager.getGame(), multiplier, payout);
            } else {
                log.info("Wager outcome was fixed by a concurrent call, using the stored one");
            }
            wager = reload(wager.getId());
            if (wager.getStatus() != WagerStatus.VERIFIED) {
                return wager.getStatus() == WagerStatus.SETTLED
                        ? Outcome.failure(OutcomeCode.ALREADY_CLAIMED, "Wager " + wager.getId() + " is already settled")
                        : Outcome.failure(OutcomeCode.CONFLICT, "Wager " + wager.getId() + " is now " + wager.getStatus());
            }
        }

        if (!wager.isWin()) {
            if (!persistence.settleLoss(wager, clock.instant())) {
                return Outcome.failure(OutcomeCode.ALREADY_CLAIMED, "Wager " + wager.getId() + " was settled concurrently");
            }
            return Outcome.ok(reload(wager.getId()));
        }

        if (wager.getClaimedAt() != null) {
            return Outcome.failure(OutcomeCode.ALREADY_CLAIMED, "Wager " + wager.getId() + " payout is in progress");
        }
        Outcome<SettlementReceipt> paid = settlementExecutor.execute(new WagerSettlementSubject(wager, persistence));
        if (!paid.isOk()) {
            return paid.propagate();
        }
        return Outcome.ok(reload(wager.getId()));
    }

    private Wager reload(UUID id) {
        return persistence.findById(id)
                .orElseThrow(() -> new IllegalStateException("Wager disappeared after update: " + id));
    }

    private static String resultTag(Wager wager) {
        return wager.isWin() ? "win" : "loss";
    }
}
