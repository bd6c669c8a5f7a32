package com.flagship.agent_settlement.wager;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-window attempt counter per requester.
 *
 * Redis is the fast path: {@code INCR} on a window key, and a block key set
 * for {@code blockFor} once the window overflows. When Redis is missing or
 * failing, the requester's wagers created inside the window are counted in
 * the database instead; that path has no block period.
 */
@Component
@Slf4j
public class WagerRateLimiter {

    private static final String COUNT_KEY_PREFIX = "wager:rate:";
    private static final String BLOCK_KEY_PREFIX = "wager:rate:block:";

    private final Optional<StringRedisTemplate> redisTemplate;
    private final WagerRepository wagerRepository;
    private final WagerProperties.RateLimit limits;

    public WagerRateLimiter(Optional<StringRedisTemplate> redisTemplate,
                            WagerRepository wagerRepository,
                            WagerProperties properties) {
        this.redisTemplate = redisTemplate;
        this.wagerRepository = wagerRepository;
        this.limits = properties.rateLimit();
    }

    public GuardDecision tryAcquire(String requesterId, Instant now) {
        if (redisTemplate.isPresent()) {
            try {
                return acquireInRedis(redisTemplate.get(), requesterId);
            } catch (RuntimeException e) {
                log.warn("Redis rate limit check failed for {}. Falling back to database. Error: {}",
                        requesterId, e.getMessage());
            }
        }
        return acquireFromDatabase(requesterId, now);
    }

    private GuardDecision acquireInRedis(StringRedisTemplate redis, String requesterId) {
        String blockKey = BLOCK_KEY_PREFIX + requesterId;
        if (Boolean.TRUE.equals(redis.hasKey(blockKey))) {
            Long ttl = redis.getExpire(blockKey, TimeUnit.SECONDS);
            return GuardDecision.deny("Too many wagers, blocked for another "
                    + (ttl != null && ttl > 0 ? ttl : limits.blockFor().toSeconds()) + "s");
        }

        String countKey = COUNT_KEY_PREFIX + requesterId;
        Long count = redis.opsForValue().increment(countKey);
        if (count != null && count == 1L) {
            redis.expire(countKey, limits.window());
        }

        if (count != null && count > limits.maxAttempts()) {
            redis.opsForValue().set(blockKey, "1", limits.blockFor());
            log.info("Requester {} exceeded {} wagers per {}s, blocking for {}s", requesterId,
                    limits.maxAttempts(), limits.window().toSeconds(), limits.blockFor().toSeconds());
            return GuardDecision.deny("Too many wagers, blocked for " + limits.blockFor().toSeconds() + "s");
        }
        return GuardDecision.allow();
    }

    private GuardDecision acquireFromDatabase(String requesterId, Instant now) {
        long recent = wagerRepository.countByRequesterIdAndCreatedAtAfter(requesterId, now.minus(limits.window()));
        if (recent >= limits.maxAttempts()) {
            return GuardDecision.deny("Too many wagers, at most " + limits.maxAttempts()
                    + " per " + limits.window().toSeconds() + "s");
        }
        return GuardDecision.allow();
    }
}
