package com.flagship.agent_settlement.wager;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Redis fast path and database fallback of the wager rate limiter.
 */
@ExtendWith(MockitoExtension.class)
class WagerRateLimiterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final WagerProperties properties = new WagerProperties(null, null, null, null, null, null,
            new WagerProperties.RateLimit(3, Duration.ofSeconds(60), Duration.ofSeconds(300)));

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private WagerRepository wagerRepository;

    @Test
    @DisplayName("First attempt in a window starts the window TTL")
    void firstAttemptSetsWindow() {
        when(redisTemplate.hasKey("wager:rate:block:alice")).thenReturn(false);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("wager:rate:alice")).thenReturn(1L);

        WagerRateLimiter limiter = new WagerRateLimiter(Optional.of(redisTemplate), wagerRepository, properties);

        assertTrue(limiter.tryAcquire("alice", NOW).allowed());
        verify(redisTemplate).expire("wager:rate:alice", Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Exceeding the window sets the block key")
    void overflowBlocks() {
        when(redisTemplate.hasKey("wager:rate:block:alice")).thenReturn(false);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("wager:rate:alice")).thenReturn(4L);

        WagerRateLimiter limiter = new WagerRateLimiter(Optional.of(redisTemplate), wagerRepository, properties);
        GuardDecision decision = limiter.tryAcquire("alice", NOW);

        assertFalse(decision.allowed());
        verify(valueOperations).set("wager:rate:block:alice", "1", Duration.ofSeconds(300));
    }

    @Test
    @DisplayName("A blocked requester is refused without counting")
    void blockedRequester() {
        when(redisTemplate.hasKey("wager:rate:block:alice")).thenReturn(true);
        when(redisTemplate.getExpire(any(), any())).thenReturn(120L);

        WagerRateLimiter limiter = new WagerRateLimiter(Optional.of(redisTemplate), wagerRepository, properties);
        GuardDecision decision = limiter.tryAcquire("alice", NOW);

        assertFalse(decision.allowed());
        assertTrue(decision.reason().contains("120s"), decision.reason());
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    @DisplayName("A Redis failure falls back to counting recent wagers in the database")
    void redisFailureFallsBack() {
        when(redisTemplate.hasKey(anyString())).thenThrow(new RedisConnectionFailureException("refused"));
        when(wagerRepository.countByRequesterIdAndCreatedAtAfter("alice", NOW.minusSeconds(60))).thenReturn(3L);

        WagerRateLimiter limiter = new WagerRateLimiter(Optional.of(redisTemplate), wagerRepository, properties);

        assertFalse(limiter.tryAcquire("alice", NOW).allowed());
    }

    @Test
    @DisplayName("Without Redis the database count decides")
    void noRedis() {
        when(wagerRepository.countByRequesterIdAndCreatedAtAfter("bob", NOW.minusSeconds(60))).thenReturn(2L);

        WagerRateLimiter limiter = new WagerRateLimiter(Optional.empty(), wagerRepository, properties);

        assertTrue(limiter.tryAcquire("bob", NOW).allowed());
    }
}
