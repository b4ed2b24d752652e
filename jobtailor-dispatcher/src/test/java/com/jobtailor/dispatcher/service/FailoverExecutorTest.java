package com.jobtailor.dispatcher.service;

import com.jobtailor.common.dto.KeyStatus;
import com.jobtailor.common.exception.AiHttpException;
import com.jobtailor.common.exception.AiServiceException;
import com.jobtailor.common.exception.NoKeysAvailableException;
import com.jobtailor.dispatcher.MutableClock;
import com.jobtailor.dispatcher.config.DispatcherProperties;
import com.jobtailor.dispatcher.pool.InMemoryApiKeyPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * acquire → 调用 → 回报 循环在各类失败下的行为。
 */
class FailoverExecutorTest {

    private static final String KEY_A = "gsk_alpha_000000000001";
    private static final String KEY_B = "gsk_bravo_000000000002";
    private static final String KEY_C = "gsk_charlie_00000000003";

    private MutableClock clock;
    private InMemoryApiKeyPool pool;
    private DispatcherProperties properties;
    private FailoverExecutor executor;
    private List<String> keysTried;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        pool = new InMemoryApiKeyPool(List.of(KEY_A, KEY_B, KEY_C), Duration.ofMinutes(5), 0, clock);
        properties = new DispatcherProperties();
        executor = new FailoverExecutor(pool, new OutcomeClassifier(), properties);
        keysTried = new ArrayList<>();
    }

    @Test
    void firstSuccessfulKeyIsReported() {
        FailoverResult<String> result = executor.execute("test", key -> {
            keysTried.add(key);
            return "ok";
        });

        assertEquals("ok", result.getValue());
        assertEquals(1, result.getAttempt());
        assertEquals("gsk_al...0001", result.getMaskedKey());
        assertEquals(List.of(KEY_A), keysTried);
    }

    @Test
    void rateLimitedKeyIsBenchedAndNextKeyUsed() {
        FailoverResult<String> result = executor.execute("test", key -> {
            keysTried.add(key);
            if (KEY_A.equals(key)) {
                throw new AiHttpException(429, "Rate limit reached");
            }
            return "ok";
        });

        assertEquals(2, result.getAttempt());
        assertEquals(List.of(KEY_A, KEY_B), keysTried);
        KeyStatus a = pool.status().getKeys().get(0);
        assertEquals(KeyStatus.State.COOLING_DOWN, a.getState());
        assertEquals(1, a.getConsecutiveFailures());
    }

    @Test
    void networkFailureCountsButDoesNotBenchKey() {
        FailoverResult<String> result = executor.execute("test", key -> {
            keysTried.add(key);
            if (KEY_A.equals(key)) {
                throw new AiServiceException("网络错误", new IOException("connection reset"));
            }
            return "ok";
        });

        assertEquals(2, result.getAttempt());
        KeyStatus a = pool.status().getKeys().get(0);
        assertEquals(KeyStatus.State.AVAILABLE, a.getState());
        assertEquals(1, a.getConsecutiveFailures());
    }

    @Test
    void successClearsEarlierFailuresOfThatKey() {
        pool.reportFailure(KEY_A, false);

        executor.execute("test", key -> "ok");

        assertEquals(0, pool.status().getKeys().get(0).getConsecutiveFailures());
    }

    @Test
    void nonRetryableErrorIsRethrownImmediately() {
        AiHttpException badRequest = new AiHttpException(400, "invalid model");

        AiHttpException thrown = assertThrows(AiHttpException.class, () -> executor.execute("test", key -> {
            keysTried.add(key);
            throw badRequest;
        }));

        assertSame(badRequest, thrown);
        assertEquals(List.of(KEY_A), keysTried);
        assertEquals(1, pool.status().getKeys().get(0).getConsecutiveFailures());
    }

    @Test
    void attemptsAreBoundedByPoolSize() {
        AiServiceException e = assertThrows(AiServiceException.class, () -> executor.execute("test", key -> {
            keysTried.add(key);
            throw new AiServiceException("超时", new IOException("timeout"));
        }));

        assertEquals(List.of(KEY_A, KEY_B, KEY_C), keysTried);
        assertTrue(e.getMessage().contains("3 次尝试"));
        assertTrue(e.getMessage().contains("超时"));
    }

    @Test
    void configuredMaxAttemptsOverridesPoolSize() {
        properties.setMaxAttempts(2);

        assertThrows(AiServiceException.class, () -> executor.execute("test", key -> {
            keysTried.add(key);
            throw new AiServiceException("超时", new IOException("timeout"));
        }));

        assertEquals(List.of(KEY_A, KEY_B), keysTried);
    }

    @Test
    void exhaustedPoolSurfacesNoKeysAvailable() {
        assertThrows(AiServiceException.class, () -> executor.execute("test", key -> {
            keysTried.add(key);
            throw new AiHttpException(429, "");
        }));

        assertEquals(List.of(KEY_A, KEY_B, KEY_C), keysTried);
        NoKeysAvailableException e = assertThrows(NoKeysAvailableException.class,
                () -> executor.execute("test", key -> "never"));
        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), e.getRetryAt());
    }
}
