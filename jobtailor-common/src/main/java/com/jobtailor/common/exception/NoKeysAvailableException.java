package com.jobtailor.common.exception;

import java.time.Duration;
import java.time.Instant;

/**
 * Key 池中所有 Key 均在冷却中时抛出。
 * <p>
 * 携带最早恢复时间，上层可据此返回 Retry-After 提示。该异常可恢复，不影响进程运行。
 */
public class NoKeysAvailableException extends JobTailorException {

    private final Instant retryAt;

    public NoKeysAvailableException(String message, Instant retryAt) {
        super("KEY_EXHAUSTED", message);
        this.retryAt = retryAt;
    }

    /** 最早一个 Key 冷却结束的时间点 */
    public Instant getRetryAt() {
        return retryAt;
    }

    /**
     * 距离最早恢复还需等待多久，最少 1 秒。
     */
    public Duration retryAfter(Instant now) {
        Duration remaining = Duration.between(now, retryAt);
        return remaining.compareTo(Duration.ofSeconds(1)) < 0 ? Duration.ofSeconds(1) : remaining;
    }
}
