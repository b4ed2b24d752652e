package com.jobtailor.dispatcher.pool;

import com.jobtailor.common.dto.KeyStatus;
import com.jobtailor.common.util.KeyMasker;

import java.time.Duration;
import java.time.Instant;

/**
 * 池中的一个 API Key 及其健康状态。
 * <p>
 * Key 值不可变；状态字段只能在 {@link InMemoryApiKeyPool} 的锁内读写。
 */
public final class ApiCredential {

    private final String value;

    /** 冷却截止时间，null 表示可用 */
    private Instant coolingUntil;

    private int consecutiveFailures;

    private Instant lastUsedAt;

    ApiCredential(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public String masked() {
        return KeyMasker.mask(value);
    }

    boolean isAvailable() {
        return coolingUntil == null;
    }

    boolean isCoolingDown(Instant now) {
        return coolingUntil != null && now.isBefore(coolingUntil);
    }

    /**
     * 冷却时间已过则恢复为可用。
     *
     * @return 本次是否发生了恢复
     */
    boolean expireCooldown(Instant now) {
        if (coolingUntil != null && !now.isBefore(coolingUntil)) {
            coolingUntil = null;
            return true;
        }
        return false;
    }

    void markUsed(Instant now) {
        lastUsedAt = now;
    }

    void markSucceeded() {
        consecutiveFailures = 0;
    }

    int markFailed() {
        return ++consecutiveFailures;
    }

    void coolDown(Instant until) {
        coolingUntil = until;
    }

    Instant getCoolingUntil() {
        return coolingUntil;
    }

    KeyStatus snapshot(Instant now) {
        boolean cooling = isCoolingDown(now);
        long remaining = 0;
        if (cooling) {
            Duration left = Duration.between(now, coolingUntil);
            // 向上取整，避免还在冷却却显示 0 秒
            remaining = left.getSeconds() + (left.getNano() > 0 ? 1 : 0);
        }
        return KeyStatus.builder()
                .maskedKey(masked())
                .state(cooling ? KeyStatus.State.COOLING_DOWN : KeyStatus.State.AVAILABLE)
                .consecutiveFailures(consecutiveFailures)
                .cooldownRemainingSeconds(remaining)
                .coolingUntil(cooling ? coolingUntil : null)
                .lastUsedAt(lastUsedAt)
                .build();
    }

    @Override
    public String toString() {
        return "ApiCredential[" + masked() + "]";
    }
}
