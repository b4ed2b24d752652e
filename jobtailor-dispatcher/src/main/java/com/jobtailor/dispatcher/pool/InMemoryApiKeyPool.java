package com.jobtailor.dispatcher.pool;

import com.jobtailor.common.dto.KeyStatus;
import com.jobtailor.common.dto.PoolStatus;
import com.jobtailor.common.exception.EmptyKeyPoolException;
import com.jobtailor.common.exception.NoKeysAvailableException;
import com.jobtailor.common.util.KeyMasker;
import com.jobtailor.dispatcher.config.DispatcherProperties;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 基于内存的 API Key 轮询池。
 * <p>
 * 所有状态（Key 列表 + 轮询游标）由一把 {@link ReentrantLock} 保护，
 * 每个操作只在锁内做内存状态变更，不在锁内发起任何网络调用。
 * 冷却到期不依赖定时任务，而是在 {@link #acquire()} 扫描时顺带恢复。
 */
@Slf4j
public class InMemoryApiKeyPool implements ApiKeyPool {

    private final List<ApiCredential> credentials;
    private final Map<String, ApiCredential> byValue;
    private final Duration cooldown;
    private final int failureThreshold;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    /** 下一次轮询的起始下标 */
    private int cursor = 0;

    public InMemoryApiKeyPool(DispatcherProperties properties, Clock clock) {
        this(properties.apiKeyList(), Duration.ofSeconds(properties.getCooldownSeconds()),
                properties.getFailureThreshold(), clock);
    }

    public InMemoryApiKeyPool(List<String> keys, Duration cooldown, int failureThreshold, Clock clock) {
        if (keys == null || keys.isEmpty()) {
            throw new EmptyKeyPoolException(
                    "未配置任何 API Key，请设置 jobtailor.dispatcher.api-keys 或环境变量 JOBTAILOR_DISPATCHER_API_KEYS");
        }
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("冷却时间不能为负数: " + cooldown);
        }
        Map<String, ApiCredential> index = new LinkedHashMap<>();
        for (String key : keys) {
            if (index.containsKey(key)) {
                log.warn("忽略重复的 API Key: {}", KeyMasker.mask(key));
                continue;
            }
            index.put(key, new ApiCredential(key));
        }
        this.byValue = Collections.unmodifiableMap(index);
        this.credentials = List.copyOf(index.values());
        this.cooldown = cooldown;
        this.failureThreshold = Math.max(0, failureThreshold);
        this.clock = clock;
        log.info("Key 池初始化完成, 共 {} 个 Key, 冷却时间 {} 秒, 连续失败阈值 {}",
                credentials.size(), cooldown.getSeconds(), this.failureThreshold);
    }

    @Override
    public ApiCredential acquire() {
        List<String> recovered = new ArrayList<>();
        ApiCredential chosen = null;
        Instant earliestRetry = null;

        lock.lock();
        try {
            Instant now = clock.instant();
            int size = credentials.size();
            for (int i = 0; i < size; i++) {
                int idx = (cursor + i) % size;
                ApiCredential candidate = credentials.get(idx);
                if (candidate.expireCooldown(now)) {
                    recovered.add(candidate.masked());
                }
                if (candidate.isAvailable()) {
                    cursor = (idx + 1) % size;
                    candidate.markUsed(now);
                    chosen = candidate;
                    break;
                }
                Instant until = candidate.getCoolingUntil();
                if (earliestRetry == null || until.isBefore(earliestRetry)) {
                    earliestRetry = until;
                }
            }
        } finally {
            lock.unlock();
        }

        for (String key : recovered) {
            log.info("Key {} 冷却结束，恢复可用", key);
        }
        if (chosen == null) {
            log.warn("所有 API Key 均在冷却中，最早恢复时间: {}", earliestRetry);
            throw new NoKeysAvailableException("所有 API Key 暂时不可用，请稍后重试", earliestRetry);
        }
        log.debug("借出 Key: {}", chosen.masked());
        return chosen;
    }

    @Override
    public void reportSuccess(String key) {
        ApiCredential credential = byValue.get(key);
        if (credential == null) {
            log.warn("回报成功的 Key 不在池中，忽略: {}", KeyMasker.mask(key));
            return;
        }
        lock.lock();
        try {
            credential.markSucceeded();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reportFailure(String key, boolean rateLimited) {
        ApiCredential credential = byValue.get(key);
        if (credential == null) {
            log.warn("回报失败的 Key 不在池中，忽略: {}", KeyMasker.mask(key));
            return;
        }
        int failures;
        Instant until = null;
        lock.lock();
        try {
            failures = credential.markFailed();
            boolean overThreshold = failureThreshold > 0 && failures >= failureThreshold;
            if (rateLimited || overThreshold) {
                until = clock.instant().plus(cooldown);
                credential.coolDown(until);
            }
        } finally {
            lock.unlock();
        }

        if (until == null) {
            log.warn("Key {} 调用失败, 连续失败 {} 次", credential.masked(), failures);
        } else if (rateLimited) {
            log.warn("Key {} 被限流, 冷却至 {} (连续失败 {} 次)", credential.masked(), until, failures);
        } else {
            log.warn("Key {} 连续失败 {} 次达到阈值, 冷却至 {}", credential.masked(), failures, until);
        }
    }

    @Override
    public PoolStatus status() {
        lock.lock();
        try {
            Instant now = clock.instant();
            List<KeyStatus> keys = new ArrayList<>(credentials.size());
            int cooling = 0;
            for (ApiCredential credential : credentials) {
                KeyStatus snapshot = credential.snapshot(now);
                if (snapshot.getState() == KeyStatus.State.COOLING_DOWN) {
                    cooling++;
                }
                keys.add(snapshot);
            }
            int available = credentials.size() - cooling;
            return PoolStatus.builder()
                    .totalKeys(credentials.size())
                    .currentKeyIndex(cursor)
                    .availableCount(available)
                    .coolingDownCount(cooling)
                    .cooldownSeconds(cooldown.getSeconds())
                    .failureThreshold(failureThreshold)
                    .hasAvailableKeys(available > 0)
                    .keys(List.copyOf(keys))
                    .build();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int size() {
        return credentials.size();
    }
}
