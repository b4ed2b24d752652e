package com.jobtailor.dispatcher.service;

import com.jobtailor.common.exception.AiServiceException;
import com.jobtailor.dispatcher.config.DispatcherProperties;
import com.jobtailor.dispatcher.pool.ApiCredential;
import com.jobtailor.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.function.Function;

/**
 * 带 Key 故障切换的 AI 调用执行器。
 * <p>
 * 每次尝试都是一轮完整的 acquire → 调用 → 回报：
 * <ul>
 *   <li>成功：回报成功并返回结果</li>
 *   <li>限流：冷却该 Key，换下一个 Key 重试</li>
 *   <li>超时 / 网络错误：记一次失败，换下一个 Key 重试</li>
 *   <li>其他错误：记一次失败后直接抛出</li>
 * </ul>
 * 所有 Key 都在冷却时 {@link com.jobtailor.common.exception.NoKeysAvailableException} 直接向上抛出，不等待。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FailoverExecutor {

    private final ApiKeyPool keyPool;
    private final OutcomeClassifier classifier;
    private final DispatcherProperties properties;

    /**
     * 执行一个需要 API Key 的任务。
     *
     * @param taskName 任务名，仅用于日志
     * @param call     实际的调用逻辑 apiKey -> result
     */
    public <R> FailoverResult<R> execute(String taskName, Function<String, R> call) {
        int maxAttempts = properties.getMaxAttempts() > 0 ? properties.getMaxAttempts() : keyPool.size();
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            ApiCredential credential = keyPool.acquire();
            String key = credential.getValue();
            log.info("{}: 第 {}/{} 次尝试, 使用 Key {}", taskName, attempt, maxAttempts, credential.masked());

            try {
                R result = call.apply(key);
                keyPool.reportSuccess(key);
                return new FailoverResult<>(result, credential.masked(), attempt);

            } catch (RuntimeException e) {
                lastError = e.getMessage();
                CallOutcome outcome = classifier.classify(e);
                switch (outcome) {
                    case RATE_LIMITED:
                        log.warn("{}: Key {} 被限流/配额不足, 切换下一个 Key", taskName, credential.masked());
                        keyPool.reportFailure(key, true);
                        break;
                    case RETRYABLE:
                        log.warn("{}: Key {} 调用失败 ({}), 切换下一个 Key", taskName, credential.masked(), e.getMessage());
                        keyPool.reportFailure(key, false);
                        break;
                    default:
                        log.error("{}: 调用失败且不可重试: {}", taskName, e.getMessage());
                        keyPool.reportFailure(key, false);
                        throw e;
                }
            }
        }

        throw new AiServiceException(taskName + " 在 " + maxAttempts + " 次尝试后仍然失败, 最后错误: " + lastError);
    }
}
