package com.jobtailor.config;

import com.jobtailor.common.dto.KeyStatus;
import com.jobtailor.common.dto.PoolStatus;
import com.jobtailor.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * 启动完成后打印 Key 池概况（Key 已脱敏）。
 * <p>
 * Key 通过 {@code jobtailor.dispatcher.api-keys} 或环境变量
 * {@code JOBTAILOR_DISPATCHER_API_KEYS} 配置，逗号分隔。未配置时 Key 池构建失败，应用不会启动。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyInitializer implements CommandLineRunner {

    private final ApiKeyPool keyPool;

    @Override
    public void run(String... args) {
        PoolStatus status = keyPool.status();
        log.info("==============================================");
        log.info("  已加载 {} 个 API Key，冷却时长 {} 秒", status.getTotalKeys(), status.getCooldownSeconds());
        for (KeyStatus key : status.getKeys()) {
            log.info("  - {}", key.getMaskedKey());
        }
        log.info("==============================================");
    }
}
