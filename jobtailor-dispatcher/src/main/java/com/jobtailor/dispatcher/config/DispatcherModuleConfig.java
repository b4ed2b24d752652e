package com.jobtailor.dispatcher.config;

import com.jobtailor.dispatcher.pool.ApiKeyPool;
import com.jobtailor.dispatcher.pool.InMemoryApiKeyPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 调度模块自动配置。
 * <p>
 * Key 池在容器启动时根据 {@code jobtailor.dispatcher.api-keys} 构建，
 * 未配置任何 Key 时直接启动失败。
 */
@Slf4j
@Configuration
@ComponentScan(basePackages = "com.jobtailor.dispatcher")
@EnableConfigurationProperties(DispatcherProperties.class)
public class DispatcherModuleConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ApiKeyPool apiKeyPool(DispatcherProperties properties, Clock clock) {
        log.info("使用内存 Key 池（单进程）");
        return new InMemoryApiKeyPool(properties, clock);
    }
}
