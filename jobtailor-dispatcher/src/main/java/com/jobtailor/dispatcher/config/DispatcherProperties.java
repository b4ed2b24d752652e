package com.jobtailor.dispatcher.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 调度中心配置项。
 */
@Data
@ConfigurationProperties(prefix = "jobtailor.dispatcher")
public class DispatcherProperties {

    /** 逗号分隔的 API Key 列表，也可通过环境变量 JOBTAILOR_DISPATCHER_API_KEYS 设置 */
    private String apiKeys = "";

    /** Key 被限流后的冷却时间（秒） */
    private long cooldownSeconds = 300;

    /** 连续普通失败多少次后也进入冷却，0 表示只有限流才冷却 */
    private int failureThreshold = 0;

    /** 单次任务最多尝试几个 Key，0 表示等于 Key 池大小 */
    private int maxAttempts = 0;

    /**
     * 解析 Key 列表：去空白、去空项、去重（保留首次出现的顺序）。
     */
    public List<String> apiKeyList() {
        if (apiKeys == null || apiKeys.isBlank()) {
            return List.of();
        }
        return List.copyOf(Arrays.stream(apiKeys.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new)));
    }
}
