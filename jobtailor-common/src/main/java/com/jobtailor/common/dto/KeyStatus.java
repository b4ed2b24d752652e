package com.jobtailor.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 单个 API Key 的健康状态快照（Key 值已脱敏）。
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class KeyStatus {

    String maskedKey;

    State state;

    /** 自上次成功以来的连续失败次数 */
    int consecutiveFailures;

    /** 剩余冷却秒数，可用时为 0 */
    long cooldownRemainingSeconds;

    /** 冷却结束时间，可用时为 null */
    Instant coolingUntil;

    /** 最近一次被选中的时间，从未使用时为 null */
    Instant lastUsedAt;

    public enum State {
        AVAILABLE, COOLING_DOWN
    }
}
