package com.jobtailor.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Key 池整体状态快照，供运维查看。
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PoolStatus {

    int totalKeys;

    /** 下一次轮询的起始位置 */
    int currentKeyIndex;

    int availableCount;

    int coolingDownCount;

    long cooldownSeconds;

    /** 连续普通失败达到该次数后进入冷却，0 表示不启用 */
    int failureThreshold;

    boolean hasAvailableKeys;

    List<KeyStatus> keys;
}
