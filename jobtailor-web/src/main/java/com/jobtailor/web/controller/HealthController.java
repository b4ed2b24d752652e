package com.jobtailor.web.controller;

import com.jobtailor.common.dto.ApiResponse;
import com.jobtailor.common.dto.PoolStatus;
import com.jobtailor.dispatcher.pool.ApiKeyPool;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 存活检查与 Key 池状态。
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ApiKeyPool keyPool;

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("status", "JobTailor API is running");
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }

    /**
     * Key 池快照，Key 值已脱敏。
     */
    @GetMapping("/api-keys/status")
    public ApiResponse<PoolStatus> keyStatus() {
        return ApiResponse.ok(keyPool.status());
    }
}
