package com.jobtailor.web.controller;

import com.jobtailor.ai.agent.CvTailoringService;
import com.jobtailor.common.dto.KeyStatus;
import com.jobtailor.common.dto.PoolStatus;
import com.jobtailor.dispatcher.pool.ApiKeyPool;
import com.jobtailor.jobs.service.JobSearchService;
import com.jobtailor.web.WebTestApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ApiKeyPool keyPool;

    @MockBean
    private CvTailoringService tailoringService;

    @MockBean
    private JobSearchService jobSearchService;

    @Test
    void rootAndHealthReportRunning() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("JobTailor API is running"));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"));
    }

    @Test
    void keyStatusReturnsMaskedSnapshot() throws Exception {
        PoolStatus snapshot = PoolStatus.builder()
                .totalKeys(2)
                .currentKeyIndex(1)
                .availableCount(1)
                .coolingDownCount(1)
                .cooldownSeconds(300)
                .failureThreshold(0)
                .hasAvailableKeys(true)
                .keys(List.of(
                        KeyStatus.builder()
                                .maskedKey("gsk_al...0001")
                                .state(KeyStatus.State.COOLING_DOWN)
                                .consecutiveFailures(1)
                                .cooldownRemainingSeconds(120)
                                .coolingUntil(WebTestApplication.NOW.plusSeconds(120))
                                .build(),
                        KeyStatus.builder()
                                .maskedKey("gsk_br...0002")
                                .state(KeyStatus.State.AVAILABLE)
                                .build()))
                .build();
        when(keyPool.status()).thenReturn(snapshot);

        mockMvc.perform(get("/api-keys/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.total_keys").value(2))
                .andExpect(jsonPath("$.data.cooling_down_count").value(1))
                .andExpect(jsonPath("$.data.keys[0].masked_key").value("gsk_al...0001"))
                .andExpect(jsonPath("$.data.keys[0].state").value("COOLING_DOWN"))
                .andExpect(jsonPath("$.data.keys[0].cooldown_remaining_seconds").value(120))
                .andExpect(jsonPath("$.data.keys[1].state").value("AVAILABLE"));
    }

    @Test
    void corsAllowsAnyOrigin() throws Exception {
        mockMvc.perform(options("/health")
                        .header("Origin", "https://jobs.example.org")
                        .header("Access-Control-Request-Method", "GET"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "https://jobs.example.org"));
    }
}
