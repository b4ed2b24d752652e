package com.jobtailor.web.controller;

import com.jobtailor.ai.agent.CvTailoringService;
import com.jobtailor.common.dto.ApiResponse;
import com.jobtailor.common.dto.TailorCvRequest;
import com.jobtailor.common.dto.TailorCvResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * 简历定制接口。
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class CvController {

    private final CvTailoringService tailoringService;

    /**
     * 根据职位信息生成定制简历和求职信（PDF 以 Base64 返回）。
     * <p>
     * Key 全部冷却时返回 503 + Retry-After，见 {@link GlobalExceptionHandler}。
     */
    @PostMapping("/tailor-cv")
    public ApiResponse<TailorCvResponse> tailorCv(@Valid @RequestBody TailorCvRequest request) {
        log.info("收到简历定制请求: {} @ {}", request.getTitle(), request.getCompany());
        TailorCvResponse response = tailoringService.tailor(request);
        return ApiResponse.ok(response, response.getMessage());
    }
}
