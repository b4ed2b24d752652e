package com.jobtailor.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 简历定制请求：目标职位信息 + 可选的自定义简历模板。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TailorCvRequest {

    @NotBlank
    private String title;

    @Builder.Default
    private String company = "N/A";

    @NotBlank
    private String description;

    /** 职位链接 */
    private String url;

    /** 自定义简历模板，不传则使用内置模板 */
    private String cvTemplate;
}
