package com.jobtailor.common.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 简历定制结果：两份 PDF（Base64）与对应纯文本。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TailorCvResponse {

    private boolean success;
    private String cvPdf;
    private String coverLetterPdf;
    private String cvText;
    private String coverLetterText;
    private String jobTitle;
    private String company;
    private String url;

    /** 本次实际使用的 Key（脱敏） */
    private String apiKeyUsed;

    /** 第几次尝试成功 */
    private int attempt;

    private String message;
}
