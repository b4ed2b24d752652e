package com.jobtailor.ai.agent;

import com.jobtailor.ai.prompt.PromptTemplates;
import com.jobtailor.ai.provider.AiProvider;
import com.jobtailor.common.dto.TailorCvRequest;
import com.jobtailor.common.dto.TailorCvResponse;
import com.jobtailor.common.exception.JobTailorException;
import com.jobtailor.dispatcher.service.FailoverExecutor;
import com.jobtailor.dispatcher.service.FailoverResult;
import com.jobtailor.document.service.PdfRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Base64;

/**
 * 简历定制核心服务。
 * <p>
 * 一次尝试内用同一个 Key 先后生成定制简历和求职信，
 * 任一调用失败则整次尝试作废，由 {@link FailoverExecutor} 决定是否换 Key 重来。
 * AI 全部成功后再渲染 PDF，渲染失败不会消耗 Key。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CvTailoringService {

    private final AiProvider aiProvider;
    private final FailoverExecutor failoverExecutor;
    private final PromptTemplates promptTemplates;
    private final PdfRenderer pdfRenderer;

    public TailorCvResponse tailor(TailorCvRequest request) {
        String jobTitle = request.getTitle();
        if (jobTitle == null || jobTitle.isBlank()) {
            throw new JobTailorException("INVALID_REQUEST", "职位名称不能为空");
        }
        String company = request.getCompany() == null || request.getCompany().isBlank()
                ? "N/A" : request.getCompany();
        String cvTemplate = request.getCvTemplate() == null || request.getCvTemplate().isBlank()
                ? promptTemplates.getDefaultCv() : request.getCvTemplate();

        log.info("开始定制简历: {} @ {}", jobTitle, company);
        long startTime = System.currentTimeMillis();

        FailoverResult<TailoredContent> result = failoverExecutor.execute("简历定制",
                apiKey -> generate(cvTemplate, jobTitle, company, request.getDescription(), apiKey));
        TailoredContent content = result.getValue();

        log.info("正在生成 PDF 文件...");
        byte[] cvPdf = pdfRenderer.render(content.getCvText(), "CV_" + jobTitle);
        byte[] coverLetterPdf = pdfRenderer.render(content.getCoverLetterText(), "CoverLetter_" + jobTitle);

        log.info("简历定制完成, 使用 Key {}, 第 {} 次尝试, 耗时 {} ms",
                result.getMaskedKey(), result.getAttempt(), System.currentTimeMillis() - startTime);

        return TailorCvResponse.builder()
                .success(true)
                .cvPdf(Base64.getEncoder().encodeToString(cvPdf))
                .coverLetterPdf(Base64.getEncoder().encodeToString(coverLetterPdf))
                .cvText(content.getCvText())
                .coverLetterText(content.getCoverLetterText())
                .jobTitle(jobTitle)
                .company(company)
                .url(request.getUrl())
                .apiKeyUsed(result.getMaskedKey())
                .attempt(result.getAttempt())
                .message("CV and Cover Letter PDFs generated successfully")
                .build();
    }

    private TailoredContent generate(String cvTemplate, String jobTitle, String company,
                                     String description, String apiKey) {
        log.info("正在生成定制简历...");
        String tailoredCv = aiProvider.complete(
                promptTemplates.getCvSystem(),
                promptTemplates.getCvTailoring(cvTemplate, jobTitle, company, description),
                apiKey);

        log.info("正在生成求职信...");
        String coverLetter = aiProvider.complete(
                promptTemplates.getCoverLetterSystem(),
                promptTemplates.getCoverLetter(cvTemplate, jobTitle, company, description),
                apiKey);

        return new TailoredContent(tailoredCv.strip(), coverLetter.strip());
    }
}
