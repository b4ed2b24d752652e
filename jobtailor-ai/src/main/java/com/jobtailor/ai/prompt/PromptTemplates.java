package com.jobtailor.ai.prompt;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 简历 / 求职信 Prompt 模板集合。
 * <p>
 * 所有提示词从 classpath 下的 {@code prompts/*.md} 文件加载，
 * 修改提示词只需编辑对应 .md 文件并重启，无需改代码。
 *
 * <pre>
 * resources/prompts/
 * ├── cv-system.md             简历定制系统提示
 * ├── cv-tailoring.md          简历定制（含占位符）
 * ├── cover-letter-system.md   求职信系统提示
 * ├── cover-letter.md          求职信（含占位符）
 * └── default-cv.md            未上传简历时使用的默认模板
 * </pre>
 */
@Slf4j
@Component
public class PromptTemplates {

    private static final String PROMPT_DIR = "prompts/";

    /** 占位符格式：{cvTemplate}、{jobTitle}、{company}、{description} */
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private static final String NO_DESCRIPTION = "No description provided";

    private String cvSystem;
    private String cvTailoringTemplate;
    private String coverLetterSystem;
    private String coverLetterTemplate;
    private String defaultCv;

    @PostConstruct
    void loadPrompts() {
        cvSystem            = loadPrompt("cv-system.md").strip();
        cvTailoringTemplate = loadPrompt("cv-tailoring.md");
        coverLetterSystem   = loadPrompt("cover-letter-system.md").strip();
        coverLetterTemplate = loadPrompt("cover-letter.md");
        defaultCv           = loadPrompt("default-cv.md").strip();

        log.info("已加载 5 个 Prompt 模板 (来自 classpath:prompts/*.md)");
    }

    // ======================== Getter ========================

    public String getCvSystem() {
        return cvSystem;
    }

    public String getCoverLetterSystem() {
        return coverLetterSystem;
    }

    /** 内置的默认简历 */
    public String getDefaultCv() {
        return defaultCv;
    }

    /**
     * 简历定制 Prompt。
     */
    public String getCvTailoring(String cvTemplate, String jobTitle, String company, String description) {
        return fill(cvTailoringTemplate, cvTemplate, jobTitle, company, description);
    }

    /**
     * 求职信 Prompt。
     */
    public String getCoverLetter(String cvTemplate, String jobTitle, String company, String description) {
        return fill(coverLetterTemplate, cvTemplate, jobTitle, company, description);
    }

    // ======================== 填充工具 ========================

    /**
     * 单遍替换占位符，用户内容里出现的花括号不会被二次替换。
     */
    private String fill(String template, String cvTemplate, String jobTitle, String company, String description) {
        Map<String, String> values = Map.of(
                "cvTemplate", cvTemplate,
                "jobTitle", jobTitle,
                "company", company,
                "description", description == null || description.isBlank() ? NO_DESCRIPTION : description);

        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString().strip();
    }

    // ======================== 加载工具 ========================

    private String loadPrompt(String filename) {
        try {
            ClassPathResource resource = new ClassPathResource(PROMPT_DIR + filename);
            String content = resource.getContentAsString(StandardCharsets.UTF_8);
            log.debug("加载 Prompt: {} ({} 字符)", filename, content.length());
            return content;
        } catch (IOException e) {
            log.error("加载 Prompt 失败: {}", filename, e);
            throw new IllegalStateException("无法加载 Prompt 文件: " + PROMPT_DIR + filename, e);
        }
    }
}
