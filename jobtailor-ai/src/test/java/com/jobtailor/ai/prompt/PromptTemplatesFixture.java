package com.jobtailor.ai.prompt;

/**
 * 在容器外构建已加载 classpath 提示词的 {@link PromptTemplates}。
 */
public final class PromptTemplatesFixture {

    private PromptTemplatesFixture() {
    }

    public static PromptTemplates loaded() {
        PromptTemplates templates = new PromptTemplates();
        templates.loadPrompts();
        return templates;
    }
}
