package com.jobtailor.ai.provider;

/**
 * AI 文本生成提供商接口。
 * <p>
 * 调用方负责传入本次使用的 API Key，提供商不感知 Key 池。
 */
public interface AiProvider {

    /**
     * 发送一次 Chat 请求（阻塞式，等待完整响应）。
     *
     * @param systemPrompt 系统提示词
     * @param userPrompt   用户提示词
     * @param apiKey       API Key
     * @return AI 返回的文本
     * @throws com.jobtailor.common.exception.AiHttpException    接口返回非 2xx
     * @throws com.jobtailor.common.exception.AiServiceException 网络错误或返回空内容
     */
    String complete(String systemPrompt, String userPrompt, String apiKey);

    /**
     * 获取提供商名称。
     */
    String getProviderName();
}
