package com.jobtailor.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jobtailor.ai.config.AiProperties;
import com.jobtailor.common.exception.AiHttpException;
import com.jobtailor.common.exception.AiServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Groq Chat Completions 实现（OpenAI 兼容协议）。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GroqProvider implements AiProvider {

    private final OkHttpClient aiHttpClient;
    private final AiProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static final MediaType JSON_MEDIA = MediaType.parse("application/json; charset=utf-8");

    @Override
    public String complete(String systemPrompt, String userPrompt, String apiKey) {
        AiProperties.GroqConfig config = properties.getGroq();
        String url = config.getBaseUrl() + "/chat/completions";

        try {
            String requestBody = buildRequestBody(config, systemPrompt, userPrompt);

            Request request = new Request.Builder()
                    .url(url)
                    .addHeader("Authorization", "Bearer " + apiKey)
                    .addHeader("Content-Type", "application/json")
                    .post(RequestBody.create(requestBody, JSON_MEDIA))
                    .build();

            try (Response response = aiHttpClient.newCall(request).execute()) {
                String body = response.body() != null ? response.body().string() : "";

                if (!response.isSuccessful()) {
                    log.error("Groq API 调用失败: {} - {}", response.code(), body);
                    throw new AiHttpException(response.code(), body);
                }

                JsonNode json = objectMapper.readTree(body);
                JsonNode content = json.path("choices").path(0).path("message").path("content");
                // content 为 null 或缺失时 asText() 会得到 "null" / ""，只接受字符串
                String result = content.isTextual() ? content.asText() : "";

                if (result.isBlank()) {
                    throw new AiServiceException("Groq API 返回空内容");
                }

                log.info("Groq 响应长度: {} 字符", result.length());
                return result;
            }

        } catch (AiServiceException e) {
            throw e;
        } catch (IOException e) {
            throw new AiServiceException("调用 Groq API 时发生网络错误", e);
        }
    }

    /**
     * 构建 Chat Completions 请求体。
     */
    private String buildRequestBody(AiProperties.GroqConfig config, String systemPrompt, String userPrompt)
            throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", config.getModel());
        root.put("temperature", config.getTemperature());
        root.put("max_tokens", config.getMaxTokens());

        ArrayNode messages = root.putArray("messages");

        ObjectNode systemMsg = messages.addObject();
        systemMsg.put("role", "system");
        systemMsg.put("content", systemPrompt);

        ObjectNode userMsg = messages.addObject();
        userMsg.put("role", "user");
        userMsg.put("content", userPrompt);

        return objectMapper.writeValueAsString(root);
    }

    @Override
    public String getProviderName() {
        return "groq";
    }
}
