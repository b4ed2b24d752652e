package com.jobtailor.dispatcher.service;

import com.jobtailor.common.exception.AiHttpException;
import com.jobtailor.common.exception.AiServiceException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Locale;

/**
 * 根据 AI 调用抛出的异常判断是否为限流。
 * <p>
 * 429 / 403 视为限流；其余 HTTP 错误若响应内容含 rate、quota、limit 也视为限流。
 */
@Component
public class OutcomeClassifier {

    private static final List<String> RATE_LIMIT_KEYWORDS = List.of("rate", "quota", "limit");

    public CallOutcome classify(Throwable error) {
        if (error instanceof AiHttpException) {
            AiHttpException httpError = (AiHttpException) error;
            int status = httpError.getStatusCode();
            if (status == 429 || status == 403) {
                return CallOutcome.RATE_LIMITED;
            }
            if (mentionsRateLimit(httpError.getResponseBody()) || mentionsRateLimit(httpError.getMessage())) {
                return CallOutcome.RATE_LIMITED;
            }
            return CallOutcome.NON_RETRYABLE;
        }
        if (error instanceof AiServiceException) {
            return error.getCause() instanceof IOException ? CallOutcome.RETRYABLE : CallOutcome.NON_RETRYABLE;
        }
        return CallOutcome.RETRYABLE;
    }

    private boolean mentionsRateLimit(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return RATE_LIMIT_KEYWORDS.stream().anyMatch(lower::contains);
    }
}
