package com.jobtailor.common.exception;

/**
 * AI 服务调用异常（网络错误、返回空内容、重试耗尽等）。
 */
public class AiServiceException extends JobTailorException {

    public AiServiceException(String message) {
        super("AI_ERROR", message);
    }

    public AiServiceException(String message, Throwable cause) {
        super("AI_ERROR", message, cause);
    }
}
