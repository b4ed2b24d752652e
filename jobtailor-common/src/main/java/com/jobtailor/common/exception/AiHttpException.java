package com.jobtailor.common.exception;

/**
 * AI 接口返回非 2xx 状态码。
 * <p>
 * 保留状态码和响应体，调用方据此判断是否为限流（429 / 403 或错误信息含 rate、quota、limit）。
 */
public class AiHttpException extends AiServiceException {

    private final int statusCode;
    private final String responseBody;

    public AiHttpException(int statusCode, String responseBody) {
        super("AI 接口返回错误: " + statusCode);
        this.statusCode = statusCode;
        this.responseBody = responseBody == null ? "" : responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
