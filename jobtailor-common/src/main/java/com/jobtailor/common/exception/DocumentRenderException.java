package com.jobtailor.common.exception;

/**
 * PDF 生成异常。
 */
public class DocumentRenderException extends JobTailorException {

    public DocumentRenderException(String message, Throwable cause) {
        super("PDF_ERROR", message, cause);
    }
}
