package com.jobtailor.document.service;

/**
 * 纯文本转 PDF。
 */
public interface PdfRenderer {

    /**
     * @param text  多行纯文本，按行排版
     * @param title 写入 PDF 元数据的标题
     * @return PDF 文件字节
     * @throws com.jobtailor.common.exception.DocumentRenderException 渲染失败
     */
    byte[] render(String text, String title);
}
