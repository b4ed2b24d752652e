package com.jobtailor.document.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * PDF 排版配置项，单位均为 pt（1 英寸 = 72pt）。
 */
@Data
@ConfigurationProperties(prefix = "jobtailor.document")
public class DocumentProperties {

    /** 页边距，默认 0.75 英寸 */
    private float margin = 54f;

    /** 正文字号 */
    private float bodyFontSize = 11f;

    /** 正文行距 */
    private float bodyLeading = 14f;

    /** 一级标题字号（全大写的短行，如 SUMMARY） */
    private float headingFontSize = 14f;

    /** 二级标题字号（以冒号结尾的短行） */
    private float subheadingFontSize = 12f;

    /** 段落之间的额外间距 */
    private float paragraphSpacing = 4f;

    /** 空行对应的垂直留白，默认 0.1 英寸 */
    private float blankLineSpacing = 7.2f;

    /** 标题判定的最大长度，超过则按正文处理 */
    private int maxHeadingLength = 50;
}
