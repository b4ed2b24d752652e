package com.jobtailor.ai.agent;

import lombok.Value;

/**
 * 一次成功尝试中 AI 生成的简历与求职信文本。
 */
@Value
public class TailoredContent {

    String cvText;

    String coverLetterText;
}
