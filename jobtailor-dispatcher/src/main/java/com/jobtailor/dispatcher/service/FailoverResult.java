package com.jobtailor.dispatcher.service;

import lombok.Value;

/**
 * 故障切换执行结果。
 */
@Value
public class FailoverResult<R> {

    /** 任务返回值 */
    R value;

    /** 成功时使用的 Key（脱敏） */
    String maskedKey;

    /** 第几次尝试成功，从 1 开始 */
    int attempt;
}
