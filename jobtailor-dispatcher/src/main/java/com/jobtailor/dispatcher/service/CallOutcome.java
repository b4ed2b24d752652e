package com.jobtailor.dispatcher.service;

/**
 * 外部 AI 调用失败后的处理方式。
 */
public enum CallOutcome {

    /** 外部接口明确限流：冷却该 Key，换下一个 Key 重试 */
    RATE_LIMITED,

    /** 超时、网络错误等临时故障：记一次失败，换下一个 Key 重试 */
    RETRYABLE,

    /** 请求本身有问题（参数错误、返回空内容等）：记一次失败，直接抛给调用方 */
    NON_RETRYABLE
}
