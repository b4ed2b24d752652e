package com.jobtailor.dispatcher.pool;

import com.jobtailor.common.dto.PoolStatus;

/**
 * API Key 轮询池接口。
 * <p>
 * Key 集合在进程启动时确定，运行期间只在可用与冷却两种状态间切换。
 * 调用方的标准用法：{@link #acquire()} 取 Key → 调用外部 AI 接口 → 按结果回报
 * {@link #reportSuccess(String)} 或 {@link #reportFailure(String, boolean)}。
 * 池本身不重试、不排队，换 Key 重试由调用方再次 acquire 完成。
 */
public interface ApiKeyPool {

    /**
     * 按轮询顺序取出下一个可用 Key。
     *
     * @throws com.jobtailor.common.exception.NoKeysAvailableException 所有 Key 都在冷却中
     */
    ApiCredential acquire();

    /** 调用成功，清零该 Key 的连续失败次数 */
    void reportSuccess(String key);

    /**
     * 调用失败。
     *
     * @param rateLimited true 表示外部接口明确限流，该 Key 立即进入冷却
     */
    void reportFailure(String key, boolean rateLimited);

    /** 只读状态快照 */
    PoolStatus status();

    /** 池中 Key 总数 */
    int size();
}
