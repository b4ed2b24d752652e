package com.jobtailor.common.exception;

/**
 * 启动时未配置任何 API Key，进程拒绝启动。
 */
public class EmptyKeyPoolException extends JobTailorException {

    public EmptyKeyPoolException(String message) {
        super("KEY_POOL_EMPTY", message);
    }
}
