package com.jobtailor.common.util;

/**
 * API Key 脱敏工具，日志与状态接口中只允许出现脱敏后的 Key。
 */
public final class KeyMasker {

    private static final int PREFIX_LENGTH = 6;
    private static final int SUFFIX_LENGTH = 4;

    private KeyMasker() {
    }

    /**
     * 保留前 6 位和后 4 位，中间以 "..." 代替；过短的 Key 整体隐藏。
     */
    public static String mask(String key) {
        if (key == null || key.length() <= PREFIX_LENGTH + SUFFIX_LENGTH + 2) {
            return "***";
        }
        return key.substring(0, PREFIX_LENGTH) + "..." + key.substring(key.length() - SUFFIX_LENGTH);
    }
}
