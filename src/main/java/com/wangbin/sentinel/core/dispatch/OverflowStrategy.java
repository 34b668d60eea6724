package com.wangbin.sentinel.core.dispatch;

/**
 * 投递队列溢出策略，丢弃时记录日志与计数
 */
public enum OverflowStrategy {
    BLOCK,
    DROP_LATEST,
    DROP_OLDEST;

    public static OverflowStrategy from(String text) {
        if (text == null || text.isBlank()) {
            return BLOCK;
        }
        try {
            return OverflowStrategy.valueOf(text.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return BLOCK;
        }
    }
}
