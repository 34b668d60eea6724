package com.wangbin.sentinel.core.analysis;

/**
 * 单个检查的分析结论
 */
public enum CheckStatus {
    OK,
    VIOLATION,
    NO_DATA
}
