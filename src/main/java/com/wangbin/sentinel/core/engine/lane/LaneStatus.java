package com.wangbin.sentinel.core.engine.lane;

/**
 * 检查通道状态
 */
public enum LaneStatus {
    PENDING,
    RUNNING,
    /**
     * 数据源读取失败，通道降级但进程继续
     */
    DEGRADED,
    COMPLETED,
    STOPPED,
    /**
     * 内部不变量被破坏
     */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == STOPPED || this == FAILED;
    }
}
