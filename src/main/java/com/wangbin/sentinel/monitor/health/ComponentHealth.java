package com.wangbin.sentinel.monitor.health;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 单个组件的健康状态：一个检查的全部通道，或投递调度器
 */
@Data
@Builder
public class ComponentHealth {

    public enum Kind {
        CHECK,
        DISPATCHER
    }

    private final String name;
    private final Kind kind;
    private final HealthStatus.Status status;
    private final String message;

    @Builder.Default
    private final Map<String, Object> details = new LinkedHashMap<>();

    /**
     * 组件在健康接口中的键，例如 check:battery
     */
    public String key() {
        return kind == Kind.CHECK ? "check:" + name : name;
    }

    public boolean isDown() {
        return status == HealthStatus.Status.DOWN;
    }
}
