package com.wangbin.sentinel.monitor.health;

import com.wangbin.sentinel.core.engine.lane.LaneStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 告警引擎整体健康状态：汇总状态、通道统计和各组件明细
 */
@Data
@Builder
public class HealthStatus {

    private final Status status;

    @Builder.Default
    private final long timestamp = Instant.now().toEpochMilli();

    /**
     * 引擎是否有通道仍在运行
     */
    private final boolean engineRunning;

    private final int laneCount;

    @Builder.Default
    private final Map<LaneStatus, Long> laneStatusCounts = new EnumMap<>(LaneStatus.class);

    @Builder.Default
    private final Map<String, ComponentHealth> components = new LinkedHashMap<>();

    /**
     * severity 越大越严重
     */
    public enum Status {
        UP(0),
        UNKNOWN(1),
        DEGRADED(2),
        DOWN(3);

        private final int severity;

        Status(int severity) {
            this.severity = severity;
        }

        public boolean worseThan(Status other) {
            return other == null || severity > other.severity;
        }
    }

    /**
     * 取各组件中最严重的状态，没有组件时为 UNKNOWN
     */
    public static Status aggregate(Collection<ComponentHealth> componentHealths) {
        Status worst = null;
        for (ComponentHealth component : componentHealths) {
            if (component != null && component.getStatus().worseThan(worst)) {
                worst = component.getStatus();
            }
        }
        return Objects.requireNonNullElse(worst, Status.UNKNOWN);
    }
}
