package com.wangbin.sentinel.core.engine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * 告警事件。每个持续时间达到阈值的越限样本各产生一条（电平触发）。
 */
@Value
@Builder
public class AlertEvent {

    @NonNull
    Instant time;

    String checkName;

    @NonNull
    String measurement;

    @NonNull
    String field;

    String instance;

    double value;

    double durationSeconds;

    /**
     * 本次越限持续段的起点，下游可据此按"新越限段"去重
     */
    @NonNull
    Instant runStart;

    @NonNull
    String alertName;

    @NonNull
    ViolationKind kind;

    public SeriesKey seriesKey() {
        return new SeriesKey(measurement, field, instance);
    }
}
