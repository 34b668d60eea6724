package com.wangbin.sentinel.core.engine.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * 单个观测样本。instance 为空表示该样本不带实例标签。
 */
@Value
@Builder
public class Sample {

    @NonNull
    Instant timestamp;

    @NonNull
    String measurement;

    @NonNull
    String field;

    String instance;

    double value;

    public SeriesKey seriesKey() {
        return new SeriesKey(measurement, field, instance);
    }

    public static Sample of(Instant timestamp, String measurement, String field, String instance, double value) {
        return new Sample(timestamp, measurement, field, instance, value);
    }
}
