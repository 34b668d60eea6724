package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.engine.model.SeriesKey;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * 一个分区在指定时间范围内的样本查询。
 */
@Value
@Builder(toBuilder = true)
public class SampleQuery {

    @NonNull
    String measurement;

    @NonNull
    String field;

    /**
     * 为空时只查询不带实例标签的样本
     */
    String instance;

    @NonNull
    TimeRange timeRange;

    /**
     * 大于 0 时限制返回的样本数
     */
    int limit;

    public SeriesKey seriesKey() {
        return new SeriesKey(measurement, field, instance);
    }

    public static SampleQuery of(SeriesKey key, TimeRange timeRange) {
        return SampleQuery.builder()
                .measurement(key.measurement())
                .field(key.field())
                .instance(key.instance())
                .timeRange(timeRange)
                .build();
    }
}
