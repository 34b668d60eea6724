package com.wangbin.sentinel.core.engine.model;

import java.util.Objects;

/**
 * 时间序列分区标识：measurement + field + instance。
 */
public record SeriesKey(String measurement, String field, String instance) {

    public SeriesKey {
        Objects.requireNonNull(measurement, "measurement");
        Objects.requireNonNull(field, "field");
    }

    public boolean matches(Sample sample) {
        return measurement.equals(sample.getMeasurement())
                && field.equals(sample.getField())
                && Objects.equals(instance, sample.getInstance());
    }

    @Override
    public String toString() {
        return instance == null
                ? measurement + "." + field
                : measurement + "." + field + "[" + instance + "]";
    }
}
