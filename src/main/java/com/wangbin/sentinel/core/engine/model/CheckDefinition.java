package com.wangbin.sentinel.core.engine.model;

import com.wangbin.sentinel.common.exception.CheckConfigException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 单个指标的阈值检查定义，启动时由静态配置创建，之后不再修改。
 *
 * <p>构造时完成校验，非法定义抛出 {@link CheckConfigException}：
 * 未设置任何边界、边界缺少对应告警名、最短持续时间为负、下限大于上限。
 */
@Getter
@ToString
@EqualsAndHashCode
public class CheckDefinition {

    private final String name;
    private final String measurement;
    private final String field;
    private final String instanceFilter;
    private final Double minValue;
    private final Double maxValue;
    private final double minDurationSeconds;
    private final String lowAlertName;
    private final String highAlertName;

    @Builder
    private CheckDefinition(String name,
                            String measurement,
                            String field,
                            String instanceFilter,
                            Double minValue,
                            Double maxValue,
                            double minDurationSeconds,
                            String lowAlertName,
                            String highAlertName) {
        this.measurement = trimToNull(measurement);
        this.field = trimToNull(field);
        this.instanceFilter = trimToNull(instanceFilter);
        this.name = trimToNull(name) != null ? name.trim() : defaultName();
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.minDurationSeconds = minDurationSeconds;
        this.lowAlertName = trimToNull(lowAlertName);
        this.highAlertName = trimToNull(highAlertName);
        validate();
    }

    private void validate() {
        if (measurement == null || field == null) {
            throw new CheckConfigException(name, "measurement 和 field 不能为空");
        }
        if (minValue == null && maxValue == null) {
            throw new CheckConfigException(name, "至少需要设置 minValue 或 maxValue");
        }
        if (minValue != null && (minValue.isNaN() || lowAlertName == null)) {
            throw new CheckConfigException(name, "设置了 minValue 但缺少 lowAlertName");
        }
        if (maxValue != null && (maxValue.isNaN() || highAlertName == null)) {
            throw new CheckConfigException(name, "设置了 maxValue 但缺少 highAlertName");
        }
        if (Double.isNaN(minDurationSeconds) || minDurationSeconds < 0) {
            throw new CheckConfigException(name, "minDurationSeconds 不能为负数: " + minDurationSeconds);
        }
        if (minValue != null && maxValue != null && minValue > maxValue) {
            throw new CheckConfigException(name,
                    String.format("minValue(%s) 大于 maxValue(%s)", minValue, maxValue));
        }
    }

    public boolean hasMin() {
        return minValue != null;
    }

    public boolean hasMax() {
        return maxValue != null;
    }

    /**
     * 仅在定义了实例过滤时才比较实例标签
     */
    public boolean matches(Sample sample) {
        if (!measurement.equals(sample.getMeasurement()) || !field.equals(sample.getField())) {
            return false;
        }
        return instanceFilter == null || instanceFilter.equals(sample.getInstance());
    }

    public String alertNameFor(ViolationKind kind) {
        return kind == ViolationKind.LOW ? lowAlertName : highAlertName;
    }

    public Double boundFor(ViolationKind kind) {
        return kind == ViolationKind.LOW ? minValue : maxValue;
    }

    private String defaultName() {
        String base = measurement + "." + field;
        return instanceFilter == null ? base : base + "[" + instanceFilter + "]";
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
