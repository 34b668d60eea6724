package com.wangbin.sentinel.core.source;

import java.time.format.DateTimeFormatter;

/**
 * InfluxDB 3 SQL 构造器
 *
 * 字段名映射：VIBE.Clip 在库中按实例拆成 Clip0/Clip1/Clip2，映射后实例已编码在字段名中，
 * 不再追加实例标签过滤。
 */
public class InfluxQueryBuilder {

    private static final DateTimeFormatter SQL_TIME = DateTimeFormatter.ISO_INSTANT;

    private final String instanceTag;

    /**
     * @param instanceTag 实例标签列名，为空表示不按实例过滤
     */
    public InfluxQueryBuilder(String instanceTag) {
        this.instanceTag = instanceTag == null || instanceTag.isBlank() ? null : instanceTag.trim();
    }

    public static String mapFieldName(String measurement, String field, String instance) {
        if ("VIBE".equals(measurement) && "Clip".equals(field) && instance != null) {
            return "Clip" + instance;
        }
        return field;
    }

    public String buildSelect(SampleQuery query) {
        String mappedField = mapFieldName(query.getMeasurement(), query.getField(), query.getInstance());
        boolean fieldCarriesInstance = !mappedField.equals(query.getField());

        StringBuilder sql = new StringBuilder("SELECT time, ")
                .append(quoteIdentifier(mappedField)).append(" AS value");
        if (instanceTag != null && !fieldCarriesInstance) {
            sql.append(", ").append(quoteIdentifier(instanceTag)).append(" AS instance");
        }
        sql.append(" FROM ").append(quoteIdentifier(query.getMeasurement()))
                .append(" WHERE ").append(timeCondition(query.getTimeRange()))
                .append(" AND ").append(quoteIdentifier(mappedField)).append(" IS NOT NULL");
        if (instanceTag != null && query.getInstance() != null && !fieldCarriesInstance) {
            sql.append(" AND ").append(quoteIdentifier(instanceTag))
                    .append(" = ").append(quoteLiteral(query.getInstance()));
        }
        // 评估要求时间升序
        sql.append(" ORDER BY time ASC");
        if (query.getLimit() > 0) {
            sql.append(" LIMIT ").append(query.getLimit());
        }
        return sql.toString();
    }

    public String buildDistinctInstances(String measurement, String field, TimeRange timeRange) {
        if (instanceTag == null) {
            throw new IllegalStateException("未配置实例标签，无法发现实例");
        }
        return "SELECT DISTINCT " + quoteIdentifier(instanceTag) + " AS instance"
                + " FROM " + quoteIdentifier(measurement)
                + " WHERE " + timeCondition(timeRange)
                + " AND " + quoteIdentifier(field) + " IS NOT NULL"
                + " ORDER BY instance";
    }

    public String getInstanceTag() {
        return instanceTag;
    }

    static String timeCondition(TimeRange range) {
        String condition = "time >= '" + SQL_TIME.format(range.getStart()) + "'";
        if (range.getEnd() != null) {
            condition += " AND time <= '" + SQL_TIME.format(range.getEnd()) + "'";
        }
        return condition;
    }

    static String quoteIdentifier(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    static String quoteLiteral(String literal) {
        return "'" + literal.replace("'", "''") + "'";
    }
}
