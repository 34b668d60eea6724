package com.wangbin.sentinel.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * InfluxDB 通知端点推送的告警，常见字段之外的内容保存在 extra 中
 */
@Data
public class InfluxAlertPayload {

    private String status;

    @JsonAlias("notificationRuleName")
    private String rule;

    @JsonAlias("checkName")
    private String check;

    private String message;

    private String sourceTimestamp;

    private String id;

    private Map<String, Object> data = new LinkedHashMap<>();

    private final Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    public String summary() {
        return String.format("status=%s rule=%s check=%s msg=%s",
                status != null ? status : "unknown",
                rule != null ? rule : "-",
                check != null ? check : "-",
                message != null ? message : "-");
    }
}
