package com.wangbin.sentinel.api.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.sentinel.api.dto.InfluxAlertPayload;
import com.wangbin.sentinel.common.utils.JsonUtil;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * InfluxDB 通知端点的接收服务，告警写入独立的滚动日志 influx_alerts.log
 */
@RestController
@RequiredArgsConstructor
public class AlertReceiverController {

    static final String RECEIVER_LOGGER = "influx_alert_receiver";

    private static final Logger alertLog = LoggerFactory.getLogger(RECEIVER_LOGGER);

    private final ObjectMapper objectMapper;

    @GetMapping("/healthz")
    public Map<String, String> healthz() {
        return Map.of("status", "ok");
    }

    @PostMapping(value = "/alerts/influx", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, String>> receive(@RequestBody(required = false) String body) {
        if (!JsonUtil.isValidJson(body)) {
            alertLog.warn("告警请求体不是合法JSON");
            return ResponseEntity.badRequest().body(Map.of("detail", "Invalid JSON: " + abbreviate(body)));
        }
        InfluxAlertPayload alert;
        try {
            alert = objectMapper.readValue(body, InfluxAlertPayload.class);
        } catch (JsonProcessingException e) {
            alertLog.warn("告警请求体解析失败: {}", e.getOriginalMessage());
            return ResponseEntity.badRequest().body(Map.of("detail", "Invalid JSON: " + e.getOriginalMessage()));
        }
        alertLog.info("Influx alert received | {}", alert.summary());
        alertLog.info("Full payload: {}", body);
        return ResponseEntity.ok(Map.of("status", "accepted"));
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "empty body";
        }
        return body.length() > 64 ? body.substring(0, 64) + "..." : body;
    }
}
