package com.wangbin.sentinel.core.sink;

import com.wangbin.sentinel.core.engine.model.AlertEvent;
import lombok.Builder;
import lombok.Value;

import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Webhook 通知载荷，字段与 InfluxDB 通知端点一致。
 */
@Value
@Builder
public class AlertNotification {
    String status;
    String notificationRuleName;
    String checkName;
    String message;
    String sourceTimestamp;

    public static AlertNotification from(AlertEvent event, String status) {
        return AlertNotification.builder()
                .status(status)
                .notificationRuleName(event.getAlertName())
                .checkName(event.getCheckName())
                .message(describe(event))
                .sourceTimestamp(DateTimeFormatter.ISO_INSTANT.format(event.getTime()))
                .build();
    }

    public static String describe(AlertEvent event) {
        return String.format(Locale.ROOT, "%s: %s=%s %s, 已持续 %.3fs",
                event.getAlertName(),
                event.seriesKey(),
                event.getValue(),
                event.getKind().getDescription(),
                event.getDurationSeconds());
    }
}
