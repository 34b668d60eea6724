package com.wangbin.sentinel.core.sink;

import com.wangbin.sentinel.common.utils.JsonUtil;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * 日志接收端：一行摘要加完整 JSON 载荷
 */
@Slf4j
public class LoggingAlertSink implements AlertSink {

    private final String status;

    public LoggingAlertSink(String status) {
        this.status = status;
    }

    @Override
    public String getName() {
        return "logging";
    }

    @Override
    public void deliver(AlertEvent event) {
        AlertNotification notification = AlertNotification.from(event, status);
        log.warn("告警 | status={} rule={} check={} msg={}",
                notification.getStatus(),
                notification.getNotificationRuleName(),
                notification.getCheckName(),
                notification.getMessage());
        log.info("告警载荷: {}", JsonUtil.toJsonString(notification));
    }
}
