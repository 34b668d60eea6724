package com.wangbin.sentinel.core.sink;

import com.wangbin.sentinel.common.exception.AlertSinkException;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Webhook 接收端：以 JSON 形式 POST {@link AlertNotification}
 */
@Slf4j
public class WebhookAlertSink implements AlertSink {

    private final RestTemplate restTemplate;
    private final String url;
    private final String status;

    private final AtomicLong successCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);

    public WebhookAlertSink(RestTemplate restTemplate, String url, String status) {
        this.restTemplate = restTemplate;
        this.url = url;
        this.status = status;
    }

    @Override
    public String getName() {
        return "webhook";
    }

    @Override
    public void deliver(AlertEvent event) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        AlertNotification notification = AlertNotification.from(event, status);
        try {
            ResponseEntity<String> response = restTemplate.postForEntity(
                    url, new HttpEntity<>(notification, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                failureCount.incrementAndGet();
                throw new AlertSinkException(getName(), "Webhook 返回非成功状态: " + response.getStatusCode());
            }
            successCount.incrementAndGet();
            log.debug("Webhook 投递成功: {} -> {}", notification.getNotificationRuleName(), url);
        } catch (RestClientException e) {
            failureCount.incrementAndGet();
            throw new AlertSinkException(getName(), "Webhook 投递失败: " + url + " - " + e.getMessage(), e);
        }
    }

    public long getSuccessCount() {
        return successCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }
}
