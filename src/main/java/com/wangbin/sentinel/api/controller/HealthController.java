package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.monitor.health.ComponentHealth;
import com.wangbin.sentinel.monitor.health.EngineHealthService;
import com.wangbin.sentinel.monitor.health.HealthStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 告警引擎健康检查接口。整体状态为 DOWN 时返回 503，便于负载均衡探测
 */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

    private final EngineHealthService engineHealthService;

    @GetMapping
    public ResponseEntity<HealthStatus> health() {
        HealthStatus health = engineHealthService.getSystemHealth();
        HttpStatus code = health.getStatus() == HealthStatus.Status.DOWN
                ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(code).body(health);
    }

    @GetMapping("/components/{key}")
    public ResponseEntity<ComponentHealth> component(@PathVariable String key) {
        return engineHealthService.getComponentHealth(key)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
