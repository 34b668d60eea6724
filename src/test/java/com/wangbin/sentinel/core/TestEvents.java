package com.wangbin.sentinel.core;

import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.ViolationKind;

import java.time.Instant;

/**
 * 测试用告警构造
 */
public final class TestEvents {

    public static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private TestEvents() {
    }

    public static AlertEvent lowBattery(int second, int runStartSecond) {
        return AlertEvent.builder()
                .time(T0.plusSeconds(second))
                .checkName("battery")
                .measurement("BAT")
                .field("Volt")
                .instance("0")
                .value(38.0)
                .durationSeconds(second - runStartSecond)
                .runStart(T0.plusSeconds(runStartSecond))
                .alertName("Battery Low")
                .kind(ViolationKind.LOW)
                .build();
    }
}
