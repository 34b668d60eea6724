package com.wangbin.sentinel.monitor.health;

import com.wangbin.sentinel.core.engine.lane.LaneSnapshot;
import com.wangbin.sentinel.core.engine.lane.LaneStatus;
import com.wangbin.sentinel.core.dispatch.AlertDispatcher;
import com.wangbin.sentinel.core.dispatch.OverflowStrategy;
import com.wangbin.sentinel.core.engine.AlertEngine;
import com.wangbin.sentinel.core.engine.EngineSettings;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.source.InMemorySampleSource;
import com.wangbin.sentinel.core.source.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineHealthServiceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    void failedLaneMarksCheckDown() {
        ComponentHealth health = EngineHealthService.buildCheckHealth("battery", List.of(
                lane("battery#0", LaneStatus.RUNNING, null),
                lane("battery#1", LaneStatus.FAILED, "out of order")));

        assertEquals(HealthStatus.Status.DOWN, health.getStatus());
        assertEquals("out of order", health.getDetails().get("error:battery#1"));
    }

    @Test
    void degradedLaneMarksCheckDegraded() {
        ComponentHealth health = EngineHealthService.buildCheckHealth("battery", List.of(
                lane("battery#0", LaneStatus.DEGRADED, "timeout"),
                lane("battery#1", LaneStatus.COMPLETED, null)));

        assertEquals(HealthStatus.Status.DEGRADED, health.getStatus());
        assertEquals(2, health.getDetails().get("lanes"));
    }

    @Test
    void aggregatePrefersWorstStatus() {
        ComponentHealth up = ComponentHealth.builder().name("a").status(HealthStatus.Status.UP).build();
        ComponentHealth degraded = ComponentHealth.builder().name("b").status(HealthStatus.Status.DEGRADED).build();
        ComponentHealth down = ComponentHealth.builder().name("c").status(HealthStatus.Status.DOWN).build();

        assertEquals(HealthStatus.Status.UP, HealthStatus.aggregate(List.of(up)));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.aggregate(List.of(up, degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.aggregate(List.of(degraded, down, up)));
        assertEquals(HealthStatus.Status.UNKNOWN, HealthStatus.aggregate(List.of()));

        ComponentHealth unknown = ComponentHealth.builder().name("d").status(HealthStatus.Status.UNKNOWN).build();
        assertEquals(HealthStatus.Status.UNKNOWN, HealthStatus.aggregate(List.of(up, unknown)));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.aggregate(List.of(unknown, degraded)));
    }

    @Test
    void systemHealthCountsLanesAndKeysComponents() throws Exception {
        CheckDefinition battery = CheckDefinition.builder()
                .name("battery")
                .measurement("BAT").field("Volt").instanceFilter("0")
                .minValue(39.5).lowAlertName("Battery Low")
                .build();
        AlertEngine engine = new AlertEngine(List.of(battery),
                new InMemorySampleSource(List.of(Sample.of(T0, "BAT", "Volt", "0", 45.0))),
                EngineSettings.defaults());
        AlertDispatcher dispatcher = new AlertDispatcher(10, 10, 10, OverflowStrategy.BLOCK);
        engine.start(TimeRange.since(T0), event -> { });
        assertTrue(engine.awaitCompletion(Duration.ofSeconds(5)));

        EngineHealthService service = new EngineHealthService(engine, dispatcher);
        HealthStatus health = service.getSystemHealth();

        assertEquals(HealthStatus.Status.UP, health.getStatus());
        assertFalse(health.isEngineRunning());
        assertEquals(1, health.getLaneCount());
        assertEquals(1L, health.getLaneStatusCounts().get(LaneStatus.COMPLETED));
        assertEquals(List.of("check:battery", "dispatcher"), List.copyOf(health.getComponents().keySet()));
        assertEquals(ComponentHealth.Kind.CHECK, service.getComponentHealth("check:battery").orElseThrow().getKind());
        assertTrue(service.getComponentHealth("check:missing").isEmpty());
    }

    private static LaneSnapshot lane(String id, LaneStatus status, String error) {
        return new LaneSnapshot(id, "battery", id.substring(id.indexOf('#') + 1), status, 0, 0, 0, null, error);
    }
}
