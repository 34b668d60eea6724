package com.wangbin.sentinel.monitor.health;

import com.wangbin.sentinel.core.dispatch.AlertDispatcher;
import com.wangbin.sentinel.core.engine.AlertEngine;
import com.wangbin.sentinel.core.engine.lane.LaneSnapshot;
import com.wangbin.sentinel.core.engine.lane.LaneStatus;
import com.wangbin.sentinel.monitor.health.HealthStatus.Status;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 聚合告警引擎各通道与投递调度器的健康信息
 */
@Service
@RequiredArgsConstructor
public class EngineHealthService {

    private final AlertEngine alertEngine;
    private final AlertDispatcher alertDispatcher;

    public HealthStatus getSystemHealth() {
        List<LaneSnapshot> snapshots = alertEngine.getLaneSnapshots();
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        Map<String, List<LaneSnapshot>> byCheck = snapshots.stream()
                .collect(Collectors.groupingBy(LaneSnapshot::checkName, LinkedHashMap::new, Collectors.toList()));
        byCheck.forEach((check, lanes) -> {
            ComponentHealth health = buildCheckHealth(check, lanes);
            components.put(health.key(), health);
        });
        ComponentHealth dispatcher = buildDispatcherHealth();
        components.put(dispatcher.key(), dispatcher);

        return HealthStatus.builder()
                .status(HealthStatus.aggregate(components.values()))
                .engineRunning(alertEngine.isRunning())
                .laneCount(snapshots.size())
                .laneStatusCounts(countByStatus(snapshots))
                .components(components)
                .build();
    }

    /**
     * 按组件键查询，例如 check:battery、dispatcher
     */
    public Optional<ComponentHealth> getComponentHealth(String key) {
        return Optional.ofNullable(getSystemHealth().getComponents().get(key));
    }

    private static Map<LaneStatus, Long> countByStatus(List<LaneSnapshot> lanes) {
        Map<LaneStatus, Long> counts = new EnumMap<>(LaneStatus.class);
        lanes.forEach(lane -> counts.merge(lane.status(), 1L, Long::sum));
        return counts;
    }

    static ComponentHealth buildCheckHealth(String check, List<LaneSnapshot> lanes) {
        Map<LaneStatus, Long> counts = countByStatus(lanes);

        Status status = Status.UP;
        String message = "lanes healthy";
        if (counts.containsKey(LaneStatus.FAILED)) {
            status = Status.DOWN;
            message = "lane failed";
        } else if (counts.containsKey(LaneStatus.DEGRADED)) {
            status = Status.DEGRADED;
            message = "sample source unavailable";
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("lanes", lanes.size());
        details.put("statusCounts", counts);
        lanes.stream()
                .filter(lane -> lane.lastError() != null)
                .forEach(lane -> details.put("error:" + lane.lane(), lane.lastError()));
        return ComponentHealth.builder()
                .name(check)
                .kind(ComponentHealth.Kind.CHECK)
                .status(status)
                .message(message)
                .details(details)
                .build();
    }

    private ComponentHealth buildDispatcherHealth() {
        Map<String, Object> details = new LinkedHashMap<>(alertDispatcher.getStatistics());
        Status status = alertDispatcher.getSinkFailureCount() > 0 ? Status.DEGRADED : Status.UP;
        return ComponentHealth.builder()
                .name("dispatcher")
                .kind(ComponentHealth.Kind.DISPATCHER)
                .status(status)
                .message(status == Status.UP ? "dispatcher running" : "sink delivery failures")
                .details(details)
                .build();
    }
}
