package com.wangbin.sentinel.core.engine.evaluator;

import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.engine.model.LaneKey;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.SeriesKey;
import com.wangbin.sentinel.core.engine.tracker.TrackerUpdate;
import com.wangbin.sentinel.core.engine.tracker.ViolationStateTracker;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 检查评估器
 *
 * 驱动一个检查定义在单个通道（检查 + 实例）上运行。电平触发：
 * 只要当前越限段持续时间不小于 minDurationSeconds，每个样本都产生一条告警，
 * 告警时间为样本自身时间，持续时间从越限段起点算起。去重交给下游。
 */
@Slf4j
public class CheckEvaluator {

    @Getter
    private final LaneKey laneKey;

    @Getter
    private final CheckDefinition definition;

    @Getter
    private final SeriesKey seriesKey;

    private final ViolationStateTracker tracker;

    // 统计信息
    private final AtomicLong samplesSeen = new AtomicLong(0);
    private final AtomicLong violatingSamples = new AtomicLong(0);
    private final AtomicLong alertsEmitted = new AtomicLong(0);
    private final AtomicLong runsStarted = new AtomicLong(0);

    /**
     * @param definition 已校验的检查定义，构造 CheckDefinition 时已抛出配置异常
     * @param laneKey    通道标识，instance 为空表示无实例标签的分区
     */
    public CheckEvaluator(CheckDefinition definition, LaneKey laneKey) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.laneKey = Objects.requireNonNull(laneKey, "laneKey");
        if (definition.getInstanceFilter() != null
                && !definition.getInstanceFilter().equals(laneKey.instance())) {
            throw new IllegalArgumentException(String.format(
                    "通道实例 %s 与检查 %s 的实例过滤 %s 不一致",
                    laneKey.instance(), definition.getName(), definition.getInstanceFilter()));
        }
        this.seriesKey = new SeriesKey(definition.getMeasurement(), definition.getField(), laneKey.instance());
        this.tracker = new ViolationStateTracker(definition);
    }

    public Optional<AlertEvent> evaluate(Sample sample) {
        if (!seriesKey.matches(sample)) {
            throw new IllegalStateException(String.format(
                    "通道 %s 收到不属于本分区的样本: %s", laneKey, sample.seriesKey()));
        }
        samplesSeen.incrementAndGet();

        TrackerUpdate update = tracker.observe(sample);
        if (!update.violating()) {
            return Optional.empty();
        }
        violatingSamples.incrementAndGet();
        if (update.runStarted()) {
            runsStarted.incrementAndGet();
        }
        if (update.durationSeconds() < definition.getMinDurationSeconds()) {
            return Optional.empty();
        }

        String alertName = definition.alertNameFor(update.kind());
        if (alertName == null) {
            return Optional.empty();
        }

        alertsEmitted.incrementAndGet();
        AlertEvent event = AlertEvent.builder()
                .time(sample.getTimestamp())
                .checkName(definition.getName())
                .measurement(sample.getMeasurement())
                .field(sample.getField())
                .instance(sample.getInstance())
                .value(sample.getValue())
                .durationSeconds(update.durationSeconds())
                .runStart(update.runStart())
                .alertName(alertName)
                .kind(update.kind())
                .build();
        log.debug("告警产生: lane={}, alert={}, value={}, duration={}s",
                laneKey, alertName, sample.getValue(), update.durationSeconds());
        return Optional.of(event);
    }

    /**
     * 批量评估，按输入顺序返回告警
     */
    public List<AlertEvent> evaluateAll(Iterable<Sample> samples) {
        List<AlertEvent> events = new ArrayList<>();
        for (Sample sample : samples) {
            evaluate(sample).ifPresent(events::add);
        }
        return events;
    }

    /**
     * 通道所有权结束时重置越限状态
     */
    public void reset() {
        tracker.reset();
    }

    public boolean isRunActive() {
        return tracker.getState().isActive();
    }

    public long getSamplesSeen() {
        return samplesSeen.get();
    }

    public long getViolatingSamples() {
        return violatingSamples.get();
    }

    public long getAlertsEmitted() {
        return alertsEmitted.get();
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("lane", laneKey.id());
        stats.put("samplesSeen", samplesSeen.get());
        stats.put("violatingSamples", violatingSamples.get());
        stats.put("runsStarted", runsStarted.get());
        stats.put("alertsEmitted", alertsEmitted.get());
        stats.put("runActive", isRunActive());
        return stats;
    }
}
