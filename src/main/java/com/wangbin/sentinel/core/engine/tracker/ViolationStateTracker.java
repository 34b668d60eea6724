package com.wangbin.sentinel.core.engine.tracker;

import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.ViolationKind;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * 连续越限跟踪器
 *
 * 对一个通道按时间顺序到达的样本逐个分类（低于下限/高于上限/正常），
 * 并维护当前连续越限段的起点与方向：
 * 1. 越限且无活动段：以该样本时间开启新段
 * 2. 越限且方向相同：延续，持续时间 = 样本时间 - 起点
 * 3. 越限但方向改变：旧段直接关闭，以该样本时间按新方向重新开启
 * 4. 不越限：关闭活动段
 *
 * 是否产生告警由 CheckEvaluator 决定。非线程安全，一个通道一个实例。
 */
@Slf4j
public class ViolationStateTracker {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final CheckDefinition definition;
    private final ViolationRunState state = new ViolationRunState();

    public ViolationStateTracker(CheckDefinition definition) {
        this.definition = definition;
    }

    public TrackerUpdate observe(Sample sample) {
        ViolationKind kind = classify(sample.getValue());

        if (kind == null) {
            if (state.isActive()) {
                log.debug("越限段结束: check={}, instance={}, at={}",
                        definition.getName(), sample.getInstance(), sample.getTimestamp());
                state.reset();
            }
            return TrackerUpdate.compliant(sample);
        }

        if (!state.isActive()) {
            state.start(sample.getTimestamp(), kind);
            return new TrackerUpdate(sample, kind, sample.getTimestamp(), 0d, true);
        }

        if (state.getViolationKind() != kind) {
            log.debug("越限方向切换 {} -> {}: check={}, at={}",
                    state.getViolationKind(), kind, definition.getName(), sample.getTimestamp());
            state.start(sample.getTimestamp(), kind);
            return new TrackerUpdate(sample, kind, sample.getTimestamp(), 0d, true);
        }

        Instant start = state.getStartTime();
        if (sample.getTimestamp().isBefore(start)) {
            throw new IllegalStateException(String.format(
                    "样本时间倒序: check=%s, series=%s, runStart=%s, sample=%s",
                    definition.getName(), sample.seriesKey(), start, sample.getTimestamp()));
        }
        return new TrackerUpdate(sample, kind, start, secondsBetween(start, sample.getTimestamp()), false);
    }

    /**
     * 分类样本值。NaN 与任何边界比较均为 false，视为正常。
     */
    ViolationKind classify(double value) {
        boolean lowViolation = definition.hasMin() && value < definition.getMinValue();
        boolean highViolation = definition.hasMax() && value > definition.getMaxValue();
        if (lowViolation) {
            return ViolationKind.LOW;
        }
        return highViolation ? ViolationKind.HIGH : null;
    }

    public void reset() {
        state.reset();
    }

    public ViolationRunState getState() {
        return state;
    }

    static double secondsBetween(Instant start, Instant end) {
        Duration duration = Duration.between(start, end);
        return duration.getSeconds() + duration.getNano() / NANOS_PER_SECOND;
    }
}
