package com.wangbin.sentinel.core.engine.tracker;

import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.ViolationKind;

import java.time.Instant;

/**
 * 单个样本的跟踪结果。未越限时 kind 与 runStart 为空，持续时间为 0。
 */
public record TrackerUpdate(Sample sample,
                            ViolationKind kind,
                            Instant runStart,
                            double durationSeconds,
                            boolean runStarted) {

    public static TrackerUpdate compliant(Sample sample) {
        return new TrackerUpdate(sample, null, null, 0d, false);
    }

    public boolean violating() {
        return kind != null;
    }
}
