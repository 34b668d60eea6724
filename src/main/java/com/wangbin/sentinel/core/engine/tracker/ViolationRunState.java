package com.wangbin.sentinel.core.engine.tracker;

import com.wangbin.sentinel.core.engine.model.ViolationKind;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 单个通道的连续越限状态，仅由 {@link ViolationStateTracker} 修改。
 */
@Getter
@ToString
public class ViolationRunState {

    private boolean active;
    private Instant startTime;
    private ViolationKind violationKind;

    void start(Instant startTime, ViolationKind kind) {
        this.active = true;
        this.startTime = startTime;
        this.violationKind = kind;
    }

    void reset() {
        this.active = false;
        this.startTime = null;
        this.violationKind = null;
    }
}
