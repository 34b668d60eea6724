package com.wangbin.sentinel.core.engine;

import com.wangbin.sentinel.core.engine.lane.LaneSnapshot;
import com.wangbin.sentinel.core.engine.model.AlertEvent;

import java.util.List;

/**
 * 一次批量运行的结果：合并后的告警流与各通道最终状态
 */
public record EngineRun(List<AlertEvent> events, List<LaneSnapshot> lanes, long lateEvents) {
}
