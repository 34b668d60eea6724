package com.wangbin.sentinel.core.engine.lane;

import java.time.Instant;

/**
 * 通道运行状态快照
 */
public record LaneSnapshot(String lane,
                           String checkName,
                           String instance,
                           LaneStatus status,
                           long samplesSeen,
                           long violatingSamples,
                           long alertsEmitted,
                           Instant watermark,
                           String lastError) {
}
