package com.wangbin.sentinel.core.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Clock;
import java.time.Duration;

/**
 * 引擎运行参数
 */
@Value
@Builder
public class EngineSettings {

    /**
     * 持续轮询间隔，0 表示每个通道只查询一次
     */
    @Builder.Default
    Duration pollInterval = Duration.ZERO;

    /**
     * 汇聚器乱序容忍窗口，0 表示只按水位线释放，为空时取查询时间范围的跨度
     */
    Duration outOfOrderTolerance;

    /**
     * 轮询模式下数据写入的延迟：每轮查询后通道水位线推进到 (当前时间 - ingestDelay)
     */
    @Builder.Default
    Duration ingestDelay = Duration.ZERO;

    /**
     * 通道线程上限，0 表示每个通道一个线程
     */
    @Builder.Default
    int maxLaneThreads = 0;

    /**
     * 停止时等待通道结束的时间
     */
    @Builder.Default
    Duration shutdownTimeout = Duration.ofSeconds(30);

    @Builder.Default
    Clock clock = Clock.systemUTC();

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }
}
