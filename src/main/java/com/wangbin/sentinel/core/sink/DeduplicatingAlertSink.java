package com.wangbin.sentinel.core.sink;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 去重接收端
 *
 * 电平触发的告警在同一越限段内会逐样本重复出现，这里按
 * (检查, 实例, 方向, 越限段起点) 只放行第一条。
 */
@Slf4j
public class DeduplicatingAlertSink implements AlertSink {

    private final AlertSink delegate;
    private final Cache<String, Boolean> seenRuns;
    private final AtomicLong suppressedCount = new AtomicLong(0);

    public DeduplicatingAlertSink(AlertSink delegate, Duration ttl, long maxRuns) {
        this.delegate = delegate;
        this.seenRuns = Caffeine.newBuilder()
                .maximumSize(maxRuns)
                .expireAfterWrite(ttl)
                .build();
    }

    @Override
    public String getName() {
        return "dedup(" + delegate.getName() + ")";
    }

    @Override
    public void deliver(AlertEvent event) {
        String runKey = runKey(event);
        if (seenRuns.asMap().putIfAbsent(runKey, Boolean.TRUE) != null) {
            suppressedCount.incrementAndGet();
            return;
        }
        try {
            delegate.deliver(event);
        } catch (RuntimeException e) {
            // 投递失败时允许同一越限段的下一条告警重试
            seenRuns.invalidate(runKey);
            throw e;
        }
    }

    static String runKey(AlertEvent event) {
        return event.getCheckName() + "|" + event.seriesKey() + "|" + event.getKind() + "|" + event.getRunStart();
    }

    public long getSuppressedCount() {
        return suppressedCount.get();
    }
}
