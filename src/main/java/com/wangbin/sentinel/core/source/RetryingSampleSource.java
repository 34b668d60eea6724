package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.SeriesKey;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 带指数退避重试的数据源装饰器。引擎本身不做重试。
 */
@Slf4j
public class RetryingSampleSource implements SampleSource {

    private final SampleSource delegate;

    @Getter
    private final int maxAttempts;

    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    private final AtomicLong retryCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);

    public RetryingSampleSource(SampleSource delegate,
                                int maxAttempts,
                                Duration initialBackoff,
                                double multiplier,
                                Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts 必须大于 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier 不能小于 1");
        }
        this.delegate = delegate;
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public Iterator<Sample> open(SampleQuery query) {
        return withRetry(() -> delegate.open(query), query.seriesKey().toString());
    }

    @Override
    public Iterator<Sample> open(SampleQuery query, Consumer<Instant> progress) {
        return withRetry(() -> delegate.open(query, progress), query.seriesKey().toString());
    }

    @Override
    public List<String> discoverInstances(String measurement, String field, TimeRange timeRange) {
        return withRetry(() -> delegate.discoverInstances(measurement, field, timeRange), measurement + "." + field);
    }

    private <T> T withRetry(Supplier<T> action, String series) {
        long backoffMs = initialBackoff.toMillis();
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (SampleSourceException e) {
                if (attempt >= maxAttempts) {
                    failureCount.incrementAndGet();
                    log.error("数据源 {} 读取 {} 失败，已重试 {} 次", getName(), series, attempt - 1);
                    throw e;
                }
                retryCount.incrementAndGet();
                log.warn("数据源 {} 读取 {} 失败，{}ms 后第 {} 次重试: {}",
                        getName(), series, backoffMs, attempt, e.getMessage());
                sleep(backoffMs, series, e);
                backoffMs = Math.min((long) (backoffMs * multiplier), maxBackoff.toMillis());
                attempt++;
            }
        }
    }

    private void sleep(long backoffMs, String series, SampleSourceException cause) {
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            SampleSourceException interrupted = new SampleSourceException(getName(), series, "重试等待被中断", e);
            interrupted.addSuppressed(cause);
            throw interrupted;
        }
    }

    @Override
    public boolean supportsInstanceDiscovery() {
        return delegate.supportsInstanceDiscovery();
    }

    @Override
    public void declarePartitions(Collection<SeriesKey> partitions) {
        delegate.declarePartitions(partitions);
    }

    public long getRetryCount() {
        return retryCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }
}
