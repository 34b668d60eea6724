package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.SeriesKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * 推送模式数据源
 *
 * 生产者调用 {@link #publish(Sample)} 把样本写入对应分区的阻塞队列，
 * 通道迭代器阻塞等待新样本，{@link #complete()} 之后队列耗尽即结束。
 * 每个分区只允许一个消费者。
 *
 * 通道等待超时时报告已推送样本的最新时间，空闲通道据此推进水位线，
 * 不会拖住其他通道的告警。引擎声明分区后，未声明分区的样本不入队，只计数。
 */
@Slf4j
public class PushSampleSource implements SampleSource {

    private static final Object END = new Object();

    private final int capacity;
    private final long pollTimeoutMs;
    private final Map<SeriesKey, BlockingQueue<Object>> queues = new ConcurrentHashMap<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);
    private final AtomicReference<Instant> newestPublished = new AtomicReference<>();
    private final AtomicLong unroutedCount = new AtomicLong(0);
    private final Set<SeriesKey> reportedUnrouted = ConcurrentHashMap.newKeySet();
    private volatile Set<SeriesKey> declared;

    public PushSampleSource(int capacity, long pollTimeoutMs) {
        this.capacity = Math.max(1, capacity);
        this.pollTimeoutMs = Math.max(1L, pollTimeoutMs);
    }

    @Override
    public String getName() {
        return "push";
    }

    /**
     * 推送一个样本，队列满时阻塞
     *
     * @return 样本所属分区没有通道读取时返回 false
     */
    public boolean publish(Sample sample) throws InterruptedException {
        if (completed.get()) {
            throw new IllegalStateException("数据源已结束，不能再推送样本");
        }
        SeriesKey key = sample.seriesKey();
        Set<SeriesKey> routed = declared;
        if (routed != null && !routed.contains(key)) {
            unroutedCount.incrementAndGet();
            if (reportedUnrouted.add(key)) {
                log.warn("分区 {} 没有对应的检查通道，样本不会被评估", key);
            }
            return false;
        }
        queueFor(key).put(sample);
        newestPublished.accumulateAndGet(sample.getTimestamp(),
                (current, candidate) -> current == null || candidate.isAfter(current) ? candidate : current);
        return true;
    }

    @Override
    public boolean supportsInstanceDiscovery() {
        return false;
    }

    @Override
    public void declarePartitions(Collection<SeriesKey> partitions) {
        Set<SeriesKey> routed = Set.copyOf(partitions);
        declared = routed;
        queues.keySet().removeIf(key -> {
            if (routed.contains(key)) {
                return false;
            }
            BlockingQueue<Object> queue = queues.get(key);
            int pending = queue == null ? 0 : queue.size();
            unroutedCount.addAndGet(pending);
            log.warn("分区 {} 没有对应的检查通道，丢弃已缓存样本 {} 个", key, pending);
            return true;
        });
        log.info("推送数据源已声明 {} 个分区", routed.size());
    }

    /**
     * 结束所有分区的样本流
     */
    public void complete() {
        if (completed.compareAndSet(false, true)) {
            queues.values().forEach(queue -> queue.offer(END));
            log.info("推送数据源已结束，共 {} 个分区", queues.size());
        }
    }

    @Override
    public Iterator<Sample> open(SampleQuery query) {
        return open(query, progress -> { });
    }

    @Override
    public Iterator<Sample> open(SampleQuery query, Consumer<Instant> progress) {
        BlockingQueue<Object> queue = queueFor(query.seriesKey());
        return new Iterator<>() {
            private Sample next;
            private boolean done;

            @Override
            public boolean hasNext() {
                while (next == null && !done) {
                    Object item;
                    try {
                        item = queue.poll(pollTimeoutMs, TimeUnit.MILLISECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new SampleSourceException(getName(), query.seriesKey().toString(), "等待样本时被中断", e);
                    }
                    if (item == END || (item == null && completed.get() && queue.isEmpty())) {
                        done = true;
                    } else if (item == null) {
                        Instant newest = newestPublished.get();
                        if (newest != null) {
                            progress.accept(newest);
                        }
                    } else if (item != null) {
                        Sample sample = (Sample) item;
                        if (query.getTimeRange().contains(sample.getTimestamp())) {
                            next = sample;
                        }
                    }
                }
                return next != null;
            }

            @Override
            public Sample next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Sample result = next;
                next = null;
                return result;
            }
        };
    }

    @Override
    public List<String> discoverInstances(String measurement, String field, TimeRange timeRange) {
        TreeSet<String> tagged = new TreeSet<>();
        boolean untagged = false;
        for (SeriesKey key : queues.keySet()) {
            if (key.measurement().equals(measurement) && key.field().equals(field)) {
                if (key.instance() == null) {
                    untagged = true;
                } else {
                    tagged.add(key.instance());
                }
            }
        }
        List<String> instances = new ArrayList<>();
        if (untagged) {
            instances.add(null);
        }
        instances.addAll(tagged);
        return instances;
    }

    public long getUnroutedCount() {
        return unroutedCount.get();
    }

    private BlockingQueue<Object> queueFor(SeriesKey key) {
        Objects.requireNonNull(key, "key");
        return queues.computeIfAbsent(key, k -> {
            BlockingQueue<Object> queue = new LinkedBlockingQueue<>(capacity);
            if (completed.get()) {
                queue.offer(END);
            }
            return queue;
        });
    }
}
