package com.wangbin.sentinel.core.engine.aggregator;

import com.google.common.collect.Iterators;
import com.google.common.collect.Streams;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.LaneKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * 告警汇聚器
 *
 * 把多个并发通道产生的告警合并为按时间升序的单一告警流，时间相同时按通道注册顺序排列，
 * 同一通道内的告警顺序保持不变。
 *
 * 并发模式下各通道通过 publish/advance/close 上报告警与水位线，告警暂存在加锁的优先队列中，
 * 只有所有未关闭通道的水位线都已越过某条告警时才向下游释放。配置了乱序容忍窗口时，
 * 早于 (已见最新时间 - 容忍窗口) 的告警即使有通道滞后也会被释放，以限制缓冲区大小。
 */
@Slf4j
public class AlertAggregator {

    private static final Comparator<AlertEvent> BY_TIME = Comparator.comparing(AlertEvent::getTime);

    private final Consumer<AlertEvent> downstream;
    private final Duration outOfOrderTolerance;

    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<Pending> buffer = new PriorityQueue<>(
            Comparator.comparing((Pending p) -> p.event().getTime())
                    .thenComparingInt(Pending::laneOrder)
                    .thenComparingLong(Pending::sequence));
    private final Map<LaneKey, LaneCursor> lanes = new LinkedHashMap<>();

    private long sequence;
    private Instant newestSeen;
    private Instant lastReleased;

    // 统计信息
    private final AtomicLong publishedCount = new AtomicLong(0);
    private final AtomicLong releasedCount = new AtomicLong(0);
    private final AtomicLong lateCount = new AtomicLong(0);

    public AlertAggregator(Consumer<AlertEvent> downstream) {
        this(downstream, null);
    }

    /**
     * @param downstream          有序告警的消费者，在汇聚器锁内被调用
     * @param outOfOrderTolerance 乱序容忍窗口，为空或为 0 时只按水位线释放
     */
    public AlertAggregator(Consumer<AlertEvent> downstream, Duration outOfOrderTolerance) {
        this.downstream = downstream;
        this.outOfOrderTolerance = outOfOrderTolerance == null || outOfOrderTolerance.isZero()
                || outOfOrderTolerance.isNegative() ? null : outOfOrderTolerance;
    }

    /**
     * 按告警时间对多个已排序的告警流做 k 路归并
     */
    public static Iterator<AlertEvent> merge(List<? extends Iterator<AlertEvent>> eventStreams) {
        List<Iterator<Indexed>> indexed = new ArrayList<>(eventStreams.size());
        for (int i = 0; i < eventStreams.size(); i++) {
            int index = i;
            indexed.add(Iterators.transform(eventStreams.get(i), event -> new Indexed(event, index)));
        }
        Comparator<Indexed> order = Comparator.comparing(Indexed::event, BY_TIME)
                .thenComparingInt(Indexed::index);
        return Iterators.transform(Iterators.mergeSorted(indexed, order), Indexed::event);
    }

    public static Stream<AlertEvent> mergeStreams(List<Stream<AlertEvent>> eventStreams) {
        List<Iterator<AlertEvent>> iterators = new ArrayList<>(eventStreams.size());
        for (Stream<AlertEvent> stream : eventStreams) {
            iterators.add(stream.iterator());
        }
        return Streams.stream(merge(iterators))
                .onClose(() -> eventStreams.forEach(Stream::close));
    }

    public void register(LaneKey lane) {
        lock.lock();
        try {
            if (lanes.containsKey(lane)) {
                throw new IllegalStateException("通道重复注册: " + lane);
            }
            lanes.put(lane, new LaneCursor(lanes.size()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 上报一条告警。同一通道内告警时间不得倒退；早于通道已推进水位线或已释放告警的，
     * 记为迟到告警照常下发。
     */
    public void publish(LaneKey lane, AlertEvent event) {
        lock.lock();
        try {
            LaneCursor cursor = openCursor(lane);
            Instant time = event.getTime();
            if (cursor.lastEvent != null && time.isBefore(cursor.lastEvent)) {
                throw new IllegalStateException(String.format(
                        "通道 %s 告警时间倒序: last=%s, event=%s", lane, cursor.lastEvent, time));
            }
            boolean behindLane = cursor.watermark != null && time.isBefore(cursor.watermark);
            boolean behindOutput = lastReleased != null && time.isBefore(lastReleased);
            if (behindLane || behindOutput) {
                lateCount.incrementAndGet();
                log.warn("迟到告警: lane={}, time={}, watermark={}, lastReleased={}",
                        lane, time, cursor.watermark, lastReleased);
            }
            cursor.lastEvent = time;
            if (cursor.watermark == null || time.isAfter(cursor.watermark)) {
                cursor.watermark = time;
            }
            if (newestSeen == null || time.isAfter(newestSeen)) {
                newestSeen = time;
            }
            buffer.add(new Pending(event, cursor.order, sequence++));
            publishedCount.incrementAndGet();
            releaseReady();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 通道已处理到 watermark 时刻。之后若仍产生更早的告警，按迟到告警处理
     */
    public void advance(LaneKey lane, Instant watermark) {
        lock.lock();
        try {
            LaneCursor cursor = openCursor(lane);
            if (cursor.watermark == null || watermark.isAfter(cursor.watermark)) {
                cursor.watermark = watermark;
            }
            releaseReady();
        } finally {
            lock.unlock();
        }
    }

    public void close(LaneKey lane) {
        lock.lock();
        try {
            LaneCursor cursor = lanes.get(lane);
            if (cursor == null) {
                throw new IllegalStateException("未注册的通道: " + lane);
            }
            cursor.closed = true;
            releaseReady();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 无条件释放缓冲区内全部告警
     */
    public void flush() {
        lock.lock();
        try {
            while (!buffer.isEmpty()) {
                release(buffer.poll());
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed(LaneKey lane) {
        lock.lock();
        try {
            LaneCursor cursor = lanes.get(lane);
            return cursor != null && cursor.closed;
        } finally {
            lock.unlock();
        }
    }

    public int getBufferedCount() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("published", publishedCount.get());
        stats.put("released", releasedCount.get());
        stats.put("late", lateCount.get());
        stats.put("buffered", getBufferedCount());
        stats.put("outOfOrderTolerance", outOfOrderTolerance == null ? null : outOfOrderTolerance.toString());
        return stats;
    }

    public long getLateCount() {
        return lateCount.get();
    }

    private LaneCursor openCursor(LaneKey lane) {
        LaneCursor cursor = lanes.get(lane);
        if (cursor == null) {
            throw new IllegalStateException("未注册的通道: " + lane);
        }
        if (cursor.closed) {
            throw new IllegalStateException("通道已关闭，不能再上报告警: " + lane);
        }
        return cursor;
    }

    private void releaseReady() {
        Instant low = lowWatermark();
        Instant forced = outOfOrderTolerance != null && newestSeen != null
                ? newestSeen.minus(outOfOrderTolerance) : null;
        while (!buffer.isEmpty()) {
            Instant head = buffer.peek().event().getTime();
            boolean safe = low == null ? allClosed() : head.isBefore(low);
            boolean expired = forced != null && head.isBefore(forced);
            if (!safe && !expired) {
                break;
            }
            release(buffer.poll());
        }
    }

    /**
     * 未关闭通道中最小的水位线；存在尚无水位线的通道时返回 Instant.MIN
     */
    private Instant lowWatermark() {
        Instant low = null;
        for (LaneCursor cursor : lanes.values()) {
            if (cursor.closed) {
                continue;
            }
            if (cursor.watermark == null) {
                return Instant.MIN;
            }
            if (low == null || cursor.watermark.isBefore(low)) {
                low = cursor.watermark;
            }
        }
        return low;
    }

    private boolean allClosed() {
        return lanes.values().stream().allMatch(cursor -> cursor.closed);
    }

    private void release(Pending pending) {
        AlertEvent event = pending.event();
        if (lastReleased == null || event.getTime().isAfter(lastReleased)) {
            lastReleased = event.getTime();
        }
        releasedCount.incrementAndGet();
        downstream.accept(event);
    }

    private record Pending(AlertEvent event, int laneOrder, long sequence) {
    }

    private record Indexed(AlertEvent event, int index) {
    }

    private static final class LaneCursor {
        private final int order;
        private Instant watermark;
        private Instant lastEvent;
        private boolean closed;

        private LaneCursor(int order) {
            this.order = order;
        }
    }
}
