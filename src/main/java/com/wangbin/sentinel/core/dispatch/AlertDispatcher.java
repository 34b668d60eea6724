package com.wangbin.sentinel.core.dispatch;

import com.wangbin.sentinel.common.exception.AlertSinkException;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.sink.AlertSink;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 告警投递调度器
 *
 * 汇聚器输出的有序告警先进入有界队列，由单个工作线程按批次交给各接收端，
 * 保证接收端看到的顺序与汇聚器输出一致。接收端失败只记录日志与计数。
 */
@Slf4j
public class AlertDispatcher implements AutoCloseable {

    private final BlockingQueue<AlertEvent> queue;
    private final int batchSize;
    private final long flushIntervalMillis;
    private final OverflowStrategy overflowStrategy;
    private final CopyOnWriteArrayList<AlertSink> sinks = new CopyOnWriteArrayList<>();
    private final Thread workerThread;
    private final AtomicBoolean running = new AtomicBoolean(false);

    // 统计信息
    private final AtomicLong enqueuedCount = new AtomicLong(0);
    private final AtomicLong deliveredCount = new AtomicLong(0);
    private final AtomicLong droppedCount = new AtomicLong(0);
    private final AtomicLong sinkFailureCount = new AtomicLong(0);

    public AlertDispatcher(int capacity,
                           int batchSize,
                           long flushIntervalMillis,
                           OverflowStrategy overflowStrategy) {
        this.queue = new LinkedBlockingQueue<>(Math.max(1, capacity));
        this.batchSize = Math.max(1, batchSize);
        this.flushIntervalMillis = Math.max(1L, flushIntervalMillis);
        this.overflowStrategy = overflowStrategy != null ? overflowStrategy : OverflowStrategy.BLOCK;
        this.workerThread = new Thread(this::processLoop, "alert-dispatcher-" + System.identityHashCode(this));
        this.workerThread.setDaemon(true);
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread.start();
        }
    }

    /**
     * 停止接收新告警，并在超时时间内把队列中已有告警投递完
     */
    public void stop(long timeoutMillis) {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        try {
            workerThread.join(timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (workerThread.isAlive()) {
            log.warn("告警投递线程未在 {}ms 内结束，剩余 {} 条告警未投递", timeoutMillis, queue.size());
            workerThread.interrupt();
        }
    }

    public void addSink(AlertSink sink) {
        if (sink != null) {
            sinks.add(sink);
        }
    }

    public List<AlertSink> getSinks() {
        return Collections.unmodifiableList(sinks);
    }

    /**
     * 汇聚器下游入口
     */
    public void enqueue(AlertEvent event) {
        if (event == null) {
            return;
        }
        enqueuedCount.incrementAndGet();
        switch (overflowStrategy) {
            case DROP_LATEST -> {
                if (!queue.offer(event)) {
                    dropped(event);
                }
            }
            case DROP_OLDEST -> {
                while (!queue.offer(event)) {
                    AlertEvent oldest = queue.poll();
                    if (oldest != null) {
                        dropped(oldest);
                    }
                }
            }
            default -> {
                try {
                    queue.put(event);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("告警入队被中断: " + event.getAlertName(), e);
                }
            }
        }
    }

    private void dropped(AlertEvent event) {
        droppedCount.incrementAndGet();
        log.warn("投递队列已满，丢弃告警: {} {} at {}", event.getAlertName(), event.seriesKey(), event.getTime());
    }

    private void processLoop() {
        List<AlertEvent> batch = new ArrayList<>(batchSize);
        while (running.get() || !queue.isEmpty()) {
            try {
                AlertEvent first = queue.poll(flushIntervalMillis, TimeUnit.MILLISECONDS);
                if (first == null) {
                    continue;
                }
                batch.add(first);
                queue.drainTo(batch, batchSize - batch.size());
                dispatchBatch(batch);
                batch.clear();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception ex) {
                log.warn("告警批量投递异常", ex);
                batch.clear();
            }
        }
    }

    private void dispatchBatch(List<AlertEvent> batch) {
        if (batch.isEmpty()) {
            return;
        }
        List<AlertEvent> snapshot = Collections.unmodifiableList(new ArrayList<>(batch));
        for (AlertSink sink : sinks) {
            try {
                sink.deliverAll(snapshot);
            } catch (AlertSinkException ex) {
                sinkFailureCount.incrementAndGet();
                log.warn("告警投递失败: sink={}, 批次大小={}, {}", ex.getSinkName(), snapshot.size(), ex.getMessage());
            } catch (RuntimeException ex) {
                sinkFailureCount.incrementAndGet();
                log.error("告警接收端异常: sink={}", sink.getName(), ex);
            }
        }
        deliveredCount.addAndGet(snapshot.size());
    }

    public int getPendingCount() {
        return queue.size();
    }

    public Map<String, Object> getStatistics() {
        Map<String, Object> stats = new HashMap<>();
        stats.put("enqueued", enqueuedCount.get());
        stats.put("delivered", deliveredCount.get());
        stats.put("dropped", droppedCount.get());
        stats.put("sinkFailures", sinkFailureCount.get());
        stats.put("pending", queue.size());
        stats.put("overflowStrategy", overflowStrategy.name());
        return stats;
    }

    public long getSinkFailureCount() {
        return sinkFailureCount.get();
    }

    @Override
    public void close() {
        stop(5000);
    }
}
