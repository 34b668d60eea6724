package com.wangbin.sentinel.core.sink;

import com.wangbin.sentinel.core.engine.model.AlertEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * 保存最近告警的内存接收端，供查询接口使用
 */
public class CollectingAlertSink implements AlertSink {

    private final int capacity;
    private final Deque<AlertEvent> recent = new ArrayDeque<>();

    public CollectingAlertSink(int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    @Override
    public String getName() {
        return "recent";
    }

    @Override
    public synchronized void deliver(AlertEvent event) {
        recent.addLast(event);
        while (recent.size() > capacity) {
            recent.removeFirst();
        }
    }

    /**
     * 最近的 limit 条告警，按时间升序
     */
    public synchronized List<AlertEvent> getRecent(int limit) {
        List<AlertEvent> all = new ArrayList<>(recent);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return new ArrayList<>(all.subList(from, all.size()));
    }

    public synchronized int size() {
        return recent.size();
    }

    public synchronized void clear() {
        recent.clear();
    }
}
