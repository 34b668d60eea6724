package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.SeriesKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 基于内存列表的样本数据源，每个分区按时间排序保存。
 */
@Slf4j
public class InMemorySampleSource implements SampleSource {

    private final String name;
    private final Map<SeriesKey, List<Sample>> series = new ConcurrentHashMap<>();

    public InMemorySampleSource() {
        this("memory");
    }

    public InMemorySampleSource(String name) {
        this.name = name;
    }

    public InMemorySampleSource(Collection<Sample> samples) {
        this("memory");
        addAll(samples);
    }

    @Override
    public String getName() {
        return name;
    }

    public void addAll(Collection<Sample> samples) {
        for (Sample sample : samples) {
            series.compute(sample.seriesKey(), (key, list) -> {
                List<Sample> updated = list == null ? new ArrayList<>() : new ArrayList<>(list);
                updated.add(sample);
                // 稳定排序，时间相同的样本保持插入顺序
                updated.sort(Comparator.comparing(Sample::getTimestamp));
                return updated;
            });
        }
        log.debug("内存数据源 {} 已加载 {} 个分区", name, series.size());
    }

    @Override
    public Iterator<Sample> open(SampleQuery query) {
        List<Sample> samples = series.getOrDefault(query.seriesKey(), List.of());
        Stream<Sample> stream = samples.stream()
                .filter(sample -> query.getTimeRange().contains(sample.getTimestamp()));
        if (query.getLimit() > 0) {
            stream = stream.limit(query.getLimit());
        }
        return stream.collect(Collectors.toList()).iterator();
    }

    @Override
    public List<String> discoverInstances(String measurement, String field, TimeRange timeRange) {
        TreeSet<String> tagged = new TreeSet<>();
        boolean untagged = false;
        for (Map.Entry<SeriesKey, List<Sample>> entry : series.entrySet()) {
            SeriesKey key = entry.getKey();
            if (!key.measurement().equals(measurement) || !key.field().equals(field)) {
                continue;
            }
            boolean inRange = entry.getValue().stream()
                    .anyMatch(sample -> timeRange.contains(sample.getTimestamp()));
            if (!inRange) {
                continue;
            }
            if (key.instance() == null) {
                untagged = true;
            } else {
                tagged.add(key.instance());
            }
        }
        List<String> instances = new ArrayList<>();
        if (untagged) {
            instances.add(null);
        }
        instances.addAll(tagged);
        return instances;
    }

    public int getSeriesCount() {
        return series.size();
    }

    public long getSampleCount() {
        return series.values().stream().filter(Objects::nonNull).mapToLong(List::size).sum();
    }
}
