package com.wangbin.sentinel.core.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.wangbin.sentinel.common.exception.CheckConfigException;
import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.aggregator.AlertAggregator;
import com.wangbin.sentinel.core.engine.evaluator.CheckEvaluator;
import com.wangbin.sentinel.core.engine.lane.LaneSnapshot;
import com.wangbin.sentinel.core.engine.lane.LaneStatus;
import com.wangbin.sentinel.core.engine.lane.LaneWorker;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.engine.model.LaneKey;
import com.wangbin.sentinel.core.source.SampleSource;
import com.wangbin.sentinel.core.source.TimeRange;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * 持续越限告警引擎
 *
 * 把检查定义展开为通道（检查 x 实例），每个通道在独立线程上运行，
 * 通道之间不共享可变状态，唯一的汇合点是告警汇聚器。
 * 检查定义列表在启动后只读。
 */
@Slf4j
public class AlertEngine {

    private final List<CheckDefinition> checks;
    private final SampleSource source;
    private final EngineSettings settings;
    private final ThreadFactory threadFactory;

    private final Object lifecycleLock = new Object();
    private ExecutorService executor;
    private AlertAggregator aggregator;
    private volatile List<LaneWorker> lanes = Collections.emptyList();

    public AlertEngine(List<CheckDefinition> checks, SampleSource source, EngineSettings settings) {
        this(checks, source, settings, new ThreadFactoryBuilder()
                .setNameFormat("alert-lane-%d")
                .setDaemon(true)
                .build());
    }

    public AlertEngine(List<CheckDefinition> checks,
                       SampleSource source,
                       EngineSettings settings,
                       ThreadFactory threadFactory) {
        this.checks = List.copyOf(checks);
        this.source = source;
        this.settings = settings != null ? settings : EngineSettings.defaults();
        this.threadFactory = threadFactory;
        validateUniqueNames(this.checks);
        validateInstanceFilters(this.checks, source);
    }

    /**
     * 不能发现实例的数据源（推送模式）上，未指定实例的检查永远收不到带标签的样本
     */
    private static void validateInstanceFilters(List<CheckDefinition> checks, SampleSource source) {
        if (source.supportsInstanceDiscovery()) {
            return;
        }
        for (CheckDefinition check : checks) {
            if (check.getInstanceFilter() == null) {
                throw new CheckConfigException(check.getName(),
                        "数据源 " + source.getName() + " 不支持实例发现，检查定义必须指定 instance");
            }
        }
    }

    private static void validateUniqueNames(List<CheckDefinition> checks) {
        Set<String> names = new HashSet<>();
        for (CheckDefinition check : checks) {
            if (!names.add(check.getName())) {
                throw new CheckConfigException(check.getName(), "检查名称重复");
            }
        }
    }

    /**
     * 启动全部通道，告警按时间顺序交给 downstream
     */
    public void start(TimeRange timeRange, Consumer<AlertEvent> downstream) {
        synchronized (lifecycleLock) {
            if (isRunning()) {
                throw new IllegalStateException("告警引擎已在运行");
            }
            Duration tolerance = resolveTolerance(timeRange);
            aggregator = new AlertAggregator(downstream, tolerance);
            List<LaneWorker> planned = planLanes(timeRange, aggregator, settings.getPollInterval());
            source.declarePartitions(planned.stream()
                    .map(lane -> lane.getEvaluator().getSeriesKey())
                    .collect(Collectors.toList()));
            executor = Executors.newFixedThreadPool(threadCount(planned.size()), threadFactory);
            for (LaneWorker lane : planned) {
                executor.execute(lane);
            }
            executor.shutdown();
            lanes = planned;
            log.info("告警引擎已启动: {} 个检查, {} 个通道, 时间范围 {}, 乱序容忍 {}",
                    checks.size(), planned.size(), timeRange, tolerance);
        }
    }

    /**
     * 批量运行：每个通道查询一次，等待全部结束后返回合并告警。
     * 对同一批样本重复运行得到相同结果。
     */
    public EngineRun runToCompletion(TimeRange timeRange) throws InterruptedException {
        List<AlertEvent> collected = Collections.synchronizedList(new ArrayList<>());
        AlertAggregator batchAggregator = new AlertAggregator(collected::add, Duration.ZERO);
        List<LaneWorker> planned = planLanes(timeRange, batchAggregator, Duration.ZERO);

        ExecutorService batchExecutor = Executors.newFixedThreadPool(threadCount(planned.size()), threadFactory);
        try {
            for (LaneWorker lane : planned) {
                batchExecutor.execute(lane);
            }
            batchExecutor.shutdown();
            if (!batchExecutor.awaitTermination(settings.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("批量运行超时，停止剩余通道");
                planned.forEach(LaneWorker::interrupt);
                batchExecutor.awaitTermination(settings.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS);
            }
        } finally {
            batchExecutor.shutdownNow();
        }
        batchAggregator.flush();

        List<LaneSnapshot> snapshots = planned.stream().map(LaneWorker::snapshot).collect(Collectors.toList());
        List<LaneSnapshot> failed = snapshots.stream()
                .filter(snapshot -> snapshot.status() == LaneStatus.FAILED)
                .collect(Collectors.toList());
        if (!failed.isEmpty()) {
            throw new IllegalStateException("通道运行失败: " + failed.stream()
                    .map(snapshot -> snapshot.lane() + " - " + snapshot.lastError())
                    .collect(Collectors.joining("; ")));
        }
        synchronized (collected) {
            return new EngineRun(new ArrayList<>(collected), snapshots, batchAggregator.getLateCount());
        }
    }

    /**
     * 协作式停止全部通道，超时后中断仍在阻塞的通道
     *
     * @return 是否全部通道在超时时间内结束
     */
    public boolean stop(Duration timeout) {
        List<LaneWorker> current;
        ExecutorService currentExecutor;
        AlertAggregator currentAggregator;
        synchronized (lifecycleLock) {
            current = lanes;
            currentExecutor = executor;
            currentAggregator = aggregator;
        }
        if (currentExecutor == null) {
            return true;
        }
        log.info("停止告警引擎，共 {} 个通道", current.size());
        current.forEach(LaneWorker::requestStop);

        long half = Math.max(1L, timeout.toMillis() / 2);
        boolean terminated = false;
        try {
            terminated = currentExecutor.awaitTermination(half, TimeUnit.MILLISECONDS);
            if (!terminated) {
                log.warn("部分通道未响应停止请求，中断等待中的通道");
                current.forEach(LaneWorker::interrupt);
                terminated = currentExecutor.awaitTermination(half, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (!terminated) {
            log.error("告警引擎停止超时，仍有通道在运行");
            currentExecutor.shutdownNow();
        }
        if (currentAggregator != null) {
            currentAggregator.flush();
        }
        return terminated;
    }

    /**
     * 阻塞直到所有通道结束（单次查询模式下全部通道读完数据）
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        ExecutorService currentExecutor;
        synchronized (lifecycleLock) {
            currentExecutor = executor;
        }
        return currentExecutor == null || currentExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return executor != null && !executor.isTerminated();
        }
    }

    List<LaneWorker> planLanes(TimeRange timeRange, AlertAggregator target, Duration pollInterval) {
        List<LaneWorker> planned = new ArrayList<>();
        for (int i = 0; i < checks.size(); i++) {
            CheckDefinition check = checks.get(i);
            for (String instance : resolveInstances(check, timeRange)) {
                LaneKey key = new LaneKey(i, check.getName(), instance);
                CheckEvaluator evaluator = new CheckEvaluator(check, key);
                target.register(key);
                planned.add(new LaneWorker(evaluator, source, target, timeRange, pollInterval,
                        settings.getClock(), settings.getIngestDelay()));
            }
        }
        return planned;
    }

    private List<String> resolveInstances(CheckDefinition check, TimeRange timeRange) {
        List<String> instances = new ArrayList<>();
        if (check.getInstanceFilter() != null) {
            instances.add(check.getInstanceFilter());
            return instances;
        }
        try {
            instances.addAll(source.discoverInstances(check.getMeasurement(), check.getField(), timeRange));
        } catch (SampleSourceException e) {
            log.warn("发现实例失败，{} 按无实例标签通道运行: {}", check.getName(), e.getMessage());
        }
        if (instances.isEmpty()) {
            instances.add(null);
        }
        return instances;
    }

    /**
     * 未配置时取查询时间范围的跨度，开放范围算到当前时间
     */
    Duration resolveTolerance(TimeRange timeRange) {
        if (settings.getOutOfOrderTolerance() != null) {
            return settings.getOutOfOrderTolerance();
        }
        Instant end = timeRange.getEnd() != null ? timeRange.getEnd() : settings.getClock().instant();
        Duration span = Duration.between(timeRange.getStart(), end);
        return span.isNegative() ? Duration.ZERO : span;
    }

    private int threadCount(int laneCount) {
        int threads = Math.max(1, laneCount);
        if (settings.getMaxLaneThreads() > 0 && settings.getMaxLaneThreads() < threads) {
            log.warn("通道数 {} 超过线程上限 {}，阻塞的通道可能延迟其他通道", laneCount, settings.getMaxLaneThreads());
            threads = settings.getMaxLaneThreads();
        }
        return threads;
    }

    public List<LaneSnapshot> getLaneSnapshots() {
        return lanes.stream().map(LaneWorker::snapshot).collect(Collectors.toList());
    }

    public List<CheckDefinition> getChecks() {
        return checks;
    }

    public SampleSource getSource() {
        return source;
    }
}
