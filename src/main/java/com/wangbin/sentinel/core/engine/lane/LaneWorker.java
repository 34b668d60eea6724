package com.wangbin.sentinel.core.engine.lane;

import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.aggregator.AlertAggregator;
import com.wangbin.sentinel.core.engine.evaluator.CheckEvaluator;
import com.wangbin.sentinel.core.engine.model.LaneKey;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.source.SampleQuery;
import com.wangbin.sentinel.core.source.SampleSource;
import com.wangbin.sentinel.core.source.TimeRange;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 检查通道工作单元
 *
 * 一个通道对应一个（检查定义, 实例）组合，独占自己的评估器与越限状态：
 * 从数据源按时间顺序拉取样本，评估后把告警与水位线上报给汇聚器。
 * pollInterval 大于 0 时持续轮询，从上次处理的时间点之后继续查询；每轮查询结束后
 * 水位线推进到 (当前时间 - ingestDelay)，没有数据的通道不会拖住其他通道。
 * 数据源空闲时报告的进度同样用于推进水位线。
 *
 * 收到停止请求后不再拉取新样本，关闭汇聚器中的通道（释放缓冲告警）后才进入终止状态，
 * 之后不会再上报任何告警。
 */
@Slf4j
public class LaneWorker implements Runnable {

    @Getter
    private final LaneKey laneKey;

    @Getter
    private final CheckEvaluator evaluator;

    private final SampleSource source;
    private final AlertAggregator aggregator;
    private final TimeRange timeRange;
    private final Duration pollInterval;
    private final Clock clock;
    private final Duration ingestDelay;

    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile LaneStatus status = LaneStatus.PENDING;
    private volatile boolean stopRequested;
    private volatile Thread runner;
    private volatile Instant watermark;
    private volatile String lastError;

    public LaneWorker(CheckEvaluator evaluator,
                      SampleSource source,
                      AlertAggregator aggregator,
                      TimeRange timeRange,
                      Duration pollInterval) {
        this(evaluator, source, aggregator, timeRange, pollInterval, Clock.systemUTC(), Duration.ZERO);
    }

    public LaneWorker(CheckEvaluator evaluator,
                      SampleSource source,
                      AlertAggregator aggregator,
                      TimeRange timeRange,
                      Duration pollInterval,
                      Clock clock,
                      Duration ingestDelay) {
        this.laneKey = evaluator.getLaneKey();
        this.evaluator = evaluator;
        this.source = source;
        this.aggregator = aggregator;
        this.timeRange = timeRange;
        this.pollInterval = pollInterval == null || pollInterval.isNegative() ? Duration.ZERO : pollInterval;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.ingestDelay = ingestDelay == null || ingestDelay.isNegative() ? Duration.ZERO : ingestDelay;
    }

    @Override
    public void run() {
        runner = Thread.currentThread();
        status = LaneStatus.RUNNING;
        LaneStatus finalStatus = LaneStatus.COMPLETED;
        log.info("通道启动: {} 范围 {}", laneKey, timeRange);
        try {
            TimeRange range = timeRange;
            boolean resumed = false;
            while (!stopRequested) {
                try {
                    consume(range, resumed);
                    if (isPolling() && !stopRequested) {
                        aggregator.advance(laneKey, pollHorizon());
                    }
                    if (status == LaneStatus.DEGRADED) {
                        log.info("通道恢复: {}", laneKey);
                        status = LaneStatus.RUNNING;
                    }
                } catch (SampleSourceException e) {
                    if (stopRequested) {
                        break;
                    }
                    lastError = e.getMessage();
                    status = LaneStatus.DEGRADED;
                    log.warn("通道降级: {} 数据源 {} 读取失败: {}", laneKey, source.getName(), e.getMessage());
                    if (!isPolling()) {
                        finalStatus = LaneStatus.DEGRADED;
                        break;
                    }
                }
                if (!isPolling() || !pause()) {
                    break;
                }
                if (watermark != null) {
                    range = timeRange.resumeAfter(watermark);
                    resumed = true;
                }
            }
            if (stopRequested) {
                finalStatus = LaneStatus.STOPPED;
            }
        } catch (RuntimeException e) {
            finalStatus = LaneStatus.FAILED;
            lastError = e.getMessage();
            log.error("通道失败: {}", laneKey, e);
            throw e;
        } finally {
            evaluator.reset();
            // 清除中断标志，保证缓冲告警能交给下游
            boolean interrupted = Thread.interrupted();
            aggregator.close(laneKey);
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            status = finalStatus;
            runner = null;
            finished.countDown();
            log.info("通道结束: {} 状态 {}, 样本 {}, 告警 {}",
                    laneKey, finalStatus, evaluator.getSamplesSeen(), evaluator.getAlertsEmitted());
        }
    }

    private void consume(TimeRange range, boolean resumed) {
        Iterator<Sample> samples = source.open(SampleQuery.of(evaluator.getSeriesKey(), range), this::onIdle);
        while (!stopRequested && samples.hasNext()) {
            Sample sample = samples.next();
            if (resumed && watermark != null && !sample.getTimestamp().isAfter(watermark)) {
                continue;
            }
            evaluator.evaluate(sample).ifPresent(event -> aggregator.publish(laneKey, event));
            aggregator.advance(laneKey, sample.getTimestamp());
            watermark = sample.getTimestamp();
        }
    }

    private void onIdle(Instant progress) {
        if (!stopRequested) {
            aggregator.advance(laneKey, progress);
        }
    }

    /**
     * 本轮查询已覆盖到的时间，不超过查询范围的结束时间
     */
    private Instant pollHorizon() {
        Instant horizon = clock.instant().minus(ingestDelay);
        Instant end = timeRange.getEnd();
        return end != null && horizon.isAfter(end) ? end : horizon;
    }

    private boolean isPolling() {
        return !pollInterval.isZero();
    }

    /**
     * 轮询间隔等待，被停止或中断时返回 false
     */
    private boolean pause() {
        try {
            Thread.sleep(pollInterval.toMillis());
            return !stopRequested;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * 协作式停止：当前样本处理完后不再拉取新样本
     */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * 中断阻塞在数据源上的线程，仅在停止请求未及时生效时使用
     */
    public void interrupt() {
        stopRequested = true;
        Thread current = runner;
        if (current != null) {
            current.interrupt();
        }
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return finished.await(timeout, unit);
    }

    public LaneStatus getStatus() {
        return status;
    }

    public LaneSnapshot snapshot() {
        return new LaneSnapshot(
                laneKey.id(),
                laneKey.checkName(),
                laneKey.instance(),
                status,
                evaluator.getSamplesSeen(),
                evaluator.getViolatingSamples(),
                evaluator.getAlertsEmitted(),
                watermark,
                lastError);
    }
}
