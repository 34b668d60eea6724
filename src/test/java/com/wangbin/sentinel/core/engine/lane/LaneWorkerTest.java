package com.wangbin.sentinel.core.engine.lane;

import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.aggregator.AlertAggregator;
import com.wangbin.sentinel.core.engine.evaluator.CheckEvaluator;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.engine.model.LaneKey;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.ViolationKind;
import com.wangbin.sentinel.core.source.InMemorySampleSource;
import com.wangbin.sentinel.core.source.SampleQuery;
import com.wangbin.sentinel.core.source.SampleSource;
import com.wangbin.sentinel.core.source.TimeRange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LaneWorkerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private CheckDefinition check;
    private LaneKey lane;
    private List<AlertEvent> delivered;
    private AlertAggregator aggregator;

    @BeforeEach
    void setUp() {
        check = CheckDefinition.builder()
                .name("vibration")
                .measurement("VIBE")
                .field("VibeX")
                .maxValue(30.0)
                .highAlertName("Vibration High")
                .build();
        lane = new LaneKey(0, "vibration", "0");
        delivered = Collections.synchronizedList(new ArrayList<>());
        aggregator = new AlertAggregator(delivered::add);
        aggregator.register(lane);
    }

    @Test
    void oneShotLaneCompletesAndClosesAggregatorLane() {
        InMemorySampleSource source = new InMemorySampleSource(List.of(
                vibe(0, 35.0), vibe(1, 10.0), vibe(2, 40.0)));
        LaneWorker worker = new LaneWorker(new CheckEvaluator(check, lane), source, aggregator,
                TimeRange.since(T0), Duration.ZERO);

        worker.run();

        assertEquals(LaneStatus.COMPLETED, worker.getStatus());
        assertTrue(aggregator.isClosed(lane));
        assertEquals(2, delivered.size());
        LaneSnapshot snapshot = worker.snapshot();
        assertEquals("vibration#0", snapshot.lane());
        assertEquals(3, snapshot.samplesSeen());
        assertEquals(T0.plusSeconds(2), snapshot.watermark());
    }

    @Test
    void sourceFailureDegradesLane() {
        SampleSource broken = new SampleSource() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public Iterator<Sample> open(SampleQuery query) {
                throw new SampleSourceException(getName(), query.seriesKey().toString(), "timeout");
            }

            @Override
            public List<String> discoverInstances(String measurement, String field, TimeRange timeRange) {
                return List.of();
            }
        };
        LaneWorker worker = new LaneWorker(new CheckEvaluator(check, lane), broken, aggregator,
                TimeRange.since(T0), Duration.ZERO);

        worker.run();

        assertEquals(LaneStatus.DEGRADED, worker.getStatus());
        assertEquals("timeout", worker.snapshot().lastError());
        assertTrue(aggregator.isClosed(lane));
    }

    @Test
    void pollingLaneResumesAfterWatermarkWithoutReprocessing() throws Exception {
        InMemorySampleSource source = new InMemorySampleSource(List.of(vibe(0, 35.0), vibe(1, 36.0)));
        LaneWorker worker = new LaneWorker(new CheckEvaluator(check, lane), source, aggregator,
                TimeRange.since(T0), Duration.ofMillis(10));
        Thread thread = new Thread(worker, "lane-test");
        thread.start();

        waitForSamples(worker, 2);
        source.addAll(List.of(vibe(2, 37.0)));
        waitForSamples(worker, 3);
        Thread.sleep(50);

        worker.requestStop();
        assertTrue(worker.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(LaneStatus.STOPPED, worker.getStatus());
        assertEquals(3, worker.snapshot().samplesSeen());
        assertEquals(3, delivered.size());
    }

    @Test
    void pollingLaneWithoutDataAdvancesToClockMinusIngestDelay() throws Exception {
        LaneKey other = new LaneKey(1, "battery", "0");
        aggregator.register(other);
        Clock clock = Clock.fixed(T0.plusSeconds(100), ZoneOffset.UTC);
        LaneWorker worker = new LaneWorker(new CheckEvaluator(check, lane), new InMemorySampleSource(), aggregator,
                TimeRange.since(T0), Duration.ofMillis(10), clock, Duration.ofSeconds(30));

        aggregator.publish(other, event(50));
        aggregator.publish(other, event(80));
        aggregator.advance(other, T0.plusSeconds(90));
        assertTrue(delivered.isEmpty());

        Thread thread = new Thread(worker, "lane-test");
        thread.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (delivered.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        Thread.sleep(50);

        assertEquals(1, delivered.size());
        assertEquals(T0.plusSeconds(50), delivered.get(0).getTime());
        worker.requestStop();
        assertTrue(worker.awaitTermination(5, TimeUnit.SECONDS));
        assertEquals(2, delivered.size());
    }

    private static AlertEvent event(int second) {
        return AlertEvent.builder()
                .time(T0.plusSeconds(second))
                .checkName("battery")
                .measurement("BAT")
                .field("Volt")
                .instance("0")
                .value(38.0)
                .durationSeconds(0)
                .runStart(T0.plusSeconds(second))
                .alertName("Battery Low")
                .kind(ViolationKind.LOW)
                .build();
    }

    private static void waitForSamples(LaneWorker worker, long expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (worker.snapshot().samplesSeen() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertEquals(expected, worker.snapshot().samplesSeen());
    }

    private static Sample vibe(int second, double value) {
        return Sample.of(T0.plusSeconds(second), "VIBE", "VibeX", "0", value);
    }
}
