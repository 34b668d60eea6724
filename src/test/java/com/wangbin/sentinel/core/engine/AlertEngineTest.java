package com.wangbin.sentinel.core.engine;

import com.wangbin.sentinel.common.exception.CheckConfigException;
import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.lane.LaneSnapshot;
import com.wangbin.sentinel.core.engine.lane.LaneStatus;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.source.InMemorySampleSource;
import com.wangbin.sentinel.core.source.PushSampleSource;
import com.wangbin.sentinel.core.source.SampleQuery;
import com.wangbin.sentinel.core.source.SampleSource;
import com.wangbin.sentinel.core.source.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class AlertEngineTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");
    private static final TimeRange RANGE = TimeRange.since(T0);

    private static CheckDefinition battery() {
        return CheckDefinition.builder()
                .name("battery")
                .measurement("BAT")
                .field("Volt")
                .instanceFilter("0")
                .minValue(39.5)
                .maxValue(50.4)
                .minDurationSeconds(2.0)
                .lowAlertName("Battery Low")
                .highAlertName("Battery High")
                .build();
    }

    private static CheckDefinition vibration(String instance) {
        return CheckDefinition.builder()
                .name("vibration")
                .measurement("VIBE")
                .field("VibeX")
                .instanceFilter(instance)
                .maxValue(30.0)
                .minDurationSeconds(1.0)
                .highAlertName("Vibration High")
                .build();
    }

    private static InMemorySampleSource flightData() {
        List<Sample> samples = new ArrayList<>();
        double[] volts = {38.0, 38.0, 38.0, 38.0, 41.0};
        double[] vibe = {31.0, 31.0, 31.0, 31.0, 10.0};
        for (int i = 0; i < volts.length; i++) {
            samples.add(Sample.of(T0.plusSeconds(i), "BAT", "Volt", "0", volts[i]));
            samples.add(Sample.of(T0.plusSeconds(i), "VIBE", "VibeX", "0", vibe[i]));
        }
        return new InMemorySampleSource(samples);
    }

    @Test
    void twoLanesMergeInStrictTimeOrder() throws Exception {
        AlertEngine engine = new AlertEngine(List.of(battery(), vibration("0")), flightData(), EngineSettings.defaults());

        EngineRun run = engine.runToCompletion(RANGE);

        List<String> order = run.events().stream()
                .map(event -> Duration.between(T0, event.getTime()).getSeconds() + ":" + event.getCheckName())
                .collect(Collectors.toList());
        assertEquals(List.of("1:vibration", "2:battery", "2:vibration", "3:battery", "3:vibration"), order);
        assertEquals(2, run.lanes().size());
        assertTrue(run.lanes().stream().allMatch(lane -> lane.status() == LaneStatus.COMPLETED));
        assertEquals(0, run.lateEvents());
    }

    @Test
    void rerunOverSameSamplesIsIdempotent() throws Exception {
        AlertEngine engine = new AlertEngine(List.of(battery(), vibration("0")), flightData(), EngineSettings.defaults());

        List<AlertEvent> first = engine.runToCompletion(RANGE).events();
        List<AlertEvent> second = engine.runToCompletion(RANGE).events();

        assertEquals(first, second);
    }

    @Test
    void checkWithoutInstanceFilterFansOutPerDiscoveredInstance() throws Exception {
        InMemorySampleSource source = new InMemorySampleSource(List.of(
                Sample.of(T0, "VIBE", "VibeX", "0", 40.0),
                Sample.of(T0.plusSeconds(1), "VIBE", "VibeX", "0", 40.0),
                Sample.of(T0, "VIBE", "VibeX", "1", 40.0),
                Sample.of(T0.plusSeconds(1), "VIBE", "VibeX", "1", 40.0)));
        AlertEngine engine = new AlertEngine(List.of(vibration(null)), source, EngineSettings.defaults());

        EngineRun run = engine.runToCompletion(RANGE);

        assertEquals(List.of("vibration#0", "vibration#1"),
                run.lanes().stream().map(LaneSnapshot::lane).collect(Collectors.toList()));
        assertEquals(List.of("0", "1"),
                run.events().stream().map(AlertEvent::getInstance).collect(Collectors.toList()));
    }

    @Test
    void noDiscoveredInstanceRunsSingleUntaggedLane() throws Exception {
        AlertEngine engine = new AlertEngine(List.of(vibration(null)), new InMemorySampleSource(),
                EngineSettings.defaults());

        EngineRun run = engine.runToCompletion(RANGE);

        assertEquals(1, run.lanes().size());
        assertNull(run.lanes().get(0).instance());
        assertTrue(run.events().isEmpty());
    }

    @Test
    void duplicateCheckNamesAreRejected() {
        assertThrows(CheckConfigException.class,
                () -> new AlertEngine(List.of(vibration("0"), vibration("1")), new InMemorySampleSource(),
                        EngineSettings.defaults()));
    }

    @Test
    void unreadableSourceDegradesLaneWithoutFailingRun() throws Exception {
        SampleSource broken = new FailingSource(new SampleSourceException("broken", "BAT.Volt[0]", "connection refused"));
        AlertEngine engine = new AlertEngine(List.of(battery()), broken, EngineSettings.defaults());

        EngineRun run = engine.runToCompletion(RANGE);

        LaneSnapshot lane = run.lanes().get(0);
        assertEquals(LaneStatus.DEGRADED, lane.status());
        assertEquals("connection refused", lane.lastError());
        assertTrue(run.events().isEmpty());
    }

    @Test
    void outOfOrderSamplesFailTheRun() {
        SampleSource unordered = new FailingSource(null) {
            @Override
            public Iterator<Sample> open(SampleQuery query) {
                return List.of(
                        Sample.of(T0.plusSeconds(5), "BAT", "Volt", "0", 38.0),
                        Sample.of(T0.plusSeconds(1), "BAT", "Volt", "0", 38.0)).iterator();
            }
        };
        AlertEngine engine = new AlertEngine(List.of(battery()), unordered, EngineSettings.defaults());

        assertThrows(IllegalStateException.class, () -> engine.runToCompletion(RANGE));
    }

    @Test
    void startDeliversOrderedEventsDownstream() throws Exception {
        AlertEngine engine = new AlertEngine(List.of(battery(), vibration("0")), flightData(), EngineSettings.defaults());
        List<AlertEvent> delivered = Collections.synchronizedList(new ArrayList<>());

        engine.start(RANGE, delivered::add);
        assertTrue(engine.awaitCompletion(Duration.ofSeconds(10)));
        assertFalse(engine.isRunning());

        assertEquals(engine.runToCompletion(RANGE).events(), new ArrayList<>(delivered));
        assertEquals(5, delivered.size());
    }

    @Test
    void stopInterruptsBlockedLanesAndFlushesBufferedEvents() throws Exception {
        PushSampleSource source = new PushSampleSource(100, 1000);
        AlertEngine engine = new AlertEngine(List.of(battery()), source, EngineSettings.builder()
                .shutdownTimeout(Duration.ofMillis(400))
                .build());
        List<AlertEvent> delivered = Collections.synchronizedList(new ArrayList<>());

        engine.start(RANGE, delivered::add);
        assertThrows(IllegalStateException.class, () -> engine.start(RANGE, delivered::add));
        for (int i = 0; i < 3; i++) {
            source.publish(Sample.of(T0.plusSeconds(i), "BAT", "Volt", "0", 38.0));
        }
        long deadline = System.currentTimeMillis() + 5000;
        while (engine.getLaneSnapshots().get(0).samplesSeen() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertTrue(engine.stop(Duration.ofMillis(400)));
        assertFalse(engine.isRunning());
        assertEquals(LaneStatus.STOPPED, engine.getLaneSnapshots().get(0).status());
        assertEquals(1, delivered.size());
        assertEquals(T0.plusSeconds(2), delivered.get(0).getTime());
    }

    @Test
    void quietPollingLaneDoesNotHoldBackOtherLanes() throws Exception {
        CheckDefinition quiet = CheckDefinition.builder()
                .name("quiet")
                .measurement("BAT").field("Volt").instanceFilter("9")
                .minValue(39.5).lowAlertName("Battery Low")
                .build();
        List<Sample> samples = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            samples.add(Sample.of(T0.plusSeconds(i), "BAT", "Volt", "0", 38.0));
        }
        AlertEngine engine = new AlertEngine(List.of(battery(), quiet), new InMemorySampleSource(samples),
                EngineSettings.builder()
                        .pollInterval(Duration.ofMillis(50))
                        .outOfOrderTolerance(Duration.ZERO)
                        .build());
        List<AlertEvent> delivered = Collections.synchronizedList(new ArrayList<>());

        engine.start(RANGE, delivered::add);
        waitForDeliveries(delivered, 3);

        assertTrue(engine.isRunning(), "alerts must flow while both lanes keep polling");
        assertEquals(List.of(T0.plusSeconds(2), T0.plusSeconds(3), T0.plusSeconds(4)),
                delivered.stream().map(AlertEvent::getTime).collect(Collectors.toList()));
        assertTrue(engine.stop(Duration.ofSeconds(2)));
    }

    @Test
    void idlePushLaneDoesNotHoldBackOtherLanes() throws Exception {
        PushSampleSource source = new PushSampleSource(100, 20);
        AlertEngine engine = new AlertEngine(List.of(battery(), vibration("0")), source, EngineSettings.builder()
                .outOfOrderTolerance(Duration.ZERO)
                .shutdownTimeout(Duration.ofMillis(400))
                .build());
        List<AlertEvent> delivered = Collections.synchronizedList(new ArrayList<>());

        engine.start(RANGE, delivered::add);
        for (int i = 0; i < 5; i++) {
            assertTrue(source.publish(Sample.of(T0.plusSeconds(i), "BAT", "Volt", "0", 38.0)));
        }
        assertTrue(source.publish(Sample.of(T0.plusSeconds(5), "BAT", "Volt", "0", 41.0)));
        assertFalse(source.publish(Sample.of(T0, "GPS", "NSats", "0", 3.0)), "no lane reads GPS");
        waitForDeliveries(delivered, 3);

        assertTrue(engine.isRunning());
        assertEquals(3, delivered.size());
        assertEquals(1, source.getUnroutedCount());
        assertTrue(engine.stop(Duration.ofMillis(400)));
    }

    @Test
    void pushSourceRequiresInstanceFilterOnEveryCheck() {
        PushSampleSource source = new PushSampleSource(10, 10);

        CheckConfigException ex = assertThrows(CheckConfigException.class,
                () -> new AlertEngine(List.of(battery(), vibration(null)), source, EngineSettings.defaults()));
        assertEquals("vibration", ex.getCheckName());
        assertDoesNotThrow(() -> new AlertEngine(List.of(battery(), vibration("1")), source, EngineSettings.defaults()));
    }

    @Test
    void toleranceDefaultsToQueryRangeSpan() {
        Clock clock = Clock.fixed(T0.plusSeconds(3600), ZoneOffset.UTC);
        AlertEngine derived = new AlertEngine(List.of(battery()), new InMemorySampleSource(),
                EngineSettings.builder().clock(clock).build());
        AlertEngine fixed = new AlertEngine(List.of(battery()), new InMemorySampleSource(),
                EngineSettings.builder().clock(clock).outOfOrderTolerance(Duration.ofMinutes(5)).build());

        assertEquals(Duration.ofHours(1), derived.resolveTolerance(RANGE));
        assertEquals(Duration.ofSeconds(30), derived.resolveTolerance(TimeRange.between(T0, T0.plusSeconds(30))));
        assertEquals(Duration.ZERO, derived.resolveTolerance(TimeRange.since(T0.plusSeconds(7200))));
        assertEquals(Duration.ofMinutes(5), fixed.resolveTolerance(RANGE));
    }

    private static void waitForDeliveries(List<AlertEvent> delivered, int expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (delivered.size() < expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, delivered.size());
    }

    private static class FailingSource implements SampleSource {
        private final SampleSourceException failure;

        FailingSource(SampleSourceException failure) {
            this.failure = failure;
        }

        @Override
        public String getName() {
            return "failing";
        }

        @Override
        public Iterator<Sample> open(SampleQuery query) {
            throw failure;
        }

        @Override
        public List<String> discoverInstances(String measurement, String field, TimeRange timeRange) {
            return List.of();
        }
    }
}
