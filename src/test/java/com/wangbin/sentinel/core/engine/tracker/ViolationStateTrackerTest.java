package com.wangbin.sentinel.core.engine.tracker;

import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.ViolationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ViolationStateTrackerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private ViolationStateTracker tracker;

    @BeforeEach
    void setUp() {
        CheckDefinition check = CheckDefinition.builder()
                .measurement("BAT")
                .field("Volt")
                .minValue(39.5)
                .maxValue(50.4)
                .lowAlertName("Battery Low")
                .highAlertName("Battery High")
                .build();
        tracker = new ViolationStateTracker(check);
    }

    @Test
    void runDurationGrowsFromFirstViolatingSample() {
        TrackerUpdate first = tracker.observe(sample(0, 38.0));
        assertTrue(first.violating());
        assertTrue(first.runStarted());
        assertEquals(0.0, first.durationSeconds());
        assertEquals(T0, first.runStart());

        TrackerUpdate second = tracker.observe(sample(1500, 38.0));
        assertFalse(second.runStarted());
        assertEquals(T0, second.runStart());
        assertEquals(1.5, second.durationSeconds(), 1e-9);
        assertEquals(ViolationKind.LOW, tracker.getState().getViolationKind());
    }

    @Test
    void compliantSampleClosesRun() {
        tracker.observe(sample(0, 38.0));
        TrackerUpdate back = tracker.observe(sample(1000, 45.0));

        assertFalse(back.violating());
        assertNull(back.runStart());
        assertFalse(tracker.getState().isActive());

        TrackerUpdate again = tracker.observe(sample(2000, 38.0));
        assertTrue(again.runStarted());
        assertEquals(T0.plusSeconds(2), again.runStart());
    }

    @Test
    void kindSwitchRestartsClockAtSwitchingSample() {
        tracker.observe(sample(0, 38.0));
        tracker.observe(sample(1000, 38.0));
        TrackerUpdate switched = tracker.observe(sample(2000, 55.0));

        assertEquals(ViolationKind.HIGH, switched.kind());
        assertTrue(switched.runStarted());
        assertEquals(0.0, switched.durationSeconds());
        assertEquals(T0.plusSeconds(2), switched.runStart());

        TrackerUpdate next = tracker.observe(sample(3000, 55.0));
        assertEquals(1.0, next.durationSeconds(), 1e-9);
    }

    @Test
    void boundsAreExclusive() {
        assertNull(tracker.classify(39.5));
        assertNull(tracker.classify(50.4));
        assertEquals(ViolationKind.LOW, tracker.classify(39.49));
        assertEquals(ViolationKind.HIGH, tracker.classify(50.41));
        assertNull(tracker.classify(Double.NaN));
    }

    @Test
    void sampleBeforeRunStartIsRejected() {
        tracker.observe(sample(5000, 38.0));
        assertThrows(IllegalStateException.class, () -> tracker.observe(sample(1000, 38.0)));
    }

    @Test
    void resetClearsActiveRun() {
        tracker.observe(sample(0, 38.0));
        tracker.reset();
        assertFalse(tracker.getState().isActive());
        assertTrue(tracker.observe(sample(1000, 38.0)).runStarted());
    }

    private static Sample sample(long offsetMillis, double value) {
        return Sample.of(T0.plusMillis(offsetMillis), "BAT", "Volt", "0", value);
    }
}
