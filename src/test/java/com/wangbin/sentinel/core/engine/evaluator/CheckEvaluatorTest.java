package com.wangbin.sentinel.core.engine.evaluator;

import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.engine.model.LaneKey;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.ViolationKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CheckEvaluatorTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private static CheckDefinition batteryCheck() {
        return CheckDefinition.builder()
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

    private static CheckEvaluator evaluator(CheckDefinition check) {
        return new CheckEvaluator(check, new LaneKey(0, check.getName(), check.getInstanceFilter()));
    }

    @Test
    void batteryScenarioAlertsOnceDurationReached() {
        CheckEvaluator evaluator = evaluator(batteryCheck());
        List<AlertEvent> events = evaluator.evaluateAll(List.of(
                volt(0, 38.0), volt(1, 38.0), volt(2, 38.0), volt(3, 38.0), volt(4, 41.0), volt(5, 41.0)));

        assertEquals(2, events.size());
        AlertEvent first = events.get(0);
        assertEquals(T0.plusSeconds(2), first.getTime());
        assertEquals(2.0, first.getDurationSeconds(), 1e-9);
        assertEquals(ViolationKind.LOW, first.getKind());
        assertEquals("Battery Low", first.getAlertName());
        assertEquals(T0, first.getRunStart());
        assertEquals("0", first.getInstance());

        AlertEvent second = events.get(1);
        assertEquals(T0.plusSeconds(3), second.getTime());
        assertEquals(3.0, second.getDurationSeconds(), 1e-9);
        assertEquals(38.0, second.getValue());
    }

    @Test
    void inRangeValueNeverAlertsEvenAfterLongRun() {
        CheckEvaluator evaluator = evaluator(batteryCheck());
        List<AlertEvent> events = evaluator.evaluateAll(List.of(
                volt(0, 38.0), volt(1, 38.0), volt(2, 38.0), volt(3, 41.0)));

        assertEquals(1, events.size());
        assertEquals(T0.plusSeconds(2), events.get(0).getTime());
        assertFalse(evaluator.isRunActive());
    }

    @Test
    void zeroDurationAlertsOnFirstViolatingSample() {
        CheckDefinition check = CheckDefinition.builder()
                .measurement("VIBE")
                .field("Clip")
                .maxValue(0.0)
                .highAlertName("Clipping")
                .build();
        CheckEvaluator evaluator = new CheckEvaluator(check, new LaneKey(0, check.getName(), null));

        Optional<AlertEvent> event = evaluator.evaluate(Sample.of(T0, "VIBE", "Clip", null, 1.0));
        assertTrue(event.isPresent());
        assertEquals(0.0, event.get().getDurationSeconds());
    }

    @Test
    void kindSwitchDelaysHighAlertUntilItsOwnDuration() {
        CheckEvaluator evaluator = evaluator(batteryCheck());
        List<AlertEvent> events = new ArrayList<>();
        events.addAll(evaluator.evaluateAll(List.of(volt(0, 38.0), volt(1, 38.0), volt(2, 38.0))));
        events.addAll(evaluator.evaluateAll(List.of(volt(3, 55.0), volt(4, 55.0), volt(5, 55.0))));

        assertEquals(2, events.size());
        assertEquals(ViolationKind.LOW, events.get(0).getKind());
        assertEquals(ViolationKind.HIGH, events.get(1).getKind());
        assertEquals(T0.plusSeconds(5), events.get(1).getTime());
        assertEquals(T0.plusSeconds(3), events.get(1).getRunStart());
    }

    @Test
    void sampleFromOtherPartitionIsRejected() {
        CheckEvaluator evaluator = evaluator(batteryCheck());
        Sample other = Sample.of(T0, "BAT", "Volt", "1", 38.0);
        assertThrows(IllegalStateException.class, () -> evaluator.evaluate(other));
    }

    @Test
    void laneInstanceMustMatchFilter() {
        CheckDefinition check = batteryCheck();
        assertThrows(IllegalArgumentException.class,
                () -> new CheckEvaluator(check, new LaneKey(0, check.getName(), "1")));
    }

    @Test
    void statisticsTrackSamplesAndAlerts() {
        CheckEvaluator evaluator = evaluator(batteryCheck());
        evaluator.evaluateAll(List.of(volt(0, 38.0), volt(1, 45.0), volt(2, 38.0), volt(3, 38.0), volt(4, 38.0)));

        assertEquals(5, evaluator.getSamplesSeen());
        assertEquals(4, evaluator.getViolatingSamples());
        assertEquals(1, evaluator.getAlertsEmitted());
        assertEquals(2L, evaluator.getStatistics().get("runsStarted"));
    }

    private static Sample volt(int second, double value) {
        return Sample.of(T0.plusSeconds(second), "BAT", "Volt", "0", value);
    }
}
