package com.wangbin.sentinel.core.source;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class TimeRangeTest {

    private static final Instant NOW = Instant.parse("2024-05-02T12:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void parsesRelativeExpressions() {
        assertEquals(NOW.minusSeconds(24 * 3600), TimeRange.parse("-24h", CLOCK).getStart());
        assertEquals(NOW.minusSeconds(30 * 60), TimeRange.parse("-30m", CLOCK).getStart());
        assertEquals(NOW.minusSeconds(14 * 86400), TimeRange.parse("-2w", CLOCK).getStart());
        assertEquals(NOW.minusSeconds(2 * 365 * 86400L), TimeRange.parse("-2y", CLOCK).getStart());
        assertEquals(NOW.minusMillis(500), TimeRange.parse("-500ms", CLOCK).getStart());
        assertNull(TimeRange.parse("-24h", CLOCK).getEnd());
    }

    @Test
    void parsesNowExpressionAndAbsoluteInstant() {
        assertEquals(NOW.minusSeconds(3600), TimeRange.parse("now() - 1h", CLOCK).getStart());
        assertEquals(NOW.minusSeconds(3600), TimeRange.parse("now() - interval '1h'", CLOCK).getStart());
        assertEquals(NOW, TimeRange.parse("now()", CLOCK).getStart());
        assertEquals(Instant.parse("2024-05-01T00:00:00Z"),
                TimeRange.parse("2024-05-01T00:00:00Z", CLOCK).getStart());
    }

    @Test
    void rejectsUnparseableExpressions() {
        assertThrows(IllegalArgumentException.class, () -> TimeRange.parse("", CLOCK));
        assertThrows(IllegalArgumentException.class, () -> TimeRange.parse("yesterday", CLOCK));
        assertThrows(IllegalArgumentException.class, () -> TimeRange.parse("-5x", CLOCK));
        assertThrows(IllegalArgumentException.class,
                () -> TimeRange.between(NOW, NOW.minusSeconds(1)));
    }

    @Test
    void containsIsInclusiveOnBothEnds() {
        TimeRange range = TimeRange.between(NOW, NOW.plusSeconds(10));
        assertTrue(range.contains(NOW));
        assertTrue(range.contains(NOW.plusSeconds(10)));
        assertFalse(range.contains(NOW.minusMillis(1)));
        assertFalse(range.contains(NOW.plusSeconds(11)));
        assertTrue(TimeRange.since(NOW).contains(NOW.plusSeconds(1_000_000)));
    }

    @Test
    void resumeAfterNeverMovesBeforeStart() {
        TimeRange range = TimeRange.between(NOW, NOW.plusSeconds(60));
        assertEquals(NOW.plusSeconds(5), range.resumeAfter(NOW.plusSeconds(5)).getStart());
        assertEquals(NOW, range.resumeAfter(NOW.minusSeconds(5)).getStart());
        assertEquals(range.getEnd(), range.resumeAfter(NOW.plusSeconds(5)).getEnd());
    }
}
