package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.engine.model.SeriesKey;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LineProtocolSampleSourceTest {

    private static final Instant T0 = Instant.parse("2024-05-01T00:00:00Z");

    private final LineProtocolParser parser = new LineProtocolParser(
            LineProtocolParser.Precision.S, List.of("instance", "imu"));

    @Test
    void loadsClasspathFileAndSkipsBrokenLines() {
        LineProtocolSampleSource source = LineProtocolSampleSource.fromLocations(
                List.of("classpath:lp/flight-test.lp"), parser);

        assertEquals(1, source.getSkippedLines());
        assertEquals(6, source.getSampleCount());

        List<Sample> battery = drain(source.open(SampleQuery.of(
                new SeriesKey("BAT", "Volt", "0"), TimeRange.since(T0))));
        assertEquals(4, battery.size());
        assertEquals(T0.plusSeconds(3), battery.get(3).getTimestamp());
    }

    @Test
    void discoversTaggedInstances() {
        LineProtocolSampleSource source = new LineProtocolSampleSource(parser);
        source.load(new ClassPathResource("lp/flight-test.lp"));

        assertEquals(List.of("0", "1"), source.discoverInstances("VIBE", "VibeX", TimeRange.since(T0)));
        assertTrue(source.discoverInstances("GPS", "NSats", TimeRange.since(T0)).isEmpty());
    }

    @Test
    void missingFileIsSourceError() {
        assertThrows(SampleSourceException.class, () -> LineProtocolSampleSource.fromLocations(
                List.of("does/not/exist.lp"), parser));
    }

    private static List<Sample> drain(java.util.Iterator<Sample> iterator) {
        List<Sample> samples = new ArrayList<>();
        iterator.forEachRemaining(samples::add);
        return samples;
    }
}
