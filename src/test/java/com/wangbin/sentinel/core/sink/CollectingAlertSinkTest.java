package com.wangbin.sentinel.core.sink;

import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;

import static com.wangbin.sentinel.core.TestEvents.lowBattery;
import static org.junit.jupiter.api.Assertions.*;

class CollectingAlertSinkTest {

    @Test
    void keepsMostRecentEventsUpToCapacity() {
        CollectingAlertSink sink = new CollectingAlertSink(3);
        for (int i = 2; i < 7; i++) {
            sink.deliver(lowBattery(i, 0));
        }

        assertEquals(3, sink.size());
        assertEquals("[5.0, 6.0]", sink.getRecent(2).stream()
                .map(event -> String.valueOf(event.getDurationSeconds()))
                .collect(Collectors.joining(", ", "[", "]")));

        sink.clear();
        assertTrue(sink.getRecent(10).isEmpty());
    }
}
