package com.wangbin.sentinel.core.analysis;

import com.wangbin.sentinel.core.engine.model.AlertEvent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class AnalysisReport {
    String timeRange;
    Instant start;
    Instant end;
    Instant generatedAt;
    List<CheckSummary> checks;
    Map<CheckStatus, Long> statusCounts;
    List<AlertEvent> alerts;
    long lateEvents;
}
