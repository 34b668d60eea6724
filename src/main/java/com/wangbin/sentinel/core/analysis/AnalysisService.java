package com.wangbin.sentinel.core.analysis;

import com.wangbin.sentinel.common.exception.BusinessException;
import com.wangbin.sentinel.common.web.result.ResultCode;
import com.wangbin.sentinel.core.engine.AlertEngine;
import com.wangbin.sentinel.core.engine.EngineRun;
import com.wangbin.sentinel.core.engine.lane.LaneSnapshot;
import com.wangbin.sentinel.core.engine.lane.LaneStatus;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.source.PushSampleSource;
import com.wangbin.sentinel.core.source.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 批量分析：对给定时间范围运行全部检查一次，按检查汇总样本数、越限数和告警数
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisService {

    private final AlertEngine alertEngine;
    private final Clock clock;

    public AnalysisReport analyze(String timeRangeExpression) {
        TimeRange timeRange = TimeRange.parse(timeRangeExpression, clock);
        if (alertEngine.getSource() instanceof PushSampleSource) {
            throw new BusinessException(ResultCode.SERVICE_UNAVAILABLE, "推送数据源不支持批量分析");
        }

        EngineRun run;
        try {
            run = alertEngine.runToCompletion(timeRange);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ResultCode.TIMEOUT_ERROR, "批量分析被中断");
        } catch (IllegalStateException e) {
            throw new BusinessException(ResultCode.ENGINE_ERROR, e.getMessage(), e);
        }

        List<CheckSummary> summaries = summarize(alertEngine.getChecks(), run);
        Map<CheckStatus, Long> statusCounts = new EnumMap<>(CheckStatus.class);
        for (CheckSummary summary : summaries) {
            statusCounts.merge(summary.getStatus(), 1L, Long::sum);
        }
        log.info("批量分析完成: 时间范围 {}, {} 个检查, {} 条告警, 状态分布 {}",
                timeRangeExpression, summaries.size(), run.events().size(), statusCounts);

        return AnalysisReport.builder()
                .timeRange(timeRangeExpression)
                .start(timeRange.getStart())
                .end(timeRange.getEnd())
                .generatedAt(clock.instant())
                .checks(summaries)
                .statusCounts(statusCounts)
                .alerts(run.events())
                .lateEvents(run.lateEvents())
                .build();
    }

    static List<CheckSummary> summarize(List<CheckDefinition> checks, EngineRun run) {
        Map<String, List<LaneSnapshot>> lanesByCheck = run.lanes().stream()
                .collect(Collectors.groupingBy(LaneSnapshot::checkName));
        Map<String, Long> alertsByCheck = run.events().stream()
                .collect(Collectors.groupingBy(AlertEvent::getCheckName, Collectors.counting()));

        List<CheckSummary> summaries = new ArrayList<>(checks.size());
        for (CheckDefinition check : checks) {
            List<LaneSnapshot> lanes = lanesByCheck.getOrDefault(check.getName(), List.of());
            long total = lanes.stream().mapToLong(LaneSnapshot::samplesSeen).sum();
            long violations = lanes.stream().mapToLong(LaneSnapshot::violatingSamples).sum();
            int degraded = (int) lanes.stream().filter(lane -> lane.status() == LaneStatus.DEGRADED).count();
            // 有数据的实例才计数，无标签通道没有样本时不算实例
            int instances = (int) lanes.stream().filter(lane -> lane.samplesSeen() > 0).count();

            CheckStatus status;
            if (total == 0) {
                status = CheckStatus.NO_DATA;
            } else if (violations > 0) {
                status = CheckStatus.VIOLATION;
            } else {
                status = CheckStatus.OK;
            }
            summaries.add(CheckSummary.builder()
                    .check(check.getName())
                    .measurement(check.getMeasurement())
                    .field(check.getField())
                    .instanceCount(instances)
                    .totalSamples(total)
                    .violations(violations)
                    .alerts(alertsByCheck.getOrDefault(check.getName(), 0L))
                    .degradedLanes(degraded)
                    .status(status)
                    .build());
        }
        return summaries;
    }
}
