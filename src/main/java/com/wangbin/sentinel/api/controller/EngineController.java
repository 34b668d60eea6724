package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.common.web.result.ApiResult;
import com.wangbin.sentinel.core.analysis.AnalysisReport;
import com.wangbin.sentinel.core.analysis.AnalysisService;
import com.wangbin.sentinel.core.engine.AlertEngine;
import com.wangbin.sentinel.core.engine.lane.LaneSnapshot;
import com.wangbin.sentinel.core.engine.model.AlertEvent;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.sink.CollectingAlertSink;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 告警引擎查询与批量分析接口
 */
@Slf4j
@Validated
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class EngineController {

    private final AlertEngine alertEngine;
    private final CollectingAlertSink recentAlertSink;
    private final AnalysisService analysisService;

    /**
     * 已配置的检查定义
     */
    @GetMapping("/checks")
    public ApiResult<List<CheckDefinition>> checks() {
        return ApiResult.success(alertEngine.getChecks());
    }

    /**
     * 当前运行中各通道的状态
     */
    @GetMapping("/lanes")
    public ApiResult<List<LaneSnapshot>> lanes() {
        ApiResult<List<LaneSnapshot>> result = ApiResult.success(alertEngine.getLaneSnapshots());
        result.addExtra("running", alertEngine.isRunning());
        return result;
    }

    /**
     * 最近的告警，按汇聚顺序
     */
    @GetMapping("/alerts")
    public ApiResult<List<AlertEvent>> alerts(
            @RequestParam(defaultValue = "100") @Min(1) @Max(10000) int limit) {
        ApiResult<List<AlertEvent>> result = ApiResult.success(recentAlertSink.getRecent(limit));
        result.addExtra("total", recentAlertSink.size());
        return result;
    }

    @PostMapping("/analysis")
    public ApiResult<AnalysisReport> analysis(@RequestParam(defaultValue = "-24h") String timeRange) {
        log.info("收到批量分析请求: timeRange={}", timeRange);
        return ApiResult.success(analysisService.analyze(timeRange));
    }
}
