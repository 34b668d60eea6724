package com.wangbin.sentinel.api.controller;

import com.wangbin.sentinel.common.exception.BusinessException;
import com.wangbin.sentinel.common.web.result.ApiResult;
import com.wangbin.sentinel.common.web.result.ResultCode;
import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.engine.model.Sample;
import com.wangbin.sentinel.core.source.LineProtocolParser;
import com.wangbin.sentinel.core.source.PushSampleSource;
import com.wangbin.sentinel.core.source.SampleSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 样本接入接口
 * 以 InfluxDB 行协议接收样本，写入推送数据源
 */
@Slf4j
@RestController
@RequestMapping("/api/samples")
@RequiredArgsConstructor
public class SampleIngestController {

    private final SampleSource sampleSource;
    private final SentinelProperties properties;

    /**
     * 推送一批行协议样本，仅在 push 数据源下可用
     *
     * @param precision 时间戳精度，默认取 line-protocol 配置
     */
    @PostMapping(consumes = MediaType.ALL_VALUE)
    public ApiResult<Map<String, Object>> ingest(@RequestBody(required = false) String body,
                                                 @RequestParam(required = false) String precision) {
        if (!(sampleSource instanceof PushSampleSource)) {
            throw new BusinessException(ResultCode.SERVICE_UNAVAILABLE,
                    "当前数据源 " + sampleSource.getName() + " 不接收推送样本");
        }
        PushSampleSource push = (PushSampleSource) sampleSource;
        SentinelProperties.LineProtocol config = properties.getSource().getLineProtocol();
        LineProtocolParser parser = new LineProtocolParser(
                LineProtocolParser.Precision.from(precision != null ? precision : config.getPrecision()),
                config.getInstanceTags());

        long accepted = 0;
        long unrouted = 0;
        long rejected = 0;
        String firstError = null;
        String[] lines = body == null ? new String[0] : body.split("\\R");
        for (String line : lines) {
            List<Sample> samples;
            try {
                samples = parser.parseLine(line);
            } catch (IllegalArgumentException e) {
                rejected++;
                if (firstError == null) {
                    firstError = e.getMessage();
                }
                continue;
            }
            for (Sample sample : samples) {
                if (publish(push, sample)) {
                    accepted++;
                } else {
                    unrouted++;
                }
            }
        }
        if (rejected > 0) {
            log.warn("行协议接入: {} 行格式错误，首个错误: {}", rejected, firstError);
        }
        log.debug("行协议接入: 接收 {}, 无对应通道 {}, 错误行 {}", accepted, unrouted, rejected);

        Map<String, Object> counts = new LinkedHashMap<>();
        counts.put("accepted", accepted);
        counts.put("unrouted", unrouted);
        counts.put("rejected", rejected);
        ApiResult<Map<String, Object>> result = ApiResult.success(counts);
        if (firstError != null) {
            result.addExtra("firstError", firstError);
        }
        return result;
    }

    private boolean publish(PushSampleSource push, Sample sample) {
        try {
            return push.publish(sample);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ResultCode.TIMEOUT_ERROR, "写入推送队列时被中断");
        } catch (IllegalStateException e) {
            throw new BusinessException(ResultCode.SERVICE_UNAVAILABLE, e.getMessage());
        }
    }
}
