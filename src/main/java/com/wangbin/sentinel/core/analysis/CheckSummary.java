package com.wangbin.sentinel.core.analysis;

import lombok.Builder;
import lombok.Value;

/**
 * 单个检查在一次批量分析中的汇总
 */
@Value
@Builder
public class CheckSummary {
    String check;
    String measurement;
    String field;
    int instanceCount;
    long totalSamples;
    /**
     * 越限样本数
     */
    long violations;
    long alerts;
    int degradedLanes;
    CheckStatus status;
}
