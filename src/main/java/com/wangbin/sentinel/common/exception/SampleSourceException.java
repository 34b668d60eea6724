package com.wangbin.sentinel.common.exception;

import com.wangbin.sentinel.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 样本数据源读取异常（网络、超时、解析等）。
 */
@Getter
public class SampleSourceException extends BusinessException {

    private final String sourceName;
    private final String series;

    public SampleSourceException(String sourceName, String series, String message) {
        super(ResultCode.SOURCE_ERROR, message);
        this.sourceName = sourceName;
        this.series = series;
    }

    public SampleSourceException(String sourceName, String series, String message, Throwable cause) {
        super(ResultCode.SOURCE_ERROR, message, cause);
        this.sourceName = sourceName;
        this.series = series;
    }

    // 创建超时异常
    public static SampleSourceException timeout(String sourceName, String series) {
        return new SampleSourceException(sourceName, series, "读取样本超时: " + series);
    }

    public static SampleSourceException timeout(String sourceName, String series, Throwable cause) {
        return new SampleSourceException(sourceName, series, "读取样本超时: " + series, cause);
    }
}
