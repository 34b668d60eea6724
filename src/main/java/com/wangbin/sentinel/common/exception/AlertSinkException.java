package com.wangbin.sentinel.common.exception;

import com.wangbin.sentinel.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 告警投递异常，对引擎而言不是致命错误。
 */
@Getter
public class AlertSinkException extends BusinessException {

    private final String sinkName;

    public AlertSinkException(String sinkName, String message) {
        super(ResultCode.SINK_ERROR, message);
        this.sinkName = sinkName;
    }

    public AlertSinkException(String sinkName, String message, Throwable cause) {
        super(ResultCode.SINK_ERROR, message, cause);
        this.sinkName = sinkName;
    }
}
