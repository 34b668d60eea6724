package com.wangbin.sentinel.common.exception;

import com.wangbin.sentinel.common.web.result.ResultCode;
import lombok.Getter;

/**
 * 检查定义配置异常，启动阶段抛出，带此异常的检查不会启动任何通道。
 */
@Getter
public class CheckConfigException extends BusinessException {

    private final String checkName;

    public CheckConfigException(String checkName, String message) {
        super(ResultCode.CONFIG_INVALID, "检查定义无效 [" + checkName + "]: " + message);
        this.checkName = checkName;
    }

    public CheckConfigException(String checkName, String message, Throwable cause) {
        super(ResultCode.CONFIG_LOAD_ERROR, "检查定义加载失败 [" + checkName + "]: " + message, cause);
        this.checkName = checkName;
    }
}
