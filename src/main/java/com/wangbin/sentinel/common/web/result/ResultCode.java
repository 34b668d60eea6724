package com.wangbin.sentinel.common.web.result;

/**
 * 响应码枚举
 */
public enum ResultCode {

    // 成功
    SUCCESS(200, "成功"),

    // 客户端错误
    BAD_REQUEST(400, "请求参数错误"),
    NOT_FOUND(404, "资源不存在"),

    // 业务错误
    PARAM_ERROR(1000, "参数错误"),
    DATA_INVALID(1003, "数据无效"),

    // 告警引擎相关错误
    ENGINE_ERROR(2000, "告警引擎错误"),
    SOURCE_ERROR(2001, "样本数据源错误"),
    SINK_ERROR(2002, "告警投递错误"),
    LANE_ERROR(2003, "检查通道错误"),

    // 配置相关错误
    CONFIG_ERROR(3000, "配置错误"),
    CONFIG_NOT_FOUND(3001, "配置不存在"),
    CONFIG_INVALID(3002, "配置无效"),
    CONFIG_LOAD_ERROR(3003, "配置加载错误"),

    // 系统错误
    SYSTEM_ERROR(5000, "系统内部错误"),
    SERVICE_UNAVAILABLE(5001, "服务不可用"),
    TIMEOUT_ERROR(5005, "超时错误"),

    // 其他错误
    UNKNOWN_ERROR(9999, "未知错误");

    private final int code;
    private final String message;

    ResultCode(int code, String message) {
        this.code = code;
        this.message = message;
    }

    public int getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    /**
     * 根据code获取枚举
     */
    public static ResultCode fromCode(int code) {
        for (ResultCode resultCode : values()) {
            if (resultCode.getCode() == code) {
                return resultCode;
            }
        }
        return UNKNOWN_ERROR;
    }

    /**
     * 判断是否为配置错误
     */
    public boolean isConfigError() {
        return code >= 3000 && code < 4000;
    }
}
