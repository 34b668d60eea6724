package com.wangbin.sentinel.core.engine.model;

/**
 * 越限方向
 */
public enum ViolationKind {

    LOW("low", "低于下限"),
    HIGH("high", "高于上限");

    private final String code;
    private final String description;

    ViolationKind(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public static ViolationKind fromCode(String code) {
        for (ViolationKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("未知的越限方向: " + code);
    }
}
