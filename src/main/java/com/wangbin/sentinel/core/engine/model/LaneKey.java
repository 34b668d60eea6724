package com.wangbin.sentinel.core.engine.model;

/**
 * 检查通道标识：一个检查定义与一个实例标签的组合。
 */
public record LaneKey(int checkIndex, String checkName, String instance) {

    public String id() {
        return instance == null ? checkName : checkName + "#" + instance;
    }

    @Override
    public String toString() {
        return id();
    }
}
