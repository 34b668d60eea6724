package com.wangbin.sentinel.core.sink;

import com.wangbin.sentinel.common.exception.AlertSinkException;
import com.wangbin.sentinel.core.engine.model.AlertEvent;

import java.util.List;

/**
 * 告警接收端接口
 *
 * 告警离开汇聚器即视为已移交，去重、限流、投递重试均由接收端负责。
 */
public interface AlertSink {

    /**
     * 获取接收端名称
     */
    String getName();

    /**
     * 投递单条告警
     *
     * @throws AlertSinkException 投递失败时抛出
     */
    void deliver(AlertEvent event);

    /**
     * 批量投递，默认逐条投递
     */
    default void deliverAll(List<AlertEvent> events) {
        for (AlertEvent event : events) {
            deliver(event);
        }
    }
}
