package com.wangbin.sentinel.core.lifecycle;

import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.dispatch.AlertDispatcher;
import com.wangbin.sentinel.core.engine.AlertEngine;
import com.wangbin.sentinel.core.source.TimeRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 服务启动后按配置启动告警引擎，告警交给投递调度器
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EngineStartupRunner implements ApplicationRunner {

    private final SentinelProperties properties;
    private final AlertEngine alertEngine;
    private final AlertDispatcher alertDispatcher;
    private final Clock clock;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRunOnStartup()) {
            log.info("sentinel.run-on-startup=false，告警引擎等待手动触发");
            return;
        }
        if (alertEngine.getChecks().isEmpty()) {
            log.warn("没有配置任何检查，告警引擎不启动");
            return;
        }
        TimeRange timeRange = TimeRange.parse(properties.getTimeRange(), clock);
        alertEngine.start(timeRange, alertDispatcher::enqueue);
    }
}
