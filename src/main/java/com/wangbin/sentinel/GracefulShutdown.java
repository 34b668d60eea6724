package com.wangbin.sentinel;

import com.wangbin.sentinel.core.config.SentinelProperties;
import com.wangbin.sentinel.core.dispatch.AlertDispatcher;
import com.wangbin.sentinel.core.engine.AlertEngine;
import com.wangbin.sentinel.core.source.PushSampleSource;
import com.wangbin.sentinel.core.source.SampleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;

/**
 * 停机顺序：先停通道，汇聚器释放剩余告警，再等待投递队列清空
 */
public class GracefulShutdown implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdown.class);

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        ApplicationContext context = event.getApplicationContext();
        SentinelProperties properties = context.getBean(SentinelProperties.class);
        long timeoutMillis = properties.getEngine().getShutdownTimeout().toMillis();

        log.info("开始优雅停机...");
        stopEngine(context, properties);
        stopDispatcher(context, timeoutMillis);
        log.info("优雅停机完成");
    }

    private void stopEngine(ApplicationContext context, SentinelProperties properties) {
        try {
            SampleSource source = context.getBean(SampleSource.class);
            if (source instanceof PushSampleSource push) {
                push.complete();
            }
            AlertEngine engine = context.getBean(AlertEngine.class);
            if (!engine.stop(properties.getEngine().getShutdownTimeout())) {
                log.warn("部分检查通道未能在超时时间内结束");
            }
        } catch (RuntimeException e) {
            log.error("停止告警引擎失败", e);
        }
    }

    private void stopDispatcher(ApplicationContext context, long timeoutMillis) {
        try {
            log.info("等待告警投递队列清空...");
            context.getBean(AlertDispatcher.class).stop(timeoutMillis);
        } catch (RuntimeException e) {
            log.error("停止告警投递失败", e);
        }
    }
}
