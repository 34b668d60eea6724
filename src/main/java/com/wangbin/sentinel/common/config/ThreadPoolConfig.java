package com.wangbin.sentinel.common.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ThreadFactory;

@Configuration
public class ThreadPoolConfig {

    private ThreadFactory buildNamedThreadFactory(String prefix, boolean daemon) {
        return new ThreadFactoryBuilder()
                .setNameFormat(prefix + "-%d")
                .setDaemon(daemon)
                .setPriority(Thread.NORM_PRIORITY)
                .build();
    }

    /**
     * 检查通道线程工厂，每个通道一个线程
     */
    @Bean("laneThreadFactory")
    public ThreadFactory laneThreadFactory() {
        return buildNamedThreadFactory("alert-lane", true);
    }
}
