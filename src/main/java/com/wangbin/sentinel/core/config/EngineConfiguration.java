package com.wangbin.sentinel.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.sentinel.core.dispatch.AlertDispatcher;
import com.wangbin.sentinel.core.dispatch.OverflowStrategy;
import com.wangbin.sentinel.core.engine.AlertEngine;
import com.wangbin.sentinel.core.engine.EngineSettings;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import com.wangbin.sentinel.core.sink.AlertSink;
import com.wangbin.sentinel.core.sink.CollectingAlertSink;
import com.wangbin.sentinel.core.sink.DeduplicatingAlertSink;
import com.wangbin.sentinel.core.sink.LoggingAlertSink;
import com.wangbin.sentinel.core.sink.WebhookAlertSink;
import com.wangbin.sentinel.core.source.InMemorySampleSource;
import com.wangbin.sentinel.core.source.InfluxQueryBuilder;
import com.wangbin.sentinel.core.source.InfluxSqlSampleSource;
import com.wangbin.sentinel.core.source.LineProtocolParser;
import com.wangbin.sentinel.core.source.LineProtocolSampleSource;
import com.wangbin.sentinel.core.source.PushSampleSource;
import com.wangbin.sentinel.core.source.RetryingSampleSource;
import com.wangbin.sentinel.core.source.SampleSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadFactory;

/**
 * 告警引擎装配：数据源、检查定义、引擎、投递调度器与接收端
 */
@Slf4j
@Configuration
public class EngineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, SentinelProperties properties) {
        SentinelProperties.Influx influx = properties.getSource().getInflux();
        return builder
                .setConnectTimeout(influx.getConnectTimeout())
                .setReadTimeout(influx.getReadTimeout())
                .build();
    }

    @Bean
    public CheckDefinitionLoader checkDefinitionLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new CheckDefinitionLoader(objectMapper, resourceLoader);
    }

    @Bean
    public List<CheckDefinition> checkDefinitions(CheckDefinitionLoader loader, SentinelProperties properties) {
        return List.copyOf(loader.load(properties));
    }

    @Bean
    public SampleSource sampleSource(SentinelProperties properties, RestTemplate restTemplate, ObjectMapper objectMapper) {
        SentinelProperties.Source config = properties.getSource();
        String type = config.getType() == null ? "" : config.getType().trim().toLowerCase(Locale.ROOT);
        SampleSource source = switch (type) {
            case "memory" -> new InMemorySampleSource();
            case "push" -> new PushSampleSource(config.getPush().getCapacity(), config.getPush().getPollTimeoutMs());
            case "influx" -> new InfluxSqlSampleSource(
                    restTemplate,
                    objectMapper,
                    config.getInflux().getUrl(),
                    config.getInflux().getToken(),
                    config.getInflux().getDatabase(),
                    new InfluxQueryBuilder(config.getInflux().getInstanceTag()));
            case "line-protocol" -> LineProtocolSampleSource.fromLocations(
                    config.getLineProtocol().getLocations(),
                    new LineProtocolParser(
                            LineProtocolParser.Precision.from(config.getLineProtocol().getPrecision()),
                            config.getLineProtocol().getInstanceTags()));
            default -> throw new IllegalArgumentException("未知的数据源类型: " + config.getType());
        };
        log.info("样本数据源: {}", source.getName());

        SentinelProperties.Retry retry = config.getRetry();
        if (retry.isEnabled() && "influx".equals(type)) {
            return new RetryingSampleSource(source, retry.getMaxAttempts(), retry.getInitialBackoff(),
                    retry.getMultiplier(), retry.getMaxBackoff());
        }
        return source;
    }

    @Bean
    public AlertEngine alertEngine(List<CheckDefinition> checkDefinitions,
                                   SampleSource sampleSource,
                                   SentinelProperties properties,
                                   Clock clock,
                                   @Qualifier("laneThreadFactory") ThreadFactory laneThreadFactory) {
        SentinelProperties.Engine engine = properties.getEngine();
        EngineSettings settings = EngineSettings.builder()
                .pollInterval(engine.getPollInterval())
                .outOfOrderTolerance(engine.getOutOfOrderTolerance())
                .ingestDelay(engine.getIngestDelay())
                .clock(clock)
                .maxLaneThreads(engine.getMaxLaneThreads())
                .shutdownTimeout(engine.getShutdownTimeout())
                .build();
        return new AlertEngine(checkDefinitions, sampleSource, settings, laneThreadFactory);
    }

    @Bean
    public CollectingAlertSink recentAlertSink(SentinelProperties properties) {
        return new CollectingAlertSink(properties.getSink().getRecentCapacity());
    }

    @Bean
    public AlertDispatcher alertDispatcher(SentinelProperties properties,
                                           CollectingAlertSink recentAlertSink,
                                           RestTemplate restTemplate) {
        SentinelProperties.Dispatcher config = properties.getDispatcher();
        AlertDispatcher dispatcher = new AlertDispatcher(
                config.getCapacity(),
                config.getBatchSize(),
                config.getFlushIntervalMs(),
                OverflowStrategy.from(config.getOverflowStrategy()));

        SentinelProperties.Sink sink = properties.getSink();
        dispatcher.addSink(recentAlertSink);
        if (sink.isLoggingEnabled()) {
            dispatcher.addSink(notificationSink(new LoggingAlertSink(sink.getStatus()), sink));
        }
        if (sink.getWebhook().isEnabled()) {
            dispatcher.addSink(notificationSink(
                    new WebhookAlertSink(restTemplate, sink.getWebhook().getUrl(), sink.getStatus()), sink));
        }
        dispatcher.start();
        return dispatcher;
    }

    private AlertSink notificationSink(AlertSink sink, SentinelProperties.Sink config) {
        if (!config.getDedup().isEnabled()) {
            return sink;
        }
        return new DeduplicatingAlertSink(sink, config.getDedup().getTtl(), config.getDedup().getMaxRuns());
    }
}
