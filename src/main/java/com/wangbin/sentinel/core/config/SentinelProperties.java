package com.wangbin.sentinel.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * sentinel 配置映射
 */
@Data
@Component
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    /**
     * 默认查询时间范围，例如 -24h、-7d、2024-01-01T00:00:00Z
     */
    private String timeRange = "-24h";

    /**
     * 启动后是否立即运行引擎
     */
    private boolean runOnStartup = true;

    /**
     * 检查定义文件（analysis.json 格式），留空表示只使用 checks 列表
     */
    private String checkFile;

    /**
     * 内联检查定义
     */
    private List<Check> checks = new ArrayList<>();

    private final Engine engine = new Engine();
    private final Source source = new Source();
    private final Sink sink = new Sink();
    private final Dispatcher dispatcher = new Dispatcher();

    @Data
    public static class Check {
        private String name;
        private String measurement;
        private String field;
        private String instance;
        private Double minValue;
        private Double maxValue;
        private double minDurationSeconds;
        private String lowAlertName;
        private String highAlertName;
    }

    @Data
    public static class Engine {
        /**
         * 持续轮询间隔，0 表示单次查询
         */
        private Duration pollInterval = Duration.ZERO;

        /**
         * 汇聚器乱序容忍窗口，未配置时取查询时间范围的跨度，0 表示只按水位线释放
         */
        private Duration outOfOrderTolerance;

        /**
         * 轮询模式下的数据写入延迟
         */
        private Duration ingestDelay = Duration.ofSeconds(5);

        /**
         * 通道线程上限，0 表示每个通道一个线程
         */
        private int maxLaneThreads = 0;

        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Source {
        /**
         * 数据源类型：memory / line-protocol / influx / push
         */
        private String type = "line-protocol";

        private final LineProtocol lineProtocol = new LineProtocol();
        private final Influx influx = new Influx();
        private final Push push = new Push();
        private final Retry retry = new Retry();
    }

    @Data
    public static class LineProtocol {
        private List<String> locations = new ArrayList<>();
        private String precision = "ms";
        private List<String> instanceTags = new ArrayList<>(List.of("instance", "imu", "sensor"));
    }

    @Data
    public static class Influx {
        private String url = "http://localhost:8181";
        private String token;
        private String database = "AeroSentinal";
        /**
         * 实例标签列名，留空表示不按实例拆分通道
         */
        private String instanceTag;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Push {
        private int capacity = 10000;
        private long pollTimeoutMs = 500;
    }

    @Data
    public static class Retry {
        private boolean enabled = true;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(500);
        private double multiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(10);
    }

    @Data
    public static class Sink {
        /**
         * 通知状态字段，对应 InfluxDB 的 crit/warn/info
         */
        private String status = "crit";
        private boolean loggingEnabled = true;
        private int recentCapacity = 1000;

        private final Webhook webhook = new Webhook();
        private final Dedup dedup = new Dedup();
    }

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url = "http://localhost:9000/alerts/influx";
    }

    @Data
    public static class Dedup {
        /**
         * 同一越限段只通知一次
         */
        private boolean enabled = true;
        private Duration ttl = Duration.ofHours(1);
        private long maxRuns = 100000;
    }

    @Data
    public static class Dispatcher {
        private int capacity = 10000;
        private int batchSize = 100;
        private long flushIntervalMs = 200;
        private String overflowStrategy = "BLOCK";
    }
}
