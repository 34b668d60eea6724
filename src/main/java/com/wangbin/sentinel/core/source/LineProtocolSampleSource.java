package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.model.Sample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 行协议文件数据源
 *
 * 启动时把一个或多个行协议文件（例如 DataFlash 日志转换结果、示例数据）
 * 读入内存并按分区排序，之后的查询与内存数据源一致。
 */
@Slf4j
public class LineProtocolSampleSource implements SampleSource {

    private final InMemorySampleSource delegate = new InMemorySampleSource("line-protocol");
    private final LineProtocolParser parser;
    private final AtomicLong skippedLines = new AtomicLong(0);

    public LineProtocolSampleSource(LineProtocolParser parser) {
        this.parser = parser;
    }

    public static LineProtocolSampleSource fromLocations(List<String> locations, LineProtocolParser parser) {
        LineProtocolSampleSource source = new LineProtocolSampleSource(parser);
        for (String location : locations) {
            source.load(resolve(location));
        }
        return source;
    }

    /**
     * 先尝试类路径，再按文件路径加载
     */
    static Resource resolve(String location) {
        String path = location.startsWith("classpath:") ? location.substring("classpath:".length()) : location;
        Resource classpath = new ClassPathResource(path);
        if (classpath.exists()) {
            return classpath;
        }
        return new FileSystemResource(path);
    }

    public void load(Resource resource) {
        if (!resource.exists()) {
            throw new SampleSourceException(getName(), null, "行协议文件不存在: " + resource.getDescription());
        }
        List<Sample> samples = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = reader.readLine()) != null) {
                lineNo++;
                try {
                    samples.addAll(parser.parseLine(line));
                } catch (IllegalArgumentException e) {
                    skippedLines.incrementAndGet();
                    log.warn("跳过无法解析的行 {}:{} - {}", resource.getFilename(), lineNo, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new SampleSourceException(getName(), null, "读取行协议文件失败: " + resource.getDescription(), e);
        }
        delegate.addAll(samples);
        log.info("从 {} 加载 {} 个样本，跳过 {} 行", resource.getDescription(), samples.size(), skippedLines.get());
    }

    @Override
    public String getName() {
        return "line-protocol";
    }

    @Override
    public Iterator<Sample> open(SampleQuery query) {
        return delegate.open(query);
    }

    @Override
    public List<String> discoverInstances(String measurement, String field, TimeRange timeRange) {
        return delegate.discoverInstances(measurement, field, timeRange);
    }

    public long getSkippedLines() {
        return skippedLines.get();
    }

    public long getSampleCount() {
        return delegate.getSampleCount();
    }
}
