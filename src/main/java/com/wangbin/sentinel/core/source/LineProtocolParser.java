package com.wangbin.sentinel.core.source;

import com.wangbin.sentinel.core.engine.model.Sample;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * InfluxDB 行协议解析器
 *
 * 格式：measurement[,tag=value...] field=value[,field=value...] [timestamp]
 * 数值字段（浮点、整数 12i/12u、布尔）各生成一个样本，字符串字段忽略。
 * 实例标签取 instanceTags 中第一个出现的标签。
 */
@Slf4j
public class LineProtocolParser {

    private final Precision precision;
    private final List<String> instanceTags;

    public LineProtocolParser(Precision precision, List<String> instanceTags) {
        this.precision = precision != null ? precision : Precision.NS;
        this.instanceTags = instanceTags != null ? List.copyOf(instanceTags) : List.of();
    }

    /**
     * 解析一行，注释和空行返回空列表
     *
     * @throws IllegalArgumentException 行格式错误
     */
    public List<Sample> parseLine(String line) {
        if (line == null) {
            return Collections.emptyList();
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
            return Collections.emptyList();
        }

        List<String> sections = split(trimmed, ' ');
        sections.removeIf(String::isEmpty);
        if (sections.size() < 2 || sections.size() > 3) {
            throw new IllegalArgumentException("行协议格式错误: " + line);
        }
        if (sections.size() == 2) {
            throw new IllegalArgumentException("行协议缺少时间戳: " + line);
        }

        List<String> keyParts = split(sections.get(0), ',');
        String measurement = unescape(keyParts.get(0));
        if (measurement.isEmpty()) {
            throw new IllegalArgumentException("行协议缺少 measurement: " + line);
        }
        Map<String, String> tags = new LinkedHashMap<>();
        for (int i = 1; i < keyParts.size(); i++) {
            String[] kv = splitPair(keyParts.get(i), line);
            tags.put(kv[0], unescape(kv[1]));
        }

        Instant timestamp = precision.toInstant(parseTimestamp(sections.get(2), line));
        String instance = resolveInstance(tags);

        List<Sample> samples = new ArrayList<>();
        for (String fieldPart : split(sections.get(1), ',')) {
            String[] kv = splitPair(fieldPart, line);
            Double value = parseNumeric(kv[1]);
            if (value == null) {
                continue;
            }
            samples.add(Sample.of(timestamp, measurement, kv[0], instance, value));
        }
        return samples;
    }

    private String resolveInstance(Map<String, String> tags) {
        for (String tag : instanceTags) {
            String value = tags.get(tag);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private long parseTimestamp(String text, String line) {
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("行协议时间戳无效: " + line, e);
        }
    }

    /**
     * 解析字段值，字符串字段返回 null
     */
    static Double parseNumeric(String raw) {
        if (raw.startsWith("\"")) {
            return null;
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        switch (lower) {
            case "t", "true" -> {
                return 1d;
            }
            case "f", "false" -> {
                return 0d;
            }
            default -> {
                // 数值字段
            }
        }
        if (lower.endsWith("i") || lower.endsWith("u")) {
            return (double) Long.parseLong(raw.substring(0, raw.length() - 1));
        }
        return Double.parseDouble(raw);
    }

    private static String[] splitPair(String part, String line) {
        List<String> kv = split(part, '=');
        if (kv.size() != 2 || kv.get(0).isEmpty()) {
            throw new IllegalArgumentException("行协议键值对格式错误 '" + part + "': " + line);
        }
        return new String[]{unescape(kv.get(0)), kv.get(1)};
    }

    /**
     * 按未转义、不在引号内的分隔符切分，保留转义符
     */
    static List<String> split(String text, char delimiter) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean escaped = false;
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (escaped) {
                current.append(c);
                escaped = false;
            } else if (c == '\\') {
                current.append(c);
                escaped = true;
            } else if (c == '"') {
                current.append(c);
                quoted = !quoted;
            } else if (c == delimiter && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    static String unescape(String text) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!escaped && c == '\\') {
                escaped = true;
                continue;
            }
            out.append(c);
            escaped = false;
        }
        return out.toString();
    }

    /**
     * 时间戳精度，与 influx write --precision 保持一致
     */
    public enum Precision {
        NS, US, MS, S;

        public Instant toInstant(long value) {
            return switch (this) {
                case NS -> Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000_000L), Math.floorMod(value, 1_000_000_000L));
                case US -> Instant.ofEpochSecond(Math.floorDiv(value, 1_000_000L), Math.floorMod(value, 1_000_000L) * 1_000L);
                case MS -> Instant.ofEpochMilli(value);
                case S -> Instant.ofEpochSecond(value);
            };
        }

        public static Precision from(String text) {
            if (text == null || text.isBlank()) {
                return NS;
            }
            return Precision.valueOf(text.trim().toUpperCase(Locale.ROOT));
        }
    }
}
