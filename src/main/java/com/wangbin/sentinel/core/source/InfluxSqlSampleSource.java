package com.wangbin.sentinel.core.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.sentinel.common.exception.SampleSourceException;
import com.wangbin.sentinel.core.engine.model.Sample;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * InfluxDB 3 SQL 数据源
 *
 * 通过 HTTP 接口 POST {url}/api/v3/query_sql 执行查询，结果为 JSON 行数组。
 * 表不存在、字段不存在视为没有数据；其余失败抛出 {@link SampleSourceException}。
 */
@Slf4j
public class InfluxSqlSampleSource implements SampleSource {

    private static final String QUERY_PATH = "/api/v3/query_sql";
    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {
    };

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String token;
    private final String database;
    private final InfluxQueryBuilder queryBuilder;

    public InfluxSqlSampleSource(RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 String baseUrl,
                                 String token,
                                 String database,
                                 InfluxQueryBuilder queryBuilder) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.database = database;
        this.queryBuilder = queryBuilder;
    }

    @Override
    public String getName() {
        return "influx";
    }

    @Override
    public Iterator<Sample> open(SampleQuery query) {
        String sql = queryBuilder.buildSelect(query);
        String series = query.seriesKey().toString();
        List<Map<String, Object>> rows = execute(sql, series);

        List<Sample> samples = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Double value = toDouble(row.get("value"));
            Object time = row.get("time");
            if (value == null || time == null) {
                continue;
            }
            samples.add(Sample.of(parseTime(time, series), query.getMeasurement(), query.getField(),
                    query.getInstance(), value));
        }
        log.debug("查询 {} 返回 {} 个样本", series, samples.size());
        return samples.iterator();
    }

    @Override
    public List<String> discoverInstances(String measurement, String field, TimeRange timeRange) {
        List<String> instances = new ArrayList<>();
        if (queryBuilder.getInstanceTag() == null) {
            instances.add(null);
            return instances;
        }
        String mapped = InfluxQueryBuilder.mapFieldName(measurement, field, null);
        List<Map<String, Object>> rows = execute(
                queryBuilder.buildDistinctInstances(measurement, mapped, timeRange), measurement + "." + field);
        for (Map<String, Object> row : rows) {
            Object instance = row.get("instance");
            instances.add(instance == null ? null : instance.toString());
        }
        return instances;
    }

    private List<Map<String, Object>> execute(String sql, String series) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (token != null && !token.isBlank()) {
            headers.setBearerAuth(token);
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("db", database);
        body.put("q", sql);
        body.put("format", "json");

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    baseUrl + QUERY_PATH, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
            String payload = response.getBody();
            if (payload == null || payload.isBlank()) {
                return Collections.emptyList();
            }
            return objectMapper.readValue(payload, ROWS);
        } catch (HttpStatusCodeException e) {
            String error = e.getResponseBodyAsString();
            if (isMissingSchema(error)) {
                log.debug("{} 不存在，视为无数据: {}", series, abbreviate(error));
                return Collections.emptyList();
            }
            throw new SampleSourceException(getName(), series,
                    "InfluxDB 查询失败 " + e.getStatusCode() + ": " + abbreviate(error), e);
        } catch (ResourceAccessException e) {
            if (e.getCause() instanceof SocketTimeoutException) {
                throw SampleSourceException.timeout(getName(), series, e);
            }
            throw new SampleSourceException(getName(), series, "InfluxDB 连接失败: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new SampleSourceException(getName(), series, "InfluxDB 请求异常: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new SampleSourceException(getName(), series, "InfluxDB 响应解析失败: " + e.getOriginalMessage(), e);
        }
    }

    static boolean isMissingSchema(String error) {
        if (error == null) {
            return false;
        }
        String lower = error.toLowerCase(Locale.ROOT);
        if (lower.contains("table") && lower.contains("not found")) {
            return true;
        }
        return (lower.contains("no field named") || lower.contains("schema error"))
                && lower.contains("valid fields");
    }

    static Instant parseTime(Object raw, String series) {
        if (raw instanceof Number number) {
            long nanos = number.longValue();
            return Instant.ofEpochSecond(Math.floorDiv(nanos, 1_000_000_000L), Math.floorMod(nanos, 1_000_000_000L));
        }
        String text = raw.toString();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                // InfluxDB 3 返回不带时区的 UTC 时间
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                throw new SampleSourceException("influx", series, "无法解析时间: " + text, nested);
            }
        }
    }

    private static Double toDouble(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1d : 0d;
        }
        return null;
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
