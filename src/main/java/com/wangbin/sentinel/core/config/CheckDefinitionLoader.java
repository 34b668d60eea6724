package com.wangbin.sentinel.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wangbin.sentinel.common.exception.CheckConfigException;
import com.wangbin.sentinel.core.engine.model.CheckDefinition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * 检查定义加载器
 *
 * 来源：
 * 1. sentinel.checks 内联列表
 * 2. sentinel.check-file 指向的 analysis.json，结构为 {"analysis_parameters": [...]}，
 *    只加载 check_type 为 simple 的检查
 *
 * 任何非法定义都会抛出 {@link CheckConfigException}，引擎不会在部分定义上启动。
 */
@Slf4j
@RequiredArgsConstructor
public class CheckDefinitionLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public CheckDefinitionLoader(ObjectMapper objectMapper) {
        this(objectMapper, new DefaultResourceLoader());
    }

    public List<CheckDefinition> load(SentinelProperties properties) {
        List<CheckDefinition> definitions = new ArrayList<>();
        for (SentinelProperties.Check check : properties.getChecks()) {
            definitions.add(fromProperties(check));
        }
        String checkFile = properties.getCheckFile();
        if (checkFile != null && !checkFile.isBlank()) {
            definitions.addAll(loadFile(checkFile));
        }
        log.info("共加载 {} 个检查定义", definitions.size());
        return definitions;
    }

    static CheckDefinition fromProperties(SentinelProperties.Check check) {
        return CheckDefinition.builder()
                .name(check.getName())
                .measurement(check.getMeasurement())
                .field(check.getField())
                .instanceFilter(check.getInstance())
                .minValue(check.getMinValue())
                .maxValue(check.getMaxValue())
                .minDurationSeconds(check.getMinDurationSeconds())
                .lowAlertName(check.getLowAlertName())
                .highAlertName(check.getHighAlertName())
                .build();
    }

    public List<CheckDefinition> loadFile(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new CheckConfigException(location, "检查定义文件不存在");
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(objectMapper.readTree(in), location);
        } catch (IOException e) {
            throw new CheckConfigException(location, e.getMessage(), e);
        }
    }

    List<CheckDefinition> parse(JsonNode root, String location) {
        JsonNode parameters = root.path("analysis_parameters");
        if (!parameters.isArray()) {
            throw new CheckConfigException(location, "缺少 analysis_parameters 数组");
        }
        List<CheckDefinition> definitions = new ArrayList<>();
        int index = 0;
        for (JsonNode node : parameters) {
            index++;
            String checkType = node.path("check_type").asText("simple");
            String measurement = text(node, "message_type");
            String field = text(node, "field");
            String name = text(node, "analysis_name");
            if (!"simple".equalsIgnoreCase(checkType)) {
                log.warn("跳过不支持的检查类型 {}: {}", checkType, name != null ? name : "#" + index);
                continue;
            }
            definitions.add(CheckDefinition.builder()
                    .name(name)
                    .measurement(measurement)
                    .field(field)
                    .instanceFilter(text(node, "instance"))
                    .minValue(number(node, "min_value"))
                    .maxValue(number(node, "max_value"))
                    .minDurationSeconds(node.path("min_duration_seconds").asDouble(0d))
                    .lowAlertName(text(node, "alert_name_low"))
                    .highAlertName(text(node, "alert_name_high"))
                    .build());
        }
        log.info("从 {} 加载 {} 个检查定义", location, definitions.size());
        return definitions;
    }

    private static String text(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static Double number(JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new CheckConfigException(text(node, "analysis_name"), name + " 不是数值: " + value);
        }
        return value.asDouble();
    }
}
