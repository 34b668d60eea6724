package com.wangbin.sentinel.common.utils;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONWriter;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON工具类，日志输出用。
 */
@Slf4j
public class JsonUtil {

    private JsonUtil() {
        // 工具类，防止实例化
    }

    /**
     * 对象转JSON字符串
     */
    public static String toJsonString(Object object) {
        try {
            return JSON.toJSONString(object, JSONWriter.Feature.WriteMapNullValue);
        } catch (Exception e) {
            log.error("对象转JSON字符串失败", e);
            return String.valueOf(object);
        }
    }

    /**
     * 对象转JSON字符串（格式化）
     */
    public static String toJsonStringPretty(Object object) {
        try {
            return JSON.toJSONString(object, JSONWriter.Feature.PrettyFormat);
        } catch (Exception e) {
            log.error("对象转JSON字符串失败", e);
            return String.valueOf(object);
        }
    }

    /**
     * 判断字符串是否为合法JSON
     */
    public static boolean isValidJson(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        return JSON.isValid(text);
    }
}
