package com.ryuqq.publisher.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Properties 값 파싱 헬퍼.
 *
 * <p>파싱할 수 없는 값은 경고 로그 후 기본값을 사용하며, 숫자는 최소 1로 보정합니다.</p>
 *
 * @author Publisher Team
 * @since 1.0.0
 */
final class ConfigProperties {

    private static final Logger log = LoggerFactory.getLogger(ConfigProperties.class);

    private ConfigProperties() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static boolean booleanValue(Properties properties, String key, boolean defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        String normalized = raw.trim().toLowerCase();
        switch (normalized) {
            case "true", "yes", "on", "1":
                return true;
            case "false", "no", "off", "0":
                return false;
            default:
                log.warn("Invalid boolean for {}: '{}', using default {}", key, raw, defaultValue);
                return defaultValue;
        }
    }

    static long positiveLong(Properties properties, String key, long defaultValue) {
        String raw = properties.getProperty(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Math.max(1L, Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    static int positiveInt(Properties properties, String key, int defaultValue) {
        return (int) Math.min(Integer.MAX_VALUE, positiveLong(properties, key, defaultValue));
    }

    /**
     * {@code a=b,c=d} 형식 파싱. 형식이 잘못된 항목은 건너뜁니다.
     */
    static Map<String, String> mapping(Properties properties, String key) {
        String raw = properties.getProperty(key);
        Map<String, String> result = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return result;
        }
        for (String pair : raw.split(",")) {
            String[] parts = pair.split("=", 2);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                log.warn("Ignoring malformed {} entry: '{}'", key, pair);
                continue;
            }
            result.put(parts[0].trim().toLowerCase(), parts[1].trim());
        }
        return result;
    }
}
