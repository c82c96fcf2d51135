package com.example.feedpipeline.delivery;

import com.example.feedpipeline.exception.FeedConfigurationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * deliveryConfig 的类型化读取视图。
 */
final class DeliveryConfig {

    private final Map<String, Object> values;

    private DeliveryConfig(Map<String, Object> values) {
        this.values = values == null ? Collections.emptyMap() : values;
    }

    static DeliveryConfig of(Map<String, Object> values) {
        return new DeliveryConfig(values);
    }

    String getString(String key) {
        Object value = values.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    String getString(String key, String defaultValue) {
        String value = getString(key);
        return value != null ? value : defaultValue;
    }

    String require(String key, String method) {
        String value = getString(key);
        if (value == null) {
            throw new FeedConfigurationException("Missing " + method + " configuration: " + key);
        }
        return value;
    }

    int getInt(String key, int defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new FeedConfigurationException("Invalid integer for " + key + ": " + value);
        }
    }

    boolean getBoolean(String key, boolean defaultValue) {
        Object value = values.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    /**
     * 列表值；单个字符串按逗号拆分。
     */
    List<String> getStringList(String key) {
        Object value = values.get(key);
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object member : (Collection<?>) value) {
                if (member != null && !member.toString().isBlank()) {
                    result.add(member.toString().trim());
                }
            }
        } else if (value != null) {
            for (String part : value.toString().split(",")) {
                if (!part.isBlank()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }

    Map<String, String> getStringMap(String key) {
        Object value = values.get(key);
        Map<String, String> result = new LinkedHashMap<>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((k, v) -> {
                if (k != null && v != null) {
                    result.put(k.toString(), v.toString());
                }
            });
        } else if (value != null) {
            throw new FeedConfigurationException(key + " must be an object");
        }
        return result;
    }
}
