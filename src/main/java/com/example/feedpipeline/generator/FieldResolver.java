package com.example.feedpipeline.generator;

import com.example.feedpipeline.exception.FeedConfigurationException;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.PropertyAccessorFactory;
import org.springframework.stereotype.Component;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 字段解析器：把导出字段名解析为记录上的值。
 * 只做 Map 键查找与 JavaBean getter 读取，不执行任意代码。
 */
@Component
public class FieldResolver {

    private static final Pattern FIELD_PATH = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    /**
     * 解析字段值。
     *
     * @param record        记录（Map 或 JavaBean）
     * @param fieldName     导出字段名
     * @param customMapping 自定义字段映射，可为 null
     * @return 字段值；集合类值返回 {@code List<String>}；任一路径段缺失时返回 null
     */
    public Object resolve(Object record, String fieldName, Map<String, String> customMapping) {
        String path = targetPath(fieldName, customMapping);

        Object value = record;
        for (String segment : path.split("\\.")) {
            value = readSegment(value, segment);
            if (value == null) {
                return null;
            }
        }
        return normalize(value);
    }

    /**
     * 校验自定义映射，非法目标路径抛出配置异常。
     */
    public void validateMapping(Map<String, String> customMapping) {
        if (customMapping == null) {
            return;
        }
        customMapping.forEach((field, target) -> checkPath(field, target));
    }

    private String targetPath(String fieldName, Map<String, String> customMapping) {
        String path = fieldName;
        if (customMapping != null && customMapping.containsKey(fieldName)) {
            path = customMapping.get(fieldName);
        }
        checkPath(fieldName, path);
        return path;
    }

    private void checkPath(String fieldName, String path) {
        if (path == null || !FIELD_PATH.matcher(path).matches()) {
            throw new FeedConfigurationException("Invalid field mapping for '" + fieldName + "': " + path);
        }
    }

    private Object readSegment(Object target, String segment) {
        if (target == null) {
            return null;
        }
        if (target instanceof Map) {
            return ((Map<?, ?>) target).get(segment);
        }
        if ("class".equals(segment)) {
            return null;
        }
        BeanWrapper wrapper = PropertyAccessorFactory.forBeanPropertyAccess(target);
        if (!wrapper.isReadableProperty(segment)) {
            return null;
        }
        return wrapper.getPropertyValue(segment);
    }

    private Object normalize(Object value) {
        if (value instanceof Collection) {
            List<String> members = new ArrayList<>();
            for (Object member : (Collection<?>) value) {
                if (member != null) {
                    members.add(FieldValues.toText(member));
                }
            }
            return members;
        }
        if (value.getClass().isArray()) {
            List<String> members = new ArrayList<>();
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                Object member = Array.get(value, i);
                if (member != null) {
                    members.add(FieldValues.toText(member));
                }
            }
            return members;
        }
        return value;
    }
}
