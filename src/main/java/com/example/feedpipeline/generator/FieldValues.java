package com.example.feedpipeline.generator;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 字段值的文本化规则，三种格式共用。
 */
final class FieldValues {

    static final String CSV_LIST_SEPARATOR = "|";

    private FieldValues() {
    }

    /**
     * 单值转文本：时间类型输出 ISO-8601，BigDecimal 不用科学计数法。
     */
    static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof LocalDateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) value);
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        return String.valueOf(value);
    }

    /**
     * XML 文本：去掉 XML 1.0 不允许的字符（除 \t \n \r 外的控制字符、代理项孤字符、U+FFFE/U+FFFF）。
     */
    static String toXmlText(Object value) {
        String text = toText(value);
        StringBuilder cleaned = null;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            int width = Character.charCount(codePoint);
            if (isXmlChar(codePoint)) {
                if (cleaned != null) {
                    cleaned.appendCodePoint(codePoint);
                }
            } else if (cleaned == null) {
                cleaned = new StringBuilder(text.length()).append(text, 0, i);
            }
            i += width;
        }
        return cleaned == null ? text : cleaned.toString();
    }

    private static boolean isXmlChar(int codePoint) {
        return codePoint == 0x9 || codePoint == 0xA || codePoint == 0xD
                || (codePoint >= 0x20 && codePoint <= 0xD7FF)
                || (codePoint >= 0xE000 && codePoint <= 0xFFFD)
                || (codePoint >= 0x10000 && codePoint <= 0x10FFFF);
    }

    static String toCsvCell(Object value) {
        if (value instanceof List) {
            return ((List<?>) value).stream()
                    .map(FieldValues::toText)
                    .collect(Collectors.joining(CSV_LIST_SEPARATOR));
        }
        return toText(value);
    }
}
