package com.example.feedpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 投递结果，由各 DeliveryHandler 返回并折叠进生成记录。
 */
@Value
@Builder
public class DeliveryOutcome {

    boolean success;

    @Builder.Default
    Map<String, Object> details = new LinkedHashMap<>();

    String error;

    public static DeliveryOutcome success(Map<String, Object> details) {
        return DeliveryOutcome.builder().success(true).details(details).build();
    }

    public static DeliveryOutcome failure(String error) {
        return DeliveryOutcome.builder().success(false).error(error).build();
    }
}
