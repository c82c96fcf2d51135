package com.example.feedpipeline.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 外部数据源提供的一条只读记录。
 * 对 FITMENTS 记录，categories / brand 取自关联商品。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRecord {

    private Object key;

    @Builder.Default
    private Set<String> categories = new LinkedHashSet<>();

    private String brand;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    // 客户 ID -> 客户专属价格
    @Builder.Default
    private Map<Long, Object> customerPrices = new LinkedHashMap<>();
}
