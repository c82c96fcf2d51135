package com.example.feedpipeline.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Feed 类型，决定读取的数据集与默认字段。
 */
@Getter
@RequiredArgsConstructor
public enum FeedType {
    PRODUCT_CATALOG("product_catalog", "Product Catalog"),
    INVENTORY("inventory", "Inventory"),
    PRICING("pricing", "Pricing"),
    ASSETS("assets", "Digital Assets"),
    FITMENT("fitment", "Vehicle Fitment"),
    CUSTOM("custom", "Custom");

    private final String code;
    private final String displayName;
}
