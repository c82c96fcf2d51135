package com.example.feedpipeline.generator;

import com.example.feedpipeline.model.FeedType;

import java.util.List;

/**
 * 未配置字段列表时使用的默认字段。
 */
public final class DefaultFields {

    private static final List<String> PRODUCT_CATALOG = List.of(
            "sku", "name", "brand", "categories", "short_description", "msrp", "customer_price",
            "part_numbers", "oem_numbers", "length", "width", "height", "weight");

    private static final List<String> ASSETS = List.of(
            "id", "title", "description", "asset_type", "categories", "tags", "file_url",
            "thumbnail_url", "file_size", "created_at");

    private static final List<String> FITMENT = List.of(
            "sku", "make", "model", "year_start", "year_end", "submodel", "engine", "position", "notes");

    private DefaultFields() {
    }

    public static List<String> forType(FeedType feedType) {
        switch (feedType) {
            case PRODUCT_CATALOG:
                return PRODUCT_CATALOG;
            case ASSETS:
                return ASSETS;
            case FITMENT:
                return FITMENT;
            default:
                return List.of();
        }
    }
}
