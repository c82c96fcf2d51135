package com.example.feedpipeline.source;

import com.example.feedpipeline.model.FeedType;

/**
 * 外部数据源暴露的数据集。
 */
public enum RecordSet {
    PRODUCTS,
    ASSETS,
    FITMENTS;

    public static RecordSet forFeedType(FeedType feedType) {
        switch (feedType) {
            case ASSETS:
                return ASSETS;
            case FITMENT:
                return FITMENTS;
            case PRODUCT_CATALOG:
            case INVENTORY:
            case PRICING:
            case CUSTOM:
                return PRODUCTS;
            default:
                throw new IllegalArgumentException("Unsupported feed type: " + feedType);
        }
    }
}
