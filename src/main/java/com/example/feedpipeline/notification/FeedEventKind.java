package com.example.feedpipeline.notification;

/**
 * 通知事件类型。
 */
public enum FeedEventKind {
    GENERATION_STARTED,
    GENERATION_FAILED,
    DELIVERY_COMPLETED
}
