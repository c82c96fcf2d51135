package com.example.feedpipeline.notification;

import com.example.feedpipeline.model.FeedOwner;

import java.util.Map;

/**
 * 面向客户的通知出口。调用方会吞掉并记录此处的异常，通知失败不影响生成结果。
 */
public interface NotificationPort {

    void notify(FeedOwner owner, FeedEventKind kind, Map<String, Object> payload);
}
