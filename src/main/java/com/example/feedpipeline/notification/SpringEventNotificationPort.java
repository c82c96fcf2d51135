package com.example.feedpipeline.notification;

import com.example.feedpipeline.model.FeedOwner;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * 以 Spring 应用事件的形式发布通知，由监听器决定具体渠道。
 */
@Component
@RequiredArgsConstructor
public class SpringEventNotificationPort implements NotificationPort {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void notify(FeedOwner owner, FeedEventKind kind, Map<String, Object> payload) {
        eventPublisher.publishEvent(new FeedNotificationEvent(this, owner, kind, payload));
    }
}
