package com.example.feedpipeline.notification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class FeedNotificationListener {

    @EventListener
    public void onFeedEvent(FeedNotificationEvent event) {
        Long customerId = event.getOwner() != null ? event.getOwner().getId() : null;
        if (event.getKind() == FeedEventKind.GENERATION_FAILED) {
            log.warn("[customer {}] {} {}", customerId, event.getKind(), event.getPayload());
        } else {
            log.info("[customer {}] {} {}", customerId, event.getKind(), event.getPayload());
        }
    }
}
