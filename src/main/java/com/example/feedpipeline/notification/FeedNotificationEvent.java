package com.example.feedpipeline.notification;

import com.example.feedpipeline.model.FeedOwner;
import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
public class FeedNotificationEvent extends ApplicationEvent {

    private final FeedOwner owner;
    private final FeedEventKind kind;
    private final Map<String, Object> payload;

    public FeedNotificationEvent(Object source, FeedOwner owner, FeedEventKind kind, Map<String, Object> payload) {
        super(source);
        this.owner = owner;
        this.kind = kind;
        this.payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
