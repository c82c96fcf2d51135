package com.example.feedpipeline.delivery;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 对外链接构造。
 */
@Component
public class FeedLinks {

    private final String baseUrl;

    public FeedLinks(@Value("${app.feeds.base-url:http://localhost:8080}") String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public String downloadUrl(String generationId) {
        return baseUrl + "/feeds/download/" + generationId;
    }
}
