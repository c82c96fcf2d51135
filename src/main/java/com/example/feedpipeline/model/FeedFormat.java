package com.example.feedpipeline.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum FeedFormat {
    CSV("csv", "text/csv"),
    XML("xml", "application/xml"),
    JSON("json", "application/json");

    private final String extension;
    private final String contentType;
}
