package com.example.feedpipeline.exception;

public class FeedNotFoundException extends RuntimeException {

    public FeedNotFoundException(String message) {
        super(message);
    }
}
