package com.example.feedpipeline.exception;

/**
 * Feed 配置错误（缺少凭据、字段映射非法等），在任何 I/O 之前检出。
 */
public class FeedConfigurationException extends RuntimeException {

    public FeedConfigurationException(String message) {
        super(message);
    }
}
