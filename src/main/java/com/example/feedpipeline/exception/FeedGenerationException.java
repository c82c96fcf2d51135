package com.example.feedpipeline.exception;

/**
 * 生成阶段错误（如投递时记录没有生成文件）。
 */
public class FeedGenerationException extends RuntimeException {

    public FeedGenerationException(String message) {
        super(message);
    }
}
