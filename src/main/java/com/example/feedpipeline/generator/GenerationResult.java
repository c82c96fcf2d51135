package com.example.feedpipeline.generator;

import lombok.Builder;
import lombok.Value;

/**
 * 格式生成结果。
 */
@Value
@Builder
public class GenerationResult {

    boolean success;
    String filePath;
    long fileSize;
    int rowCount;
    String error;

    public static GenerationResult success(String filePath, long fileSize, int rowCount) {
        return GenerationResult.builder()
                .success(true)
                .filePath(filePath)
                .fileSize(fileSize)
                .rowCount(rowCount)
                .build();
    }

    public static GenerationResult failure(String error) {
        return GenerationResult.builder().success(false).error(error).build();
    }
}
