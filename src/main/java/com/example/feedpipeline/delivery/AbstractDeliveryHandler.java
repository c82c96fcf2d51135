package com.example.feedpipeline.delivery;

import com.example.feedpipeline.exception.FeedGenerationException;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * 投递公共流程：捕获所有异常并转换为失败结果。
 */
@Slf4j
public abstract class AbstractDeliveryHandler implements DeliveryHandler {

    protected final StorageSink storageSink;

    protected AbstractDeliveryHandler(StorageSink storageSink) {
        this.storageSink = storageSink;
    }

    @Override
    public final DeliveryOutcome deliver(FeedDefinition feed, GenerationRecord generation) {
        try {
            return doDeliver(feed, generation, DeliveryConfig.of(feed.getDeliveryConfig()));
        } catch (Exception e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("{} delivery error for feed {} (generation {}): {}", method(), feed.getSlug(),
                    generation.getGenerationId(), error, e);
            return DeliveryOutcome.failure(error);
        }
    }

    @Override
    public void validate(FeedDefinition feed) {
        checkConfig(feed, DeliveryConfig.of(feed.getDeliveryConfig()));
    }

    /**
     * 子类按需覆盖，默认无需配置。
     */
    protected void checkConfig(FeedDefinition feed, DeliveryConfig config) {
    }

    protected abstract DeliveryOutcome doDeliver(FeedDefinition feed, GenerationRecord generation,
            DeliveryConfig config) throws Exception;

    protected byte[] readArtifact(GenerationRecord generation) throws IOException {
        if (generation.getFilePath() == null) {
            throw new FeedGenerationException("Generation " + generation.getGenerationId() + " has no artifact");
        }
        return storageSink.open(generation.getFilePath());
    }

    protected static String fileName(GenerationRecord generation) {
        String path = generation.getFilePath();
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    protected static String joinRemote(String directory, String fileName) {
        if (directory == null || directory.isEmpty()) {
            return fileName;
        }
        return directory.endsWith("/") ? directory + fileName : directory + "/" + fileName;
    }
}
