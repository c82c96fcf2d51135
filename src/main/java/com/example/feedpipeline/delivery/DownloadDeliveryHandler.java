package com.example.feedpipeline.delivery;

import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 直接下载：文件已在存储中，只返回下载地址。
 */
@Component
public class DownloadDeliveryHandler extends AbstractDeliveryHandler {

    private final FeedLinks feedLinks;

    public DownloadDeliveryHandler(StorageSink storageSink, FeedLinks feedLinks) {
        super(storageSink);
        this.feedLinks = feedLinks;
    }

    @Override
    public DeliveryMethod method() {
        return DeliveryMethod.DOWNLOAD;
    }

    @Override
    protected DeliveryOutcome doDeliver(FeedDefinition feed, GenerationRecord generation, DeliveryConfig config) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("method", "download");
        details.put("file_path", generation.getFilePath());
        details.put("ready_for_download", true);
        details.put("download_url", feedLinks.downloadUrl(generation.getGenerationId()));
        return DeliveryOutcome.success(details);
    }
}
