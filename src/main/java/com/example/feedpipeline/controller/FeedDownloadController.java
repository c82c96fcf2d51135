package com.example.feedpipeline.controller;

import com.example.feedpipeline.exception.FeedNotFoundException;
import com.example.feedpipeline.model.FeedFormat;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.service.GenerationRecordService;
import com.example.feedpipeline.storage.StorageSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;

/**
 * 生成文件下载。
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class FeedDownloadController {

    private final GenerationRecordService recordService;
    private final StorageSink storageSink;

    @GetMapping("/feeds/download/{generationId}")
    public ResponseEntity<ByteArrayResource> download(@PathVariable String generationId) throws IOException {
        GenerationRecord record = recordService.findByGenerationId(generationId)
                .orElseThrow(() -> new FeedNotFoundException("Generation not found: " + generationId));
        String path = record.getFilePath();
        if (path == null || !storageSink.exists(path)) {
            throw new FeedNotFoundException("No file available for generation " + generationId);
        }

        String fileName = path.substring(path.lastIndexOf('/') + 1);
        log.info("Serving {} for generation {}", fileName, generationId);

        byte[] content = storageSink.open(path);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(ContentDisposition.attachment().filename(fileName).build());
        headers.setContentLength(content.length);
        return ResponseEntity.ok()
                .headers(headers)
                .contentType(contentType(fileName))
                .body(new ByteArrayResource(content));
    }

    private MediaType contentType(String fileName) {
        for (FeedFormat format : FeedFormat.values()) {
            if (fileName.endsWith("." + format.getExtension())) {
                return MediaType.parseMediaType(format.getContentType());
            }
        }
        return MediaType.APPLICATION_OCTET_STREAM;
    }
}
