package com.example.feedpipeline.generator;

import com.example.feedpipeline.exception.FeedConfigurationException;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import com.example.feedpipeline.storage.StoredFile;
import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/**
 * 生成器公共流程：确定字段、渲染、写入存储。
 * 子类只负责把记录渲染成字节。
 */
@Slf4j
public abstract class AbstractFormatGenerator implements FormatGenerator {

    protected final FieldResolver fieldResolver;
    private final StorageSink storageSink;

    protected AbstractFormatGenerator(FieldResolver fieldResolver, StorageSink storageSink) {
        this.fieldResolver = fieldResolver;
        this.storageSink = storageSink;
    }

    @Override
    public GenerationResult generate(FeedDefinition feed, Stream<?> records, GenerationRecord generation) {
        try {
            List<String> fields = fieldsFor(feed);
            Iterator<?> iterator = records == null ? Stream.empty().iterator() : records.iterator();

            Rendered rendered = render(feed, fields, iterator, generation);

            StoredFile stored = storageSink.save(artifactPath(feed, generation), rendered.content());
            log.info("Generated {} feed {}: {} rows, {} bytes", format(), feed.getSlug(),
                    rendered.rowCount(), stored.size());
            return GenerationResult.success(stored.path(), stored.size(), rendered.rowCount());

        } catch (FeedConfigurationException e) {
            log.warn("Feed {} is misconfigured: {}", feed.getSlug(), e.getMessage());
            return GenerationResult.failure(e.getMessage());
        } catch (Exception e) {
            log.error("Error generating {} feed {}: {}", format(), feed.getSlug(), e.getMessage(), e);
            return GenerationResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * 配置的字段列表，未配置时取该类型的默认字段。
     */
    public List<String> fieldsFor(FeedDefinition feed) {
        List<String> fields = feed.getIncludedFields();
        if (fields == null || fields.isEmpty()) {
            fields = DefaultFields.forType(feed.getFeedType());
        }
        if (fields.isEmpty()) {
            throw new FeedConfigurationException(
                    "No fields configured for feed type " + feed.getFeedType().getCode());
        }
        return fields;
    }

    /**
     * 文件路径：feeds/{客户 ID}/{生成 ID}/{slug}_{生成 ID}.{扩展名}
     */
    public String artifactPath(FeedDefinition feed, GenerationRecord generation) {
        String fileName = feed.getSlug() + "_" + generation.getGenerationId() + "." + format().getExtension();
        return "feeds/" + feed.getOwner().getId() + "/" + generation.getGenerationId() + "/" + fileName;
    }

    protected Object valueOf(FeedDefinition feed, Object record, String field) {
        return fieldResolver.resolve(record, field, feed.getCustomFieldMapping());
    }

    protected abstract Rendered render(FeedDefinition feed, List<String> fields, Iterator<?> records,
            GenerationRecord generation) throws Exception;

    protected record Rendered(byte[] content, int rowCount) {
    }
}
