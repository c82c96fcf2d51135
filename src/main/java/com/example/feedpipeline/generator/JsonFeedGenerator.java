package com.example.feedpipeline.generator;

import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.FeedFormat;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON 生成器：{"feed": {...}, "items": [...]}。
 * 每个 item 的键与字段列表一致，缺失值输出为 null。
 */
@Component
public class JsonFeedGenerator extends AbstractFormatGenerator {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public JsonFeedGenerator(FieldResolver fieldResolver, StorageSink storageSink) {
        super(fieldResolver, storageSink);
    }

    @Override
    public FeedFormat format() {
        return FeedFormat.JSON;
    }

    @Override
    protected Rendered render(FeedDefinition feed, List<String> fields, Iterator<?> records,
            GenerationRecord generation) throws Exception {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("type", feed.getFeedType().getCode());
        header.put("name", feed.getName());
        header.put("generated", generation.getStartedAt());
        header.put("generation_id", generation.getGenerationId());
        header.put("customer", feed.getOwner().displayName());

        List<Map<String, Object>> items = new ArrayList<>();
        while (records.hasNext()) {
            Object record = records.next();
            Map<String, Object> item = new LinkedHashMap<>();
            for (String field : fields) {
                item.put(field, toJsonValue(valueOf(feed, record, field)));
            }
            items.add(item);
        }

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("feed", header);
        document.put("items", items);

        return new Rendered(objectMapper.writeValueAsBytes(document), items.size());
    }

    private Object toJsonValue(Object value) {
        // 时间类型交给 JavaTimeModule，与 feed.generated 格式一致
        if (value == null || value instanceof List || value instanceof String
                || value instanceof Number || value instanceof Boolean || value instanceof Temporal) {
            return value;
        }
        return FieldValues.toText(value);
    }
}
