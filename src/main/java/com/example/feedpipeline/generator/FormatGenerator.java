package com.example.feedpipeline.generator;

import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.FeedFormat;
import com.example.feedpipeline.model.GenerationRecord;

import java.util.stream.Stream;

public interface FormatGenerator {

    FeedFormat format();

    /**
     * Render the records into this format and persist the artifact.
     *
     * @param feed       the feed definition
     * @param records    record stream, may be null (treated as empty)
     * @param generation the owning generation record
     * @return result with file metadata, or a failure carrying the error message
     */
    GenerationResult generate(FeedDefinition feed, Stream<?> records, GenerationRecord generation);
}
