package com.example.feedpipeline.generator;

import com.example.feedpipeline.model.FeedFormat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 格式生成器工厂。
 */
@Component
@RequiredArgsConstructor
public class FormatGeneratorFactory {

    private final CsvFeedGenerator csvFeedGenerator;
    private final XmlFeedGenerator xmlFeedGenerator;
    private final JsonFeedGenerator jsonFeedGenerator;

    /**
     * 根据输出格式获取生成器。
     *
     * @param format 输出格式
     * @return 生成器
     */
    public FormatGenerator getGenerator(FeedFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("Feed format is required");
        }
        switch (format) {
            case CSV:
                return csvFeedGenerator;
            case XML:
                return xmlFeedGenerator;
            case JSON:
                return jsonFeedGenerator;
            default:
                throw new IllegalArgumentException("Unsupported feed format: " + format);
        }
    }
}
