package com.example.feedpipeline.generator;

import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.FeedFormat;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.storage.StorageSink;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * CSV 生成器：首行为字段名，多值字段以 | 连接，最小化引号。
 */
@Component
public class CsvFeedGenerator extends AbstractFormatGenerator {

    public CsvFeedGenerator(FieldResolver fieldResolver, StorageSink storageSink) {
        super(fieldResolver, storageSink);
    }

    @Override
    public FeedFormat format() {
        return FeedFormat.CSV;
    }

    @Override
    protected Rendered render(FeedDefinition feed, List<String> fields, Iterator<?> records,
            GenerationRecord generation) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        CsvWriter writer = new CsvWriter(new OutputStreamWriter(buffer, StandardCharsets.UTF_8), writerSettings());

        int rowCount = 0;
        try {
            writer.writeRow(fields);
            while (records.hasNext()) {
                Object record = records.next();
                List<String> row = new ArrayList<>(fields.size());
                for (String field : fields) {
                    row.add(FieldValues.toCsvCell(valueOf(feed, record, field)));
                }
                writer.writeRow(row);
                rowCount++;
            }
        } finally {
            writer.close();
        }
        return new Rendered(buffer.toByteArray(), rowCount);
    }

    static CsvWriterSettings writerSettings() {
        CsvWriterSettings settings = new CsvWriterSettings();
        settings.getFormat().setDelimiter(',');
        settings.getFormat().setQuote('"');
        settings.getFormat().setQuoteEscape('"');
        settings.getFormat().setLineSeparator("\r\n");
        // 只对包含分隔符、引号或换行的值加引号
        settings.setQuoteAllFields(false);
        settings.setQuoteEscapingEnabled(true);
        // 引号内的换行原样输出，不改写为 \r\n
        settings.setNormalizeLineEndingsWithinQuotes(false);
        settings.setIgnoreLeadingWhitespaces(false);
        settings.setIgnoreTrailingWhitespaces(false);
        return settings;
    }
}
