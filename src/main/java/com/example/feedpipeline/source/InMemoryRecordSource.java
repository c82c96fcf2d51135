package com.example.feedpipeline.source;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * 内存数据源，未接入外部商品库时使用。
 */
@Slf4j
public class InMemoryRecordSource implements RecordSource {

    private final Map<RecordSet, List<SourceRecord>> records = new ConcurrentHashMap<>();

    /**
     * 替换指定数据集的全部记录。
     */
    public void replace(RecordSet recordSet, Collection<SourceRecord> newRecords) {
        records.put(recordSet, List.copyOf(newRecords));
        log.info("Loaded {} records into {}", newRecords.size(), recordSet);
    }

    @Override
    public Stream<SourceRecord> stream(RecordSet recordSet) {
        return records.getOrDefault(recordSet, List.of()).stream();
    }
}
