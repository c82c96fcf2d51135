package com.example.feedpipeline.source;

import java.util.stream.Stream;

/**
 * 商品 / 资产数据的外部只读端口。调用方负责关闭返回的流。
 */
public interface RecordSource {

    Stream<SourceRecord> stream(RecordSet recordSet);
}
