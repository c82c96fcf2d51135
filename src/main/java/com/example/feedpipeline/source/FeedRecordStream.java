package com.example.feedpipeline.source;

import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.FeedOwner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * 按 feed 的内容过滤条件打开记录流：分类 / 品牌 / 标签过滤、按主键去重、叠加客户专属价格。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedRecordStream {

    public static final String CUSTOMER_PRICE_FIELD = "customer_price";

    private final RecordSource recordSource;

    /**
     * 打开 feed 对应的记录流，元素为可被 FieldResolver 解析的字段 Map。
     *
     * @param feed feed 配置
     * @return 记录流（调用方负责关闭）
     */
    public Stream<Map<String, Object>> open(FeedDefinition feed) {
        RecordSet recordSet = RecordSet.forFeedType(feed.getFeedType());
        Stream<SourceRecord> source = recordSource.stream(recordSet);
        if (source == null) {
            return Stream.empty();
        }

        Set<Object> seenKeys = new HashSet<>();
        return source
                .filter(contentFilter(feed, recordSet))
                .filter(record -> record.getKey() == null || seenKeys.add(record.getKey()))
                .map(record -> toFieldMap(record, recordSet, feed.getOwner()));
    }

    private Predicate<SourceRecord> contentFilter(FeedDefinition feed, RecordSet recordSet) {
        if (recordSet == RecordSet.ASSETS) {
            return record -> true;
        }
        List<String> categories = feed.getCategories();
        List<String> brands = feed.getBrands();
        // 标签过滤只作用于商品
        List<String> tags = recordSet == RecordSet.PRODUCTS ? feed.getProductTags() : List.of();

        return record -> matchesAny(categories, record.getCategories())
                && (isEmpty(brands) || (record.getBrand() != null && brands.contains(record.getBrand())))
                && matchesAny(tags, record.getTags());
    }

    private boolean matchesAny(List<String> wanted, Collection<String> actual) {
        if (isEmpty(wanted)) {
            return true;
        }
        if (actual == null) {
            return false;
        }
        for (String value : actual) {
            if (wanted.contains(value)) {
                return true;
            }
        }
        return false;
    }

    private boolean isEmpty(List<String> values) {
        return values == null || values.isEmpty();
    }

    private Map<String, Object> toFieldMap(SourceRecord record, RecordSet recordSet, FeedOwner owner) {
        Map<String, Object> fields = new LinkedHashMap<>();
        if (record.getAttributes() != null) {
            fields.putAll(record.getAttributes());
        }
        if (recordSet == RecordSet.PRODUCTS && owner != null && record.getCustomerPrices() != null) {
            Object price = record.getCustomerPrices().get(owner.getId());
            if (price != null) {
                fields.put(CUSTOMER_PRICE_FIELD, price);
            }
        }
        return fields;
    }
}
