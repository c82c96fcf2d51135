package com.example.feedpipeline.model;

import com.example.feedpipeline.model.converter.JsonMapConverter;
import com.example.feedpipeline.model.converter.JsonStringListConverter;
import com.example.feedpipeline.model.converter.JsonStringMapConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 客户的 Feed 配置（由外部管理端维护，本模块只更新调度计数字段）。
 */
@Entity
@Table(name = "feed_definitions", indexes = {
        @Index(name = "idx_feed_definitions_schedule", columnList = "frequency,active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, unique = true)
    private String slug;

    @Embedded
    private FeedOwner owner;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private FeedType feedType;

    @Enumerated(EnumType.STRING)
    @Column(name = "feed_format", nullable = false, length = 10)
    private FeedFormat format;

    // 内容过滤
    @Builder.Default
    @Convert(converter = JsonStringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> categories = new ArrayList<>();

    @Builder.Default
    @Convert(converter = JsonStringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> brands = new ArrayList<>();

    @Builder.Default
    @Convert(converter = JsonStringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> productTags = new ArrayList<>();

    // 字段配置
    @Builder.Default
    @Convert(converter = JsonStringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> includedFields = new ArrayList<>();

    @Builder.Default
    @Convert(converter = JsonStringMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, String> customFieldMapping = new LinkedHashMap<>();

    // 调度
    @Builder.Default
    private boolean active = true;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Frequency frequency = Frequency.MANUAL;

    private LocalTime scheduleTime; // DAILY 必填

    private Integer scheduleDay; // WEEKLY: 0-6（0 为周一），MONTHLY: 1-31

    // 投递
    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DeliveryMethod deliveryMethod = DeliveryMethod.DOWNLOAD;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> deliveryConfig = new LinkedHashMap<>();

    // 统计
    private LocalDateTime lastGenerated;

    private LocalDateTime lastDelivered;

    @Builder.Default
    private Integer generationCount = 0;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
