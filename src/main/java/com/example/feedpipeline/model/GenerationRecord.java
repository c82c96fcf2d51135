package com.example.feedpipeline.model;

import com.example.feedpipeline.model.converter.JsonMapConverter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 单次 Feed 生成的执行记录。
 * activeFeedId 在非终态时等于 feedId，终态清空；唯一约束保证同一 feed 不会并发生成。
 */
@Entity
@Table(name = "feed_generations",
        uniqueConstraints = @UniqueConstraint(name = "uk_feed_generations_active_feed", columnNames = "active_feed_id"),
        indexes = {
                @Index(name = "idx_feed_generations_feed", columnList = "feed_id,started_at"),
                @Index(name = "idx_feed_generations_status", columnList = "status")
        })
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 36)
    private String generationId;

    @Column(name = "feed_id", nullable = false)
    private Long feedId;

    @JsonIgnore
    @Column(name = "active_feed_id")
    private Long activeFeedId;

    // 乐观锁：超时回收后，原工作线程的写入会被拒绝
    @JsonIgnore
    @Version
    private Long version;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GenerationStatus status = GenerationStatus.PENDING;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", length = 20)
    private GenerationTrigger trigger = GenerationTrigger.SCHEDULED;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    private LocalDateTime completedAt;

    // 文件信息
    @Column(length = 500)
    private String filePath;

    private Long fileSize;

    private Integer rowCount;

    // 投递信息
    private LocalDateTime deliveredAt;

    @Column(length = 50)
    private String deliveryStatus;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> deliveryDetails = new LinkedHashMap<>();

    // 错误信息
    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> errorDetails = new LinkedHashMap<>();

    /**
     * 创建一条占用 feed 的 PENDING 记录。
     */
    public static GenerationRecord open(FeedDefinition feed, GenerationTrigger trigger, LocalDateTime now) {
        return GenerationRecord.builder()
                .generationId(UUID.randomUUID().toString())
                .feedId(feed.getId())
                .activeFeedId(feed.getId())
                .trigger(trigger)
                .startedAt(now)
                .build();
    }

    public void markGenerating() {
        transitionTo(GenerationStatus.GENERATING);
    }

    public void markGenerated(String filePath, long fileSize, int rowCount) {
        transitionTo(GenerationStatus.GENERATED);
        this.filePath = filePath;
        this.fileSize = fileSize;
        this.rowCount = rowCount;
    }

    public void markDelivering() {
        transitionTo(GenerationStatus.DELIVERING);
        this.deliveryStatus = "delivering";
    }

    /**
     * 进入 COMPLETED。从 GENERATED 直接完成只允许 DOWNLOAD 方式。
     *
     * @param method  投递方式
     * @param details 投递明细
     * @param now     完成时间
     */
    public void markCompleted(DeliveryMethod method, Map<String, Object> details, LocalDateTime now) {
        if (status == GenerationStatus.GENERATED && method != DeliveryMethod.DOWNLOAD) {
            throw new IllegalStateException("Generation " + generationId + " must pass DELIVERING before COMPLETED");
        }
        transitionTo(GenerationStatus.COMPLETED);
        this.completedAt = now;
        this.deliveredAt = now;
        this.deliveryStatus = method == DeliveryMethod.DOWNLOAD ? "ready" : "delivered";
        this.deliveryDetails = details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
        this.activeFeedId = null;
    }

    /**
     * 进入 FAILED。errorMessage 只保留第一次失败原因。
     */
    public void markFailed(String message, Map<String, Object> details, LocalDateTime now) {
        boolean wasDelivering = status == GenerationStatus.DELIVERING;
        transitionTo(GenerationStatus.FAILED);
        if (this.errorMessage == null || this.errorMessage.isEmpty()) {
            this.errorMessage = message;
        }
        if (details != null) {
            this.errorDetails = new LinkedHashMap<>(details);
        }
        if (wasDelivering) {
            this.deliveryStatus = "failed";
        }
        this.completedAt = now;
        this.activeFeedId = null;
    }

    private void transitionTo(GenerationStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(
                    "Illegal transition " + status + " -> " + target + " for generation " + generationId);
        }
        this.status = target;
    }
}
