package com.example.feedpipeline.service;

import com.example.feedpipeline.exception.FeedNotFoundException;
import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.model.GenerationStatus;
import com.example.feedpipeline.model.GenerationTrigger;
import com.example.feedpipeline.repository.FeedDefinitionRepository;
import com.example.feedpipeline.repository.GenerationRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 生成记录的持久化操作。
 * 并发保护依赖 active_feed_id 唯一约束：同一 feed 同时只能插入一条进行中的记录。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationRecordService {

    private final GenerationRecordRepository recordRepository;
    private final FeedDefinitionRepository feedRepository;

    /**
     * 为 feed 打开一条 PENDING 记录。已有进行中的记录时返回空（不是错误）。
     * 不在外层事务中执行：唯一约束冲突需要在独立事务里失败。
     */
    public Optional<GenerationRecord> open(FeedDefinition feed, GenerationTrigger trigger, LocalDateTime now) {
        if (recordRepository.existsByActiveFeedId(feed.getId())) {
            log.warn("Feed {} already has a generation in flight, skipping", feed.getSlug());
            return Optional.empty();
        }
        try {
            GenerationRecord record = recordRepository.saveAndFlush(GenerationRecord.open(feed, trigger, now));
            log.info("Opened generation {} for feed {} ({})", record.getGenerationId(), feed.getSlug(), trigger);
            return Optional.of(record);
        } catch (DataIntegrityViolationException e) {
            log.warn("Feed {} was claimed concurrently, skipping", feed.getSlug());
            return Optional.empty();
        }
    }

    @Transactional
    public GenerationRecord save(GenerationRecord record) {
        return recordRepository.save(record);
    }

    /**
     * COMPLETED 迁移与 feed 计数更新放在同一事务。
     */
    @Transactional
    public GenerationRecord complete(Long feedId, GenerationRecord record, DeliveryMethod method,
            Map<String, Object> details, LocalDateTime now) {
        FeedDefinition feed = feedRepository.findById(feedId)
                .orElseThrow(() -> new FeedNotFoundException("Feed not found: " + feedId));

        // 在副本上迁移，写库失败时调用方手里的记录仍是迁移前状态
        GenerationRecord completed = record.toBuilder().build();
        completed.markCompleted(method, details, now);
        GenerationRecord saved = recordRepository.save(completed);

        feed.setLastGenerated(now);
        feed.setGenerationCount(feed.getGenerationCount() == null ? 1 : feed.getGenerationCount() + 1);
        if (method != DeliveryMethod.DOWNLOAD) {
            feed.setLastDelivered(now);
        }
        feedRepository.save(feed);
        return saved;
    }

    @Transactional
    public GenerationRecord fail(GenerationRecord record, String message, Map<String, Object> details,
            LocalDateTime now) {
        GenerationRecord failed = record.toBuilder().build();
        failed.markFailed(message, details, now);
        return recordRepository.save(failed);
    }

    /**
     * 把超时未结束的记录置为 FAILED，释放 feed 占用。其产物不会被投递。
     *
     * @param now        当前时间
     * @param staleAfter 超时时长
     * @return 被回收的记录
     */
    @Transactional
    public List<GenerationRecord> recoverStale(LocalDateTime now, Duration staleAfter) {
        List<GenerationRecord> stale = recordRepository.findByStatusInAndStartedAtBefore(
                GenerationStatus.IN_FLIGHT, now.minus(staleAfter));
        for (GenerationRecord record : stale) {
            GenerationStatus previous = record.getStatus();
            record.markFailed("Generation abandoned after " + staleAfter,
                    Map.of("reason", "stale", "previous_status", previous.name()), now);
            log.warn("Generation {} for feed {} was stuck in {}, marked as failed",
                    record.getGenerationId(), record.getFeedId(), previous);
        }
        return recordRepository.saveAll(stale);
    }

    @Transactional(readOnly = true)
    public Optional<GenerationRecord> findByGenerationId(String generationId) {
        return recordRepository.findByGenerationId(generationId);
    }

    /**
     * feed 当前进行中的记录（如有）。
     */
    @Transactional(readOnly = true)
    public Optional<GenerationRecord> findActive(Long feedId) {
        return recordRepository.findByActiveFeedId(feedId);
    }

    @Transactional(readOnly = true)
    public List<GenerationRecord> recentForFeed(Long feedId) {
        return recordRepository.findTop20ByFeedIdOrderByStartedAtDesc(feedId);
    }
}
