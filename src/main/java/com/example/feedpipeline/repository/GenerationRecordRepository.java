package com.example.feedpipeline.repository;

import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.model.GenerationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 生成记录仓储接口。
 */
@Repository
public interface GenerationRecordRepository extends JpaRepository<GenerationRecord, Long> {

    Optional<GenerationRecord> findByGenerationId(String generationId);

    /**
     * 查询 feed 当前占用中的记录。
     *
     * @param activeFeedId feed ID
     * @return 进行中的记录
     */
    Optional<GenerationRecord> findByActiveFeedId(Long activeFeedId);

    boolean existsByActiveFeedId(Long activeFeedId);

    List<GenerationRecord> findTop20ByFeedIdOrderByStartedAtDesc(Long feedId);

    /**
     * 查询超时未结束的记录。
     *
     * @param statuses 非终态集合
     * @param cutoff   开始时间早于此值视为超时
     * @return 超时记录
     */
    List<GenerationRecord> findByStatusInAndStartedAtBefore(Collection<GenerationStatus> statuses, LocalDateTime cutoff);
}
