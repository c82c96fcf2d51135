package com.example.feedpipeline.repository;

import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.Frequency;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Feed 配置仓储接口。
 */
@Repository
public interface FeedDefinitionRepository extends JpaRepository<FeedDefinition, Long> {

    /**
     * 查询参与自动调度的 feed（启用且非 MANUAL）。
     *
     * @param frequency 排除的频率
     * @return feed 列表
     */
    List<FeedDefinition> findByActiveTrueAndFrequencyNot(Frequency frequency);
}
