package com.example.feedpipeline.service;

import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.model.GenerationStatus;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 定时批次入口。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeedSchedulerService {

    private final FeedOrchestrator orchestrator;
    private final Clock clock;

    @Value("${app.feeds.schedule.enabled:true}")
    private boolean enabled;

    /**
     * 定时任务：默认每分钟检查一次到期 feed
     */
    @Scheduled(cron = "${app.feeds.schedule.cron:0 * * * * *}")
    public void scheduledRun() {
        if (!enabled) {
            log.debug("Feed scheduling is disabled, skipping");
            return;
        }
        runDue();
    }

    /**
     * 手动触发一次批次
     */
    public BatchSummary runDue() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<GenerationRecord> results = orchestrator.runDueFeeds(now);

        long completed = results.stream().filter(r -> r.getStatus() == GenerationStatus.COMPLETED).count();
        return BatchSummary.builder()
                .startedAt(now)
                .started(results.size())
                .completed(completed)
                .failed(results.size() - completed)
                .generationIds(results.stream().map(GenerationRecord::getGenerationId).collect(Collectors.toList()))
                .build();
    }

    @Data
    @Builder
    public static class BatchSummary {
        private LocalDateTime startedAt;
        private int started;
        private long completed;
        private long failed;
        private List<String> generationIds;
    }
}
