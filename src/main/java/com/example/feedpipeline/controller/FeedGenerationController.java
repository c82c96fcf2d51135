package com.example.feedpipeline.controller;

import com.example.feedpipeline.exception.FeedNotFoundException;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.repository.FeedDefinitionRepository;
import com.example.feedpipeline.service.FeedOrchestrator;
import com.example.feedpipeline.service.FeedSchedulerService;
import com.example.feedpipeline.service.GenerationRecordService;
import com.example.feedpipeline.service.ScheduleEvaluator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Feed 生成接口控制器。
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class FeedGenerationController {

    private final FeedOrchestrator orchestrator;
    private final FeedSchedulerService schedulerService;
    private final GenerationRecordService recordService;
    private final FeedDefinitionRepository feedRepository;
    private final ScheduleEvaluator scheduleEvaluator;
    private final Clock clock;

    /**
     * 手动触发生成，异步执行
     */
    @PostMapping("/feeds/{id}/generate")
    public ResponseEntity<Map<String, Object>> generate(@PathVariable Long id) {
        Optional<GenerationRecord> opened = orchestrator.runFeed(id);

        Map<String, Object> body = new LinkedHashMap<>();
        if (opened.isEmpty()) {
            body.put("status", HttpStatus.CONFLICT.value());
            body.put("error", "Conflict");
            body.put("message", "A generation is already in progress for feed " + id);
            recordService.findActive(id).ifPresent(active -> {
                body.put("activeGenerationId", active.getGenerationId());
                body.put("activeStatus", active.getStatus());
            });
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }
        body.put("generationId", opened.get().getGenerationId());
        body.put("status", opened.get().getStatus());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(body);
    }

    @GetMapping("/generations/{generationId}")
    public ResponseEntity<GenerationRecord> getGeneration(@PathVariable String generationId) {
        return recordService.findByGenerationId(generationId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new FeedNotFoundException("Generation not found: " + generationId));
    }

    /**
     * 最近 20 次生成记录
     */
    @GetMapping("/feeds/{id}/generations")
    public ResponseEntity<List<GenerationRecord>> listGenerations(@PathVariable Long id) {
        requireFeed(id);
        return ResponseEntity.ok(recordService.recentForFeed(id));
    }

    @GetMapping("/feeds/{id}/schedule")
    public ResponseEntity<Map<String, Object>> schedule(@PathVariable Long id) {
        FeedDefinition feed = requireFeed(id);
        LocalDateTime now = LocalDateTime.now(clock);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("due", scheduleEvaluator.isDue(feed, now));
        body.put("nextRunAt", scheduleEvaluator.nextRunTime(feed, now).orElse(null));
        body.put("lastGenerated", feed.getLastGenerated());
        return ResponseEntity.ok(body);
    }

    /**
     * 手动触发一次调度批次
     */
    @PostMapping("/feeds/run-due")
    public ResponseEntity<FeedSchedulerService.BatchSummary> runDue() {
        return ResponseEntity.ok(schedulerService.runDue());
    }

    private FeedDefinition requireFeed(Long id) {
        return feedRepository.findById(id)
                .orElseThrow(() -> new FeedNotFoundException("Feed not found: " + id));
    }
}
