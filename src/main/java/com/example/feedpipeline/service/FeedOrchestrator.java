package com.example.feedpipeline.service;

import com.example.feedpipeline.delivery.DeliveryHandler;
import com.example.feedpipeline.delivery.DeliveryHandlerFactory;
import com.example.feedpipeline.exception.FeedConfigurationException;
import com.example.feedpipeline.exception.FeedNotFoundException;
import com.example.feedpipeline.generator.GenerationResult;
import com.example.feedpipeline.generator.FormatGeneratorFactory;
import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.Frequency;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.model.GenerationStatus;
import com.example.feedpipeline.model.GenerationTrigger;
import com.example.feedpipeline.notification.FeedEventKind;
import com.example.feedpipeline.notification.NotificationPort;
import com.example.feedpipeline.repository.FeedDefinitionRepository;
import com.example.feedpipeline.source.FeedRecordStream;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

/**
 * Feed 生成编排：选出到期 feed，生成文件，投递，并把任何失败收敛为 FAILED + 通知。
 * 本类是异常边界，{@link #runDueFeeds} 不会向外抛出单个 feed 的异常。
 */
@Service
@Slf4j
public class FeedOrchestrator {

    private final FeedDefinitionRepository feedRepository;
    private final GenerationRecordService recordService;
    private final ScheduleEvaluator scheduleEvaluator;
    private final FeedDefinitionValidator validator;
    private final FeedRecordStream recordStream;
    private final FormatGeneratorFactory generatorFactory;
    private final DeliveryHandlerFactory deliveryHandlerFactory;
    private final NotificationPort notificationPort;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Executor feedExecutor;

    @Value("${app.feeds.stale-after:PT6H}")
    private Duration staleAfter = Duration.ofHours(6);

    public FeedOrchestrator(FeedDefinitionRepository feedRepository,
            GenerationRecordService recordService,
            ScheduleEvaluator scheduleEvaluator,
            FeedDefinitionValidator validator,
            FeedRecordStream recordStream,
            FormatGeneratorFactory generatorFactory,
            DeliveryHandlerFactory deliveryHandlerFactory,
            NotificationPort notificationPort,
            MeterRegistry meterRegistry,
            Clock clock,
            @Qualifier("feedExecutor") Executor feedExecutor) {
        this.feedRepository = feedRepository;
        this.recordService = recordService;
        this.scheduleEvaluator = scheduleEvaluator;
        this.validator = validator;
        this.recordStream = recordStream;
        this.generatorFactory = generatorFactory;
        this.deliveryHandlerFactory = deliveryHandlerFactory;
        this.notificationPort = notificationPort;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.feedExecutor = feedExecutor;
    }

    /**
     * 批量运行所有到期 feed，并行执行并等待全部结束。
     *
     * @param now 批次时间
     * @return 本批次创建的生成记录（终态）
     */
    public List<GenerationRecord> runDueFeeds(LocalDateTime now) {
        try {
            recordService.recoverStale(now, staleAfter);
        } catch (RuntimeException e) {
            log.error("Failed to recover stale generations: {}", e.getMessage(), e);
        }

        List<FeedDefinition> candidates = feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL);
        List<CompletableFuture<GenerationRecord>> running = new ArrayList<>();

        for (FeedDefinition feed : candidates) {
            if (!scheduleEvaluator.isDue(feed, now)) {
                continue;
            }
            Optional<GenerationRecord> opened = openSafely(feed, GenerationTrigger.SCHEDULED, now);
            opened.ifPresent(record -> running.add(submit(feed, record)));
        }

        List<GenerationRecord> results = new ArrayList<>();
        for (CompletableFuture<GenerationRecord> future : running) {
            results.add(future.join());
        }
        if (results.isEmpty()) {
            log.info("No feeds to generate at {}", now);
        } else {
            long failed = results.stream().filter(r -> r.getStatus() == GenerationStatus.FAILED).count();
            log.info("Batch finished: {} generated, {} failed", results.size() - failed, failed);
        }
        return results;
    }

    /**
     * 手动触发。返回 PENDING 记录，生成在工作线程池中异步执行；已有进行中的生成时返回空。
     */
    public Optional<GenerationRecord> runFeed(FeedDefinition feed) {
        Optional<GenerationRecord> opened = openSafely(feed, GenerationTrigger.MANUAL, LocalDateTime.now(clock));
        // 工作线程操作副本，返回给调用方的记录保持 PENDING
        opened.ifPresent(record -> submit(feed, record.toBuilder().build()));
        return opened;
    }

    public Optional<GenerationRecord> runFeed(Long feedId) {
        FeedDefinition feed = feedRepository.findById(feedId)
                .orElseThrow(() -> new FeedNotFoundException("Feed not found: " + feedId));
        return runFeed(feed);
    }

    private CompletableFuture<GenerationRecord> submit(FeedDefinition feed, GenerationRecord record) {
        try {
            return CompletableFuture.supplyAsync(() -> execute(feed, record), feedExecutor)
                    .exceptionally(e -> {
                        log.error("Generation {} for feed {} aborted: {}", record.getGenerationId(),
                                feed.getSlug(), e.getMessage(), e);
                        return record;
                    });
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected generation {} for feed {}", record.getGenerationId(), feed.getSlug());
            return CompletableFuture.completedFuture(
                    fail(feed, record, "Worker pool is saturated", Map.of("stage", "scheduling")));
        }
    }

    /**
     * 执行一次生成 + 投递，返回终态记录。
     */
    GenerationRecord execute(FeedDefinition feed, GenerationRecord record) {
        Timer.Sample sample = Timer.start(meterRegistry);
        GenerationRecord current = record;
        try {
            notifySafely(feed, FeedEventKind.GENERATION_STARTED, eventPayload(feed, current,
                    "Generating " + feed.getName() + "..."));

            validator.validate(feed);

            current.markGenerating();
            current = recordService.save(current);

            GenerationResult result;
            try (Stream<Map<String, Object>> records = recordStream.open(feed)) {
                result = generatorFactory.getGenerator(feed.getFormat()).generate(feed, records, current);
            }
            if (!result.isSuccess()) {
                return fail(feed, current, result.getError(), Map.of("stage", "generation"));
            }
            current.markGenerated(result.getFilePath(), result.getFileSize(), result.getRowCount());
            current = recordService.save(current);

            DeliveryMethod method = feed.getDeliveryMethod();
            DeliveryHandler handler = deliveryHandlerFactory.getHandler(method);
            if (method != DeliveryMethod.DOWNLOAD) {
                current.markDelivering();
                current = recordService.save(current);
            }

            DeliveryOutcome outcome = handler.deliver(feed, current);
            if (!outcome.isSuccess()) {
                Map<String, Object> details = new LinkedHashMap<>(outcome.getDetails());
                details.put("stage", "delivery");
                return fail(feed, current, outcome.getError() != null ? outcome.getError() : "Delivery failed",
                        details);
            }

            current = recordService.complete(feed.getId(), current, method, outcome.getDetails(),
                    LocalDateTime.now(clock));
            meterRegistry.counter("feeds.generations", "outcome", "completed").increment();
            log.info("Feed {} generation {} completed: {} rows via {}", feed.getSlug(),
                    current.getGenerationId(), current.getRowCount(), method);

            notifySafely(feed, FeedEventKind.DELIVERY_COMPLETED, eventPayload(feed, current,
                    feed.getName() + " is ready"));
            return current;

        } catch (FeedConfigurationException e) {
            log.warn("Feed {} is misconfigured: {}", feed.getSlug(), e.getMessage());
            return fail(feed, current, e.getMessage(), Map.of("stage", "configuration"));
        } catch (OptimisticLockingFailureException e) {
            return reclaimed(feed, current);
        } catch (Exception e) {
            log.error("Error generating feed {}: {}", feed.getSlug(), e.getMessage(), e);
            return fail(feed, current, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    Map.of("stage", "execution", "exception", e.getClass().getName()));
        } finally {
            sample.stop(meterRegistry.timer("feeds.generation.duration", "format",
                    feed.getFormat() != null ? feed.getFormat().name() : "UNKNOWN"));
        }
    }

    private GenerationRecord fail(FeedDefinition feed, GenerationRecord record, String message,
            Map<String, Object> details) {
        GenerationRecord failed = record;
        if (record.getStatus().isTerminal()) {
            log.warn("Generation {} already {}, not marking failed", record.getGenerationId(), record.getStatus());
        } else {
            try {
                failed = recordService.fail(record, message, details, LocalDateTime.now(clock));
            } catch (OptimisticLockingFailureException e) {
                return reclaimed(feed, record);
            } catch (RuntimeException e) {
                log.error("Could not persist failure of generation {}: {}", record.getGenerationId(),
                        e.getMessage(), e);
            }
        }
        meterRegistry.counter("feeds.generations", "outcome", "failed").increment();
        notifySafely(feed, FeedEventKind.GENERATION_FAILED, eventPayload(feed, failed,
                "Failed to generate " + feed.getName() + ": " + message));
        return failed;
    }

    /**
     * 记录已被超时回收（或被其他进程改写），丢弃本次结果，不再投递，返回库中的状态。
     */
    private GenerationRecord reclaimed(FeedDefinition feed, GenerationRecord record) {
        log.warn("Generation {} for feed {} was reclaimed while running, dropping its result",
                record.getGenerationId(), feed.getSlug());
        meterRegistry.counter("feeds.generations", "outcome", "reclaimed").increment();
        try {
            return recordService.findByGenerationId(record.getGenerationId()).orElse(record);
        } catch (RuntimeException e) {
            log.error("Could not reload generation {}: {}", record.getGenerationId(), e.getMessage(), e);
            return record;
        }
    }

    private Optional<GenerationRecord> openSafely(FeedDefinition feed, GenerationTrigger trigger, LocalDateTime now) {
        try {
            return recordService.open(feed, trigger, now);
        } catch (RuntimeException e) {
            log.error("Could not open generation for feed {}: {}", feed.getSlug(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private void notifySafely(FeedDefinition feed, FeedEventKind kind, Map<String, Object> payload) {
        try {
            notificationPort.notify(feed.getOwner(), kind, payload);
        } catch (RuntimeException e) {
            log.warn("Notification {} for feed {} failed: {}", kind, feed.getSlug(), e.getMessage());
        }
    }

    private Map<String, Object> eventPayload(FeedDefinition feed, GenerationRecord record, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("feed_id", feed.getId());
        payload.put("feed_name", feed.getName());
        payload.put("generation_id", record.getGenerationId());
        payload.put("status", record.getStatus().name().toLowerCase());
        payload.put("message", message);
        return payload;
    }

    void setStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
    }
}
