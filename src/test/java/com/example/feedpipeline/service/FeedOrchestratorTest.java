package com.example.feedpipeline.service;

import com.example.feedpipeline.FeedFixtures;
import com.example.feedpipeline.delivery.DeliveryHandler;
import com.example.feedpipeline.delivery.DeliveryHandlerFactory;
import com.example.feedpipeline.exception.FeedConfigurationException;
import com.example.feedpipeline.generator.CsvFeedGenerator;
import com.example.feedpipeline.generator.FieldResolver;
import com.example.feedpipeline.generator.FormatGeneratorFactory;
import com.example.feedpipeline.generator.JsonFeedGenerator;
import com.example.feedpipeline.generator.XmlFeedGenerator;
import com.example.feedpipeline.model.DeliveryMethod;
import com.example.feedpipeline.model.DeliveryOutcome;
import com.example.feedpipeline.model.FeedDefinition;
import com.example.feedpipeline.model.FeedType;
import com.example.feedpipeline.model.Frequency;
import com.example.feedpipeline.model.GenerationRecord;
import com.example.feedpipeline.model.GenerationStatus;
import com.example.feedpipeline.model.GenerationTrigger;
import com.example.feedpipeline.notification.FeedEventKind;
import com.example.feedpipeline.notification.NotificationPort;
import com.example.feedpipeline.repository.FeedDefinitionRepository;
import com.example.feedpipeline.repository.GenerationRecordRepository;
import com.example.feedpipeline.source.FeedRecordStream;
import com.example.feedpipeline.source.InMemoryRecordSource;
import com.example.feedpipeline.source.RecordSet;
import com.example.feedpipeline.source.SourceRecord;
import com.example.feedpipeline.storage.FileSystemStorageSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class FeedOrchestratorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 5, 15, 10, 0);

    @TempDir
    Path storageRoot;

    @Mock
    private FeedDefinitionRepository feedRepository;
    @Mock
    private GenerationRecordRepository recordRepository;
    @Mock
    private DeliveryHandlerFactory deliveryHandlerFactory;
    @Mock
    private DeliveryHandler deliveryHandler;
    @Mock
    private NotificationPort notificationPort;

    private final List<GenerationRecord> savedRecords = new ArrayList<>();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final Map<Long, FeedDefinition> feeds = new HashMap<>();
    private FeedOrchestrator orchestrator;

    @BeforeEach
    void setup() {
        when(recordRepository.existsByActiveFeedId(anyLong())).thenReturn(false);
        when(recordRepository.saveAndFlush(any(GenerationRecord.class))).thenAnswer(inv -> inv.getArgument(0));
        when(recordRepository.save(any(GenerationRecord.class))).thenAnswer(inv -> {
            GenerationRecord record = inv.getArgument(0);
            savedRecords.add(record.toBuilder().build());
            return record;
        });
        when(recordRepository.saveAll(any())).thenAnswer(inv -> inv.getArgument(0));
        when(recordRepository.findByStatusInAndStartedAtBefore(anyCollection(), any())).thenReturn(List.of());
        when(feedRepository.findById(anyLong())).thenAnswer(inv -> Optional.ofNullable(feeds.get(inv.getArgument(0))));
        when(feedRepository.save(any(FeedDefinition.class))).thenAnswer(inv -> inv.getArgument(0));

        when(deliveryHandlerFactory.getHandler(any(DeliveryMethod.class))).thenReturn(deliveryHandler);
        when(deliveryHandler.deliver(any(), any())).thenReturn(DeliveryOutcome.success(Map.of("method", "download")));

        InMemoryRecordSource source = new InMemoryRecordSource();
        source.replace(RecordSet.PRODUCTS, List.of(
                SourceRecord.builder().key("A1").attributes(Map.of("sku", "A1", "name", "Bolt", "price", "1.50")).build(),
                SourceRecord.builder().key("A2").attributes(Map.of("sku", "A2", "name", "Nut", "price", "0.20")).build()));

        FieldResolver fieldResolver = new FieldResolver();
        FileSystemStorageSink storage = new FileSystemStorageSink(storageRoot.toString());
        FormatGeneratorFactory generatorFactory = new FormatGeneratorFactory(
                new CsvFeedGenerator(fieldResolver, storage),
                new XmlFeedGenerator(fieldResolver, storage),
                new JsonFeedGenerator(fieldResolver, storage));

        Clock clock = Clock.fixed(NOW.atZone(ZoneId.systemDefault()).toInstant(), ZoneId.systemDefault());
        Executor sameThread = Runnable::run;

        orchestrator = new FeedOrchestrator(feedRepository,
                new GenerationRecordService(recordRepository, feedRepository),
                new ScheduleEvaluator(),
                new FeedDefinitionValidator(fieldResolver, deliveryHandlerFactory),
                new FeedRecordStream(source),
                generatorFactory,
                deliveryHandlerFactory,
                notificationPort,
                meterRegistry,
                clock,
                sameThread);
    }

    private FeedDefinition register(FeedDefinition feed) {
        feeds.put(feed.getId(), feed);
        return feed;
    }

    private FeedDefinition hourly(long id) {
        return register(FeedFixtures.catalogFeed(id).frequency(Frequency.HOURLY).build());
    }

    @Test
    void testRunDueFeedsGeneratesOnlyDueFeeds() {
        FeedDefinition first = hourly(1L);
        FeedDefinition second = hourly(2L);
        FeedDefinition notDue = register(FeedFixtures.catalogFeed(3L)
                .frequency(Frequency.DAILY).scheduleTime(LocalTime.of(18, 0)).build());
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(first, second, notDue));

        List<GenerationRecord> results = orchestrator.runDueFeeds(NOW);

        assertEquals(2, results.size());
        for (GenerationRecord record : results) {
            assertEquals(GenerationStatus.COMPLETED, record.getStatus());
            assertEquals(2, record.getRowCount());
            assertEquals(GenerationTrigger.SCHEDULED, record.getTrigger());
            assertNull(record.getActiveFeedId());
        }
        assertEquals(1, first.getGenerationCount());
        assertEquals(NOW, first.getLastGenerated());
        assertNull(first.getLastDelivered());
        assertEquals(0, notDue.getGenerationCount());
        assertEquals(2.0, meterRegistry.counter("feeds.generations", "outcome", "completed").count());

        // 两个 feed 属于同一客户
        verify(notificationPort, times(2)).notify(eq(first.getOwner()), eq(FeedEventKind.DELIVERY_COMPLETED), anyMap());
    }

    @Test
    void testOneFailingFeedDoesNotAbortBatch() {
        FeedDefinition broken = hourly(1L);
        broken.setFeedType(FeedType.CUSTOM);
        broken.setIncludedFields(new ArrayList<>());
        FeedDefinition healthy = hourly(2L);
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(broken, healthy));

        List<GenerationRecord> results = orchestrator.runDueFeeds(NOW);

        assertEquals(GenerationStatus.FAILED, results.get(0).getStatus());
        assertTrue(results.get(0).getErrorMessage().contains("No fields configured"));
        assertEquals("generation", results.get(0).getErrorDetails().get("stage"));
        assertNull(results.get(0).getActiveFeedId());
        assertNull(broken.getLastGenerated());
        assertEquals(0, broken.getGenerationCount());

        assertEquals(GenerationStatus.COMPLETED, results.get(1).getStatus());
        verify(notificationPort).notify(eq(broken.getOwner()), eq(FeedEventKind.GENERATION_FAILED), anyMap());
    }

    @Test
    void testDeliveryFailureLeavesCountersUntouched() {
        FeedDefinition feed = hourly(1L);
        feed.setDeliveryMethod(DeliveryMethod.FTP);
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(feed));
        when(deliveryHandler.deliver(any(), any())).thenReturn(DeliveryOutcome.failure("Connection refused"));

        GenerationRecord record = orchestrator.runDueFeeds(NOW).get(0);

        assertEquals(GenerationStatus.FAILED, record.getStatus());
        assertEquals("failed", record.getDeliveryStatus());
        assertEquals("Connection refused", record.getErrorMessage());
        assertNotNull(record.getFilePath());
        assertEquals(0, feed.getGenerationCount());
        assertNull(feed.getLastGenerated());
        assertTrue(savedRecords.stream().anyMatch(r -> r.getStatus() == GenerationStatus.DELIVERING));
    }

    @Test
    void testTransportSuccessUpdatesLastDelivered() {
        FeedDefinition feed = hourly(1L);
        feed.setDeliveryMethod(DeliveryMethod.WEBHOOK);
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(feed));

        GenerationRecord record = orchestrator.runDueFeeds(NOW).get(0);

        assertEquals(GenerationStatus.COMPLETED, record.getStatus());
        assertEquals("delivered", record.getDeliveryStatus());
        assertEquals(NOW, feed.getLastDelivered());
    }

    @Test
    void testHandlerExceptionIsConvertedToFailure() {
        FeedDefinition feed = hourly(1L);
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(feed));
        when(deliveryHandler.deliver(any(), any())).thenThrow(new IllegalStateException("unexpected"));

        List<GenerationRecord> results = orchestrator.runDueFeeds(NOW);

        assertEquals(GenerationStatus.FAILED, results.get(0).getStatus());
        assertEquals("unexpected", results.get(0).getErrorMessage());
    }

    @Test
    void testConfigurationErrorFailsBeforeGeneration() {
        FeedDefinition feed = hourly(1L);
        feed.setDeliveryMethod(DeliveryMethod.FTP);
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(feed));
        doThrow(new FeedConfigurationException("Missing FTP configuration: host")).when(deliveryHandler).validate(feed);

        GenerationRecord record = orchestrator.runDueFeeds(NOW).get(0);

        assertEquals(GenerationStatus.FAILED, record.getStatus());
        assertEquals("configuration", record.getErrorDetails().get("stage"));
        assertNull(record.getFilePath());
        verify(deliveryHandler, never()).deliver(any(), any());
    }

    @Test
    void testDuplicateInFlightIsSkipped() {
        FeedDefinition feed = hourly(1L);
        when(recordRepository.existsByActiveFeedId(1L)).thenReturn(true);

        Optional<GenerationRecord> result = orchestrator.runFeed(feed);

        assertTrue(result.isEmpty());
        verify(recordRepository, never()).saveAndFlush(any());
    }

    @Test
    void testConcurrentClaimIsSkipped() {
        FeedDefinition feed = hourly(1L);
        when(recordRepository.saveAndFlush(any(GenerationRecord.class)))
                .thenThrow(new DataIntegrityViolationException("uk_feed_generations_active_feed"));
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(feed));

        assertTrue(orchestrator.runFeed(feed).isEmpty());
        assertTrue(orchestrator.runDueFeeds(NOW).isEmpty());
    }

    @Test
    void testManualRunReturnsPendingRecord() {
        FeedDefinition feed = register(FeedFixtures.catalogFeed(5L).build());

        GenerationRecord pending = orchestrator.runFeed(5L).orElseThrow();

        assertEquals(GenerationStatus.PENDING, pending.getStatus());
        assertEquals(GenerationTrigger.MANUAL, pending.getTrigger());
        assertEquals(1, feed.getGenerationCount());
        assertTrue(savedRecords.stream().anyMatch(r ->
                r.getGenerationId().equals(pending.getGenerationId()) && r.getStatus() == GenerationStatus.COMPLETED));
    }

    @Test
    void testNotificationFailureIsNotFatal() {
        FeedDefinition feed = hourly(1L);
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(feed));
        doThrow(new RuntimeException("broker down")).when(notificationPort).notify(any(), any(), anyMap());

        GenerationRecord record = orchestrator.runDueFeeds(NOW).get(0);

        assertEquals(GenerationStatus.COMPLETED, record.getStatus());
    }

    @Test
    void testStaleRecordsAreFailedBeforeBatch() {
        FeedDefinition feed = hourly(1L);
        GenerationRecord stuck = GenerationRecord.open(feed, GenerationTrigger.SCHEDULED, NOW.minusHours(7));
        stuck.markGenerating();
        when(recordRepository.findByStatusInAndStartedAtBefore(anyCollection(), eq(NOW.minusHours(6))))
                .thenReturn(List.of(stuck));
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of());

        orchestrator.runDueFeeds(NOW);

        assertEquals(GenerationStatus.FAILED, stuck.getStatus());
        assertNull(stuck.getActiveFeedId());
        assertEquals("stale", stuck.getErrorDetails().get("reason"));
    }

    @Test
    void testCompletionWriteFailureEndsInFailed() {
        FeedDefinition feed = hourly(1L);
        feed.setDeliveryMethod(DeliveryMethod.WEBHOOK);
        when(feedRepository.findByActiveTrueAndFrequencyNot(Frequency.MANUAL)).thenReturn(List.of(feed));
        when(recordRepository.save(argThat((GenerationRecord r) -> r != null && r.getStatus() == GenerationStatus.COMPLETED)))
                .thenThrow(new DataAccessResourceFailureException("connection lost"));

        GenerationRecord record = orchestrator.runDueFeeds(NOW).get(0);

        assertEquals(GenerationStatus.FAILED, record.getStatus());
        assertEquals("connection lost", record.getErrorMessage());
        assertEquals("execution", record.getErrorDetails().get("stage"));
        assertNull(record.getActiveFeedId());
        GenerationRecord lastSaved = savedRecords.get(savedRecords.size() - 1);
        assertEquals(GenerationStatus.FAILED, lastSaved.getStatus());
        assertEquals(0, feed.getGenerationCount());
        assertNull(feed.getLastGenerated());
        verify(notificationPort).notify(eq(feed.getOwner()), eq(FeedEventKind.GENERATION_FAILED),
                argThat(payload -> "failed".equals(payload.get("status"))));
        verify(notificationPort, never()).notify(any(), eq(FeedEventKind.DELIVERY_COMPLETED), anyMap());
    }
}
