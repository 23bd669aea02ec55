package com.fry.backend.service;

import com.fry.backend.config.PainEngineProperties;
import com.fry.backend.dto.BatchResult;
import com.fry.backend.dto.BatchResult.AcceptedLoss;
import com.fry.backend.dto.BatchResult.RejectedLoss;
import com.fry.backend.dto.LossAnalysis;
import com.fry.backend.dto.PainIndices;
import com.fry.backend.dto.PatternAnalysis;
import com.fry.backend.event.LossScoredEvent;
import com.fry.backend.exception.PainValidationException;
import com.fry.backend.model.LossEvent;
import com.fry.backend.model.PainHistoryEntry;
import com.fry.backend.model.PainScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Write path of the engine. Losses for one trader are scored and recorded under that trader's lock,
 * so the frequency factor always sees history strictly prior to the loss being scored.
 */
@Slf4j
@Service
public class LossIngestionService {

    private final PainEngineProperties properties;
    private final LossEventValidator validator;
    private final PainScoreCalculator calculator;
    private final AccountProfileStore store;
    private final NetworkAggregator aggregator;
    private final PainIndexTracker indexTracker;
    private final PatternInsightAnalyzer patternAnalyzer;
    private final PainMetricsRecorder metricsRecorder;
    private final ApplicationEventPublisher eventPublisher;
    private final Executor scoringExecutor;

    private final Map<String, ReentrantLock> traderLocks = new ConcurrentHashMap<>();

    public LossIngestionService(PainEngineProperties properties,
                                LossEventValidator validator,
                                PainScoreCalculator calculator,
                                AccountProfileStore store,
                                NetworkAggregator aggregator,
                                PainIndexTracker indexTracker,
                                PatternInsightAnalyzer patternAnalyzer,
                                PainMetricsRecorder metricsRecorder,
                                ApplicationEventPublisher eventPublisher,
                                @Qualifier("scoringExecutor") Executor scoringExecutor) {
        this.properties = properties;
        this.validator = validator;
        this.calculator = calculator;
        this.store = store;
        this.aggregator = aggregator;
        this.indexTracker = indexTracker;
        this.patternAnalyzer = patternAnalyzer;
        this.metricsRecorder = metricsRecorder;
        this.eventPublisher = eventPublisher;
        this.scoringExecutor = scoringExecutor;
    }

    public LossAnalysis processLoss(LossEvent event) {
        try {
            validator.validate(event);
        } catch (PainValidationException ex) {
            metricsRecorder.recordRejection(ex.getField());
            log.warn("Rejected loss trader={} field={} reason={}",
                    event == null ? null : event.traderId(), ex.getField(), ex.getConstraint());
            throw ex;
        }

        PainScore score = scoreAndRecord(event);

        double concentration = aggregator.aggregate(store.snapshots()).painConcentration();
        PainIndices indices = indexTracker.update(event, score, concentration);
        PatternAnalysis patterns = patternAnalyzer.analyze(score, concentration);

        log.info("Scored loss trader={} tier={} multiplier={} level={}",
                event.traderId(), score.traderTier(), score.painMultiplier(), score.painLevel());
        eventPublisher.publishEvent(new LossScoredEvent(event.traderId(), event.asset(), score, event.timestamp()));
        return new LossAnalysis(score, patterns, indices);
    }

    /**
     * Scores a batch. Losses are grouped by trader and each group runs in input order on the scoring executor;
     * a rejected loss is reported and never stops the rest of its group.
     */
    public BatchResult processBatch(List<LossEvent> events) {
        if (events == null) {
            throw new PainValidationException("events", "must not be null");
        }
        int maxBatchSize = properties.getIngestion().getMaxBatchSize();
        if (events.size() > maxBatchSize) {
            throw new PainValidationException("events", "must contain at most " + maxBatchSize + " losses");
        }

        List<RejectedLoss> rejected = new ArrayList<>();
        Map<String, List<Indexed>> partitions = new LinkedHashMap<>();
        for (int i = 0; i < events.size(); i++) {
            LossEvent event = events.get(i);
            try {
                validator.validate(event);
            } catch (PainValidationException ex) {
                metricsRecorder.recordRejection(ex.getField());
                log.warn("Rejected batch loss index={} trader={} field={} reason={}",
                        i, event == null ? null : event.traderId(), ex.getField(), ex.getConstraint());
                rejected.add(new RejectedLoss(i, event == null ? null : event.traderId(), ex.getField(), ex.getMessage()));
                continue;
            }
            partitions.computeIfAbsent(event.traderId(), id -> new ArrayList<>()).add(new Indexed(i, event));
        }

        List<CompletableFuture<PartitionResult>> futures = partitions.values().stream()
                .map(this::submitPartition)
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw ex;
        }

        List<AcceptedLoss> accepted = new ArrayList<>();
        for (CompletableFuture<PartitionResult> future : futures) {
            PartitionResult result = future.join();
            accepted.addAll(result.accepted());
            rejected.addAll(result.rejected());
        }
        accepted.sort(Comparator.comparingInt(AcceptedLoss::index));
        rejected.sort(Comparator.comparingInt(RejectedLoss::index));

        log.info("Processed batch submitted={} accepted={} rejected={} traders={}",
                events.size(), accepted.size(), rejected.size(), partitions.size());
        return new BatchResult(events.size(), List.copyOf(accepted), List.copyOf(rejected));
    }

    /**
     * Runs the partition on the calling thread when the executor refuses it, so every partition of an
     * accepted batch is applied exactly once.
     */
    private CompletableFuture<PartitionResult> submitPartition(List<Indexed> partition) {
        try {
            return CompletableFuture.supplyAsync(() -> processPartition(partition), scoringExecutor);
        } catch (RejectedExecutionException ex) {
            log.warn("Scoring executor saturated, running partition of {} losses inline", partition.size());
            return CompletableFuture.completedFuture(processPartition(partition));
        }
    }

    private PartitionResult processPartition(List<Indexed> partition) {
        List<AcceptedLoss> accepted = new ArrayList<>();
        List<RejectedLoss> rejected = new ArrayList<>();
        for (Indexed item : partition) {
            try {
                accepted.add(new AcceptedLoss(item.index(), processLoss(item.event())));
            } catch (PainValidationException ex) {
                rejected.add(new RejectedLoss(item.index(), item.event().traderId(), ex.getField(), ex.getMessage()));
            }
        }
        return new PartitionResult(accepted, rejected);
    }

    private PainScore scoreAndRecord(LossEvent event) {
        ReentrantLock lock = traderLocks.computeIfAbsent(event.traderId(), id -> new ReentrantLock());
        lock.lock();
        try {
            List<PainHistoryEntry> prior = store.getRecentEvents(
                    event.traderId(),
                    properties.getMultiplier().getFrequencyWindowDays(),
                    event.timestamp());
            PainScore score = calculator.computePainScore(event, prior);
            store.recordLoss(event, score);
            return score;
        } finally {
            lock.unlock();
        }
    }

    private record Indexed(int index, LossEvent event) {}

    private record PartitionResult(List<AcceptedLoss> accepted, List<RejectedLoss> rejected) {}
}
