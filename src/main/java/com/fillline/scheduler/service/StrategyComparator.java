package com.fillline.scheduler.service;

import com.fillline.scheduler.domain.ComparisonEntry;
import com.fillline.scheduler.domain.ComparisonReport;
import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.ScheduleResult;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.domain.SortMetric;
import com.fillline.scheduler.engine.SequencingStrategy;
import com.fillline.scheduler.engine.StrategyRegistry;
import com.fillline.scheduler.validation.PostflightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs several strategies on the same lots, one task each, and ranks the ones that succeed. A
 * failing strategy becomes a failure entry; it never cancels the others.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyComparator {

    private final StrategyRegistry registry;
    private final PostflightValidator postflightValidator;

    public ComparisonReport compare(List<Lot> lots, List<String> strategies, SchedulerConfig config,
                                    SortMetric sortBy, LocalDateTime startTime) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one strategy is required");
        }
        if (config == null || startTime == null) {
            throw new IllegalArgumentException("Configuration and start time are required");
        }
        List<Lot> frozen = List.copyOf(lots);
        SortMetric metric = sortBy == null ? SortMetric.MAKESPAN : sortBy;

        int threads = Math.max(1, Math.min(strategies.size(), Runtime.getRuntime().availableProcessors()));
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<ComparisonEntry> entries = new ArrayList<>();
        try {
            List<Future<ComparisonEntry>> futures = new ArrayList<>();
            for (String name : strategies) {
                futures.add(executor.submit(() -> runOne(name, frozen, config, startTime)));
            }
            for (int i = 0; i < futures.size(); i++) {
                entries.add(collect(futures.get(i), strategies.get(i)));
            }
        } finally {
            executor.shutdown();
        }

        List<ScheduleResult> ranked = new ArrayList<>();
        List<ComparisonEntry> failures = new ArrayList<>();
        for (ComparisonEntry entry : entries) {
            if (entry.isCompleted()) {
                ranked.add(entry.getResult());
            } else {
                failures.add(entry);
            }
        }
        ranked.sort(metric.comparator());

        ComparisonReport report = new ComparisonReport(metric, ranked, failures);
        log.info("Compared {} strategies on {} lots by {}: best {}, {} failed",
                strategies.size(), frozen.size(), metric, report.getBestStrategy(), failures.size());
        return report;
    }

    private ComparisonEntry runOne(String name, List<Lot> lots, SchedulerConfig config, LocalDateTime startTime) {
        long started = System.currentTimeMillis();
        try {
            SequencingStrategy strategy = registry.get(name);
            ScheduleResult result = strategy.plan(lots, startTime, config);
            postflightValidator.validate(result.getSchedule(), config);
            return ComparisonEntry.builder()
                    .strategy(strategy.name())
                    .status(ComparisonEntry.Status.COMPLETED)
                    .result(result)
                    .executionTimeMs(System.currentTimeMillis() - started)
                    .build();
        } catch (RuntimeException e) {
            log.warn("Strategy {} failed: {}", name, e.getMessage());
            return failed(name, e, System.currentTimeMillis() - started);
        }
    }

    private ComparisonEntry collect(Future<ComparisonEntry> future, String name) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Strategy {} crashed", name, e.getCause());
            return failed(name, e.getCause(), 0);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failed(name, e, 0);
        }
    }

    private static ComparisonEntry failed(String name, Throwable error, long elapsedMs) {
        return ComparisonEntry.builder()
                .strategy(name)
                .status(ComparisonEntry.Status.FAILED)
                .errorType(error.getClass().getSimpleName())
                .errorMessage(error.getMessage())
                .executionTimeMs(elapsedMs)
                .build();
    }
}
