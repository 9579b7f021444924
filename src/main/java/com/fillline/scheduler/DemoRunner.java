package com.fillline.scheduler;

import com.fillline.scheduler.domain.Activity;
import com.fillline.scheduler.domain.ComparisonEntry;
import com.fillline.scheduler.domain.ComparisonReport;
import com.fillline.scheduler.domain.PreflightReport;
import com.fillline.scheduler.domain.RawLotRecord;
import com.fillline.scheduler.domain.ScheduleResult;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.domain.SortMetric;
import com.fillline.scheduler.engine.StrategyRegistry;
import com.fillline.scheduler.service.SchedulingService;
import com.fillline.scheduler.service.StrategyComparator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Console walkthrough of the three-lot example. Enabled with {@code fillline.demo.enabled=true}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fillline.demo.enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final SchedulingService service;
    private final StrategyComparator comparator;
    private final StrategyRegistry registry;

    @Override
    public void run(String... args) {
        System.out.println("=== FILL LINE SCHEDULING DEMO ===");

        // 1. Raw records as they would arrive from the lot list
        List<RawLotRecord> records = Arrays.asList(
                RawLotRecord.builder().id("A").type("Solution").vialCount("1000000").build(),
                RawLotRecord.builder().id("B").type("Solution").vialCount("500000").build(),
                RawLotRecord.builder().id("C").type("Suspension").vialCount("2000000").build()
        );

        // 2. Line defaults
        SchedulerConfig config = service.defaultConfig();
        PreflightReport report = service.preflight(records, config);
        if (!report.isValid()) {
            report.getErrors().forEach(issue -> System.out.println("Rejected: " + issue.getMessage()));
            return;
        }

        // 3. Every registered strategy, ranked by makespan
        ComparisonReport comparison = comparator.compare(report.getLots(), registry.names(), config,
                SortMetric.MAKESPAN, service.defaultStartTime());

        System.out.println("\n--- RANKING ---");
        for (ScheduleResult result : comparison.getResults()) {
            System.out.printf("%-12s makespan %7.2f h  utilization %5.1f%%  changeovers %d  (%d ms)%n",
                    result.getStrategy(), result.getMakespanHours(), result.getKpis().getUtilization() * 100,
                    result.getKpis().getChangeovers(), result.getComputationTimeMs());
        }
        for (ComparisonEntry failure : comparison.getFailures()) {
            System.out.printf("%-12s FAILED %s: %s%n", failure.getStrategy(), failure.getErrorType(),
                    failure.getErrorMessage());
        }

        // 4. Best schedule, activity by activity
        if (!comparison.getResults().isEmpty()) {
            ScheduleResult best = comparison.getResults().get(0);
            System.out.println("\n--- " + best.getStrategy().toUpperCase() + " ---");
            for (Activity a : best.getSchedule().getActivities()) {
                System.out.printf("%-10s %s -> %s  %s%n", a.getKind(), a.getStart(), a.getEnd(),
                        a.getLotId() != null ? a.getLotId() : a.getNote());
            }
            log.info("Demo finished, best strategy {}", best.getStrategy());
        }
    }
}
