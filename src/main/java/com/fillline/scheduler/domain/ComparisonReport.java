package com.fillline.scheduler.domain;

import lombok.Value;

import java.util.List;

@Value
public class ComparisonReport {
    SortMetric sortBy;
    List<ScheduleResult> results; // ranked
    List<ComparisonEntry> failures;

    public ComparisonReport(SortMetric sortBy, List<ScheduleResult> results, List<ComparisonEntry> failures) {
        this.sortBy = sortBy;
        this.results = List.copyOf(results);
        this.failures = List.copyOf(failures);
    }

    public String getBestStrategy() {
        return results.isEmpty() ? null : results.get(0).getStrategy();
    }
}
