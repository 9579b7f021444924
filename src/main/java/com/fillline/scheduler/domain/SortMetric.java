package com.fillline.scheduler.domain;

import java.util.Comparator;
import java.util.Locale;

/**
 * Ranking key for comparison results. Ties are broken by strategy name.
 */
public enum SortMetric {
    MAKESPAN(Comparator.comparingDouble(ScheduleResult::getMakespanHours)),
    UTILIZATION(Comparator.comparingDouble((ScheduleResult r) -> r.getKpis().getUtilization()).reversed()),
    CHANGEOVERS(Comparator.comparingInt((ScheduleResult r) -> r.getKpis().getChangeovers()));

    private final Comparator<ScheduleResult> order;

    SortMetric(Comparator<ScheduleResult> order) {
        this.order = order;
    }

    public Comparator<ScheduleResult> comparator() {
        return order.thenComparing(ScheduleResult::getStrategy);
    }

    public static SortMetric parse(String value) {
        if (value == null || value.isBlank()) {
            return MAKESPAN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown sort metric: " + value
                    + " (expected makespan, utilization or changeovers)", e);
        }
    }
}
