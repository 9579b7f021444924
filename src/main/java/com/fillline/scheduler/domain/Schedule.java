package com.fillline.scheduler.domain;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, non-overlapping activities of one line, as produced by a strategy.
 */
@Value
public class Schedule {
    String lineId;
    String strategy;
    List<Activity> activities;

    public Schedule(String lineId, String strategy, List<Activity> activities) {
        this.lineId = lineId;
        this.strategy = strategy;
        this.activities = List.copyOf(activities);
    }

    public boolean isEmpty() {
        return activities.isEmpty();
    }

    public List<Activity> fills() {
        return activities.stream().filter(a -> a.is(ActivityKind.FILL)).collect(Collectors.toList());
    }

    /** Lot ids in fill order. */
    public List<String> fillOrder() {
        return activities.stream()
                .filter(a -> a.is(ActivityKind.FILL))
                .map(Activity::getLotId)
                .collect(Collectors.toList());
    }

    public KpiSummary kpis() {
        return KpiSummary.of(activities);
    }
}
