package com.fillline.scheduler.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Figures derived from a schedule's activities. Never stored apart from the schedule they
 * were computed from.
 */
@Value
@Builder
public class KpiSummary {
    double makespanHours;
    double totalCleanHours;
    double totalChangeoverHours;
    double totalFillHours;
    double utilization;
    int lotsScheduled;
    int cleanBlocks;
    int changeovers;

    public static KpiSummary of(List<Activity> activities) {
        if (activities.isEmpty()) {
            return KpiSummary.builder().build();
        }
        double clean = 0, changeover = 0, fill = 0;
        int fills = 0, cleans = 0, changeovers = 0;
        for (Activity a : activities) {
            switch (a.getKind()) {
                case CLEAN -> {
                    clean += a.durationHours();
                    cleans++;
                }
                case CHANGEOVER -> {
                    changeover += a.durationHours();
                    changeovers++;
                }
                case FILL -> {
                    fill += a.durationHours();
                    fills++;
                }
            }
        }
        double makespan = Duration.between(activities.get(0).getStart(),
                activities.get(activities.size() - 1).getEnd()).toNanos() / 3_600_000_000_000.0;
        return KpiSummary.builder()
                .makespanHours(makespan)
                .totalCleanHours(clean)
                .totalChangeoverHours(changeover)
                .totalFillHours(fill)
                .utilization(makespan > 0 ? fill / makespan : 0.0)
                .lotsScheduled(fills)
                .cleanBlocks(cleans)
                .changeovers(changeovers)
                .build();
    }

    /** Flat view keyed by stable names, for report and persistence collaborators. */
    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("makespan_hours", makespanHours);
        map.put("total_clean_hours", totalCleanHours);
        map.put("total_changeover_hours", totalChangeoverHours);
        map.put("total_fill_hours", totalFillHours);
        map.put("utilization", utilization);
        map.put("lots_scheduled", (double) lotsScheduled);
        map.put("clean_blocks", (double) cleanBlocks);
        map.put("changeovers", (double) changeovers);
        return map;
    }
}
