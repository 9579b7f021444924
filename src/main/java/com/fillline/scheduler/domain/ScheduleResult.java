package com.fillline.scheduler.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScheduleResult {
    String strategy;
    Schedule schedule;
    double makespanHours;
    KpiSummary kpis;

    // Metrics
    long computationTimeMs;

    public static ScheduleResult of(Schedule schedule, long computationTimeMs) {
        KpiSummary kpis = schedule.kpis();
        return ScheduleResult.builder()
                .strategy(schedule.getStrategy())
                .schedule(schedule)
                .makespanHours(kpis.getMakespanHours())
                .kpis(kpis)
                .computationTimeMs(computationTimeMs)
                .build();
    }
}
