package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.Schedule;
import com.fillline.scheduler.domain.ScheduleResult;
import com.fillline.scheduler.domain.SchedulerConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Template for strategies built on {@link ScheduleBuilder}: input checks first, then the
 * variant's own placement order.
 */
@Slf4j
public abstract class AbstractPackingStrategy implements SequencingStrategy {

    @Override
    public final ScheduleResult plan(List<Lot> lots, LocalDateTime startTime, SchedulerConfig config,
                                     ProgressListener progress) {
        Objects.requireNonNull(lots, "lots");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(config, "config");
        long started = System.currentTimeMillis();

        ScheduleBuilder.checkPlannable(lots, config);
        ScheduleBuilder builder = new ScheduleBuilder(name(), startTime, config);
        pack(List.copyOf(lots), builder, config, progress == null ? ProgressListener.NONE : progress);

        Schedule schedule = builder.build();
        ScheduleResult result = ScheduleResult.of(schedule, System.currentTimeMillis() - started);
        log.debug("{} planned {} lots: makespan {} h, {} activities",
                name(), lots.size(), String.format("%.2f", result.getMakespanHours()),
                schedule.getActivities().size());
        return result;
    }

    protected abstract void pack(List<Lot> lots, ScheduleBuilder builder, SchedulerConfig config,
                                 ProgressListener progress);

    protected void report(ProgressListener progress, int placed, int total) {
        try {
            progress.onProgress(new ProgressEvent(name(), placed, total));
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for {}: {}", name(), e.getMessage());
        }
    }
}
