package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.ScheduleResult;
import com.fillline.scheduler.domain.SchedulerConfig;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Orders a validated lot set onto the line. Implementations are deterministic and keep no state
 * between calls.
 */
public interface SequencingStrategy {

    String name();

    ScheduleResult plan(List<Lot> lots, LocalDateTime startTime, SchedulerConfig config, ProgressListener progress);

    default ScheduleResult plan(List<Lot> lots, LocalDateTime startTime, SchedulerConfig config) {
        return plan(lots, startTime, config, ProgressListener.NONE);
    }
}
