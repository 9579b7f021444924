package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;

import java.util.List;

/**
 * Strategies whose whole policy is a fixed order decided up front.
 */
public abstract class OrderedPackingStrategy extends AbstractPackingStrategy {

    protected abstract List<Lot> order(List<Lot> lots, SchedulerConfig config);

    @Override
    protected void pack(List<Lot> lots, ScheduleBuilder builder, SchedulerConfig config, ProgressListener progress) {
        List<Lot> ordered = order(lots, config);
        int placed = 0;
        for (Lot lot : ordered) {
            builder.place(lot);
            report(progress, ++placed, ordered.size());
        }
    }
}
