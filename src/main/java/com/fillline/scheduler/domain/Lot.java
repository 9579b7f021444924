package com.fillline.scheduler.domain;

import lombok.Value;

/**
 * A production batch to be filled. Built by the preflight validator from a raw record; the
 * fill duration is fixed at that point from the configured fill rate.
 */
@Value
public class Lot {
    String id;
    String type;
    long vialCount;
    double fillHours;

    public static Lot of(String id, String type, long vialCount, SchedulerConfig config) {
        return new Lot(id, type, vialCount, vialCount / config.getFillRateVialsPerHour());
    }
}
