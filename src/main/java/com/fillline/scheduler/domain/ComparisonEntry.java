package com.fillline.scheduler.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one strategy inside a comparison: either a result or the failure that stopped it.
 */
@Value
@Builder
public class ComparisonEntry {
    public enum Status {
        COMPLETED,
        FAILED
    }

    String strategy;
    Status status;
    ScheduleResult result;
    String errorType;
    String errorMessage;
    long executionTimeMs;

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
