package com.fillline.scheduler.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One block of line time. {@code lotId} is set for fills only; {@code lotType} is the filled
 * type for a fill and the incoming type for a changeover; {@code previousType} is the outgoing
 * type of a changeover.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Activity {
    ActivityKind kind;
    LocalDateTime start;
    LocalDateTime end;
    String lineId;
    String lotId;
    String lotType;
    String previousType;
    String note;

    public double durationHours() {
        return Duration.between(start, end).toNanos() / 3_600_000_000_000.0;
    }

    public boolean is(ActivityKind other) {
        return kind == other;
    }
}
