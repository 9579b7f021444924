package com.fillline.scheduler.exception;

import lombok.Getter;

/**
 * A produced schedule breaks a structural invariant. Always a defect in the producing strategy,
 * never a data problem. Indices point into the schedule's activity list; -1 when not applicable.
 */
@Getter
public class ScheduleInvariantException extends SchedulingException {

    private final int firstIndex;
    private final int secondIndex;

    public ScheduleInvariantException(String message, int firstIndex, int secondIndex) {
        super(message);
        this.firstIndex = firstIndex;
        this.secondIndex = secondIndex;
    }
}
