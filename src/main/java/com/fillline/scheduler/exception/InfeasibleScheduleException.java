package com.fillline.scheduler.exception;

/**
 * No valid schedule exists for the given lots and configuration.
 */
public class InfeasibleScheduleException extends SchedulingException {

    public InfeasibleScheduleException(String message) {
        super(message);
    }
}
