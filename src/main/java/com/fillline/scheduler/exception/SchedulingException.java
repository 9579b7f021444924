package com.fillline.scheduler.exception;

/**
 * Root of every failure a scheduling operation can end with.
 */
public abstract class SchedulingException extends RuntimeException {

    protected SchedulingException(String message) {
        super(message);
    }
}
