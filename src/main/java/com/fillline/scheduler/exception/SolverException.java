package com.fillline.scheduler.exception;

/**
 * Exact-optimizer failures. Callers may recover by running a heuristic strategy instead.
 */
public abstract class SolverException extends SchedulingException {

    protected SolverException(String message) {
        super(message);
    }
}
