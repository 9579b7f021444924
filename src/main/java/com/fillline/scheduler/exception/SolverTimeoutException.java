package com.fillline.scheduler.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class SolverTimeoutException extends SolverException {

    private final Duration timeLimit;

    public SolverTimeoutException(Duration timeLimit) {
        super("Solver found no solution within " + timeLimit.toMillis() + " ms");
        this.timeLimit = timeLimit;
    }
}
