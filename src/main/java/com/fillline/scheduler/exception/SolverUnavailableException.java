package com.fillline.scheduler.exception;

public class SolverUnavailableException extends SolverException {

    public SolverUnavailableException(String message) {
        super(message);
    }
}
