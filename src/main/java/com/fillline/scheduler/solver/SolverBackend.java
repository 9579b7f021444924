package com.fillline.scheduler.solver;

import java.time.Duration;

/**
 * Integer-programming engine behind the exact strategy. Implementations must return within
 * roughly {@code timeLimit}, reporting {@link SolverStatus#TIMEOUT} instead of blocking.
 */
public interface SolverBackend {

    String name();

    boolean isAvailable();

    SolverSolution solve(LinearProgram program, Duration timeLimit);
}
