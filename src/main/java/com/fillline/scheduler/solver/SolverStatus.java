package com.fillline.scheduler.solver;

public enum SolverStatus {
    OPTIMAL,
    /** A solution was found but not proven optimal before the time limit. */
    FEASIBLE,
    INFEASIBLE,
    /** Time limit reached without any solution. */
    TIMEOUT,
    UNAVAILABLE,
    ABNORMAL;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
