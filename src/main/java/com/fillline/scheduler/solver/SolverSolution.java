package com.fillline.scheduler.solver;

import lombok.Value;

/**
 * Outcome of one solver run. Variable values are copied in and out, so a solution never changes
 * after it is built.
 */
@Value
public class SolverSolution {
    SolverStatus status;
    double[] values;
    double objectiveValue;
    long wallTimeMs;

    public SolverSolution(SolverStatus status, double[] values, double objectiveValue, long wallTimeMs) {
        this.status = status;
        this.values = values.clone();
        this.objectiveValue = objectiveValue;
        this.wallTimeMs = wallTimeMs;
    }

    public static SolverSolution of(SolverStatus status, long wallTimeMs) {
        return new SolverSolution(status, new double[0], Double.NaN, wallTimeMs);
    }

    public double[] getValues() {
        return values.clone();
    }

    public boolean isSet(int variable) {
        return values[variable] > 0.5;
    }
}
