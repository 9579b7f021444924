package com.fillline.scheduler.exception;

import lombok.Getter;

@Getter
public class SolverSizeLimitException extends SolverException {

    private final int lotCount;
    private final int maxLots;

    public SolverSizeLimitException(int lotCount, int maxLots) {
        super("Exact optimization is limited to " + maxLots + " lots, got " + lotCount
                + "; use a heuristic strategy for larger instances");
        this.lotCount = lotCount;
        this.maxLots = maxLots;
    }
}
