package com.fillline.scheduler.exception;

import lombok.Getter;

/**
 * A single lot's fill is longer than the clean window, so it can never be placed without
 * being split by a mandatory clean.
 */
@Getter
public class OversizeLotException extends InfeasibleScheduleException {

    private final String lotId;
    private final double fillHours;
    private final double windowHours;

    public OversizeLotException(String lotId, double fillHours, double windowHours) {
        super(String.format("Lot %s needs %.2f h of filling, which exceeds the %.2f h clean window",
                lotId, fillHours, windowHours));
        this.lotId = lotId;
        this.fillHours = fillHours;
        this.windowHours = windowHours;
    }
}
