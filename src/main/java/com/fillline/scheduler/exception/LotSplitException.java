package com.fillline.scheduler.exception;

public class LotSplitException extends ScheduleInvariantException {

    public LotSplitException(String message, int firstIndex, int secondIndex) {
        super(message, firstIndex, secondIndex);
    }
}
