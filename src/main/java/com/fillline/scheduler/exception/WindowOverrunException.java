package com.fillline.scheduler.exception;

public class WindowOverrunException extends ScheduleInvariantException {

    public WindowOverrunException(String message, int cleanIndex, int activityIndex) {
        super(message, cleanIndex, activityIndex);
    }
}
