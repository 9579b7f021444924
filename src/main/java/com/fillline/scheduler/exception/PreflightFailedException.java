package com.fillline.scheduler.exception;

import com.fillline.scheduler.domain.PreflightReport;
import lombok.Getter;

/**
 * Raised by the service layer when preflight found errors; carries the complete report so the
 * caller can fix every record in one pass.
 */
@Getter
public class PreflightFailedException extends SchedulingException {

    private final PreflightReport report;

    public PreflightFailedException(PreflightReport report) {
        super("Input validation failed with " + report.getErrors().size() + " error(s)");
        this.report = report;
    }
}
