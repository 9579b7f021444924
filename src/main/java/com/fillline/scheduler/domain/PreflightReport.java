package com.fillline.scheduler.domain;

import lombok.Value;

import java.util.List;

@Value
public class PreflightReport {
    List<Lot> lots;
    List<LotIssue> errors;
    List<LotIssue> warnings;

    public PreflightReport(List<Lot> lots, List<LotIssue> errors, List<LotIssue> warnings) {
        this.lots = List.copyOf(lots);
        this.errors = List.copyOf(errors);
        this.warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
