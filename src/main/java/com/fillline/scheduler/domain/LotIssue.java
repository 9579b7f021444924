package com.fillline.scheduler.domain;

import lombok.Value;

/**
 * A problem found by preflight. {@code row} is the zero-based record index, or -1 for
 * configuration issues.
 */
@Value
public class LotIssue {
    IssueCode code;
    int row;
    String lotId;
    String message;
}
