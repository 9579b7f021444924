package com.fillline.scheduler.domain;

public enum IssueCode {
    BLANK_ID,
    BLANK_TYPE,
    MISSING_VIAL_COUNT,
    NON_NUMERIC_VIAL_COUNT,
    NON_POSITIVE_VIAL_COUNT,
    DUPLICATE_ID,
    OVERSIZE_LOT,
    INVALID_CONFIG
}
