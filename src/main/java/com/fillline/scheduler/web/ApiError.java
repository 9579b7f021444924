package com.fillline.scheduler.web;

import com.fillline.scheduler.domain.LotIssue;
import lombok.Value;

import java.util.List;

@Value
public class ApiError {
    int status;
    String error;
    String message;
    List<LotIssue> issues;
}
