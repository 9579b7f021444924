package com.fillline.scheduler.web;

import com.fillline.scheduler.domain.RawLotRecord;
import com.fillline.scheduler.domain.SchedulerConfig;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CompareRequest {
    private List<RawLotRecord> lots;
    private List<String> strategies; // all registered when absent
    private String sortBy; // makespan, utilization or changeovers
    private LocalDateTime startTime;
    private SchedulerConfig config;
}
