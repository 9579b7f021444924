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
public class ScheduleRequest {
    private List<RawLotRecord> lots;
    private String strategy; // registry name or alias; line default when absent
    private LocalDateTime startTime;
    private SchedulerConfig config;
}
