package com.fillline.scheduler.web;

import com.fillline.scheduler.domain.ComparisonReport;
import com.fillline.scheduler.domain.PreflightReport;
import com.fillline.scheduler.domain.ScheduleResult;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.domain.SortMetric;
import com.fillline.scheduler.engine.StrategyRegistry;
import com.fillline.scheduler.exception.PreflightFailedException;
import com.fillline.scheduler.service.SchedulingService;
import com.fillline.scheduler.service.StrategyComparator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/v1/schedules")
@RequiredArgsConstructor
public class ScheduleController {

    private final SchedulingService schedulingService;
    private final StrategyComparator strategyComparator;
    private final StrategyRegistry strategyRegistry;

    @GetMapping("/strategies")
    public ResponseEntity<List<String>> strategies() {
        return ResponseEntity.ok(strategyRegistry.names());
    }

    @PostMapping("/preflight")
    public ResponseEntity<PreflightReport> preflight(@RequestBody ScheduleRequest request) {
        return ResponseEntity.ok(schedulingService.preflight(request.getLots(), request.getConfig()));
    }

    @PostMapping
    public ResponseEntity<ScheduleResult> schedule(@RequestBody ScheduleRequest request) {
        ScheduleResult result = schedulingService.schedule(
                request.getLots(),
                request.getStrategy(),
                request.getStartTime(),
                request.getConfig()
        );
        return ResponseEntity.ok(result);
    }

    @PostMapping("/compare")
    public ResponseEntity<ComparisonReport> compare(@RequestBody CompareRequest request) {
        SchedulerConfig config = request.getConfig() != null ? request.getConfig() : schedulingService.defaultConfig();
        SortMetric sortBy = SortMetric.parse(request.getSortBy());
        PreflightReport report = schedulingService.preflight(request.getLots(), config);
        if (!report.isValid()) {
            throw new PreflightFailedException(report);
        }
        List<String> strategies = request.getStrategies() == null || request.getStrategies().isEmpty()
                ? strategyRegistry.names()
                : request.getStrategies();
        LocalDateTime start = request.getStartTime() != null
                ? request.getStartTime()
                : schedulingService.defaultStartTime();
        return ResponseEntity.ok(strategyComparator.compare(report.getLots(), strategies, config, sortBy, start));
    }
}
