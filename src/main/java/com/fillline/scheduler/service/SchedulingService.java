package com.fillline.scheduler.service;

import com.fillline.scheduler.config.SchedulerProperties;
import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.LotIssue;
import com.fillline.scheduler.domain.PreflightReport;
import com.fillline.scheduler.domain.RawLotRecord;
import com.fillline.scheduler.domain.Schedule;
import com.fillline.scheduler.domain.ScheduleResult;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.engine.ProgressListener;
import com.fillline.scheduler.engine.ScheduleBuilder;
import com.fillline.scheduler.engine.SequencingStrategy;
import com.fillline.scheduler.engine.StrategyRegistry;
import com.fillline.scheduler.exception.PreflightFailedException;
import com.fillline.scheduler.validation.PostflightValidator;
import com.fillline.scheduler.validation.PreflightValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Preflight, plan, postflight. Missing configuration, strategy or start time fall back to the
 * configured line defaults.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulingService {

    public static final String GIVEN_ORDER = "given-order";

    private final StrategyRegistry registry;
    private final PreflightValidator preflightValidator;
    private final PostflightValidator postflightValidator;
    private final SchedulerProperties properties;

    public SchedulerConfig defaultConfig() {
        return properties.toConfig();
    }

    public LocalDateTime defaultStartTime() {
        return properties.getStartTime();
    }

    public PreflightReport preflight(List<RawLotRecord> records, SchedulerConfig config) {
        if (records == null) {
            throw new IllegalArgumentException("Lot records cannot be null");
        }
        return preflightValidator.validate(records, config == null ? defaultConfig() : config);
    }

    /**
     * @throws PreflightFailedException when any record is invalid; nothing is planned then
     */
    public ScheduleResult schedule(List<RawLotRecord> records, String strategy, LocalDateTime startTime,
                                   SchedulerConfig config) {
        SchedulerConfig effective = config == null ? defaultConfig() : config;
        if (records == null || records.isEmpty()) {
            throw new IllegalArgumentException("Lot list cannot be empty");
        }
        PreflightReport report = preflightValidator.validate(records, effective);
        for (LotIssue warning : report.getWarnings()) {
            log.warn("Preflight: {}", warning.getMessage());
        }
        if (!report.isValid()) {
            log.info("Preflight rejected {} record(s) with {} error(s)", records.size(), report.getErrors().size());
            throw new PreflightFailedException(report);
        }
        return plan(report.getLots(), strategy, startTime, effective, ProgressListener.NONE);
    }

    public ScheduleResult plan(List<Lot> lots, String strategy, LocalDateTime startTime, SchedulerConfig config,
                               ProgressListener progress) {
        SchedulerConfig effective = config == null ? defaultConfig() : config;
        SequencingStrategy selected = registry.get(strategy == null ? properties.getStrategy() : strategy);

        ScheduleResult result = selected.plan(lots, startOrDefault(startTime), effective, progress);
        postflightValidator.validate(result.getSchedule(), effective);
        log.info("{}: {} lots, makespan {} h, utilization {}", selected.name(), lots.size(),
                String.format("%.2f", result.getMakespanHours()),
                String.format("%.3f", result.getKpis().getUtilization()));
        return result;
    }

    /**
     * Packs lots in a caller-given id order, as a baseline for the optimizing strategies. Lots
     * missing from the sequence follow in input order; unknown ids in the sequence are skipped.
     */
    public ScheduleResult planInGivenOrder(List<Lot> lots, List<String> sequence, LocalDateTime startTime,
                                           SchedulerConfig config) {
        long started = System.currentTimeMillis();
        SchedulerConfig effective = config == null ? defaultConfig() : config;
        ScheduleBuilder.checkPlannable(lots, effective);

        Map<String, Lot> byId = new LinkedHashMap<>();
        lots.forEach(lot -> byId.put(lot.getId(), lot));
        List<Lot> ordered = new ArrayList<>();
        Set<String> listed = new LinkedHashSet<>();
        for (String id : sequence) {
            Lot lot = byId.get(id);
            if (lot == null) {
                log.warn("Sequence names unknown lot {}; skipped", id);
            } else if (listed.add(id)) {
                ordered.add(lot);
            }
        }
        for (Lot lot : lots) {
            if (!listed.contains(lot.getId())) {
                ordered.add(lot);
            }
        }

        ScheduleBuilder builder = new ScheduleBuilder(GIVEN_ORDER, startOrDefault(startTime), effective);
        ordered.forEach(builder::place);
        Schedule schedule = builder.build();
        postflightValidator.validate(schedule, effective);
        return ScheduleResult.of(schedule, System.currentTimeMillis() - started);
    }

    private LocalDateTime startOrDefault(LocalDateTime startTime) {
        return startTime != null ? startTime : defaultStartTime();
    }
}
