package com.fillline.scheduler.config;

import com.fillline.scheduler.domain.SchedulerConfig;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDateTime;

/**
 * Line defaults from {@code application.properties} ({@code fillline.scheduler.*}). Used when a
 * request brings no configuration of its own.
 */
@Data
@ConfigurationProperties(prefix = "fillline.scheduler")
public class SchedulerProperties {

    private String strategy = "smart-pack";
    private LocalDateTime startTime = LocalDateTime.of(2025, 1, 1, 8, 0);
    private String lineId = "LINE-1";

    // Process constants
    private double fillRateVialsPerHour = 19_920.0;
    private double cleanHours = 24.0;
    private double windowHours = 120.0;
    private double changeoverSameHours = 4.0;
    private double changeoverDiffHours = 8.0;
    private boolean cleanCountsTowardWindow = false;
    private boolean strictDuplicateIds = false;

    // Strategies
    private int beamWidth = 3;
    private int lookaheadHorizon = 3;
    private double changeoverWeight = 2.0;
    private double forcedCleanPenalty = 1_000.0;
    private int milpMaxLots = 30;
    private double milpTimeLimitSeconds = 60.0;

    public SchedulerConfig toConfig() {
        return SchedulerConfig.builder()
                .lineId(lineId)
                .fillRateVialsPerHour(fillRateVialsPerHour)
                .cleanHours(cleanHours)
                .windowHours(windowHours)
                .changeoverSameHours(changeoverSameHours)
                .changeoverDiffHours(changeoverDiffHours)
                .cleanCountsTowardWindow(cleanCountsTowardWindow)
                .strictDuplicateIds(strictDuplicateIds)
                .beamWidth(beamWidth)
                .lookaheadHorizon(lookaheadHorizon)
                .changeoverWeight(changeoverWeight)
                .forcedCleanPenalty(forcedCleanPenalty)
                .milpMaxLots(milpMaxLots)
                .milpTimeLimitSeconds(milpTimeLimitSeconds)
                .build();
    }
}
