package com.fillline.scheduler.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Immutable set of line constants and tuning knobs. Every rule, strategy and validator call
 * receives one explicitly; nothing reads process-wide settings.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SchedulerConfig {

    // Line constants
    @Builder.Default
    double fillRateVialsPerHour = 19_920.0;
    @Builder.Default
    double cleanHours = 24.0;
    @Builder.Default
    double windowHours = 120.0;
    @Builder.Default
    double changeoverSameHours = 4.0;
    @Builder.Default
    double changeoverDiffHours = 8.0;

    /**
     * When true the window clock starts when a clean begins, so the clean itself consumes
     * window budget. Default is the clock starting at clean completion.
     */
    @Builder.Default
    boolean cleanCountsTowardWindow = false;

    @Builder.Default
    String lineId = "LINE-1";

    // Preflight
    @Builder.Default
    boolean strictDuplicateIds = false;

    // Beam search (smart-pack, hybrid-pack)
    @Builder.Default
    int beamWidth = 3;
    @Builder.Default
    int lookaheadHorizon = 3;
    @Builder.Default
    double changeoverWeight = 2.0;
    @Builder.Default
    double forcedCleanPenalty = 1_000.0;

    // Exact optimizer
    @Builder.Default
    int milpMaxLots = 30;
    @Builder.Default
    double milpTimeLimitSeconds = 60.0;

    public static SchedulerConfig defaults() {
        return SchedulerConfig.builder().build();
    }

    /**
     * Largest span of changeover plus fill work that fits between two cleans.
     */
    public double windowCapacityHours() {
        return cleanCountsTowardWindow ? windowHours - cleanHours : windowHours;
    }
}
