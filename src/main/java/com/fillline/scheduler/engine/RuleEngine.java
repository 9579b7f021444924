package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.SchedulerConfig;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Cleaning, changeover and window rules of the filling line. Stateless; the configuration is
 * passed into every call.
 */
public final class RuleEngine {

    /** Slack used when comparing planned hour sums, to absorb floating point drift. */
    public static final double EPSILON = 1e-9;

    static final double NANOS_PER_HOUR = 3_600_000_000_000.0;

    private RuleEngine() {
    }

    public static double cleanDuration(SchedulerConfig config) {
        return config.getCleanHours();
    }

    /**
     * Setup time between two consecutive fills. No previous type means the line was just
     * cleaned, which needs no changeover.
     */
    public static double changeoverDuration(String previousType, String nextType, SchedulerConfig config) {
        if (previousType == null) {
            return 0.0;
        }
        return previousType.equals(nextType)
                ? config.getChangeoverSameHours()
                : config.getChangeoverDiffHours();
    }

    public static double windowBudget(LocalDateTime lastCleanEnd, LocalDateTime now, SchedulerConfig config) {
        return windowBudget(hoursBetween(lastCleanEnd, now), config);
    }

    /**
     * Hours of changeover and fill work still allowed before the next mandatory clean, given the
     * hours elapsed since the last clean completed.
     */
    public static double windowBudget(double hoursSinceCleanEnd, SchedulerConfig config) {
        return config.windowCapacityHours() - hoursSinceCleanEnd;
    }

    public static boolean requiresForcedClean(double remainingHours, double neededHours) {
        return neededHours > remainingHours + EPSILON;
    }

    /** True when the fill alone can never fit into a single window. */
    public static boolean isOversize(double fillHours, SchedulerConfig config) {
        return fillHours > config.windowCapacityHours() + EPSILON;
    }

    public static double hoursBetween(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).toNanos() / NANOS_PER_HOUR;
    }
}
