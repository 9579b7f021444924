package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;
import lombok.Value;

/**
 * Transient clean-window state of one planning run. Times are hours since the schedule start.
 * Immutable so the beam search can branch from any state.
 */
@Value
public class PackingState {
    double clock;
    double lastCleanEnd;
    String lastType;

    /** State right after the opening clean. */
    public static PackingState opened(SchedulerConfig config) {
        double cleanEnd = RuleEngine.cleanDuration(config);
        return new PackingState(cleanEnd, cleanEnd, null);
    }

    public double budget(SchedulerConfig config) {
        return RuleEngine.windowBudget(clock - lastCleanEnd, config);
    }

    public boolean fits(Lot lot, SchedulerConfig config) {
        double needed = RuleEngine.changeoverDuration(lastType, lot.getType(), config) + lot.getFillHours();
        return !RuleEngine.requiresForcedClean(budget(config), needed);
    }

    public Placement evaluate(Lot lot, SchedulerConfig config) {
        double budget = budget(config);
        double changeover = RuleEngine.changeoverDuration(lastType, lot.getType(), config);
        double needed = changeover + lot.getFillHours();

        if (RuleEngine.requiresForcedClean(budget, needed)) {
            double windowStart = clock + RuleEngine.cleanDuration(config);
            double fillEnd = windowStart + lot.getFillHours();
            return new Placement(lot, null, true, clock, windowStart, 0.0, windowStart, fillEnd,
                    Math.max(0.0, budget), RuleEngine.windowBudget(lot.getFillHours(), config));
        }
        double fillStart = clock + changeover;
        return new Placement(lot, lastType, false, Double.NaN, clock, changeover, fillStart,
                fillStart + lot.getFillHours(), 0.0, budget - needed);
    }

    public PackingState after(Placement placement, SchedulerConfig config) {
        double cleanEnd = placement.isForcedClean()
                ? placement.getCleanStart() + RuleEngine.cleanDuration(config)
                : lastCleanEnd;
        return new PackingState(placement.getFillEnd(), cleanEnd, placement.getLot().getType());
    }

    /** State after an explicit clean, regardless of remaining budget. */
    public PackingState cleaned(SchedulerConfig config) {
        double cleanEnd = clock + RuleEngine.cleanDuration(config);
        return new PackingState(cleanEnd, cleanEnd, null);
    }
}
