package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Activity;
import com.fillline.scheduler.domain.ActivityKind;
import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.Schedule;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.exception.OversizeLotException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Packing skeleton shared by every strategy: opens the line with a clean, then appends the
 * changeover and fill of each placed lot, inserting a clean whenever the next lot would overrun
 * the window. All activity bounds derive from one hour offset per boundary, so adjacent
 * activities meet exactly.
 */
public class ScheduleBuilder {

    private final String strategy;
    private final LocalDateTime startTime;
    private final SchedulerConfig config;
    private final List<Activity> activities = new ArrayList<>();
    private PackingState state;
    private int fills;

    public ScheduleBuilder(String strategy, LocalDateTime startTime, SchedulerConfig config) {
        this.strategy = strategy;
        this.startTime = startTime;
        this.config = config;
        this.state = PackingState.opened(config);
        activities.add(clean(0.0, "Block reset"));
    }

    /**
     * Rejects input no strategy can plan: duplicate ids, or a lot whose fill alone exceeds the
     * window. Runs before anything is placed.
     */
    public static void checkPlannable(Collection<Lot> lots, SchedulerConfig config) {
        Set<String> ids = new HashSet<>();
        for (Lot lot : lots) {
            if (!ids.add(lot.getId())) {
                throw new IllegalArgumentException("Duplicate lot id: " + lot.getId());
            }
            if (RuleEngine.isOversize(lot.getFillHours(), config)) {
                throw new OversizeLotException(lot.getId(), lot.getFillHours(), config.windowCapacityHours());
            }
        }
    }

    public PackingState getState() {
        return state;
    }

    public Placement place(Lot lot) {
        Placement p = state.evaluate(lot, config);
        if (p.isForcedClean()) {
            activities.add(clean(p.getCleanStart(), "Window limit"));
        }
        if (p.getChangeoverHours() > 0.0) {
            activities.add(Activity.builder()
                    .kind(ActivityKind.CHANGEOVER)
                    .start(at(p.getChangeoverStart()))
                    .end(at(p.getFillStart()))
                    .lineId(config.getLineId())
                    .lotType(lot.getType())
                    .previousType(p.getPreviousType())
                    .note(p.getPreviousType() + "->" + lot.getType())
                    .build());
        }
        activities.add(Activity.builder()
                .kind(ActivityKind.FILL)
                .start(at(p.getFillStart()))
                .end(at(p.getFillEnd()))
                .lineId(config.getLineId())
                .lotId(lot.getId())
                .lotType(lot.getType())
                .note(lot.getVialCount() + " vials")
                .build());
        state = state.after(p, config);
        fills++;
        return p;
    }

    /** Closes the current window early, e.g. at a block boundary chosen by an exact solver. */
    public void closeWindow() {
        activities.add(clean(state.getClock(), "Block reset"));
        state = state.cleaned(config);
    }

    /** Empty when nothing was filled; a lone opening clean is not a schedule. */
    public Schedule build() {
        return new Schedule(config.getLineId(), strategy, fills == 0 ? List.of() : activities);
    }

    private Activity clean(double offset, String note) {
        return Activity.builder()
                .kind(ActivityKind.CLEAN)
                .start(at(offset))
                .end(at(offset + RuleEngine.cleanDuration(config)))
                .lineId(config.getLineId())
                .note(note)
                .build();
    }

    private LocalDateTime at(double hoursFromStart) {
        return startTime.plusNanos(Math.round(hoursFromStart * RuleEngine.NANOS_PER_HOUR));
    }
}
