package com.fillline.scheduler.validation;

import com.fillline.scheduler.domain.Activity;
import com.fillline.scheduler.domain.ActivityKind;
import com.fillline.scheduler.domain.Schedule;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.engine.RuleEngine;
import com.fillline.scheduler.exception.LotSplitException;
import com.fillline.scheduler.exception.ScheduleInvariantException;
import com.fillline.scheduler.exception.WindowOverrunException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Re-walks a produced schedule and stops at the first broken invariant: ordering and overlap,
 * unsplit fills, the clean window, and the changeover in front of every fill. A violation is a
 * defect in the strategy that produced the schedule.
 */
@Component
public class PostflightValidator {

    static final double TOLERANCE_HOURS = 1e-6;

    public void validate(Schedule schedule, SchedulerConfig config) {
        List<Activity> activities = schedule.getActivities();
        if (activities.isEmpty()) {
            return;
        }
        double capacity = config.windowCapacityHours();
        Map<String, Integer> fillIndexByLot = new HashMap<>();

        LocalDateTime windowStart = activities.get(0).getStart();
        int windowOpenedBy = -1;
        String lastFillType = null;
        int lastFill = -1;
        int pendingChangeover = -1;

        for (int i = 0; i < activities.size(); i++) {
            Activity a = activities.get(i);
            checkShape(schedule, a, i);
            if (i > 0 && activities.get(i - 1).getEnd().isAfter(a.getStart())) {
                throw new ScheduleInvariantException(
                        String.format("Activities %d and %d overlap or are out of order", i - 1, i), i - 1, i);
            }

            switch (a.getKind()) {
                case CLEAN -> {
                    if (pendingChangeover >= 0) {
                        throw new ScheduleInvariantException(String.format(
                                "Changeover %d is followed by clean %d instead of a fill", pendingChangeover, i),
                                pendingChangeover, i);
                    }
                    windowStart = a.getEnd();
                    windowOpenedBy = i;
                    lastFillType = null;
                }
                case CHANGEOVER -> {
                    if (pendingChangeover >= 0) {
                        throw new ScheduleInvariantException(String.format(
                                "Activities %d and %d are consecutive changeovers", pendingChangeover, i),
                                pendingChangeover, i);
                    }
                    pendingChangeover = i;
                    checkWindow(windowStart, windowOpenedBy, a, i, capacity);
                }
                case FILL -> {
                    Integer earlier = fillIndexByLot.putIfAbsent(a.getLotId(), i);
                    if (earlier != null) {
                        throw new LotSplitException(String.format(
                                "Lot %s is filled by activities %d and %d", a.getLotId(), earlier, i), earlier, i);
                    }
                    if (a.durationHours() > capacity + TOLERANCE_HOURS) {
                        throw new LotSplitException(String.format(
                                "Fill %d of lot %s lasts %.2f h, longer than the %.2f h window",
                                i, a.getLotId(), a.durationHours(), capacity), i, -1);
                    }
                    checkChangeover(activities, pendingChangeover, lastFill, lastFillType, a, i, config);
                    checkWindow(windowStart, windowOpenedBy, a, i, capacity);
                    lastFillType = a.getLotType();
                    lastFill = i;
                    pendingChangeover = -1;
                }
            }
        }
        if (pendingChangeover >= 0) {
            throw new ScheduleInvariantException(String.format(
                    "Changeover %d is not followed by a fill", pendingChangeover), pendingChangeover, -1);
        }
    }

    private static void checkShape(Schedule schedule, Activity a, int i) {
        if (a.getKind() == null || a.getStart() == null || a.getEnd() == null) {
            throw new ScheduleInvariantException("Activity " + i + " is missing its kind or bounds", i, -1);
        }
        if (!a.getEnd().isAfter(a.getStart())) {
            throw new ScheduleInvariantException("Activity " + i + " ends at or before its start", i, -1);
        }
        if (!Objects.equals(a.getLineId(), schedule.getLineId())) {
            throw new ScheduleInvariantException(String.format("Activity %d runs on line %s, schedule is for line %s",
                    i, a.getLineId(), schedule.getLineId()), i, -1);
        }
        if (a.getKind() == ActivityKind.FILL
                && (a.getLotId() == null || a.getLotId().isBlank())) {
            throw new ScheduleInvariantException("Fill " + i + " does not name a lot", i, -1);
        }
    }

    private static void checkChangeover(List<Activity> activities, int changeoverIndex, int lastFill,
                                        String lastFillType, Activity fill, int i, SchedulerConfig config) {
        double expected = RuleEngine.changeoverDuration(lastFillType, fill.getLotType(), config);
        if (changeoverIndex < 0) {
            if (expected > TOLERANCE_HOURS) {
                throw new ScheduleInvariantException(String.format(
                        "Fill %d (%s) follows fill %d (%s) without the required %.2f h changeover",
                        i, fill.getLotType(), lastFill, lastFillType, expected), lastFill, i);
            }
            return;
        }
        Activity changeover = activities.get(changeoverIndex);
        if (Math.abs(changeover.durationHours() - expected) > TOLERANCE_HOURS) {
            throw new ScheduleInvariantException(String.format(
                    "Changeover %d lasts %.2f h but %s -> %s requires %.2f h",
                    changeoverIndex, changeover.durationHours(), lastFillType, fill.getLotType(), expected),
                    changeoverIndex, i);
        }
        if (!Objects.equals(changeover.getLotType(), fill.getLotType())
                || !Objects.equals(changeover.getPreviousType(), lastFillType)) {
            throw new ScheduleInvariantException(String.format(
                    "Changeover %d is labelled %s -> %s but sits between %s and %s",
                    changeoverIndex, changeover.getPreviousType(), changeover.getLotType(),
                    lastFillType, fill.getLotType()), changeoverIndex, i);
        }
    }

    private static void checkWindow(LocalDateTime windowStart, int windowOpenedBy, Activity a, int i, double capacity) {
        double elapsed = RuleEngine.hoursBetween(windowStart, a.getEnd());
        if (elapsed > capacity + TOLERANCE_HOURS) {
            throw new WindowOverrunException(String.format(
                    "Window opened by activity %d reaches %.2f h at the end of activity %d, over the %.2f h limit",
                    windowOpenedBy, elapsed, i, capacity), windowOpenedBy, i);
        }
    }
}
