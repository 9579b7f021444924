package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import lombok.Value;

/**
 * What placing one lot next would do, in hours from the schedule start. Computed by
 * {@link PackingState#evaluate}; nothing is committed until a {@link ScheduleBuilder} emits it.
 */
@Value
public class Placement {
    Lot lot;
    String previousType;
    boolean forcedClean;
    double cleanStart;
    double changeoverStart;
    double changeoverHours;
    double fillStart;
    double fillEnd;
    /** Budget left unused in the window closed by the forced clean, 0 when none is forced. */
    double abandonedBudget;
    double budgetAfter;
}
