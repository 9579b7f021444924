package com.fillline.scheduler.engine;

import com.fillline.scheduler.Fixtures;
import com.fillline.scheduler.domain.Activity;
import com.fillline.scheduler.domain.ActivityKind;
import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.Schedule;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.exception.OversizeLotException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScheduleBuilderTest {

    private final SchedulerConfig config = SchedulerConfig.defaults();

    @Test
    public void testForcedCleanReplacesChangeover() {
        List<Lot> lots = Fixtures.threeLots();
        Lot a = lots.get(0), b = lots.get(1), c = lots.get(2);

        ScheduleBuilder builder = new ScheduleBuilder("test", Fixtures.START, config);
        assertFalse(builder.place(b).isForcedClean());
        Placement toA = builder.place(a);
        assertEquals(4.0, toA.getChangeoverHours());
        Placement toC = builder.place(c);
        assertTrue(toC.isForcedClean());
        assertEquals(0.0, toC.getChangeoverHours());
        Schedule schedule = builder.build();

        List<Activity> activities = schedule.getActivities();
        assertEquals(List.of(ActivityKind.CLEAN, ActivityKind.FILL, ActivityKind.CHANGEOVER, ActivityKind.FILL,
                        ActivityKind.CLEAN, ActivityKind.FILL),
                activities.stream().map(Activity::getKind).toList());
        assertEquals(List.of("B", "A", "C"), schedule.fillOrder());

        // Opening clean starts at the start time, every activity meets the next one exactly
        assertEquals(Fixtures.START, activities.get(0).getStart());
        for (int i = 1; i < activities.size(); i++) {
            assertEquals(activities.get(i - 1).getEnd(), activities.get(i).getStart());
        }

        Activity changeover = activities.get(2);
        assertEquals("Solution", changeover.getPreviousType());
        assertEquals("Solution", changeover.getLotType());
        assertEquals(4.0, changeover.durationHours(), 1e-6);

        double expected = 24 + b.getFillHours() + 4 + a.getFillHours() + 24 + c.getFillHours();
        assertEquals(expected, schedule.kpis().getMakespanHours(), 1e-6);
        assertEquals(2, schedule.kpis().getCleanBlocks());
        assertEquals(1, schedule.kpis().getChangeovers());
    }

    @Test
    public void testFirstFillAfterCleanHasNoChangeover() {
        ScheduleBuilder builder = new ScheduleBuilder("test", Fixtures.START, config);
        Placement first = builder.place(Fixtures.threeLots().get(2));
        assertNull(first.getPreviousType());
        assertEquals(24.0, first.getFillStart(), 1e-12);
        assertEquals(2, builder.build().getActivities().size());
    }

    @Test
    public void testExactlyFullWindowNeedsNoClean() {
        SchedulerConfig rate = Fixtures.ROUND_RATE;
        ScheduleBuilder builder = new ScheduleBuilder("test", Fixtures.START, rate);
        builder.place(Fixtures.lot("L1", "X", 58));
        Placement second = builder.place(Fixtures.lot("L2", "X", 58));

        assertFalse(second.isForcedClean());
        assertEquals(0.0, second.getBudgetAfter(), 1e-9);
        assertEquals(0.0, builder.getState().budget(rate), 1e-9);
    }

    @Test
    public void testEmptyLotSetGivesEmptySchedule() {
        Schedule schedule = new ScheduleBuilder("test", Fixtures.START, config).build();
        assertTrue(schedule.isEmpty());
        assertEquals(0.0, schedule.kpis().getMakespanHours());
    }

    @Test
    public void testCloseWindowStartsNewBlock() {
        ScheduleBuilder builder = new ScheduleBuilder("test", Fixtures.START, Fixtures.ROUND_RATE);
        builder.place(Fixtures.lot("L1", "X", 10));
        builder.closeWindow();
        Placement next = builder.place(Fixtures.lot("L2", "Y", 10));

        assertNull(next.getPreviousType());
        assertEquals(0.0, next.getChangeoverHours());
        assertEquals(24 + 10 + 24, next.getFillStart(), 1e-12);
    }

    @Test
    public void testCheckPlannableRejectsOversizeAndDuplicates() {
        Lot huge = Fixtures.lot("BIG", "X", 121);
        OversizeLotException e = assertThrows(OversizeLotException.class,
                () -> ScheduleBuilder.checkPlannable(List.of(huge), Fixtures.ROUND_RATE));
        assertEquals("BIG", e.getLotId());
        assertEquals(120.0, e.getWindowHours());

        Lot one = Fixtures.lot("L1", "X", 1);
        assertThrows(IllegalArgumentException.class,
                () -> ScheduleBuilder.checkPlannable(List.of(one, one), Fixtures.ROUND_RATE));
    }

    @Test
    public void testCleanCountingTowardWindowForcesEarlierClean() {
        SchedulerConfig counting = Fixtures.ROUND_RATE.toBuilder().cleanCountsTowardWindow(true).build();
        ScheduleBuilder builder = new ScheduleBuilder("test", Fixtures.START, counting);
        builder.place(Fixtures.lot("L1", "X", 60));
        // 4 h changeover + 40 h fill fits 120 h but not 96 h
        assertTrue(builder.place(Fixtures.lot("L2", "X", 40)).isForcedClean());

        ScheduleBuilder standard = new ScheduleBuilder("test", Fixtures.START, Fixtures.ROUND_RATE);
        standard.place(Fixtures.lot("L1", "X", 60));
        assertFalse(standard.place(Fixtures.lot("L2", "X", 40)).isForcedClean());
    }
}
