package com.fillline.scheduler.engine;

import com.fillline.scheduler.Fixtures;
import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.ScheduleResult;
import com.fillline.scheduler.domain.SchedulerConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SmartPackStrategyTest {

    private final SchedulerConfig config = SchedulerConfig.defaults();

    @Test
    public void testThreeLotExample() {
        ScheduleResult result = new SmartPackStrategy().plan(Fixtures.threeLots(), Fixtures.START, config);
        // C fills most of the first window; A and B share the second without a type change
        assertEquals(List.of("C", "A", "B"), result.getSchedule().fillOrder());
        assertEquals(2, result.getKpis().getCleanBlocks());
        assertEquals(1, result.getKpis().getChangeovers());
    }

    @Test
    public void testTwoBlocksOnBigAndSmall() {
        ScheduleResult result = new SmartPackStrategy().plan(Fixtures.bigAndSmall(), Fixtures.START,
                Fixtures.ROUND_RATE);
        assertEquals(196.0, result.getMakespanHours(), 1e-6);
        assertEquals(2, result.getKpis().getCleanBlocks());
    }

    @Test
    public void testBeamPrefersLotThatFitsOverForcedClean() {
        SchedulerConfig rate = Fixtures.ROUND_RATE;
        BeamSearch search = new BeamSearch(rate.toBuilder().lookaheadHorizon(1).build());
        PackingState state = PackingState.opened(rate).after(
                PackingState.opened(rate).evaluate(Fixtures.lot("L0", "X", 100), rate), rate);

        Lot tooBig = Fixtures.lot("A-BIG", "X", 30);
        Lot fits = Fixtures.lot("B-FIT", "X", 10);
        assertEquals(fits, search.selectNext(state, List.of(tooBig, fits)));
    }

    @Test
    public void testStepScorePenalizesAvoidableCleanOnly() {
        SchedulerConfig rate = Fixtures.ROUND_RATE;
        BeamSearch search = new BeamSearch(rate);
        PackingState state = new PackingState(124.0, 24.0, "X");
        Placement forced = state.evaluate(Fixtures.lot("BIG", "X", 30), rate);
        assertTrue(forced.isForcedClean());

        double unavoidable = search.stepScore(forced, false);
        double avoidable = search.stepScore(forced, true);
        assertEquals(rate.getForcedCleanPenalty(), unavoidable - avoidable, 1e-9);
        // abandoned 20 h plus 90 h left in the new window
        assertEquals(-110.0, unavoidable, 1e-9);
    }

    @Test
    public void testDeterministic() {
        List<Lot> lots = Fixtures.randomLots(new Random(7), config);
        ScheduleResult first = new SmartPackStrategy().plan(lots, Fixtures.START, config);
        ScheduleResult second = new SmartPackStrategy().plan(lots, Fixtures.START, config);
        assertEquals(first.getSchedule(), second.getSchedule());
    }

    @Test
    public void testProgressListenerFailureDoesNotStopPlanning() {
        List<Integer> seen = new ArrayList<>();
        ScheduleResult result = new SmartPackStrategy().plan(Fixtures.threeLots(), Fixtures.START, config, event -> {
            seen.add(event.getPlaced());
            throw new IllegalStateException("listener broke");
        });
        assertEquals(List.of(1, 2, 3), seen);
        assertEquals(3, result.getSchedule().fills().size());
    }

    @Test
    public void testHybridKeepsClusterOrder() {
        List<Lot> lots = List.of(
                Fixtures.lot("S1", "Solution", 50),
                Fixtures.lot("S2", "Solution", 60),
                Fixtures.lot("S3", "Solution", 5),
                Fixtures.lot("P1", "Powder", 20));
        ScheduleResult result = new HybridPackStrategy().plan(lots, Fixtures.START, Fixtures.ROUND_RATE);
        List<String> order = result.getSchedule().fillOrder();
        assertEquals("P1", order.get(3));
        assertEquals(4, order.size());
    }
}
