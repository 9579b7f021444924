package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.SchedulerConfig;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

public class RuleEngineTest {

    private final SchedulerConfig config = SchedulerConfig.defaults();

    @Test
    public void testChangeoverDurations() {
        assertEquals(0.0, RuleEngine.changeoverDuration(null, "Solution", config));
        assertEquals(4.0, RuleEngine.changeoverDuration("Solution", "Solution", config));
        assertEquals(8.0, RuleEngine.changeoverDuration("Solution", "Suspension", config));
    }

    @Test
    public void testTypeComparisonIsCaseSensitive() {
        assertEquals(8.0, RuleEngine.changeoverDuration("solution", "Solution", config));
    }

    @Test
    public void testWindowBudget() {
        assertEquals(120.0, RuleEngine.windowBudget(0.0, config));
        assertEquals(20.0, RuleEngine.windowBudget(100.0, config), 1e-12);

        LocalDateTime cleanEnd = LocalDateTime.of(2025, 1, 2, 8, 0);
        assertEquals(90.0, RuleEngine.windowBudget(cleanEnd, cleanEnd.plusHours(30), config), 1e-12);
    }

    @Test
    public void testCleanCountingTowardWindowShrinksBudget() {
        SchedulerConfig counting = config.toBuilder().cleanCountsTowardWindow(true).build();
        assertEquals(96.0, counting.windowCapacityHours());
        assertEquals(96.0, RuleEngine.windowBudget(0.0, counting));
    }

    @Test
    public void testForcedCleanToleratesRoundingDrift() {
        assertFalse(RuleEngine.requiresForcedClean(10.0, 10.0));
        assertFalse(RuleEngine.requiresForcedClean(10.0, 10.0 + 1e-12));
        assertTrue(RuleEngine.requiresForcedClean(10.0, 10.001));
    }

    @Test
    public void testOversize() {
        assertFalse(RuleEngine.isOversize(120.0, config));
        assertTrue(RuleEngine.isOversize(120.01, config));
        assertTrue(RuleEngine.isOversize(100.0, config.toBuilder().cleanCountsTowardWindow(true).build()));
    }

    @Test
    public void testHoursBetween() {
        LocalDateTime from = LocalDateTime.of(2025, 1, 1, 8, 0);
        assertEquals(1.5, RuleEngine.hoursBetween(from, from.plusMinutes(90)), 1e-12);
    }
}
