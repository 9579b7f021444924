package com.fillline.scheduler.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class StrategyRegistryTest {

    private final StrategyRegistry registry = StrategyRegistry.withDefaults(new StubSolverBackend());

    @Test
    public void testCanonicalNames() {
        assertEquals(List.of("spt-pack", "lpt-pack", "cfs-pack", "smart-pack", "hybrid-pack", "milp-opt"),
                registry.names());
    }

    @Test
    public void testAliases() {
        assertEquals("spt-pack", registry.get("SPT").name());
        assertEquals("lpt-pack", registry.get(" lpt_pack ").name());
        assertEquals("smart-pack", registry.get("smartpack").name());
        assertEquals("milp-opt", registry.get("milp").name());
        assertEquals("hybrid-pack", registry.get("Hybrid").name());
    }

    @Test
    public void testUnknownName() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> registry.get("fifo"));
        assertTrue(e.getMessage().contains("spt-pack"));
        assertThrows(IllegalArgumentException.class, () -> registry.get(" "));
        assertThrows(IllegalArgumentException.class, () -> registry.get(null));
    }

    @Test
    public void testDuplicateRegistrationRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new StrategyRegistry(List.of(new SptPackStrategy(), new SptPackStrategy())));
    }
}
