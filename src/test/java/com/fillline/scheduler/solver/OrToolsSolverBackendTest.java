package com.fillline.scheduler.solver;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

public class OrToolsSolverBackendTest {

    private final OrToolsSolverBackend backend = new OrToolsSolverBackend();

    @BeforeEach
    public void requireNatives() {
        assumeTrue(backend.isAvailable(), "OR-Tools natives not available");
    }

    @Test
    public void testSmallIntegerProgram() {
        LinearProgram program = new LinearProgram("small");
        int x = program.addInteger("x", 0, 10);
        int y = program.addInteger("y", 0, 10);
        program.addConstraint("c1", -LinearProgram.INFINITY, 4).coefficient(x, 1).coefficient(y, 2);
        program.addConstraint("c2", -LinearProgram.INFINITY, 6).coefficient(x, 3).coefficient(y, 1);
        program.setObjectiveCoefficient(x, 1);
        program.setObjectiveCoefficient(y, 1);
        program.setMaximization();

        SolverSolution solution = backend.solve(program, Duration.ofSeconds(10));

        assertEquals(SolverStatus.OPTIMAL, solution.getStatus());
        assertEquals(2.0, solution.getObjectiveValue(), 1e-6);
        assertEquals(2.0, solution.getValues()[x] + solution.getValues()[y], 1e-6);
    }

    @Test
    public void testInfeasibleProgram() {
        LinearProgram program = new LinearProgram("contradiction");
        int x = program.addBinary("x");
        program.addConstraint("at_least_two", 2, LinearProgram.INFINITY).coefficient(x, 1);

        SolverSolution solution = backend.solve(program, Duration.ofSeconds(10));

        assertEquals(SolverStatus.INFEASIBLE, solution.getStatus());
        assertFalse(solution.getStatus().hasSolution());
    }

    @Test
    public void testName() {
        assertEquals("or-tools/SCIP", backend.name());
    }
}
