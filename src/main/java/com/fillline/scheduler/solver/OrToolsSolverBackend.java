package com.fillline.scheduler.solver;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Google OR-Tools linear solver wrapper, SCIP by default. The native libraries are loaded on
 * first use so an application without them still starts; {@link #isAvailable()} then reports
 * false.
 */
@Slf4j
@Component
public class OrToolsSolverBackend implements SolverBackend {

    private static final long GRACE_MS = 2_000;

    private static Boolean nativesLoaded;

    private final String solverId;

    public OrToolsSolverBackend() {
        this("SCIP");
    }

    public OrToolsSolverBackend(String solverId) {
        this.solverId = solverId;
    }

    @Override
    public String name() {
        return "or-tools/" + solverId;
    }

    @Override
    public boolean isAvailable() {
        if (!loadNatives()) {
            return false;
        }
        MPSolver probe = MPSolver.createSolver(solverId);
        if (probe == null) {
            return false;
        }
        probe.delete();
        return true;
    }

    @Override
    public SolverSolution solve(LinearProgram program, Duration timeLimit) {
        long startTime = System.currentTimeMillis();
        if (!loadNatives()) {
            return SolverSolution.of(SolverStatus.UNAVAILABLE, 0);
        }

        // 1. Initialize Solver
        MPSolver solver = MPSolver.createSolver(solverId);
        if (solver == null) {
            log.error("Could not create solver {}", solverId);
            return SolverSolution.of(SolverStatus.UNAVAILABLE, 0);
        }
        solver.setTimeLimit(timeLimit.toMillis());

        // 2. Variables, constraints, objective
        MPVariable[] x = makeVariables(solver, program.getVariables());
        for (LinearProgram.Constraint c : program.getConstraints()) {
            MPConstraint ct = solver.makeConstraint(bound(c.getLowerBound()), bound(c.getUpperBound()), c.getName());
            for (Map.Entry<Integer, Double> term : c.getCoefficients().entrySet()) {
                ct.setCoefficient(x[term.getKey()], term.getValue());
            }
        }
        MPObjective objective = solver.objective();
        for (Map.Entry<Integer, Double> term : program.getObjective().entrySet()) {
            objective.setCoefficient(x[term.getKey()], term.getValue());
        }
        if (program.isMinimize()) {
            objective.setMinimization();
        } else {
            objective.setMaximization();
        }
        log.debug("Solving {} with {}: {} variables, {} constraints, limit {} ms",
                program.getName(), solverId, x.length, program.getConstraints().size(), timeLimit.toMillis());

        // 3. Solve, never waiting past the limit
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<MPSolver.ResultStatus> pending = executor.submit(() -> solver.solve());
        boolean finished = false;
        try {
            MPSolver.ResultStatus status = pending.get(timeLimit.toMillis() + GRACE_MS, TimeUnit.MILLISECONDS);
            finished = true;
            long elapsed = System.currentTimeMillis() - startTime;
            SolverStatus mapped = map(status);
            if (!mapped.hasSolution()) {
                log.info("{} ended with {} after {} ms", name(), status, elapsed);
                return SolverSolution.of(mapped, elapsed);
            }
            double[] values = new double[x.length];
            for (int i = 0; i < x.length; i++) {
                values[i] = x[i].solutionValue();
            }
            return new SolverSolution(mapped, values, objective.value(), elapsed);
        } catch (TimeoutException e) {
            log.warn("{} did not return within {} ms, interrupting", name(), timeLimit.toMillis());
            finished = interrupt(solver, pending);
            return SolverSolution.of(SolverStatus.TIMEOUT, System.currentTimeMillis() - startTime);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            finished = interrupt(solver, pending);
            return SolverSolution.of(SolverStatus.TIMEOUT, System.currentTimeMillis() - startTime);
        } catch (ExecutionException e) {
            log.error("{} failed: {}", name(), e.getCause().getMessage(), e.getCause());
            finished = true;
            return SolverSolution.of(SolverStatus.ABNORMAL, System.currentTimeMillis() - startTime);
        } finally {
            executor.shutdownNow();
            if (finished) {
                solver.delete();
            }
        }
    }

    private static MPVariable[] makeVariables(MPSolver solver, List<LinearProgram.Variable> variables) {
        MPVariable[] x = new MPVariable[variables.size()];
        for (LinearProgram.Variable v : variables) {
            x[v.getIndex()] = v.isInteger()
                    ? solver.makeIntVar(bound(v.getLowerBound()), bound(v.getUpperBound()), v.getName())
                    : solver.makeNumVar(bound(v.getLowerBound()), bound(v.getUpperBound()), v.getName());
        }
        return x;
    }

    private static double bound(double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return MPSolver.infinity();
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return -MPSolver.infinity();
        }
        return value;
    }

    private static SolverStatus map(MPSolver.ResultStatus status) {
        switch (status) {
            case OPTIMAL:
                return SolverStatus.OPTIMAL;
            case FEASIBLE:
                return SolverStatus.FEASIBLE;
            case INFEASIBLE:
                return SolverStatus.INFEASIBLE;
            case NOT_SOLVED:
                // time limit hit before any incumbent
                return SolverStatus.TIMEOUT;
            default:
                return SolverStatus.ABNORMAL;
        }
    }

    /** Returns whether the native solve has stopped, i.e. the solver may be released. */
    private boolean interrupt(MPSolver solver, Future<MPSolver.ResultStatus> pending) {
        solver.interruptSolve();
        try {
            pending.get(GRACE_MS, TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return true;
        } catch (TimeoutException e) {
            log.warn("{} still running after interrupt; leaking native solver", name());
            return false;
        }
    }

    private static synchronized boolean loadNatives() {
        if (nativesLoaded == null) {
            try {
                Loader.loadNativeLibraries();
                nativesLoaded = Boolean.TRUE;
            } catch (UnsatisfiedLinkError | RuntimeException e) {
                log.warn("OR-Tools native libraries could not be loaded: {}", e.getMessage());
                nativesLoaded = Boolean.FALSE;
            }
        }
        return nativesLoaded;
    }
}
