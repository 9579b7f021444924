package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.exception.InfeasibleScheduleException;
import com.fillline.scheduler.exception.SolverSizeLimitException;
import com.fillline.scheduler.exception.SolverTimeoutException;
import com.fillline.scheduler.exception.SolverUnavailableException;
import com.fillline.scheduler.solver.SolverBackend;
import com.fillline.scheduler.solver.SolverSolution;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Exact optimizer: formulates the block model, hands it to a {@link SolverBackend} and lays the
 * returned blocks out with the packing skeleton, one clean per block. Limited to small instances.
 */
@Slf4j
@Component
@Order(6)
@RequiredArgsConstructor
public class MilpOptStrategy extends AbstractPackingStrategy {

    public static final String NAME = "milp-opt";

    private final SolverBackend backend;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected void pack(List<Lot> lots, ScheduleBuilder builder, SchedulerConfig config, ProgressListener progress) {
        if (lots.isEmpty()) {
            return;
        }
        if (lots.size() > config.getMilpMaxLots()) {
            throw new SolverSizeLimitException(lots.size(), config.getMilpMaxLots());
        }
        if (!backend.isAvailable()) {
            throw new SolverUnavailableException("Solver backend " + backend.name() + " is not available");
        }

        List<Lot> indexed = new ArrayList<>(lots);
        indexed.sort(Comparator.comparing(Lot::getId));
        MilpFormulation formulation = MilpFormulation.formulate(indexed, config);

        Duration limit = Duration.ofMillis(Math.round(config.getMilpTimeLimitSeconds() * 1000));
        SolverSolution solution = backend.solve(formulation.getProgram(), limit);
        log.info("{} on {} lots: {} in {} ms, objective {}", backend.name(), lots.size(),
                solution.getStatus(), solution.getWallTimeMs(), solution.getObjectiveValue());

        switch (solution.getStatus()) {
            case OPTIMAL:
                break;
            case FEASIBLE:
                log.warn("{} stopped at the time limit; using the best solution found", backend.name());
                break;
            case INFEASIBLE:
                throw new InfeasibleScheduleException("Solver proved the instance infeasible");
            case TIMEOUT:
                throw new SolverTimeoutException(limit);
            case UNAVAILABLE:
                throw new SolverUnavailableException("Solver backend " + backend.name() + " is not available");
            default:
                throw new SolverUnavailableException("Solver backend " + backend.name()
                        + " ended abnormally (" + solution.getStatus() + ")");
        }

        List<List<Lot>> blocks = formulation.parse(solution);
        int placed = 0;
        for (int b = 0; b < blocks.size(); b++) {
            if (b > 0) {
                builder.closeWindow();
            }
            for (Lot lot : blocks.get(b)) {
                builder.place(lot);
                report(progress, ++placed, lots.size());
            }
        }
    }
}
