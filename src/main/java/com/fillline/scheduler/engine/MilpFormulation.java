package com.fillline.scheduler.engine;

import com.fillline.scheduler.domain.Lot;
import com.fillline.scheduler.domain.SchedulerConfig;
import com.fillline.scheduler.exception.InfeasibleScheduleException;
import com.fillline.scheduler.solver.LinearProgram;
import com.fillline.scheduler.solver.SolverSolution;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exact block model of the line. Each block is the run of fills between two cleans; lots are
 * assigned to blocks and chained inside a block by successor arcs.
 *
 * <pre>
 * y[b,i]   lot i runs in block b
 * u[b]     block b is used
 * s[b,i]   lot i opens block b          e[b,i]  lot i closes block b
 * z[b,i,j] lot j follows lot i in b     p[b,i]  position of i in b (MTZ)
 *
 * min  clean * sum u[b] + sum changeover(i,j) * z[b,i,j]
 * s.t. sum_b y[b,i] = 1
 *      u[b] <= sum_i y[b,i] <= n * u[b]
 *      sum_i s[b,i] = u[b],  sum_i e[b,i] = u[b]
 *      sum_j z[b,i,j] = y[b,i] - e[b,i],  sum_j z[b,j,i] = y[b,i] - s[b,i]
 *      y[b,i] <= p[b,i] <= n * y[b,i],  p[b,j] >= p[b,i] + 1 - M (1 - z[b,i,j])
 *      sum_i fill(i) y[b,i] + sum changeover(i,j) z[b,i,j] <= capacity * u[b]
 *      u[b] >= u[b+1]
 * </pre>
 *
 * Fill time is constant, so the objective is the makespan minus total fill hours.
 */
final class MilpFormulation {

    private final List<Lot> lots;
    private final int blocks;
    private final LinearProgram program;
    private final int[] u;
    private final int[][] y;
    private final int[][] s;
    private final int[][] e;
    private final int[][][] z;

    private MilpFormulation(List<Lot> lots) {
        this.lots = List.copyOf(lots);
        this.blocks = lots.size();
        this.program = new LinearProgram("fill-line-blocks");
        int n = lots.size();
        this.u = new int[blocks];
        this.y = new int[blocks][n];
        this.s = new int[blocks][n];
        this.e = new int[blocks][n];
        this.z = new int[blocks][n][n];
    }

    static MilpFormulation formulate(List<Lot> lots, SchedulerConfig config) {
        MilpFormulation f = new MilpFormulation(lots);
        f.build(config);
        return f;
    }

    LinearProgram getProgram() {
        return program;
    }

    private void build(SchedulerConfig config) {
        int n = lots.size();
        int[][] p = new int[blocks][n];
        double[][] setup = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                setup[i][j] = RuleEngine.changeoverDuration(lots.get(i).getType(), lots.get(j).getType(), config);
            }
        }

        for (int b = 0; b < blocks; b++) {
            u[b] = program.addBinary("u_" + b);
            program.setObjectiveCoefficient(u[b], RuleEngine.cleanDuration(config));
            for (int i = 0; i < n; i++) {
                y[b][i] = program.addBinary("y_" + b + "_" + i);
                s[b][i] = program.addBinary("s_" + b + "_" + i);
                e[b][i] = program.addBinary("e_" + b + "_" + i);
                p[b][i] = program.addInteger("p_" + b + "_" + i, 0, n);
            }
            for (int i = 0; i < n; i++) {
                for (int j = 0; j < n; j++) {
                    if (i == j) {
                        z[b][i][j] = -1;
                        continue;
                    }
                    z[b][i][j] = program.addBinary("z_" + b + "_" + i + "_" + j);
                    program.setObjectiveCoefficient(z[b][i][j], setup[i][j]);
                }
            }
        }

        // each lot in exactly one block
        for (int i = 0; i < n; i++) {
            LinearProgram.Constraint once = program.addConstraint("assign_once_" + i, 1, 1);
            for (int b = 0; b < blocks; b++) {
                once.coefficient(y[b][i], 1);
            }
        }

        double bigM = n + 1;
        double capacity = config.windowCapacityHours();
        for (int b = 0; b < blocks; b++) {
            LinearProgram.Constraint usedLow = program.addConstraint("used_lb_" + b, 0, LinearProgram.INFINITY)
                    .coefficient(u[b], -1);
            LinearProgram.Constraint usedHigh = program.addConstraint("used_ub_" + b, -LinearProgram.INFINITY, 0)
                    .coefficient(u[b], -n);
            LinearProgram.Constraint oneStart = program.addConstraint("one_start_" + b, 0, 0)
                    .coefficient(u[b], -1);
            LinearProgram.Constraint oneEnd = program.addConstraint("one_end_" + b, 0, 0)
                    .coefficient(u[b], -1);
            LinearProgram.Constraint cap = program.addConstraint("capacity_" + b, -LinearProgram.INFINITY, 0)
                    .coefficient(u[b], -capacity);

            for (int i = 0; i < n; i++) {
                usedLow.coefficient(y[b][i], 1);
                usedHigh.coefficient(y[b][i], 1);
                oneStart.coefficient(s[b][i], 1);
                oneEnd.coefficient(e[b][i], 1);
                cap.coefficient(y[b][i], lots.get(i).getFillHours());

                LinearProgram.Constraint out = program.addConstraint("outdeg_" + b + "_" + i, 0, 0)
                        .coefficient(y[b][i], -1)
                        .coefficient(e[b][i], 1);
                LinearProgram.Constraint in = program.addConstraint("indeg_" + b + "_" + i, 0, 0)
                        .coefficient(y[b][i], -1)
                        .coefficient(s[b][i], 1);
                for (int j = 0; j < n; j++) {
                    if (i == j) {
                        continue;
                    }
                    out.coefficient(z[b][i][j], 1);
                    in.coefficient(z[b][j][i], 1);
                    cap.coefficient(z[b][i][j], setup[i][j]);

                    // z = 1  =>  p[j] >= p[i] + 1
                    program.addConstraint("mtz_" + b + "_" + i + "_" + j, 1 - bigM, LinearProgram.INFINITY)
                            .coefficient(p[b][j], 1)
                            .coefficient(p[b][i], -1)
                            .coefficient(z[b][i][j], -bigM);
                }

                program.addConstraint("pos_lb_" + b + "_" + i, 0, LinearProgram.INFINITY)
                        .coefficient(p[b][i], 1)
                        .coefficient(y[b][i], -1);
                program.addConstraint("pos_ub_" + b + "_" + i, -LinearProgram.INFINITY, 0)
                        .coefficient(p[b][i], 1)
                        .coefficient(y[b][i], -n);
            }

            if (b + 1 < blocks) {
                program.addConstraint("symmetry_" + b, 0, LinearProgram.INFINITY)
                        .coefficient(u[b], 1)
                        .coefficient(u[b + 1], -1);
            }
        }
    }

    /**
     * Reads the used blocks back as lot sequences, in block order.
     *
     * @throws InfeasibleScheduleException when the assignment is not a set of simple paths
     *                                     covering every lot exactly once
     */
    List<List<Lot>> parse(SolverSolution solution) {
        int n = lots.size();
        List<List<Lot>> sequences = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();

        for (int b = 0; b < blocks; b++) {
            if (!solution.isSet(u[b])) {
                continue;
            }
            int current = -1;
            for (int i = 0; i < n; i++) {
                if (solution.isSet(s[b][i])) {
                    current = i;
                    break;
                }
            }
            if (current < 0) {
                throw new InfeasibleScheduleException("Solver solution has no opening lot for block " + b);
            }
            List<Lot> sequence = new ArrayList<>();
            while (current >= 0) {
                if (!seen.add(current)) {
                    throw new InfeasibleScheduleException("Solver solution places lot "
                            + lots.get(current).getId() + " more than once");
                }
                sequence.add(lots.get(current));
                current = successor(solution, b, current);
            }
            sequences.add(sequence);
        }

        if (seen.size() != n) {
            throw new InfeasibleScheduleException("Solver solution covers " + seen.size() + " of " + n + " lots");
        }
        return sequences;
    }

    private int successor(SolverSolution solution, int b, int i) {
        for (int j = 0; j < lots.size(); j++) {
            if (j != i && solution.isSet(z[b][i][j])) {
                return j;
            }
        }
        return -1;
    }
}
