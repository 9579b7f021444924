package com.fillline.scheduler.solver;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Backend-neutral mixed-integer linear program: bounded variables, ranged linear constraints and
 * a linear objective. Variables are addressed by the index returned when they are added.
 */
@Getter
public class LinearProgram {

    public static final double INFINITY = Double.POSITIVE_INFINITY;

    private final String name;
    private final List<Variable> variables = new ArrayList<>();
    private final List<Constraint> constraints = new ArrayList<>();
    private final Map<Integer, Double> objective = new LinkedHashMap<>();
    private boolean minimize = true;

    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> byName = new HashMap<>();

    public LinearProgram(String name) {
        this.name = name;
    }

    public int addBinary(String name) {
        return addVariable(name, 0.0, 1.0, true);
    }

    public int addInteger(String name, double lowerBound, double upperBound) {
        return addVariable(name, lowerBound, upperBound, true);
    }

    public int addContinuous(String name, double lowerBound, double upperBound) {
        return addVariable(name, lowerBound, upperBound, false);
    }

    public Constraint addConstraint(String name, double lowerBound, double upperBound) {
        Constraint c = new Constraint(name, lowerBound, upperBound);
        constraints.add(c);
        return c;
    }

    public void setObjectiveCoefficient(int variable, double coefficient) {
        objective.put(variable, coefficient);
    }

    public void setMaximization() {
        this.minimize = false;
    }

    public int indexOf(String variableName) {
        Integer index = byName.get(variableName);
        if (index == null) {
            throw new IllegalArgumentException("Unknown variable: " + variableName);
        }
        return index;
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public Map<Integer, Double> getObjective() {
        return Collections.unmodifiableMap(objective);
    }

    private int addVariable(String name, double lowerBound, double upperBound, boolean integer) {
        if (byName.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate variable name: " + name);
        }
        int index = variables.size();
        variables.add(new Variable(index, name, lowerBound, upperBound, integer));
        byName.put(name, index);
        return index;
    }

    @Value
    public static class Variable {
        int index;
        String name;
        double lowerBound;
        double upperBound;
        boolean integer;
    }

    /** {@code lowerBound <= sum(coefficient * variable) <= upperBound}. */
    @Getter
    public static class Constraint {
        private final String name;
        private final double lowerBound;
        private final double upperBound;
        private final Map<Integer, Double> coefficients = new LinkedHashMap<>();

        Constraint(String name, double lowerBound, double upperBound) {
            this.name = name;
            this.lowerBound = lowerBound;
            this.upperBound = upperBound;
        }

        /** Adds to any coefficient already set for the variable. */
        public Constraint coefficient(int variable, double value) {
            coefficients.merge(variable, value, Double::sum);
            return this;
        }
    }
}
