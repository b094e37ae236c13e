package fr.uga.amdn.solver;

import java.util.Map;

/**
 * Truth values of the variables of a weighted CNF problem, as returned by a solver. Variables are numbered from 1;
 * a variable the solver did not report is false.
 */
public final class Assignment {

    private final boolean[] values;
    private final long cost;

    public Assignment(boolean[] values, long cost) {
        this.values = values.clone();
        this.cost = cost;
    }

    /**
     * Builds an assignment from a DIMACS model (signed literals). Literals above {@code variableCount} are solver
     * internal and ignored.
     */
    public static Assignment fromModel(int[] model, int variableCount, long cost) {
        boolean[] values = new boolean[variableCount + 1];
        for (int literal : model) {
            int variable = Math.abs(literal);
            if (variable <= variableCount) {
                values[variable] = literal > 0;
            }
        }
        return new Assignment(values, cost);
    }

    public static Assignment fromMap(Map<Integer, Boolean> truth, int variableCount, long cost) {
        boolean[] values = new boolean[variableCount + 1];
        for (Map.Entry<Integer, Boolean> entry : truth.entrySet()) {
            if (entry.getKey() >= 1 && entry.getKey() <= variableCount) {
                values[entry.getKey()] = entry.getValue();
            }
        }
        return new Assignment(values, cost);
    }

    public boolean isTrue(int variable) {
        return variable > 0 && variable < this.values.length && this.values[variable];
    }

    public int getVariableCount() {
        return this.values.length - 1;
    }

    /**
     * Total weight of the soft clauses falsified by this assignment.
     */
    public long getCost() {
        return this.cost;
    }

    public boolean[] toArray() {
        return this.values.clone();
    }
}
