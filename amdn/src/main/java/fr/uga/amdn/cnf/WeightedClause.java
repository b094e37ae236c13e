package fr.uga.amdn.cnf;

import java.util.Arrays;

/**
 * A disjunction of DIMACS literals with its weight. Hard clauses carry the sentinel weight of their problem.
 */
public final class WeightedClause {

    private final long weight;
    private final boolean hard;
    private final int[] literals;

    WeightedClause(long weight, boolean hard, int[] literals) {
        this.weight = weight;
        this.hard = hard;
        this.literals = literals;
    }

    public long getWeight() {
        return this.weight;
    }

    public boolean isHard() {
        return this.hard;
    }

    public int[] getLiterals() {
        return this.literals.clone();
    }

    /**
     * @param assignment truth value of each variable, indexed by variable number
     */
    public boolean isSatisfiedBy(boolean[] assignment) {
        for (int literal : this.literals) {
            boolean value = assignment[Math.abs(literal)];
            if (literal > 0 == value) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return (this.hard ? "HARD " : this.weight + " ") + Arrays.toString(this.literals);
    }
}
