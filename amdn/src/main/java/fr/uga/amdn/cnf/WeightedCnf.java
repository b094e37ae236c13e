package fr.uga.amdn.cnf;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A weighted CNF problem: soft clauses with positive integer weights and hard clauses that must hold.
 *
 * <p>The hard sentinel is computed when the problem is built, as the sum of all soft weights plus one, so that
 * no assignment can trade a violated hard clause for soft weight.</p>
 */
public final class WeightedCnf {

    private final List<WeightedClause> clauses;
    private final int variableCount;
    private final long hardWeight;
    private final long softWeightSum;

    private WeightedCnf(List<WeightedClause> clauses, int variableCount, long hardWeight, long softWeightSum) {
        this.clauses = Collections.unmodifiableList(clauses);
        this.variableCount = variableCount;
        this.hardWeight = hardWeight;
        this.softWeightSum = softWeightSum;
    }

    public List<WeightedClause> getClauses() {
        return this.clauses;
    }

    public int getVariableCount() {
        return this.variableCount;
    }

    public long getHardWeight() {
        return this.hardWeight;
    }

    public long getSoftWeightSum() {
        return this.softWeightSum;
    }

    public long countHard() {
        return this.clauses.stream().filter(WeightedClause::isHard).count();
    }

    public long countSoft() {
        return this.clauses.size() - countHard();
    }

    /**
     * Sum of the weights of the soft clauses falsified by an assignment, indexed by variable number.
     */
    public long cost(boolean[] assignment) {
        long cost = 0;
        for (WeightedClause clause : this.clauses) {
            if (!clause.isHard() && !clause.isSatisfiedBy(assignment)) {
                cost += clause.getWeight();
            }
        }
        return cost;
    }

    public boolean satisfiesHardClauses(boolean[] assignment) {
        for (WeightedClause clause : this.clauses) {
            if (clause.isHard() && !clause.isSatisfiedBy(assignment)) {
                return false;
            }
        }
        return true;
    }

    public static final class Builder {

        private final List<int[]> soft = new ArrayList<>();
        private final List<Long> softWeights = new ArrayList<>();
        private final List<int[]> hard = new ArrayList<>();
        private int variableCount;

        public Builder addSoft(long weight, int... literals) {
            if (weight <= 0) {
                throw new IllegalArgumentException("Soft clauses need a strictly positive weight, got " + weight);
            }
            this.soft.add(normalize(literals));
            this.softWeights.add(weight);
            return this;
        }

        public Builder addHard(int... literals) {
            this.hard.add(normalize(literals));
            return this;
        }

        // Declares variables that may not occur in any clause
        public Builder variableCount(int count) {
            this.variableCount = Math.max(this.variableCount, count);
            return this;
        }

        private int[] normalize(int[] literals) {
            if (literals.length == 0) {
                throw new IllegalArgumentException("Empty clause");
            }
            Set<Integer> unique = new LinkedHashSet<>();
            for (int literal : literals) {
                if (literal == 0) {
                    throw new IllegalArgumentException("0 is not a DIMACS literal");
                }
                this.variableCount = Math.max(this.variableCount, Math.abs(literal));
                unique.add(literal);
            }
            return unique.stream().mapToInt(Integer::intValue).toArray();
        }

        public WeightedCnf build() {
            long sum = 0;
            for (long weight : this.softWeights) {
                sum = Math.addExact(sum, weight);
            }
            long top = Math.addExact(sum, 1L);
            List<WeightedClause> clauses = new ArrayList<>();
            for (int i = 0; i < this.soft.size(); i++) {
                clauses.add(new WeightedClause(this.softWeights.get(i), false, this.soft.get(i)));
            }
            for (int[] literals : this.hard) {
                clauses.add(new WeightedClause(top, true, literals));
            }
            return new WeightedCnf(clauses, this.variableCount, top, sum);
        }
    }
}
