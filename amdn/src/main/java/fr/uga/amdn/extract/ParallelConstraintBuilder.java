package fr.uga.amdn.extract;

import fr.uga.amdn.formula.ConstraintSet;
import fr.uga.amdn.formula.FormulaArena;
import fr.uga.amdn.observation.ObservationLists;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.Fluent;
import fr.uga.amdn.trace.ParallelTrace;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Set;

/**
 * STRIPS well-formedness of every action, and mutual exclusion of the effects of actions that may have run at the
 * same time.
 */
public class ParallelConstraintBuilder implements ConstraintBuilder {

    private static final Logger LOGGER = LogManager.getLogger(ParallelConstraintBuilder.class.getName());

    private final LiteralFactory literals;

    public ParallelConstraintBuilder(LiteralFactory literals) {
        this.literals = literals;
    }

    @Override
    public ConstraintSet build(ObservationLists observations) {
        ConstraintSet constraints = buildHard(observations);
        int hard = constraints.size();
        constraints.merge(buildSoft(observations));
        LOGGER.debug("Built {} hard and {} soft parallel constraints", hard, constraints.size() - hard);
        return constraints;
    }

    /**
     * An action never needs what it adds, and only deletes what it needs.
     */
    ConstraintSet buildHard(ObservationLists observations) {
        FormulaArena f = this.literals.getArena();
        ConstraintSet constraints = new ConstraintSet();
        for (Action a : observations.getActions()) {
            for (Fluent r : observations.getPropositions()) {
                constraints.addHard(f.implies(this.literals.add(r, a), f.not(this.literals.pre(r, a))));
                constraints.addHard(f.implies(this.literals.delete(r, a), this.literals.pre(r, a)));
            }
        }
        return constraints;
    }

    ConstraintSet buildSoft(ObservationLists observations) {
        ConstraintSet constraints = new ConstraintSet();
        // Actions of the same set, assuming they were not disordered
        for (ParallelTrace trace : observations.getTraces()) {
            for (Set<Action> set : trace.getActionSets()) {
                for (Action x : set) {
                    for (Action xPrime : set) {
                        if (x.equals(xPrime)) {
                            continue;
                        }
                        double p = observations.probability(x, xPrime);
                        for (Fluent r : observations.getPropositions()) {
                            constraints.addSoft(mutex(r, x, xPrime), 1.0 - p);
                        }
                    }
                }
            }
        }
        // Actions of adjacent sets, assuming they were disordered
        for (ParallelTrace trace : observations.getTraces()) {
            List<Set<Action>> sets = trace.getActionSets();
            for (int j = 0; j < sets.size() - 1; j++) {
                for (Action y : sets.get(j + 1)) {
                    for (Action xPrime : sets.get(j)) {
                        if (y.equals(xPrime)) {
                            continue;
                        }
                        double p = observations.probability(y, xPrime);
                        for (Fluent r : observations.getPropositions()) {
                            constraints.addSoft(mutex(r, y, xPrime), p);
                        }
                    }
                }
            }
        }
        return constraints;
    }

    // At most one of x and other touches r
    int mutex(Fluent r, Action x, Action other) {
        FormulaArena f = this.literals.getArena();
        return f.or(
            f.and(f.not(this.literals.add(r, other)), f.not(this.literals.delete(r, other))),
            f.and(f.not(this.literals.add(r, x)), f.not(this.literals.delete(r, x))));
    }
}
