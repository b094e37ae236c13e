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
 * Scores every pair of actions of adjacent action sets against both possible execution orders.
 *
 * <p>For x in set j, y in set j+1 and a proposition r, the ordered hypothesis says that x and y interact on r in the
 * recorded order; it is weighted by {@code 1 - p}. The disordered hypothesis is the same formula with x and y
 * swapped, weighted by {@code p}, where p is the disorder probability of the pair.</p>
 */
public class DisorderConstraintBuilder implements ConstraintBuilder {

    private static final Logger LOGGER = LogManager.getLogger(DisorderConstraintBuilder.class.getName());

    private final LiteralFactory literals;

    public DisorderConstraintBuilder(LiteralFactory literals) {
        this.literals = literals;
    }

    @Override
    public ConstraintSet build(ObservationLists observations) {
        ConstraintSet constraints = new ConstraintSet();
        for (ParallelTrace trace : observations.getTraces()) {
            List<Set<Action>> sets = trace.getActionSets();
            for (int j = 0; j < sets.size() - 1; j++) {
                for (Action x : sets.get(j)) {
                    for (Action y : sets.get(j + 1)) {
                        if (x.equals(y)) {
                            continue;
                        }
                        double p = observations.probability(x, y);
                        for (Fluent r : observations.getPropositions()) {
                            constraints.addSoft(orderedHypothesis(r, x, y), 1.0 - p);
                            constraints.addSoft(orderedHypothesis(r, y, x), p);
                        }
                    }
                }
            }
        }
        LOGGER.debug("Built {} disorder constraints", constraints.size());
        return constraints;
    }

    /**
     * x interacts with y on r when x runs first: x needs r and y deletes it, x adds r and y needs or deletes it,
     * or x deletes r and y adds it.
     */
    int orderedHypothesis(Fluent r, Action x, Action y) {
        FormulaArena f = this.literals.getArena();
        return f.or(
            f.and(this.literals.pre(r, x), f.not(this.literals.delete(r, x)), this.literals.delete(r, y)),
            f.and(this.literals.add(r, x), this.literals.pre(r, y)),
            f.and(this.literals.add(r, x), this.literals.delete(r, y)),
            f.and(this.literals.delete(r, x), this.literals.add(r, y)));
    }
}
