package fr.uga.amdn.extract;

import fr.uga.amdn.formula.ConstraintSet;
import fr.uga.amdn.formula.FormulaArena;
import fr.uga.amdn.observation.ObservationLists;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.Fluent;
import fr.uga.amdn.trace.ParallelTrace;
import fr.uga.amdn.trace.State;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Occurrence-frequency heuristics that make noisy observations less influential.
 *
 * <ul>
 *     <li>Rule 6: a proposition frequently true right after an action is probably not deleted by it.</li>
 *     <li>Rule 7: a proposition that turns from false to true was added by an action of the step.</li>
 *     <li>Rule 8: a proposition frequently true right before an action is probably one of its preconditions.</li>
 * </ul>
 *
 * All weights are occurrence counts divided by the number of true observations over all states of all traces.
 */
public class NoiseConstraintBuilder implements ConstraintBuilder {

    private static final Logger LOGGER = LogManager.getLogger(NoiseConstraintBuilder.class.getName());

    private final LiteralFactory literals;
    private final int occurrenceThreshold;

    public NoiseConstraintBuilder(LiteralFactory literals, int occurrenceThreshold) {
        if (occurrenceThreshold < 0) {
            throw new IllegalArgumentException("The occurrence threshold cannot be negative: " + occurrenceThreshold);
        }
        this.literals = literals;
        this.occurrenceThreshold = occurrenceThreshold;
    }

    @Override
    public ConstraintSet build(ObservationLists observations) {
        long total = countTrueObservations(observations);
        if (total == 0) {
            LOGGER.warn("No proposition is observed true in any state, no noise constraint can be weighted");
            return new ConstraintSet();
        }
        List<ConstraintSet> rules = new ArrayList<>();
        rules.add(rule6(observations, total));
        rules.add(rule7(observations, total));
        rules.add(rule8(observations, total));
        ConstraintSet constraints = ConstraintSet.mergeAll(rules);
        LOGGER.debug("Built {} noise constraints (6: {}, 7: {}, 8: {})", constraints.size(),
            rules.get(0).size(), rules.get(1).size(), rules.get(2).size());
        return constraints;
    }

    static long countTrueObservations(ObservationLists observations) {
        long total = 0;
        for (ParallelTrace trace : observations.getTraces()) {
            for (State state : trace.getStates()) {
                total += state.trueFluents().size();
            }
        }
        return total;
    }

    ConstraintSet rule6(ObservationLists observations, long total) {
        FormulaArena f = this.literals.getArena();
        ConstraintSet constraints = new ConstraintSet();
        Map<Action, Map<Fluent, Integer>> occurrences = countAround(observations, true);
        for (Map.Entry<Action, Map<Fluent, Integer>> perAction : occurrences.entrySet()) {
            for (Map.Entry<Fluent, Integer> entry : perAction.getValue().entrySet()) {
                if (entry.getValue() > this.occurrenceThreshold) {
                    int notDeleted = f.not(this.literals.delete(entry.getKey(), perAction.getKey()));
                    constraints.addSoft(this.literals.asClause(notDeleted), (double) entry.getValue() / total);
                }
            }
        }
        return constraints;
    }

    ConstraintSet rule7(ObservationLists observations, long total) {
        FormulaArena f = this.literals.getArena();
        ConstraintSet constraints = new ConstraintSet();
        Map<Fluent, Integer> occurrences = new HashMap<>();
        for (ParallelTrace trace : observations.getTraces()) {
            for (State state : trace.getStates()) {
                for (Fluent r : state.trueFluents()) {
                    occurrences.merge(r, 1, Integer::sum);
                }
            }
        }
        for (ParallelTrace trace : observations.getTraces()) {
            for (int j = 0; j < trace.size(); j++) {
                Set<Action> set = trace.getActionSets().get(j);
                if (set.isEmpty()) {
                    continue;
                }
                State before = trace.stateBefore(j);
                for (Fluent r : trace.stateAfter(j).trueFluents()) {
                    if (!before.isObservedFalse(r) || !observations.getPropositions().contains(r)) {
                        continue;
                    }
                    List<Integer> adders = new ArrayList<>();
                    for (Action a : set) {
                        adders.add(this.literals.add(r, a));
                    }
                    constraints.addSoft(f.or(adders), (double) occurrences.get(r) / total);
                }
            }
        }
        return constraints;
    }

    ConstraintSet rule8(ObservationLists observations, long total) {
        ConstraintSet constraints = new ConstraintSet();
        Map<Action, Map<Fluent, Integer>> occurrences = countAround(observations, false);
        for (Map.Entry<Action, Map<Fluent, Integer>> perAction : occurrences.entrySet()) {
            for (Map.Entry<Fluent, Integer> entry : perAction.getValue().entrySet()) {
                if (entry.getValue() > this.occurrenceThreshold) {
                    int pre = this.literals.pre(entry.getKey(), perAction.getKey());
                    constraints.addSoft(this.literals.asClause(pre), (double) entry.getValue() / total);
                }
            }
        }
        return constraints;
    }

    /**
     * For every action and proposition, how many times the proposition is observed true in the state right after
     * ({@code after == true}) or right before a set holding the action.
     */
    private Map<Action, Map<Fluent, Integer>> countAround(ObservationLists observations, boolean after) {
        Map<Action, Map<Fluent, Integer>> occurrences = new LinkedHashMap<>();
        for (Action a : observations.getActions()) {
            Map<Fluent, Integer> perFluent = new LinkedHashMap<>();
            for (Fluent r : observations.getPropositions()) {
                perFluent.put(r, 0);
            }
            occurrences.put(a, perFluent);
        }
        for (ParallelTrace trace : observations.getTraces()) {
            for (int j = 0; j < trace.size(); j++) {
                State state = after ? trace.stateAfter(j) : trace.stateBefore(j);
                for (Fluent r : state.trueFluents()) {
                    for (Action a : trace.getActionSets().get(j)) {
                        Map<Fluent, Integer> perFluent = occurrences.get(a);
                        if (perFluent != null && perFluent.containsKey(r)) {
                            perFluent.merge(r, 1, Integer::sum);
                        }
                    }
                }
            }
        }
        return occurrences;
    }
}
