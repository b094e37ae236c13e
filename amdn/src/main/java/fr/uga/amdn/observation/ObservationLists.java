package fr.uga.amdn.observation;

import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.ActionPair;
import fr.uga.amdn.trace.Fluent;
import fr.uga.amdn.trace.ParallelTrace;
import fr.uga.amdn.trace.State;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The observed traces handed to an extraction technique, together with the propositions and actions they mention
 * and the disorder probability of every action pair. Instances are immutable.
 */
public final class ObservationLists {

    private final ObservationToken token;
    private final List<ParallelTrace> traces;
    private final Set<Fluent> propositions;
    private final Set<Action> actions;
    private final Map<ActionPair, Double> probabilities;

    /**
     * Builds the collection, collecting propositions and actions from the traces themselves.
     */
    public ObservationLists(ObservationToken token, List<ParallelTrace> traces,
                            Map<ActionPair, Double> probabilities) {
        this(token, traces, collectPropositions(traces), collectActions(traces), probabilities);
    }

    public ObservationLists(ObservationToken token, List<ParallelTrace> traces, Collection<Fluent> propositions,
                            Collection<Action> actions, Map<ActionPair, Double> probabilities) {
        if (token == null) {
            throw new IllegalArgumentException("An observation collection needs a token type");
        }
        for (Map.Entry<ActionPair, Double> entry : probabilities.entrySet()) {
            double p = entry.getValue();
            if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
                throw new IllegalArgumentException("Disorder probability of " + entry.getKey()
                    + " must be within [0, 1], got " + p);
            }
        }
        this.token = token;
        this.traces = Collections.unmodifiableList(new ArrayList<>(traces));
        this.propositions = Collections.unmodifiableSet(new LinkedHashSet<>(propositions));
        this.actions = Collections.unmodifiableSet(new LinkedHashSet<>(actions));
        this.probabilities = Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
    }

    private static Set<Fluent> collectPropositions(List<ParallelTrace> traces) {
        Set<Fluent> fluents = new LinkedHashSet<>();
        for (ParallelTrace trace : traces) {
            for (State state : trace.getStates()) {
                fluents.addAll(state.getValues().keySet());
            }
        }
        return fluents;
    }

    private static Set<Action> collectActions(List<ParallelTrace> traces) {
        Set<Action> found = new LinkedHashSet<>();
        for (ParallelTrace trace : traces) {
            for (Set<Action> set : trace.getActionSets()) {
                found.addAll(set);
            }
        }
        return found;
    }

    public ObservationToken getToken() {
        return this.token;
    }

    public List<ParallelTrace> getTraces() {
        return this.traces;
    }

    public Set<Fluent> getPropositions() {
        return this.propositions;
    }

    public Set<Action> getActions() {
        return this.actions;
    }

    public Map<ActionPair, Double> getProbabilities() {
        return this.probabilities;
    }

    /**
     * Looks up the probability that {@code a} and {@code b} were executed in the opposite of their recorded order.
     *
     * @throws MissingProbabilityException if the table has no entry for the pair
     */
    public double probability(Action a, Action b) {
        ActionPair pair = new ActionPair(a, b);
        Double p = this.probabilities.get(pair);
        if (p == null) {
            throw new MissingProbabilityException(pair);
        }
        return p;
    }

    public boolean isEmpty() {
        return this.traces.isEmpty();
    }

    public int size() {
        return this.traces.size();
    }
}
