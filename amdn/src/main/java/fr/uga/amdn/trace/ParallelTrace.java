package fr.uga.amdn.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A trace whose steps are sets of actions of unknown relative order.
 *
 * <p>State {@code i} is observed right before action set {@code i}, and state {@code i + 1} right after it, so a
 * trace always holds one more state than action sets.</p>
 */
public final class ParallelTrace {

    private final List<Set<Action>> actionSets;
    private final List<State> states;

    public ParallelTrace(List<? extends Set<Action>> actionSets, List<State> states) {
        if (states.size() != actionSets.size() + 1) {
            throw new IllegalArgumentException("A trace with " + actionSets.size()
                + " action sets needs " + (actionSets.size() + 1) + " states, got " + states.size());
        }
        List<Set<Action>> sets = new ArrayList<>();
        for (Set<Action> set : actionSets) {
            sets.add(Collections.unmodifiableSet(new LinkedHashSet<>(set)));
        }
        this.actionSets = Collections.unmodifiableList(sets);
        this.states = Collections.unmodifiableList(new ArrayList<>(states));
    }

    public List<Set<Action>> getActionSets() {
        return this.actionSets;
    }

    public List<State> getStates() {
        return this.states;
    }

    public State stateBefore(int step) {
        return this.states.get(step);
    }

    public State stateAfter(int step) {
        return this.states.get(step + 1);
    }

    public int size() {
        return this.actionSets.size();
    }
}
