package fr.uga.amdn;

import fr.uga.amdn.observation.ObservationLists;
import fr.uga.amdn.observation.ObservationToken;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.ActionPair;
import fr.uga.amdn.trace.Fluent;
import fr.uga.amdn.trace.ParallelTrace;
import fr.uga.amdn.trace.State;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A two-proposition, two-action toy domain.
 */
public final class Fixtures {

    public static final Fluent P = new Fluent("p");
    public static final Fluent Q = new Fluent("q");
    public static final Action A = new Action("a");
    public static final Action B = new Action("b");

    private Fixtures() {
    }

    public static State state(Object... fluentsAndValues) {
        Map<Fluent, Boolean> values = new LinkedHashMap<>();
        for (int i = 0; i < fluentsAndValues.length; i += 2) {
            values.put((Fluent) fluentsAndValues[i], (Boolean) fluentsAndValues[i + 1]);
        }
        return new State(values);
    }

    public static Set<Action> set(Action... actions) {
        return new LinkedHashSet<>(Arrays.asList(actions));
    }

    /**
     * a then b: p holds until b runs, q becomes true when a runs.
     */
    public static ParallelTrace sequentialTrace() {
        return new ParallelTrace(Arrays.asList(set(A), set(B)), Arrays.asList(
            state(P, true, Q, false),
            state(P, true, Q, true),
            state(P, false, Q, true)));
    }

    public static ObservationLists observations(List<ParallelTrace> traces, double p) {
        return observations(ObservationToken.NOISY_PARTIAL_DISORDERED_PARALLEL, traces, p);
    }

    public static ObservationLists observations(ObservationToken token, List<ParallelTrace> traces, double p) {
        Map<ActionPair, Double> probabilities = Collections.singletonMap(new ActionPair(A, B), p);
        return new ObservationLists(token, traces, Arrays.asList(P, Q), Arrays.asList(A, B), probabilities);
    }

    public static ObservationLists sequential(double p) {
        return observations(Collections.singletonList(sequentialTrace()), p);
    }

    public static final String OBSERVATIONS_JSON = "{\n"
        + "  \"token\": \"NOISY_PARTIAL_DISORDERED_PARALLEL\",\n"
        + "  \"traces\": [{\n"
        + "    \"actionSets\": [[\"a\"], [\"b\"]],\n"
        + "    \"states\": [{\"(p)\": true, \"(q)\": false}, {\"(p)\": true, \"(q)\": true},"
        + " {\"(p)\": false, \"(q)\": true}]\n"
        + "  }],\n"
        + "  \"probabilities\": [{\"actions\": [\"a\", \"b\"], \"p\": 0.3}]\n"
        + "}\n";
}
