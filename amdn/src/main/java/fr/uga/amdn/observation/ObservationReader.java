package fr.uga.amdn.observation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.ActionPair;
import fr.uga.amdn.trace.Fluent;
import fr.uga.amdn.trace.ParallelTrace;
import fr.uga.amdn.trace.State;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads an observation collection from its JSON document:
 *
 * <pre>
 * {"token": "NOISY_PARTIAL_DISORDERED_PARALLEL",
 *  "traces": [{"actionSets": [["stack a b"]], "states": [{"(on a b)": false}, {"(on a b)": true}]}],
 *  "probabilities": [{"actions": ["stack a b", "unstack a b"], "p": 0.3}]}
 * </pre>
 */
public class ObservationReader {

    private static final Logger LOGGER = LogManager.getLogger(ObservationReader.class.getName());

    private final ObjectMapper mapper;

    public ObservationReader() {
        this.mapper = new ObjectMapper();
    }

    public ObservationLists read(Path file) throws IOException {
        LOGGER.debug("Reading observations from {}", file);
        return fromTree(this.mapper.readTree(file.toFile()));
    }

    public ObservationLists read(String json) throws IOException {
        return fromTree(this.mapper.readTree(json));
    }

    private ObservationLists fromTree(JsonNode root) throws IOException {
        JsonNode tokenNode = root.get("token");
        if (tokenNode == null) {
            throw new IOException("Observation document has no \"token\" field");
        }
        ObservationToken token;
        try {
            token = ObservationToken.valueOf(tokenNode.asText());
        } catch (IllegalArgumentException e) {
            throw new IOException("Unknown observation token " + tokenNode.asText(), e);
        }

        List<ParallelTrace> traces = new ArrayList<>();
        for (JsonNode traceNode : root.path("traces")) {
            List<Set<Action>> sets = new ArrayList<>();
            for (JsonNode setNode : traceNode.path("actionSets")) {
                Set<Action> set = new LinkedHashSet<>();
                for (JsonNode actionNode : setNode) {
                    set.add(Action.parse(actionNode.asText()));
                }
                sets.add(set);
            }
            List<State> states = new ArrayList<>();
            for (JsonNode stateNode : traceNode.path("states")) {
                Map<Fluent, Boolean> values = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = stateNode.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    JsonNode value = field.getValue();
                    if (value.isNull()) {
                        // null is an unobserved fluent, not a false one
                        continue;
                    }
                    if (!value.isBoolean()) {
                        throw new IOException("Fluent " + field.getKey() + " of trace #" + traces.size()
                            + " must be true, false or null, got " + value);
                    }
                    values.put(Fluent.parse(field.getKey()), value.booleanValue());
                }
                states.add(new State(values));
            }
            try {
                traces.add(new ParallelTrace(sets, states));
            } catch (IllegalArgumentException e) {
                throw new IOException("Malformed trace #" + traces.size() + ": " + e.getMessage(), e);
            }
        }

        Map<ActionPair, Double> probabilities = new LinkedHashMap<>();
        for (JsonNode entry : root.path("probabilities")) {
            JsonNode pair = entry.path("actions");
            if (pair.size() != 2 || !entry.has("p")) {
                throw new IOException("A probability entry needs two actions and a \"p\" value: " + entry);
            }
            ActionPair actions = new ActionPair(Action.parse(pair.get(0).asText()), Action.parse(pair.get(1).asText()));
            JsonNode p = entry.get("p");
            if (!p.isNumber()) {
                throw new IOException("The disorder probability of " + actions + " must be a number, got " + p);
            }
            probabilities.put(actions, p.doubleValue());
        }
        LOGGER.debug("Read {} traces and {} action pair probabilities", traces.size(), probabilities.size());
        return new ObservationLists(token, traces, probabilities);
    }
}
