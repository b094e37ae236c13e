package fr.uga.amdn.extract;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Maps the DIMACS variables of an encoded problem back to the decision literals they stand for. Auxiliary
 * variables have no entry.
 */
public final class DecodeTable {

    private final Map<Integer, DecisionLiteral> literals;
    private final Map<DecisionLiteral, Integer> variables;

    DecodeTable(Map<Integer, DecisionLiteral> literals) {
        this.literals = Collections.unmodifiableMap(new TreeMap<>(literals));
        this.variables = new HashMap<>();
        for (Map.Entry<Integer, DecisionLiteral> entry : this.literals.entrySet()) {
            this.variables.put(entry.getValue(), entry.getKey());
        }
    }

    /**
     * @return the decision literal of a variable, or null for an auxiliary variable
     */
    public DecisionLiteral literalOf(int variable) {
        return this.literals.get(variable);
    }

    public int variableOf(DecisionLiteral literal) {
        Integer variable = this.variables.get(literal);
        if (variable == null) {
            throw new IllegalArgumentException("No variable for " + literal);
        }
        return variable;
    }

    public Map<Integer, DecisionLiteral> asMap() {
        return this.literals;
    }

    // Variable names, in variable order, for DIMACS comments
    public Map<Integer, String> names() {
        Map<Integer, String> names = new LinkedHashMap<>();
        for (Map.Entry<Integer, DecisionLiteral> entry : this.literals.entrySet()) {
            names.put(entry.getKey(), entry.getValue().name());
        }
        return names;
    }

    public int size() {
        return this.literals.size();
    }
}
