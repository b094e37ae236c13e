package fr.uga.amdn.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An observed state. Fluents missing from the mapping were not observed.
 */
public final class State {

    private final Map<Fluent, Boolean> values;

    public State(Map<Fluent, Boolean> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static State empty() {
        return new State(Collections.emptyMap());
    }

    public boolean holds(Fluent fluent) {
        return Boolean.TRUE.equals(this.values.get(fluent));
    }

    public boolean isObservedFalse(Fluent fluent) {
        return Boolean.FALSE.equals(this.values.get(fluent));
    }

    public boolean isObserved(Fluent fluent) {
        return this.values.containsKey(fluent);
    }

    public List<Fluent> trueFluents() {
        return this.values.entrySet().stream()
            .filter(Map.Entry::getValue)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }

    public Map<Fluent, Boolean> getValues() {
        return this.values;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof State && this.values.equals(((State) o).values);
    }

    @Override
    public int hashCode() {
        return this.values.hashCode();
    }

    @Override
    public String toString() {
        return this.values.toString();
    }
}
