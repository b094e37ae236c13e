package fr.uga.amdn.model;

import fr.uga.amdn.trace.Fluent;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * A learned action model: the fluents of the problem and its actions with their preconditions and effects.
 */
public final class Model {

    private final Set<Fluent> fluents;
    private final Set<LearnedAction> actions;

    public Model(Collection<Fluent> fluents, Collection<LearnedAction> actions) {
        this.fluents = Collections.unmodifiableSet(new TreeSet<>(fluents));
        this.actions = Collections.unmodifiableSet(new TreeSet<>(actions));
    }

    public Set<Fluent> getFluents() {
        return this.fluents;
    }

    public Set<LearnedAction> getActions() {
        return this.actions;
    }

    /**
     * A human readable rendering of the model.
     */
    public String details() {
        String indent = "  ";
        StringBuilder sb = new StringBuilder("Model:\n");
        sb.append(indent).append("Fluents: ")
            .append(this.fluents.stream().map(Fluent::toString).collect(Collectors.joining(", "))).append('\n');
        sb.append(indent).append("Actions:\n");
        for (LearnedAction action : this.actions) {
            sb.append(indent).append(indent).append(action).append(":\n");
            appendFluents(sb, "precond", action.getPrecond());
            appendFluents(sb, "add", action.getAdd());
            appendFluents(sb, "delete", action.getDelete());
        }
        return sb.toString();
    }

    private static void appendFluents(StringBuilder sb, String title, Set<Fluent> fluents) {
        sb.append("      ").append(title).append(":\n");
        for (Fluent fluent : fluents) {
            sb.append("        ").append(fluent).append('\n');
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Model)) {
            return false;
        }
        Model other = (Model) o;
        return this.fluents.equals(other.fluents) && this.actions.equals(other.actions);
    }

    @Override
    public int hashCode() {
        return 31 * this.fluents.hashCode() + this.actions.hashCode();
    }

    @Override
    public String toString() {
        return details();
    }
}
