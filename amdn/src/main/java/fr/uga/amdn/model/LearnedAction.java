package fr.uga.amdn.model;

import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.Fluent;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * An action of a learned model with its preconditions, add effects and delete effects.
 */
public final class LearnedAction implements Comparable<LearnedAction> {

    private final Action action;
    private final Set<Fluent> precond;
    private final Set<Fluent> add;
    private final Set<Fluent> delete;

    public LearnedAction(Action action, Collection<Fluent> precond, Collection<Fluent> add,
                         Collection<Fluent> delete) {
        this.action = action;
        this.precond = Collections.unmodifiableSet(new TreeSet<>(precond));
        this.add = Collections.unmodifiableSet(new TreeSet<>(add));
        this.delete = Collections.unmodifiableSet(new TreeSet<>(delete));
    }

    public Action getAction() {
        return this.action;
    }

    public Set<Fluent> getPrecond() {
        return this.precond;
    }

    public Set<Fluent> getAdd() {
        return this.add;
    }

    public Set<Fluent> getDelete() {
        return this.delete;
    }

    @Override
    public int compareTo(LearnedAction other) {
        return this.action.compareTo(other.action);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LearnedAction)) {
            return false;
        }
        LearnedAction other = (LearnedAction) o;
        return this.action.equals(other.action) && this.precond.equals(other.precond)
            && this.add.equals(other.add) && this.delete.equals(other.delete);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.action, this.precond, this.add, this.delete);
    }

    @Override
    public String toString() {
        return this.action.toString();
    }
}
