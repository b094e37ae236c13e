package fr.uga.amdn.extract;

import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.Fluent;

import java.util.Objects;

/**
 * One unknown of the model: whether {@code fluent} stands in relation {@code role} with {@code action}.
 */
public final class DecisionLiteral {

    private final Fluent fluent;
    private final Action action;
    private final Role role;

    public DecisionLiteral(Fluent fluent, Action action, Role role) {
        this.fluent = fluent;
        this.action = action;
        this.role = role;
    }

    public Fluent getFluent() {
        return this.fluent;
    }

    public Action getAction() {
        return this.action;
    }

    public Role getRole() {
        return this.role;
    }

    // e.g. "on a b is added by stack a b"
    public String name() {
        return this.fluent.details() + " " + this.role.getPhrase() + " " + this.action.details();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DecisionLiteral)) {
            return false;
        }
        DecisionLiteral other = (DecisionLiteral) o;
        return this.fluent.equals(other.fluent) && this.action.equals(other.action) && this.role == other.role;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.fluent, this.action, this.role);
    }

    @Override
    public String toString() {
        return name();
    }
}
