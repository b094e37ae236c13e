package fr.uga.amdn.trace;

/**
 * An unordered pair of two distinct actions, used as the key of the disorder probability table.
 */
public final class ActionPair {

    private final Action first;
    private final Action second;

    public ActionPair(Action a, Action b) {
        if (a.equals(b)) {
            throw new IllegalArgumentException("An action pair needs two distinct actions, got " + a + " twice");
        }
        // Canonical order so that {a, b} and {b, a} print the same way
        if (a.compareTo(b) <= 0) {
            this.first = a;
            this.second = b;
        } else {
            this.first = b;
            this.second = a;
        }
    }

    public Action getFirst() {
        return this.first;
    }

    public Action getSecond() {
        return this.second;
    }

    public boolean contains(Action action) {
        return this.first.equals(action) || this.second.equals(action);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActionPair)) {
            return false;
        }
        ActionPair other = (ActionPair) o;
        return this.first.equals(other.first) && this.second.equals(other.second);
    }

    @Override
    public int hashCode() {
        return 31 * this.first.hashCode() + this.second.hashCode();
    }

    @Override
    public String toString() {
        return "{" + this.first + ", " + this.second + "}";
    }
}
