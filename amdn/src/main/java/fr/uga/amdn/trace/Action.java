package fr.uga.amdn.trace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A grounded action observed in a trace. Two actions with the same details are the same action.
 */
public final class Action implements Comparable<Action> {

    private final String name;
    private final List<String> objects;

    public Action(String name, List<String> objects) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("An action needs a name");
        }
        this.name = name;
        this.objects = Collections.unmodifiableList(new ArrayList<>(objects));
    }

    public Action(String name, String... objects) {
        this(name, Arrays.asList(objects));
    }

    /**
     * Parses the form produced by {@link #details()}, e.g. {@code stack a b}.
     */
    public static Action parse(String text) {
        String body = text.trim();
        if (body.startsWith("(") && body.endsWith(")")) {
            body = body.substring(1, body.length() - 1).trim();
        }
        String[] tokens = body.split("\\s+");
        return new Action(tokens[0], Arrays.asList(tokens).subList(1, tokens.length));
    }

    public String getName() {
        return this.name;
    }

    public List<String> getObjects() {
        return this.objects;
    }

    public String details() {
        if (this.objects.isEmpty()) {
            return this.name;
        }
        return this.name + " " + String.join(" ", this.objects);
    }

    @Override
    public int compareTo(Action other) {
        return this.details().compareTo(other.details());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Action)) {
            return false;
        }
        Action other = (Action) o;
        return this.name.equals(other.name) && this.objects.equals(other.objects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.objects);
    }

    @Override
    public String toString() {
        return details();
    }
}
