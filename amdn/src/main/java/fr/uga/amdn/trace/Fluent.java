package fr.uga.amdn.trace;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A ground proposition of the planning problem, e.g. {@code (on a b)}.
 */
public final class Fluent implements Comparable<Fluent> {

    private final String name;
    private final List<String> objects;

    public Fluent(String name, List<String> objects) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("A fluent needs a name");
        }
        this.name = name;
        this.objects = Collections.unmodifiableList(new ArrayList<>(objects));
    }

    public Fluent(String name, String... objects) {
        this(name, Arrays.asList(objects));
    }

    /**
     * Parses the textual form produced by {@link #toString()}. The surrounding parentheses are optional.
     */
    public static Fluent parse(String text) {
        String body = text.trim();
        if (body.startsWith("(") && body.endsWith(")")) {
            body = body.substring(1, body.length() - 1).trim();
        }
        String[] tokens = body.split("\\s+");
        return new Fluent(tokens[0], Arrays.asList(tokens).subList(1, tokens.length));
    }

    public String getName() {
        return this.name;
    }

    public List<String> getObjects() {
        return this.objects;
    }

    // The fluent without its parentheses, used to build literal names
    public String details() {
        if (this.objects.isEmpty()) {
            return this.name;
        }
        return this.name + " " + String.join(" ", this.objects);
    }

    @Override
    public int compareTo(Fluent other) {
        return this.toString().compareTo(other.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Fluent)) {
            return false;
        }
        Fluent other = (Fluent) o;
        return this.name.equals(other.name) && this.objects.equals(other.objects);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.name, this.objects);
    }

    @Override
    public String toString() {
        return "(" + details() + ")";
    }
}
