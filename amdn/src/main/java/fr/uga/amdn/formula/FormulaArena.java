package fr.uga.amdn.formula;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Propositional formulas stored as nodes of an arena and referenced by their integer id.
 *
 * <p>Nodes are hash-consed: building a formula that is structurally identical to an existing one returns the
 * existing id, so two formulas are equal exactly when their ids are equal. All methods are thread safe.</p>
 */
public final class FormulaArena {

    public enum Kind {
        VAR,
        NOT,
        AND,
        OR
    }

    private static final int[] NO_CHILDREN = new int[0];

    private final List<Kind> kinds = new ArrayList<>();
    private final List<int[]> children = new ArrayList<>();
    private final List<String> names = new ArrayList<>();
    private final Map<String, Integer> index = new HashMap<>();

    public synchronized int variable(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("A variable needs a name");
        }
        return intern(Kind.VAR, NO_CHILDREN, name);
    }

    public synchronized int not(int child) {
        checkNode(child);
        return intern(Kind.NOT, new int[]{child}, null);
    }

    public synchronized int and(int... operands) {
        return intern(Kind.AND, checkOperands(operands), null);
    }

    public int and(List<Integer> operands) {
        return and(operands.stream().mapToInt(Integer::intValue).toArray());
    }

    public synchronized int or(int... operands) {
        return intern(Kind.OR, checkOperands(operands), null);
    }

    public int or(List<Integer> operands) {
        return or(operands.stream().mapToInt(Integer::intValue).toArray());
    }

    // a => b
    public int implies(int premise, int conclusion) {
        return or(not(premise), conclusion);
    }

    public synchronized Kind kind(int node) {
        checkNode(node);
        return this.kinds.get(node);
    }

    public synchronized int[] children(int node) {
        checkNode(node);
        return this.children.get(node).clone();
    }

    public synchronized String name(int node) {
        checkNode(node);
        return this.names.get(node);
    }

    public synchronized int size() {
        return this.kinds.size();
    }

    /**
     * A variable or the negation of a variable.
     */
    public synchronized boolean isLiteral(int node) {
        checkNode(node);
        Kind kind = this.kinds.get(node);
        return kind == Kind.VAR || (kind == Kind.NOT && this.kinds.get(this.children.get(node)[0]) == Kind.VAR);
    }

    /**
     * A literal or a disjunction of literals.
     */
    public synchronized boolean isClause(int node) {
        if (isLiteral(node)) {
            return true;
        }
        if (this.kinds.get(node) != Kind.OR) {
            return false;
        }
        for (int child : this.children.get(node)) {
            if (!isLiteral(child)) {
                return false;
            }
        }
        return true;
    }

    public synchronized String toString(int node) {
        checkNode(node);
        switch (this.kinds.get(node)) {
            case VAR:
                return this.names.get(node);
            case NOT:
                return "~" + toString(this.children.get(node)[0]);
            case AND:
                return Arrays.stream(this.children.get(node)).mapToObj(this::toString)
                    .collect(Collectors.joining(" & ", "(", ")"));
            default:
                return Arrays.stream(this.children.get(node)).mapToObj(this::toString)
                    .collect(Collectors.joining(" | ", "(", ")"));
        }
    }

    private int intern(Kind kind, int[] operands, String name) {
        String key = kind == Kind.VAR ? "V:" + name : kind.name() + ":" + Arrays.toString(operands);
        Integer existing = this.index.get(key);
        if (existing != null) {
            return existing;
        }
        int id = this.kinds.size();
        this.kinds.add(kind);
        this.children.add(operands);
        this.names.add(name);
        this.index.put(key, id);
        return id;
    }

    private int[] checkOperands(int[] operands) {
        if (operands.length == 0) {
            throw new IllegalArgumentException("A connective needs at least one operand");
        }
        for (int operand : operands) {
            checkNode(operand);
        }
        return operands.clone();
    }

    private void checkNode(int node) {
        if (node < 0 || node >= this.kinds.size()) {
            throw new IllegalArgumentException("Unknown formula node " + node);
        }
    }
}
