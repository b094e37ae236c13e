package fr.uga.amdn.cnf;

import fr.uga.amdn.formula.FormulaArena;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Converts arena formulas into clauses over DIMACS variables.
 *
 * <p>Every compound sub-formula gets an auxiliary variable {@code t} and the clauses of {@code t <=> sub-formula}.
 * Structurally identical sub-formulas share their auxiliary variable, since the arena gives them the same id.
 * Variables of the arena must be numbered by the caller before conversion; auxiliary variables are numbered after
 * them.</p>
 */
public class TseitinTransformer {

    private final FormulaArena arena;
    private final Map<Integer, Integer> variables;     // arena VAR node -> DIMACS variable
    private final Map<Integer, Integer> definitions;   // compound arena node -> auxiliary variable
    private final List<int[]> pending;
    private final int firstAuxiliary;
    private int nextVariable;

    public TseitinTransformer(FormulaArena arena, Map<Integer, Integer> variables) {
        this.arena = arena;
        this.variables = new HashMap<>(variables);
        this.definitions = new HashMap<>();
        this.pending = new ArrayList<>();
        int max = 0;
        for (int number : variables.values()) {
            max = Math.max(max, number);
        }
        this.firstAuxiliary = max + 1;
        this.nextVariable = max + 1;
    }

    /**
     * Returns the DIMACS literal equivalent to {@code node}, introducing auxiliary variables and queueing their
     * defining clauses as needed.
     */
    public int define(int node) {
        switch (this.arena.kind(node)) {
            case VAR:
                return variableOf(node);
            case NOT:
                return -define(this.arena.children(node)[0]);
            default:
                break;
        }
        Integer known = this.definitions.get(node);
        if (known != null) {
            return known;
        }
        int[] children = this.arena.children(node);
        int[] operands = new int[children.length];
        for (int i = 0; i < children.length; i++) {
            operands[i] = define(children[i]);
        }
        int aux = this.nextVariable++;
        if (this.arena.kind(node) == FormulaArena.Kind.AND) {
            // t => c_i, and (c_1 & ... & c_n) => t
            int[] back = new int[operands.length + 1];
            for (int i = 0; i < operands.length; i++) {
                this.pending.add(new int[]{-aux, operands[i]});
                back[i] = -operands[i];
            }
            back[operands.length] = aux;
            this.pending.add(back);
        } else {
            // c_i => t, and t => (c_1 | ... | c_n)
            int[] forth = new int[operands.length + 1];
            for (int i = 0; i < operands.length; i++) {
                this.pending.add(new int[]{aux, -operands[i]});
                forth[i] = operands[i];
            }
            forth[operands.length] = -aux;
            this.pending.add(forth);
        }
        this.definitions.put(node, aux);
        return aux;
    }

    /**
     * Clauses of a formula in conjunctive normal form without introducing any variable, or null when the formula
     * is not a clause or a conjunction of clauses.
     */
    public List<int[]> directClauses(int node) {
        if (this.arena.isClause(node)) {
            return Collections.singletonList(clauseOf(node));
        }
        if (this.arena.kind(node) != FormulaArena.Kind.AND) {
            return null;
        }
        List<int[]> clauses = new ArrayList<>();
        for (int child : this.arena.children(node)) {
            if (!this.arena.isClause(child)) {
                return null;
            }
            clauses.add(clauseOf(child));
        }
        return clauses;
    }

    /**
     * The literals of a clause-shaped formula.
     */
    public int[] clauseOf(int node) {
        if (!this.arena.isClause(node)) {
            throw new IllegalArgumentException("Not a clause: " + this.arena.toString(node));
        }
        if (this.arena.isLiteral(node)) {
            return new int[]{define(node)};
        }
        Set<Integer> literals = new LinkedHashSet<>();
        for (int child : this.arena.children(node)) {
            literals.add(define(child));
        }
        return literals.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Returns the defining clauses produced since the previous call.
     */
    public List<int[]> drainDefinitions() {
        List<int[]> drained = new ArrayList<>(this.pending);
        this.pending.clear();
        return drained;
    }

    public boolean isAuxiliary(int variable) {
        return variable >= this.firstAuxiliary && variable < this.nextVariable;
    }

    public int getVariableCount() {
        return this.nextVariable - 1;
    }

    public int getAuxiliaryCount() {
        return this.nextVariable - this.firstAuxiliary;
    }

    private int variableOf(int node) {
        Integer number = this.variables.get(node);
        if (number == null) {
            throw new IllegalArgumentException("Variable " + this.arena.name(node) + " has no DIMACS number");
        }
        return number;
    }
}
