package fr.uga.amdn.extract;

import fr.uga.amdn.formula.FormulaArena;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.Fluent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the decision variables of an extraction run.
 *
 * <p>The whole grid propositions x actions x roles is created up front; asking for a literal outside of it is an
 * error.</p>
 */
public class LiteralFactory {

    private static final Logger LOGGER = LogManager.getLogger(LiteralFactory.class.getName());

    private final FormulaArena arena;
    private final List<DecisionLiteral> grid;
    private final Map<DecisionLiteral, Integer> literalToNode; // From decision literals to arena nodes
    private final Map<Integer, DecisionLiteral> nodeToLiteral; // The reverse

    public LiteralFactory(FormulaArena arena, Collection<Fluent> propositions, Collection<Action> actions) {
        this.arena = arena;
        this.grid = new ArrayList<>();
        this.literalToNode = new HashMap<>();
        this.nodeToLiteral = new HashMap<>();
        for (Action action : actions) {
            for (Fluent fluent : propositions) {
                for (Role role : Role.values()) {
                    DecisionLiteral literal = new DecisionLiteral(fluent, action, role);
                    int node = arena.variable(literal.name());
                    this.grid.add(literal);
                    this.literalToNode.put(literal, node);
                    this.nodeToLiteral.put(node, literal);
                }
            }
        }
        LOGGER.debug("Created {} decision literals for {} propositions and {} actions",
            this.grid.size(), propositions.size(), actions.size());
    }

    public int pre(Fluent fluent, Action action) {
        return literal(fluent, action, Role.PRECONDITION);
    }

    public int add(Fluent fluent, Action action) {
        return literal(fluent, action, Role.ADD);
    }

    public int delete(Fluent fluent, Action action) {
        return literal(fluent, action, Role.DELETE);
    }

    public int literal(Fluent fluent, Action action, Role role) {
        Integer node = this.literalToNode.get(new DecisionLiteral(fluent, action, role));
        if (node == null) {
            throw new IllegalArgumentException("No decision literal for " + fluent + " / " + action
                + ": the proposition or the action is not part of the observations");
        }
        return node;
    }

    /**
     * Wraps a single literal into a one-literal disjunction; any other formula is returned unchanged.
     */
    public int asClause(int node) {
        return this.arena.isLiteral(node) ? this.arena.or(node) : node;
    }

    /**
     * @return the decision literal an arena variable stands for, or null for any other node
     */
    public DecisionLiteral decisionLiteral(int node) {
        return this.nodeToLiteral.get(node);
    }

    public List<DecisionLiteral> getGrid() {
        return Collections.unmodifiableList(this.grid);
    }

    public FormulaArena getArena() {
        return this.arena;
    }
}
