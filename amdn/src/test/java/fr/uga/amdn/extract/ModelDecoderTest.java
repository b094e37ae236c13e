package fr.uga.amdn.extract;

import fr.uga.amdn.Fixtures;
import fr.uga.amdn.formula.ConstraintSet;
import fr.uga.amdn.formula.FormulaArena;
import fr.uga.amdn.model.LearnedAction;
import fr.uga.amdn.model.Model;
import fr.uga.amdn.observation.ObservationLists;
import fr.uga.amdn.solver.Assignment;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;

import static fr.uga.amdn.Fixtures.A;
import static fr.uga.amdn.Fixtures.B;
import static fr.uga.amdn.Fixtures.P;
import static fr.uga.amdn.Fixtures.Q;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModelDecoderTest {

    private final ObservationLists observations = Fixtures.sequential(0.3);

    private DecodeTable table() {
        LiteralFactory literals = new LiteralFactory(new FormulaArena(), this.observations.getPropositions(),
            this.observations.getActions());
        return new WcnfEncoder(literals, 1000.0).encode(new ConstraintSet()).getDecodeTable();
    }

    @Test
    void readsRolesOffTrueDecisionVariables() {
        DecodeTable table = table();
        Map<Integer, Boolean> truth = new HashMap<>();
        truth.put(table.variableOf(new DecisionLiteral(P, A, Role.PRECONDITION)), true);
        truth.put(table.variableOf(new DecisionLiteral(Q, A, Role.ADD)), true);
        truth.put(table.variableOf(new DecisionLiteral(P, B, Role.DELETE)), true);
        truth.put(table.variableOf(new DecisionLiteral(Q, B, Role.PRECONDITION)), false);
        Assignment assignment = Assignment.fromMap(truth, 14, 0);

        Model model = new ModelDecoder().decode(assignment, table, this.observations);

        assertEquals(Set.of(P, Q), model.getFluents());
        Iterator<LearnedAction> actions = model.getActions().iterator();
        LearnedAction a = actions.next();
        assertEquals(A, a.getAction());
        assertEquals(Set.of(P), a.getPrecond());
        assertEquals(Set.of(Q), a.getAdd());
        assertTrue(a.getDelete().isEmpty());
        LearnedAction b = actions.next();
        assertEquals(B, b.getAction());
        assertTrue(b.getPrecond().isEmpty());
        assertTrue(b.getAdd().isEmpty());
        assertEquals(Set.of(P), b.getDelete());
    }

    @Test
    void variablesMissingFromTheAssignmentAreFalse() {
        Model model = new ModelDecoder().decode(Assignment.fromModel(new int[0], 0, 0), table(), this.observations);
        assertEquals(2, model.getActions().size());
        for (LearnedAction action : model.getActions()) {
            assertTrue(action.getPrecond().isEmpty());
            assertTrue(action.getAdd().isEmpty());
            assertTrue(action.getDelete().isEmpty());
        }
    }
}
