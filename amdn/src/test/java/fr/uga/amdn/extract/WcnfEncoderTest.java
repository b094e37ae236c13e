package fr.uga.amdn.extract;

import fr.uga.amdn.Fixtures;
import fr.uga.amdn.cnf.WeightedClause;
import fr.uga.amdn.cnf.WeightedCnf;
import fr.uga.amdn.formula.ConstraintSet;
import fr.uga.amdn.formula.FormulaArena;
import fr.uga.amdn.observation.ObservationLists;
import org.junit.jupiter.api.Test;

import java.util.List;

import static fr.uga.amdn.Fixtures.A;
import static fr.uga.amdn.Fixtures.B;
import static fr.uga.amdn.Fixtures.P;
import static fr.uga.amdn.Fixtures.Q;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WcnfEncoderTest {

    private final ObservationLists observations = Fixtures.sequential(0.3);
    private final FormulaArena arena = new FormulaArena();
    private final LiteralFactory literals = new LiteralFactory(this.arena, this.observations.getPropositions(),
        this.observations.getActions());
    private final WcnfEncoder encoder = new WcnfEncoder(this.literals, 1000.0);

    @Test
    void decisionLiteralsComeFirstInGridOrder() {
        EncodedProblem problem = this.encoder.encode(new ConstraintSet());
        DecodeTable table = problem.getDecodeTable();
        assertEquals(12, table.size());
        assertEquals(1, table.variableOf(new DecisionLiteral(P, A, Role.PRECONDITION)));
        assertEquals(2, table.variableOf(new DecisionLiteral(P, A, Role.ADD)));
        assertEquals(3, table.variableOf(new DecisionLiteral(P, A, Role.DELETE)));
        assertEquals(4, table.variableOf(new DecisionLiteral(Q, A, Role.PRECONDITION)));
        assertEquals(7, table.variableOf(new DecisionLiteral(P, B, Role.PRECONDITION)));
        assertEquals(12, table.variableOf(new DecisionLiteral(Q, B, Role.DELETE)));
        assertEquals("p is deleted by b", table.names().get(9));
        assertEquals(12, problem.getCnf().getVariableCount());
    }

    @Test
    void encodesClausesDirectlyAndOtherFormulasThroughTheirRoot() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.addSoft(this.arena.or(this.literals.add(P, A)), 0.5);
        constraints.addSoft(this.arena.and(this.literals.pre(P, A), this.literals.pre(Q, A)), 0.25);
        constraints.addHard(this.arena.implies(this.literals.add(P, A), this.arena.not(this.literals.pre(P, A))));

        EncodedProblem problem = this.encoder.encode(constraints);
        WeightedCnf cnf = problem.getCnf();
        List<WeightedClause> clauses = cnf.getClauses();

        assertEquals(13, cnf.getVariableCount());
        assertEquals(2, cnf.countSoft());
        assertEquals(4, cnf.countHard());
        assertEquals(751, cnf.getHardWeight());

        assertEquals(500, clauses.get(0).getWeight());
        assertArrayEquals(new int[]{2}, clauses.get(0).getLiterals());
        assertEquals(250, clauses.get(1).getWeight());
        assertArrayEquals(new int[]{13}, clauses.get(1).getLiterals());

        assertArrayEquals(new int[]{-13, 1}, clauses.get(2).getLiterals());
        assertArrayEquals(new int[]{-13, 4}, clauses.get(3).getLiterals());
        assertArrayEquals(new int[]{-1, -4, 13}, clauses.get(4).getLiterals());
        assertArrayEquals(new int[]{-2, -1}, clauses.get(5).getLiterals());
        assertTrue(clauses.get(5).isHard());
    }

    @Test
    void auxiliaryVariablesAreNotDecoded() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.addSoft(this.arena.and(this.literals.pre(P, B), this.literals.delete(P, B)), 0.4);
        DecodeTable table = this.encoder.encode(constraints).getDecodeTable();
        assertNull(table.literalOf(13));
        assertEquals(new DecisionLiteral(P, B, Role.DELETE), table.literalOf(9));
    }

    @Test
    void hardFormulasOutsideClausalFormAreAsserted() {
        ConstraintSet constraints = new ConstraintSet();
        int either = this.arena.or(this.arena.and(this.literals.pre(P, A), this.literals.add(Q, A)),
            this.literals.delete(Q, B));
        constraints.addHard(either);
        WeightedCnf cnf = this.encoder.encode(constraints).getCnf();

        // one definition for the conjunction, one for the disjunction, then the root unit
        assertEquals(14, cnf.getVariableCount());
        assertEquals(0, cnf.countSoft());
        assertEquals(1, cnf.getHardWeight());
        List<WeightedClause> clauses = cnf.getClauses();
        assertArrayEquals(new int[]{14}, clauses.get(clauses.size() - 1).getLiterals());
    }

    @Test
    void scaledWeightsNeverDropToZero() {
        assertEquals(1, WcnfEncoder.scale(0.0001, 1000.0));
        assertEquals(300, WcnfEncoder.scale(0.3, 1000.0));
        assertEquals(667, WcnfEncoder.scale(2.0 / 3.0, 1000.0));
    }

    @Test
    void smallWeightsKeepTheirRatios() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.addSoft(this.arena.or(this.literals.pre(P, A)), 0.0002);
        constraints.addSoft(this.arena.or(this.literals.pre(Q, A)), 0.0008);
        constraints.addSoft(this.arena.or(this.literals.pre(P, B)), 0.0024);
        List<WeightedClause> clauses = this.encoder.encode(constraints).getCnf().getClauses();

        long smallest = clauses.get(0).getWeight();
        assertTrue(smallest >= WcnfEncoder.MIN_SCALED_WEIGHT);
        assertEquals(4 * smallest, clauses.get(1).getWeight());
        assertEquals(12 * smallest, clauses.get(2).getWeight());
    }

    @Test
    void configuredScaleIsKeptWhenLargeEnough() {
        assertEquals(1000.0, this.encoder.scaleFactor(List.of(0.3, 0.7)));
        assertEquals(1000.0, this.encoder.scaleFactor(List.of()));
        assertEquals(500000.0, this.encoder.scaleFactor(List.of(0.0002, 0.5)), 1e-6);
    }

    @Test
    void hardSentinelOutweighsEverySoftClause() {
        ConstraintSet constraints = new ConstraintSet();
        constraints.addSoft(this.arena.or(this.literals.pre(P, A)), 0.9);
        constraints.addSoft(this.arena.or(this.arena.not(this.literals.pre(P, A))), 0.8);
        constraints.addHard(this.arena.or(this.literals.pre(Q, B)));
        WeightedCnf cnf = this.encoder.encode(constraints).getCnf();
        assertEquals(1700, cnf.getSoftWeightSum());
        assertEquals(1701, cnf.getHardWeight());
        for (WeightedClause clause : cnf.getClauses()) {
            if (clause.isHard()) {
                assertEquals(cnf.getHardWeight(), clause.getWeight());
            } else {
                assertFalse(clause.getWeight() >= cnf.getHardWeight());
            }
        }
    }

    @Test
    void rejectsNonPositiveScale() {
        assertThrows(IllegalArgumentException.class, () -> new WcnfEncoder(this.literals, 0.0));
    }
}
