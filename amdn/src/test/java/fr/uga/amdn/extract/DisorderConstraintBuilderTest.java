package fr.uga.amdn.extract;

import fr.uga.amdn.Fixtures;
import fr.uga.amdn.formula.ConstraintSet;
import fr.uga.amdn.formula.FormulaArena;
import fr.uga.amdn.observation.MissingProbabilityException;
import fr.uga.amdn.observation.ObservationLists;
import fr.uga.amdn.observation.ObservationToken;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.ActionPair;
import fr.uga.amdn.trace.Fluent;
import fr.uga.amdn.trace.ParallelTrace;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static fr.uga.amdn.Fixtures.A;
import static fr.uga.amdn.Fixtures.B;
import static fr.uga.amdn.Fixtures.P;
import static fr.uga.amdn.Fixtures.Q;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DisorderConstraintBuilderTest {

    private static LiteralFactory literals(ObservationLists observations) {
        return new LiteralFactory(new FormulaArena(), observations.getPropositions(), observations.getActions());
    }

    @Test
    void twoHypothesesPerPropositionWeightedByDisorderProbability() {
        ObservationLists observations = Fixtures.observations(
            Arrays.asList(Fixtures.sequentialTrace(), Fixtures.sequentialTrace()), 0.3);
        LiteralFactory literals = literals(observations);
        DisorderConstraintBuilder builder = new DisorderConstraintBuilder(literals);
        ConstraintSet constraints = builder.build(observations);

        assertEquals(4, constraints.size());
        for (Fluent r : Arrays.asList(P, Q)) {
            int ordered = builder.orderedHypothesis(r, A, B);
            int disordered = builder.orderedHypothesis(r, B, A);
            assertNotEquals(ordered, disordered);
            assertEquals(0.7, constraints.weightOf(ordered).getValue(), 1e-12);
            assertEquals(0.3, constraints.weightOf(disordered).getValue(), 1e-12);
        }
    }

    @Test
    void hypothesisWeightsSumToOne() {
        Action c = new Action("c");
        Map<ActionPair, Double> probabilities = new LinkedHashMap<>();
        probabilities.put(new ActionPair(A, B), 0.15);
        probabilities.put(new ActionPair(A, c), 0.4);
        probabilities.put(new ActionPair(B, c), 0.85);
        ParallelTrace trace = new ParallelTrace(
            Arrays.asList(Fixtures.set(A), Fixtures.set(B, c)),
            Arrays.asList(Fixtures.state(P, true), Fixtures.state(Q, true), Fixtures.state(P, false)));
        ObservationLists observations = new ObservationLists(ObservationToken.NOISY_PARTIAL_DISORDERED_PARALLEL,
            Collections.singletonList(trace), Arrays.asList(P, Q), Arrays.asList(A, B, c), probabilities);
        DisorderConstraintBuilder builder = new DisorderConstraintBuilder(literals(observations));
        ConstraintSet constraints = builder.build(observations);

        assertEquals(8, constraints.size());
        for (Action y : Arrays.asList(B, c)) {
            for (Fluent r : Arrays.asList(P, Q)) {
                double sum = constraints.weightOf(builder.orderedHypothesis(r, A, y)).getValue()
                    + constraints.weightOf(builder.orderedHypothesis(r, y, A)).getValue();
                assertEquals(1.0, sum, 1e-12);
            }
        }
    }

    @Test
    void certainOrderDropsTheZeroWeightHypothesis() {
        ObservationLists observations = Fixtures.sequential(0.0);
        DisorderConstraintBuilder builder = new DisorderConstraintBuilder(literals(observations));
        ConstraintSet constraints = builder.build(observations);
        assertEquals(2, constraints.size());
        assertTrue(constraints.contains(builder.orderedHypothesis(P, A, B)));
    }

    @Test
    void everyTraceIsProcessed() {
        Action c = new Action("c");
        ParallelTrace second = new ParallelTrace(Arrays.asList(Fixtures.set(B), Fixtures.set(c)),
            Arrays.asList(Fixtures.state(P, true), Fixtures.state(P, true), Fixtures.state(P, true)));
        Map<ActionPair, Double> probabilities = new LinkedHashMap<>();
        probabilities.put(new ActionPair(A, B), 0.5);
        probabilities.put(new ActionPair(B, c), 0.5);
        ObservationLists observations = new ObservationLists(ObservationToken.NOISY_PARTIAL_DISORDERED_PARALLEL,
            Arrays.asList(Fixtures.sequentialTrace(), second), Arrays.asList(P, Q), Arrays.asList(A, B, c),
            probabilities);
        DisorderConstraintBuilder builder = new DisorderConstraintBuilder(literals(observations));
        assertTrue(builder.build(observations).contains(builder.orderedHypothesis(Q, B, c)));
    }

    @Test
    void missingProbabilityFailsLoudly() {
        Action c = new Action("c");
        ParallelTrace trace = new ParallelTrace(Arrays.asList(Fixtures.set(A), Fixtures.set(c)),
            Arrays.asList(Fixtures.state(P, true), Fixtures.state(P, true), Fixtures.state(P, true)));
        ObservationLists observations = new ObservationLists(ObservationToken.NOISY_PARTIAL_DISORDERED_PARALLEL,
            Collections.singletonList(trace), Arrays.asList(P), Arrays.asList(A, c), Collections.emptyMap());
        DisorderConstraintBuilder builder = new DisorderConstraintBuilder(literals(observations));
        MissingProbabilityException e = assertThrows(MissingProbabilityException.class,
            () -> builder.build(observations));
        assertEquals(new ActionPair(A, c), e.getPair());
    }
}
