package fr.uga.amdn.observation;

import fr.uga.amdn.Fixtures;
import fr.uga.amdn.trace.Action;
import fr.uga.amdn.trace.ActionPair;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ObservationListsTest {

    @Test
    void propositionsAndActionsDefaultToWhatTheTracesMention() {
        ObservationLists observations = new ObservationLists(ObservationToken.NOISY_PARTIAL_DISORDERED_PARALLEL,
            Collections.singletonList(Fixtures.sequentialTrace()),
            Collections.singletonMap(new ActionPair(Fixtures.A, Fixtures.B), 0.5));
        assertEquals(2, observations.getPropositions().size());
        assertEquals(2, observations.getActions().size());
        assertEquals(0.5, observations.probability(Fixtures.B, Fixtures.A));
    }

    @Test
    void missingProbabilityNamesThePair() {
        ObservationLists observations = Fixtures.sequential(0.3);
        MissingProbabilityException e = assertThrows(MissingProbabilityException.class,
            () -> observations.probability(Fixtures.A, new Action("c")));
        assertEquals(new ActionPair(Fixtures.A, new Action("c")), e.getPair());
    }

    @Test
    void probabilitiesOutsideTheUnitIntervalAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> Fixtures.sequential(1.5));
        assertThrows(IllegalArgumentException.class, () -> Fixtures.sequential(-0.1));
    }
}
