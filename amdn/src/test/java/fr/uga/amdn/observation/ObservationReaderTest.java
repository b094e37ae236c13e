package fr.uga.amdn.observation;

import fr.uga.amdn.Fixtures;
import fr.uga.amdn.trace.State;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObservationReaderTest {

    private final ObservationReader reader = new ObservationReader();

    @Test
    void readsTracesAndProbabilities() throws IOException {
        ObservationLists observations = this.reader.read(Fixtures.OBSERVATIONS_JSON);
        assertEquals(ObservationToken.NOISY_PARTIAL_DISORDERED_PARALLEL, observations.getToken());
        assertEquals(1, observations.size());
        assertEquals(Fixtures.sequentialTrace().getStates(), observations.getTraces().get(0).getStates());
        assertTrue(observations.getActions().contains(Fixtures.A));
        assertEquals(0.3, observations.probability(Fixtures.A, Fixtures.B));
    }

    @Test
    void unknownTokenIsAnInputError() {
        assertThrows(IOException.class, () -> this.reader.read("{\"token\": \"FULL\", \"traces\": []}"));
        assertThrows(IOException.class, () -> this.reader.read("{\"traces\": []}"));
    }

    @Test
    void traceWithMissingStateIsAnInputError() {
        String json = "{\"token\": \"NOISY_PARTIAL_DISORDERED_PARALLEL\","
            + " \"traces\": [{\"actionSets\": [[\"a\"]], \"states\": [{\"(p)\": true}]}]}";
        assertThrows(IOException.class, () -> this.reader.read(json));
    }

    @Test
    void probabilityMustBeANumber() {
        for (String p : new String[]{"null", "\"high\"", "true"}) {
            String json = Fixtures.OBSERVATIONS_JSON.replace("\"p\": 0.3", "\"p\": " + p);
            IOException e = assertThrows(IOException.class, () -> this.reader.read(json), p);
            assertTrue(e.getMessage().contains("{a, b}"), e.getMessage());
        }
    }

    @Test
    void nullFluentIsUnobserved() throws IOException {
        String json = Fixtures.OBSERVATIONS_JSON.replace("{\"(p)\": true, \"(q)\": false}",
            "{\"(p)\": true, \"(q)\": null}");
        State first = this.reader.read(json).getTraces().get(0).getStates().get(0);
        assertFalse(first.isObserved(Fixtures.Q));
        assertFalse(first.isObservedFalse(Fixtures.Q));
        assertTrue(first.holds(Fixtures.P));
    }

    @Test
    void nonBooleanFluentValueIsAnInputError() {
        for (String value : new String[]{"0", "\"false\"", "[]"}) {
            String json = Fixtures.OBSERVATIONS_JSON.replace("{\"(p)\": true, \"(q)\": false}",
                "{\"(p)\": true, \"(q)\": " + value + "}");
            assertThrows(IOException.class, () -> this.reader.read(json), value);
        }
    }
}
