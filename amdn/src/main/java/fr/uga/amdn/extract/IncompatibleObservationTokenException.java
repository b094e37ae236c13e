package fr.uga.amdn.extract;

import fr.uga.amdn.ExtractionException;
import fr.uga.amdn.observation.ObservationToken;

/**
 * Raised when observations were tokenized with a type the extraction technique cannot use.
 */
public class IncompatibleObservationTokenException extends ExtractionException {

    private static final long serialVersionUID = 1L;

    private final ObservationToken token;
    private final String technique;

    public IncompatibleObservationTokenException(ObservationToken token, String technique) {
        super("Observations of type " + token + " are not compatible with the " + technique
            + " extraction technique");
        this.token = token;
        this.technique = technique;
    }

    public ObservationToken getToken() {
        return this.token;
    }

    public String getTechnique() {
        return this.technique;
    }
}
