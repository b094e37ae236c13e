package fr.uga.amdn.observation;

import fr.uga.amdn.ExtractionException;
import fr.uga.amdn.trace.ActionPair;

/**
 * Raised when the disorder probability of an encountered action pair was never supplied.
 */
public class MissingProbabilityException extends ExtractionException {

    private static final long serialVersionUID = 1L;

    private final transient ActionPair pair;

    public MissingProbabilityException(ActionPair pair) {
        super("No disorder probability for the action pair " + pair);
        this.pair = pair;
    }

    public ActionPair getPair() {
        return this.pair;
    }
}
