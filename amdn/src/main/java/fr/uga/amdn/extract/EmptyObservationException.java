package fr.uga.amdn.extract;

import fr.uga.amdn.ExtractionException;

/**
 * Raised when there is no trace to extract a model from.
 */
public class EmptyObservationException extends ExtractionException {

    private static final long serialVersionUID = 1L;

    public EmptyObservationException() {
        super("The observation collection is empty, nothing to extract from");
    }
}
