package fr.uga.amdn.solver;

import fr.uga.amdn.ExtractionException;

/**
 * Raised when the hard clauses cannot all be satisfied, so no model is consistent with them.
 */
public class NoFeasibleModelException extends ExtractionException {

    private static final long serialVersionUID = 1L;

    public NoFeasibleModelException(String message) {
        super(message);
    }

    public NoFeasibleModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
