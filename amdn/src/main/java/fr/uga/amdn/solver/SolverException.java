package fr.uga.amdn.solver;

import fr.uga.amdn.ExtractionException;

/**
 * Raised when the solver fails for any other reason.
 */
public class SolverException extends ExtractionException {

    private static final long serialVersionUID = 1L;

    public SolverException(String message) {
        super(message);
    }

    public SolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
