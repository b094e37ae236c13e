package fr.uga.amdn.solver;

import fr.uga.amdn.ExtractionException;

/**
 * Raised when the solver did not converge to an optimal assignment within its time limit.
 */
public class SolverTimeoutException extends ExtractionException {

    private static final long serialVersionUID = 1L;

    public SolverTimeoutException(String message) {
        super(message);
    }

    public SolverTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
