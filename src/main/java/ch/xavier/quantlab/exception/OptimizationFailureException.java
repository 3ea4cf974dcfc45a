package ch.xavier.quantlab.exception;

import lombok.Getter;

/**
 * Raised when the portfolio solver does not converge. {@link #getSolverMessage()} holds the solver's own diagnostic.
 */
@Getter
public class OptimizationFailureException extends QuantLabException {

    private final String solverMessage;

    public OptimizationFailureException(String solverMessage, Throwable cause) {
        super("Optimization failed: " + solverMessage, cause);
        this.solverMessage = solverMessage;
    }

    public OptimizationFailureException(String solverMessage) {
        super("Optimization failed: " + solverMessage);
        this.solverMessage = solverMessage;
    }
}
