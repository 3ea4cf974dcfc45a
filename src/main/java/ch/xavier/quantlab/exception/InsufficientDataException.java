package ch.xavier.quantlab.exception;

import lombok.Getter;

/**
 * Raised when a series is shorter than the minimum number of observations a computation needs.
 */
@Getter
public class InsufficientDataException extends QuantLabException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String what, int required, int actual) {
        super(String.format("%s needs at least %d observation(s) but got %d", what, required, actual));
        this.required = required;
        this.actual = actual;
    }
}
