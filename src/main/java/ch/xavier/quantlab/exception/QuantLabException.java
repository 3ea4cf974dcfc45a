package ch.xavier.quantlab.exception;

/**
 * Base type of every failure raised by the backtesting and allocation engines.
 */
public abstract class QuantLabException extends RuntimeException {

    protected QuantLabException(String message) {
        super(message);
    }

    protected QuantLabException(String message, Throwable cause) {
        super(message, cause);
    }
}
