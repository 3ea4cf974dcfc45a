package ch.xavier.quantlab.exception;

public class InvalidParameterException extends QuantLabException {

    public InvalidParameterException(String message) {
        super(message);
    }
}
