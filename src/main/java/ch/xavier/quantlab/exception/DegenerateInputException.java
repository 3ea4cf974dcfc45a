package ch.xavier.quantlab.exception;

public class DegenerateInputException extends QuantLabException {

    public DegenerateInputException(String message) {
        super(message);
    }
}
