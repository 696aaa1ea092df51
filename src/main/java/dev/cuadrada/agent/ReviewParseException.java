package dev.cuadrada.agent;

/** The backend answer does not carry a verdict that can be classified without guessing. */
public class ReviewParseException extends RuntimeException {
    public ReviewParseException(String message) {
        super(message);
    }
}
