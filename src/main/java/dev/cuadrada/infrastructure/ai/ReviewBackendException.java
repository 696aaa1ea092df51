package dev.cuadrada.infrastructure.ai;

/** No model of the fallback chain produced a usable answer. */
public class ReviewBackendException extends RuntimeException {
    public ReviewBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
