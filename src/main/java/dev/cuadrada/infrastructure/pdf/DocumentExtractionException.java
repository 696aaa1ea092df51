package dev.cuadrada.infrastructure.pdf;

/** The uploaded paper could not be read or carries too little text to review. */
public class DocumentExtractionException extends RuntimeException {
    public DocumentExtractionException(String message) {
        super(message);
    }

    public DocumentExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
