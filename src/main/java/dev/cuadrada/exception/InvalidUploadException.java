package dev.cuadrada.exception;

/** Upload rejected before anything was stored (empty file, not a PDF). */
public class InvalidUploadException extends IllegalArgumentException {
    public InvalidUploadException(String message) {
        super(message);
    }
}
