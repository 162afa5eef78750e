package io.github.rowbase.exception;

/**
 * Base class of all errors raised by the resource engine.
 *
 * <p>Every subclass knows the HTTP status it is reported with, so the query engine can
 * turn a failed request into a structured result without inspecting exception types.</p>
 */
public class RowbaseException extends RuntimeException {

    private final int statusCode;

    public RowbaseException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public RowbaseException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
