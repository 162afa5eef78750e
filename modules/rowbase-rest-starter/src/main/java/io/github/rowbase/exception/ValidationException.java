package io.github.rowbase.exception;

/**
 * Thrown when request data violates the data model (ids, required values, sizes).
 */
public class ValidationException extends RowbaseException {

    public ValidationException(String message) {
        super(message, 400);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
