package io.github.rowbase.exception;

/**
 * Thrown when a request references a field the data model does not have.
 */
public class UnknownFieldException extends RowbaseException {

    public UnknownFieldException(String message) {
        super(message, 400);
    }

    public UnknownFieldException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
