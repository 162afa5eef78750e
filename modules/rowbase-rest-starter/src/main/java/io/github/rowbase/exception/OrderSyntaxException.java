package io.github.rowbase.exception;

/**
 * Thrown by the strict order parser for a malformed order token.
 */
public class OrderSyntaxException extends RowbaseException {

    public OrderSyntaxException(String message) {
        super(message, 400);
    }

    public OrderSyntaxException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
