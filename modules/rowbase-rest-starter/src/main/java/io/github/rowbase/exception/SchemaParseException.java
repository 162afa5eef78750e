package io.github.rowbase.exception;

/**
 * Thrown when a native table description cannot be parsed into a data model.
 */
public class SchemaParseException extends RowbaseException {

    public SchemaParseException(String message) {
        super(message, 500);
    }

    public SchemaParseException(String message, Throwable cause) {
        super(message, 500, cause);
    }
}
