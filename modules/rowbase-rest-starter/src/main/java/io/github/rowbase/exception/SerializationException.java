package io.github.rowbase.exception;

/**
 * Thrown when a request body cannot be decoded for its declared content type,
 * or a value cannot be encoded for the response.
 */
public class SerializationException extends RowbaseException {

    private final String fragment;

    public SerializationException(String message, String fragment) {
        super(message + " '" + fragment + "'", 400);
        this.fragment = fragment;
    }

    public SerializationException(String message, String fragment, Throwable cause) {
        super(message + " '" + fragment + "'", 400, cause);
        this.fragment = fragment;
    }

    public String getFragment() {
        return fragment;
    }
}
