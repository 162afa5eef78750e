package io.github.rowbase.exception;

/**
 * Thrown when an id token fails authentication or is not a well-formed token.
 * Reported to clients as an invalid id.
 */
public class CryptoIntegrityException extends RowbaseException {

    public CryptoIntegrityException(String message) {
        super(message, 400);
    }

    public CryptoIntegrityException(String message, Throwable cause) {
        super(message, 400, cause);
    }
}
