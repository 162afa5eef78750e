package io.github.rowbase.exception;

/**
 * Thrown when an id codec is constructed with an invalid key or length.
 */
public class CryptoConfigException extends RowbaseException {

    public CryptoConfigException(String message) {
        super(message, 500);
    }

    public CryptoConfigException(String message, Throwable cause) {
        super(message, 500, cause);
    }
}
