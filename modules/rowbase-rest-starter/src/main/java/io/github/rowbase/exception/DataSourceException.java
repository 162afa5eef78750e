package io.github.rowbase.exception;

/**
 * Wraps a driver level failure. The message is the driver's message, unchanged.
 */
public class DataSourceException extends RowbaseException {

    public DataSourceException(String message) {
        super(message, 500);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, 500, cause);
    }
}
