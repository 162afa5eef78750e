package io.github.rowbase.exception;

/**
 * Thrown for a request or response content type the row codecs do not support.
 */
public class UnsupportedMediaTypeException extends RowbaseException {

    public UnsupportedMediaTypeException(String message) {
        super(message, 415);
    }

    public UnsupportedMediaTypeException(String message, Throwable cause) {
        super(message, 415, cause);
    }
}
