package io.github.rowbase.exception;

/**
 * Thrown when a filter string does not match the filter grammar.
 */
public class FilterSyntaxException extends RowbaseException {

    private final String fragment;

    public FilterSyntaxException(String message, String fragment) {
        super(message + " '" + fragment + "'", 400);
        this.fragment = fragment;
    }

    public FilterSyntaxException(String message, String fragment, Throwable cause) {
        super(message + " '" + fragment + "'", 400, cause);
        this.fragment = fragment;
    }

    /** The offending part of the filter. */
    public String getFragment() {
        return fragment;
    }
}
