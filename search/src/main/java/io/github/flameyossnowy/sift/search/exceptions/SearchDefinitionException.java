package io.github.flameyossnowy.sift.search.exceptions;

/**
 * Thrown when the search library itself is misconfigured in a way that no filter
 * definition can recover from, such as a range type without the expected endpoints.
 * <p>
 * Problems in an individual filter class are logged and skipped, never thrown.
 */
public class SearchDefinitionException extends RuntimeException {
    public SearchDefinitionException(String message) {
        super(message);
    }

    public SearchDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
