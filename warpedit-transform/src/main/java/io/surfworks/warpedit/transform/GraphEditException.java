package io.surfworks.warpedit.transform;

/**
 * Base class of the errors raised when a transformation cannot proceed.
 *
 * <p>These signal contract violations by the caller. They are not retried: a failed
 * transformation may leave operations it already created in the destination graph.
 */
public class GraphEditException extends RuntimeException {

    public GraphEditException(String message) {
        super(message);
    }

    public GraphEditException(String message, Throwable cause) {
        super(message, cause);
    }
}
