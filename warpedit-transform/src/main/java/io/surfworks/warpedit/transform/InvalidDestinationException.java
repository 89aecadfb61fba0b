package io.surfworks.warpedit.transform;

/**
 * Thrown when the destination of a transformation is not a usable graph.
 * Raised before anything is created.
 */
public class InvalidDestinationException extends GraphEditException {

    public InvalidDestinationException(String message) {
        super(message);
    }
}
