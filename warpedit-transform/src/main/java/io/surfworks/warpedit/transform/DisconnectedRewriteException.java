package io.surfworks.warpedit.transform;

/**
 * Thrown by targeted replacement when no operation lies on a path from the replaced
 * tensors to the targets. Raised before the graph is modified.
 */
public class DisconnectedRewriteException extends GraphEditException {

    public DisconnectedRewriteException(String message) {
        super(message);
    }
}
