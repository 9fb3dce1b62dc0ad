package io.github.ofx2json;

import java.util.List;

/// Thrown at the end of a document when containers are still open, or when the
/// root container cannot be closed.
public class OfxUnbalancedStackException extends OfxConversionException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final List<String> openContainers;

    /// @param message the error message
    /// @param openContainers names of the containers left open, innermost first
    public OfxUnbalancedStackException(String message, List<String> openContainers) {
        super(message + " " + openContainers);
        this.openContainers = List.copyOf(openContainers);
    }

    public List<String> openContainers() {
        return openContainers;
    }
}
