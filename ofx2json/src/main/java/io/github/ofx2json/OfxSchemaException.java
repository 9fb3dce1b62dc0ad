package io.github.ofx2json;

/// Thrown when a schema table cannot be loaded or is not usable: unknown node
/// references, cycles, or children whose serialize mode cannot attach to their parent.
public class OfxSchemaException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public OfxSchemaException(String message) {
        super(message);
    }

    public OfxSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
