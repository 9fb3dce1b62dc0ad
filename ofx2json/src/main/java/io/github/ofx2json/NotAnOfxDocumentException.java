package io.github.ofx2json;

/// Thrown before any parsing starts when the input does not contain the root marker.
public class NotAnOfxDocumentException extends OfxConversionException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// @param marker the literal opening tag that was searched for, e.g. `<OFX>`
    public NotAnOfxDocumentException(String marker) {
        super("Not an OFX file: no " + marker + " found");
    }
}
