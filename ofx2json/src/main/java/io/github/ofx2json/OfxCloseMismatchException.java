package io.github.ofx2json;

/// Thrown when a close tag matches neither a pending leaf of the current
/// container nor the container itself.
public class OfxCloseMismatchException extends OfxConversionException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String closeTag;
    private final String expected;

    /// @param closeTag the tag name of the close event, without the slash
    /// @param expected the name of the container on top of the stack, or null when the stack was empty
    public OfxCloseMismatchException(String closeTag, String expected) {
        super(expected == null
            ? "unexpected close tag found: </" + closeTag + ">"
            : "mismatch for </" + closeTag + ">, expecting </" + expected + ">");
        this.closeTag = closeTag;
        this.expected = expected;
    }

    public String closeTag() {
        return closeTag;
    }

    public String expected() {
        return expected;
    }
}
