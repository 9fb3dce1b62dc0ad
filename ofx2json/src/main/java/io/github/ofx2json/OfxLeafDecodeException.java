package io.github.ofx2json;

/// Thrown when the text of a leaf declared as a number or a boolean does not
/// decode as one. Datetime leaves never raise this, they fall back to a string.
public class OfxLeafDecodeException extends OfxConversionException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String tag;
    private final LeafKind kind;
    private final String text;

    public OfxLeafDecodeException(String tag, LeafKind kind, String text) {
        super("<" + tag + "> failed to parse '" + text + "' as a " + kind.displayName());
        this.tag = tag;
        this.kind = kind;
        this.text = text;
    }

    public String tag() {
        return tag;
    }

    public LeafKind kind() {
        return kind;
    }

    public String text() {
        return text;
    }
}
