package io.github.ofx2json;

/// Thrown by the tokenizer when the markup itself is broken: a missing name,
/// a missing `>`, an unterminated quoted attribute or input that ends inside a tag.
public class OfxParseException extends OfxConversionException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final int position;

    /// Creates a new parse exception pointing at an offset of the scanned input.
    /// @param message the error message
    /// @param input the text being scanned
    /// @param position offset of the offending character, may equal the input length
    public OfxParseException(String message, CharSequence input, int position) {
        super(formatMessage(message, input, position));
        this.position = position;
    }

    /// Returns the offset in the scanned input where the error was detected.
    public int position() {
        return position;
    }

    private static String formatMessage(String message, CharSequence input, int position) {
        final var sb = new StringBuilder();
        sb.append(message);
        sb.append(" at offset ").append(position);
        if (position < input.length()) {
            sb.append(" (near '").append(input.charAt(position)).append("')");
        } else {
            sb.append(" (end of input)");
        }
        return sb.toString();
    }
}
