package io.github.ofx2json;

/// Base class of every failure that aborts a conversion.
/// No partial tree is ever returned alongside one of these.
public class OfxConversionException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates a new conversion exception with the given message.
    /// @param message the error message
    public OfxConversionException(String message) {
        super(message);
    }

    /// Creates a new conversion exception with the given message and cause.
    /// @param message the error message
    /// @param cause the underlying cause
    public OfxConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
