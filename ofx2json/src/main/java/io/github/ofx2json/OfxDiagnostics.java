package io.github.ofx2json;

/// Receives the non-fatal notices of a conversion.
///
/// Notices never change the produced tree. Both callbacks do nothing by
/// default, so a sink only overrides what it cares about.
public interface OfxDiagnostics {

    /// A sink that drops every notice.
    OfxDiagnostics SILENT = new OfxDiagnostics() {
        @Override
        public String toString() {
            return "OfxDiagnostics.SILENT";
        }
    };

    /// Called for an open tag that is neither a child nor a leaf of the current container.
    /// @param container name of the container on top of the stack
    /// @param tag the unrecognized tag
    /// @param text the decoded text that followed the tag
    default void unrecognizedElement(String container, String tag, String text) {
    }

    /// Called once per conversion, after the tree is complete or after the
    /// first fatal error.
    /// @param success whether a tree was produced
    /// @param detail a short summary, or the failure message
    default void completed(boolean success, String detail) {
    }

    /// {@return the sink that writes notices to `java.util.logging`}
    static OfxDiagnostics logging() {
        return LoggingDiagnostics.INSTANCE;
    }
}
