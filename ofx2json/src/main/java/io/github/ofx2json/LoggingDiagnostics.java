package io.github.ofx2json;

import java.util.logging.Logger;

/// Writes conversion notices to the `io.github.ofx2json.Ofx2Json` logger.
final class LoggingDiagnostics implements OfxDiagnostics {

    static final LoggingDiagnostics INSTANCE = new LoggingDiagnostics();

    private static final Logger LOG = Logger.getLogger(Ofx2Json.class.getName());

    private LoggingDiagnostics() {}

    @Override
    public void unrecognizedElement(String container, String tag, String text) {
        LOG.warning(() -> "Unrecognized element in " + container + ": " + tag
            + (text.isEmpty() ? "" : " = '" + text + "'"));
    }

    @Override
    public void completed(boolean success, String detail) {
        if (success) {
            LOG.info(() -> "Conversion completed: " + detail);
        } else {
            LOG.warning(() -> "Conversion failed: " + detail);
        }
    }

    @Override
    public String toString() {
        return "OfxDiagnostics.logging()";
    }
}
