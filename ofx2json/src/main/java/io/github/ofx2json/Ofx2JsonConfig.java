package io.github.ofx2json;

import java.util.Objects;

/// Settings for one [Ofx2Json] converter.
///
/// @param schema the schema table that drives the conversion
/// @param quiet when set, notices go nowhere whatever `diagnostics` is
/// @param prettyPrint whether [Ofx2Json#toJson(String)] indents its output
/// @param diagnostics where non-fatal notices go
public record Ofx2JsonConfig(OfxSchema schema, boolean quiet, boolean prettyPrint, OfxDiagnostics diagnostics) {

    public Ofx2JsonConfig {
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(diagnostics, "diagnostics must not be null");
    }

    /// The built-in OFX table, notices logged, compact output.
    public static Ofx2JsonConfig defaults() {
        return new Ofx2JsonConfig(OfxSchema.defaultSchema(), false, false, OfxDiagnostics.logging());
    }

    public Ofx2JsonConfig withSchema(OfxSchema schema) {
        return new Ofx2JsonConfig(schema, quiet, prettyPrint, diagnostics);
    }

    public Ofx2JsonConfig withQuiet(boolean quiet) {
        return new Ofx2JsonConfig(schema, quiet, prettyPrint, diagnostics);
    }

    public Ofx2JsonConfig withPrettyPrint(boolean prettyPrint) {
        return new Ofx2JsonConfig(schema, quiet, prettyPrint, diagnostics);
    }

    public Ofx2JsonConfig withDiagnostics(OfxDiagnostics diagnostics) {
        return new Ofx2JsonConfig(schema, quiet, prettyPrint, diagnostics);
    }

    /// {@return the sink notices actually go to}
    OfxDiagnostics effectiveDiagnostics() {
        return quiet ? OfxDiagnostics.SILENT : diagnostics;
    }
}
