package io.github.ofx2json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Objects;

/// Serializes a [TreeValue] through Jackson's streaming generator.
///
/// The generator does not check for duplicate field names, so repeated
/// members of a [TreeObject] are written as they were added.
public final class TreeWriter {

    private static final JsonFactory FACTORY = JsonFactory.builder().build();

    private TreeWriter() {}

    /// Writes the value as JSON text; the writer is flushed but not closed.
    /// @param value the value to write
    /// @param out where the text goes
    /// @param pretty whether to indent the output
    public static void write(TreeValue value, Writer out, boolean pretty) throws IOException {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(out, "out must not be null");
        try (JsonGenerator gen = FACTORY.createGenerator(out)) {
            gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
            if (pretty) {
                gen.useDefaultPrettyPrinter();
            }
            writeValue(gen, value);
        }
    }

    /// {@return the value as compact JSON text}
    public static String toJson(TreeValue value) {
        return toJson(value, false);
    }

    /// {@return the value as JSON text, indented when `pretty` is set}
    public static String toJson(TreeValue value, boolean pretty) {
        final var out = new StringWriter();
        try {
            write(value, out, pretty);
        } catch (IOException e) {
            throw new UncheckedIOException("StringWriter failed", e);
        }
        return out.toString();
    }

    private static void writeValue(JsonGenerator gen, TreeValue value) throws IOException {
        if (value instanceof TreeObject obj) {
            gen.writeStartObject();
            for (final TreeObject.Member member : obj.members()) {
                gen.writeFieldName(member.name());
                writeValue(gen, member.value());
            }
            gen.writeEndObject();
        } else if (value instanceof TreeArray arr) {
            gen.writeStartArray();
            for (final TreeValue element : arr.elements()) {
                writeValue(gen, element);
            }
            gen.writeEndArray();
        } else if (value instanceof TreeString str) {
            gen.writeString(str.value());
        } else if (value instanceof TreeNumber num) {
            gen.writeNumber(num.value());
        } else if (value instanceof TreeBoolean bool) {
            gen.writeBoolean(bool.value());
        } else {
            throw new AssertionError("unreachable: " + value.getClass());
        }
    }
}
