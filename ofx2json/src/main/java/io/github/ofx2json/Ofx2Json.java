package io.github.ofx2json;

import java.util.Objects;
import java.util.logging.Logger;

/// Converts OFX documents to JSON.
///
/// ```java
/// Ofx2Json converter = Ofx2Json.create(Ofx2JsonConfig.defaults().withPrettyPrint(true));
/// String json = converter.toJson(Files.readAllBytes(statement));
/// ```
///
/// A converter is immutable and may be shared; every call runs its own
/// tokenizer over the whole input and either returns a complete tree or
/// throws an [OfxConversionException] subtype.
public final class Ofx2Json {

    private static final Logger LOG = Logger.getLogger(Ofx2Json.class.getName());

    private final Ofx2JsonConfig config;

    private Ofx2Json(Ofx2JsonConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// {@return a converter using [Ofx2JsonConfig#defaults()]}
    public static Ofx2Json create() {
        return new Ofx2Json(Ofx2JsonConfig.defaults());
    }

    public static Ofx2Json create(Ofx2JsonConfig config) {
        return new Ofx2Json(config);
    }

    public Ofx2JsonConfig config() {
        return config;
    }

    /// Converts a whole document held in memory.
    /// @return the document object, whose members are the folded top-level containers
    /// @throws NotAnOfxDocumentException if the root marker is missing
    /// @throws OfxConversionException for any other structural or decode failure
    public TreeObject convert(String document) {
        Objects.requireNonNull(document, "document must not be null");
        final OfxDiagnostics diagnostics = config.effectiveDiagnostics();
        try {
            final TreeObject result = build(document, diagnostics);
            diagnostics.completed(true, result.size() + " top-level members from " + document.length() + " chars");
            return result;
        } catch (OfxConversionException e) {
            diagnostics.completed(false, e.getMessage());
            throw e;
        }
    }

    /// Decodes the bytes with the charset their header declares, then converts them.
    public TreeObject convert(byte[] document) {
        Objects.requireNonNull(document, "document must not be null");
        return convert(OfxCharsets.decode(document));
    }

    /// {@return the converted document as JSON text, indented when the configuration says so}
    public String toJson(String document) {
        return TreeWriter.toJson(convert(document), config.prettyPrint());
    }

    public String toJson(byte[] document) {
        return TreeWriter.toJson(convert(document), config.prettyPrint());
    }

    private TreeObject build(String document, OfxDiagnostics diagnostics) {
        final OfxSchema schema = config.schema();
        final String marker = schema.rootMarker();
        final int start = document.indexOf(marker);
        if (start < 0) {
            throw new NotAnOfxDocumentException(marker);
        }
        LOG.fine(() -> "Found " + marker + " at offset " + start);

        final TreeObject result = new TreeObject();
        final var stack = new ContainerStack(schema.rootTag(), schema.root(), result, diagnostics);
        final var tokenizer = new OfxTokenizer(document, start + marker.length(), schema.rootTag());
        int events = 0;
        for (OfxElement element = tokenizer.next(); element != null; element = tokenizer.next()) {
            final OfxElement current = element;
            LOG.finer(() -> "Event " + current + " at depth " + stack.depth());
            stack.accept(element);
            events++;
        }
        final int total = events;
        LOG.fine(() -> "Scan ended after " + total + " events"
            + (tokenizer.rootClosed() ? " at </" + schema.rootTag() + ">" : " at end of input"));
        stack.finish();
        return result;
    }
}
