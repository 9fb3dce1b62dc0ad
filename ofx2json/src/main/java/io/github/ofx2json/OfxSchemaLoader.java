package io.github.ofx2json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Reads a schema table from its declarative JSON form.
///
/// ```json
/// {
///   "root": "OFX",
///   "start": "main",
///   "nodes": {
///     "main":   { "serialize": "suppressed", "children": { "SIGNONMSGSRSV1": "signon" } },
///     "signon": { "serialize": "object", "leaves": { "DTSERVER": "datetime" } }
///   }
/// }
/// ```
///
/// Nodes refer to each other by id; a node referenced from several parents is
/// built once and shared. Unknown ids, unknown modes or kinds, and reference
/// cycles are rejected with an [OfxSchemaException].
public final class OfxSchemaLoader {

    private static final Logger LOG = Logger.getLogger(OfxSchemaLoader.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private OfxSchemaLoader() {}

    /// Loads a schema table from a file.
    /// @throws UncheckedIOException if the file cannot be read
    /// @throws OfxSchemaException if the table is invalid
    public static OfxSchema load(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        LOG.fine(() -> "Loading schema table from " + file);
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read schema table " + file, e);
        }
    }

    /// Loads a schema table from a stream; the stream is not closed.
    /// @throws UncheckedIOException if the stream cannot be read
    /// @throws OfxSchemaException if the table is invalid
    public static OfxSchema load(InputStream in) {
        Objects.requireNonNull(in, "in must not be null");
        try {
            return fromTree(MAPPER.readTree(in));
        } catch (JsonProcessingException e) {
            throw new OfxSchemaException("Schema table is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read schema table", e);
        }
    }

    /// Parses a schema table from JSON text.
    /// @throws OfxSchemaException if the text is not JSON or the table is invalid
    public static OfxSchema parse(String json) {
        Objects.requireNonNull(json, "json must not be null");
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new OfxSchemaException("Schema table is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static OfxSchema loadResource(String resource) {
        LOG.fine(() -> "Loading schema table resource " + resource);
        try (InputStream in = OfxSchemaLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new OfxSchemaException("Schema resource not found: " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read schema resource " + resource, e);
        }
    }

    static OfxSchema fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new OfxSchemaException("Schema table must be a JSON object");
        }
        final String rootTag = requiredText(root, "root", "schema table");
        final String start = requiredText(root, "start", "schema table");
        final JsonNode nodes = root.get("nodes");
        if (nodes == null || !nodes.isObject()) {
            throw new OfxSchemaException("Schema table must have a \"nodes\" object");
        }

        final var resolver = new Resolver(nodes);
        final SchemaNode startNode = resolver.resolve(start);
        LOG.fine(() -> "Resolved schema table rooted at <" + rootTag + "> with " + resolver.built.size()
            + " of " + nodes.size() + " nodes reachable");
        return new OfxSchema(rootTag, startNode);
    }

    private static String requiredText(JsonNode obj, String field, String where) {
        final JsonNode value = obj.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new OfxSchemaException(where + " needs a non-blank string \"" + field + "\"");
        }
        return value.asText();
    }

    /// Depth-first resolution of node ids; ids on the current path are cycles.
    private static final class Resolver {
        private final JsonNode definitions;
        private final Map<String, SchemaNode> built = new HashMap<>();
        private final Deque<String> inProgress = new ArrayDeque<>();

        Resolver(JsonNode definitions) {
            this.definitions = definitions;
        }

        SchemaNode resolve(String id) {
            final SchemaNode done = built.get(id);
            if (done != null) {
                return done;
            }
            if (inProgress.contains(id)) {
                final List<String> cycle = new ArrayList<>(inProgress);
                Collections.reverse(cycle);
                cycle.add(id);
                throw new OfxSchemaException("Schema node reference cycle: " + String.join(" -> ", cycle));
            }
            final JsonNode definition = definitions.get(id);
            if (definition == null) {
                throw new OfxSchemaException("Unknown schema node '" + id + "'");
            }
            if (!definition.isObject()) {
                throw new OfxSchemaException("Schema node '" + id + "' must be a JSON object");
            }

            inProgress.push(id);
            final SchemaNode node = build(id, definition);
            inProgress.pop();
            built.put(id, node);
            LOG.finer(() -> "Built schema node '" + id + "': " + node);
            return node;
        }

        private SchemaNode build(String id, JsonNode definition) {
            final String modeKey = requiredText(definition, "serialize", "schema node '" + id + "'");
            final SerializeMode mode = SerializeMode.fromKey(modeKey);
            if (mode == null) {
                throw new OfxSchemaException("Schema node '" + id + "' has unknown serialize mode '" + modeKey + "'");
            }
            final SchemaNode.Builder builder = SchemaNode.builder(mode);

            final JsonNode children = definition.get("children");
            if (children != null) {
                requireObject(children, id, "children");
                for (final Iterator<Map.Entry<String, JsonNode>> it = children.fields(); it.hasNext(); ) {
                    final Map.Entry<String, JsonNode> entry = it.next();
                    if (!entry.getValue().isTextual()) {
                        throw new OfxSchemaException("Child <" + entry.getKey() + "> of schema node '" + id
                            + "' must name a node id");
                    }
                    builder.child(entry.getKey(), resolve(entry.getValue().asText()));
                }
            }

            final JsonNode leaves = definition.get("leaves");
            if (leaves != null) {
                requireObject(leaves, id, "leaves");
                for (final Iterator<Map.Entry<String, JsonNode>> it = leaves.fields(); it.hasNext(); ) {
                    final Map.Entry<String, JsonNode> entry = it.next();
                    final LeafKind kind = entry.getValue().isTextual() ? LeafKind.fromKey(entry.getValue().asText()) : null;
                    if (kind == null) {
                        throw new OfxSchemaException("Leaf <" + entry.getKey() + "> of schema node '" + id
                            + "' has unknown kind " + entry.getValue());
                    }
                    builder.leaf(entry.getKey(), kind);
                }
            }
            return builder.build();
        }

        private static void requireObject(JsonNode value, String id, String field) {
            if (!value.isObject()) {
                throw new OfxSchemaException("\"" + field + "\" of schema node '" + id + "' must be a JSON object");
            }
        }
    }
}
