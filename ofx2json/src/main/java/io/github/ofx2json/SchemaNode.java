package io.github.ofx2json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Static descriptor of one container element: how its value is serialized,
/// which child tags open nested containers and which tags are typed leaves.
///
/// Nodes are immutable and may be shared by several parents. Because a node
/// can only reference nodes that already exist, a graph built from nodes is
/// always acyclic.
///
/// ```java
/// SchemaNode status = SchemaNode.builder(SerializeMode.MERGED_OBJECT)
///     .leaf("CODE", LeafKind.STRING)
///     .leaf("SEVERITY", LeafKind.STRING)
///     .build();
/// ```
public record SchemaNode(SerializeMode mode, Map<String, SchemaNode> children, Map<String, LeafKind> leaves) {

    public SchemaNode {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(children, "children must not be null");
        Objects.requireNonNull(leaves, "leaves must not be null");
        children = Collections.unmodifiableMap(new LinkedHashMap<>(children));
        leaves = Collections.unmodifiableMap(new LinkedHashMap<>(leaves));
        for (final String tag : children.keySet()) {
            if (leaves.containsKey(tag)) {
                throw new OfxSchemaException("Tag '" + tag + "' is declared both as a child and as a leaf");
            }
        }
    }

    /// Starts a node with the given serialize mode and no children or leaves.
    public static Builder builder(SerializeMode mode) {
        return new Builder(mode);
    }

    /// Whether this node's own value is an array. Suppressed nodes have no
    /// value of their own and answer false here.
    boolean holdsArray() {
        return mode == SerializeMode.ARRAY;
    }

    @Override
    public String toString() {
        return "SchemaNode[mode=" + mode + ", children=" + children.keySet() + ", leaves=" + leaves + "]";
    }

    /// Mutable builder; tags keep their declaration order.
    public static final class Builder {
        private final SerializeMode mode;
        private final Map<String, SchemaNode> children = new LinkedHashMap<>();
        private final Map<String, LeafKind> leaves = new LinkedHashMap<>();

        private Builder(SerializeMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode must not be null");
        }

        public Builder child(String tag, SchemaNode node) {
            Objects.requireNonNull(tag, "tag must not be null");
            Objects.requireNonNull(node, "node must not be null");
            children.put(tag, node);
            return this;
        }

        public Builder leaf(String tag, LeafKind kind) {
            Objects.requireNonNull(tag, "tag must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            leaves.put(tag, kind);
            return this;
        }

        public SchemaNode build() {
            return new SchemaNode(mode, children, leaves);
        }
    }
}
