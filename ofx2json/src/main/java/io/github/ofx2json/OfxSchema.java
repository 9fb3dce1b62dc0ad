package io.github.ofx2json;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// A complete schema table: the document's root tag name and the node that
/// describes the root container.
///
/// Construction checks that every child can be attached to the value of its
/// parent: an array-valued container accepts only array elements and takes no
/// leaves, an object-valued container accepts no array elements. Suppressed
/// nodes are checked against the value they alias.
public record OfxSchema(String rootTag, SchemaNode root) {

    private static final Logger LOG = Logger.getLogger(OfxSchema.class.getName());

    /// Classpath location of the built-in OFX table.
    public static final String DEFAULT_RESOURCE = "/io/github/ofx2json/ofx-schema.json";

    public OfxSchema {
        Objects.requireNonNull(rootTag, "rootTag must not be null");
        Objects.requireNonNull(root, "root must not be null");
        if (rootTag.isBlank()) {
            throw new OfxSchemaException("Root tag must not be blank");
        }
        if (root.mode().attachesToArray() || root.holdsArray()) {
            throw new OfxSchemaException("Root node must serialize as an object, got " + root.mode());
        }
        validate(rootTag, root);
    }

    /// {@return the literal marker that starts a document, e.g. `<OFX>`}
    public String rootMarker() {
        return "<" + rootTag + ">";
    }

    /// {@return the built-in OFX table, loaded once from [#DEFAULT_RESOURCE]}
    /// @throws OfxSchemaException if the resource is missing or invalid
    public static OfxSchema defaultSchema() {
        return DefaultHolder.INSTANCE;
    }

    private static void validate(String rootTag, SchemaNode root) {
        final Set<SchemaNode> seenUnderObject = Collections.newSetFromMap(new IdentityHashMap<>());
        final Set<SchemaNode> seenUnderArray = Collections.newSetFromMap(new IdentityHashMap<>());
        validateNode(rootTag, root, false, seenUnderObject, seenUnderArray);
        LOG.finer(() -> "Validated schema rooted at <" + rootTag + ">: " + seenUnderObject.size()
            + " object-valued and " + seenUnderArray.size() + " array-valued nodes");
    }

    /// @param enclosingIsArray the kind of value a suppressed node would alias
    private static void validateNode(String path, SchemaNode node, boolean enclosingIsArray,
                                     Set<SchemaNode> seenUnderObject, Set<SchemaNode> seenUnderArray) {
        final boolean valueIsArray = node.mode() == SerializeMode.SUPPRESSED ? enclosingIsArray : node.holdsArray();
        final Set<SchemaNode> seen = valueIsArray ? seenUnderArray : seenUnderObject;
        if (!seen.add(node)) {
            return;
        }

        if (valueIsArray && !node.leaves().isEmpty()) {
            throw new OfxSchemaException("Array container " + path + " cannot declare leaves " + node.leaves().keySet());
        }
        for (final var entry : node.children().entrySet()) {
            final String childPath = path + "/" + entry.getKey();
            final SerializeMode childMode = entry.getValue().mode();
            if (valueIsArray && childMode != SerializeMode.SUPPRESSED && !childMode.attachesToArray()) {
                throw new OfxSchemaException("Child " + childPath + " of array container must be an array element, got "
                    + childMode.key());
            }
            if (!valueIsArray && childMode.attachesToArray()) {
                throw new OfxSchemaException("Child " + childPath + " of object container cannot be "
                    + childMode.key());
            }
            validateNode(childPath, entry.getValue(), valueIsArray, seenUnderObject, seenUnderArray);
        }
    }

    private static final class DefaultHolder {
        static final OfxSchema INSTANCE = OfxSchemaLoader.loadResource(DEFAULT_RESOURCE);
    }
}
