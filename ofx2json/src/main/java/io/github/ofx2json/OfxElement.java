package io.github.ofx2json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One structural event produced by [OfxTokenizer].
///
/// Open events carry the element's attributes and the entity-decoded text that
/// follows the tag up to the next `<`. Close events carry only the name; their
/// attributes are empty and their text is empty.
///
/// @param name the element name, without the slash of a close tag
/// @param close whether this is a close event
/// @param attributes decoded attribute values, first occurrence wins
/// @param text decoded text following an open tag, trailing whitespace trimmed
public record OfxElement(String name, boolean close, Map<String, String> attributes, String text) {

    public OfxElement {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(text, "text must not be null");
        attributes = attributes.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    static OfxElement open(String name, Map<String, String> attributes, String text) {
        return new OfxElement(name, false, attributes, text);
    }

    static OfxElement close(String name) {
        return new OfxElement(name, true, Map.of(), "");
    }

    /// {@return the name as written in the markup, with a leading `/` for close events}
    public String displayName() {
        return close ? "/" + name : name;
    }

    @Override
    public String toString() {
        return "<" + displayName() + (attributes.isEmpty() ? "" : " " + attributes) + ">"
            + (text.isEmpty() ? "" : "'" + text + "'");
    }
}
