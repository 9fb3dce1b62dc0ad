package io.github.ofx2json;

import java.util.Locale;

/// How a closed container's accumulated value is attached to its parent's value.
public enum SerializeMode {
    /// The container has no value of its own; its leaves and children land in the enclosing value.
    SUPPRESSED("suppressed"),
    /// An object added to the parent object under the lower-cased tag name.
    MERGED_OBJECT("object"),
    /// An object appended to the parent array.
    ARRAY_ELEMENT("array-element"),
    /// An object wrapped as `{tag: value}` and appended to the parent array.
    NAMED_ARRAY_ELEMENT("named-array-element"),
    /// An array added to the parent object under the lower-cased tag name.
    ARRAY("array");

    private final String key;

    SerializeMode(String key) {
        this.key = key;
    }

    /// The spelling used in schema JSON.
    public String key() {
        return key;
    }

    /// Whether a container of this mode is appended to an array rather than named in an object.
    boolean attachesToArray() {
        return this == ARRAY_ELEMENT || this == NAMED_ARRAY_ELEMENT;
    }

    /// Looks up a mode by its schema spelling, ignoring case.
    /// @return the mode, or null when the spelling is unknown
    public static SerializeMode fromKey(String key) {
        final String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (final SerializeMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return mode;
            }
        }
        return null;
    }
}
