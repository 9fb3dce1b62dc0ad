package io.github.ofx2json;

import java.util.Locale;

/// How the text of a leaf element is decoded before it is attached to its container.
public enum LeafKind {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    DATETIME("datetime");

    private final String key;

    LeafKind(String key) {
        this.key = key;
    }

    /// The spelling used in schema JSON and in error messages.
    public String displayName() {
        return key;
    }

    /// Looks up a kind by its schema spelling, ignoring case.
    /// @return the kind, or null when the spelling is unknown
    public static LeafKind fromKey(String key) {
        final String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (final LeafKind kind : values()) {
            if (kind.key.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
