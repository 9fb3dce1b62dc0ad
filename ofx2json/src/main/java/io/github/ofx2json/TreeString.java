package io.github.ofx2json;

import java.util.Objects;

/// A string leaf; also the fallback for datetime text that did not decode.
public record TreeString(String value) implements TreeValue {
    public TreeString {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String toString() {
        return TreeWriter.toJson(this);
    }
}
