package io.github.ofx2json;

/// A decoded `Y`/`N` leaf.
public record TreeBoolean(boolean value) implements TreeValue {
    @Override
    public String toString() {
        return TreeWriter.toJson(this);
    }
}
