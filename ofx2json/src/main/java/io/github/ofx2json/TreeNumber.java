package io.github.ofx2json;

/// A decoded numeric leaf.
public record TreeNumber(double value) implements TreeValue {
    @Override
    public String toString() {
        return TreeWriter.toJson(this);
    }
}
