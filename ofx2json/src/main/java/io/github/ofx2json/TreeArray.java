package io.github.ofx2json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// An array value built from `array-element` and `named-array-element` containers.
public final class TreeArray implements TreeValue {

    private final List<TreeValue> elements = new ArrayList<>();

    void add(TreeValue value) {
        elements.add(value);
    }

    /// {@return the elements in insertion order}
    public List<TreeValue> elements() {
        return Collections.unmodifiableList(elements);
    }

    /// @throws IndexOutOfBoundsException if the index is outside the array
    public TreeValue element(int index) {
        return elements.get(index);
    }

    public int size() {
        return elements.size();
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TreeArray other && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return TreeWriter.toJson(this);
    }
}
