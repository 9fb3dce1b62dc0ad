package io.github.ofx2json;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An object value whose members keep insertion order.
///
/// The same name may occur more than once: several `<BUYSTOCK>` containers
/// under one `<INVTRANLIST>` each add a `buystock` member, and all of them are
/// written out.
public final class TreeObject implements TreeValue {

    /// One name/value pair of an object.
    public record Member(String name, TreeValue value) {
        public Member {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    private final List<Member> members = new ArrayList<>();

    /// Appends a member, keeping any earlier member with the same name.
    void add(String name, TreeValue value) {
        members.add(new Member(name, value));
    }

    /// {@return the members in insertion order}
    public List<Member> members() {
        return Collections.unmodifiableList(members);
    }

    /// {@return the value of the first member with the given name}
    public Optional<TreeValue> getOrAbsent(String name) {
        Objects.requireNonNull(name, "name must not be null");
        for (final Member member : members) {
            if (member.name().equals(name)) {
                return Optional.of(member.value());
            }
        }
        return Optional.empty();
    }

    /// {@return the value of the first member with the given name}
    /// @throws IllegalArgumentException if there is no such member
    public TreeValue get(String name) {
        return getOrAbsent(name).orElseThrow(
            () -> new IllegalArgumentException("Object member \"" + name + "\" does not exist."));
    }

    /// {@return the values of every member with the given name, in order}
    public List<TreeValue> getAll(String name) {
        Objects.requireNonNull(name, "name must not be null");
        final List<TreeValue> values = new ArrayList<>();
        for (final Member member : members) {
            if (member.name().equals(name)) {
                values.add(member.value());
            }
        }
        return values;
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TreeObject other && members.equals(other.members);
    }

    @Override
    public int hashCode() {
        return members.hashCode();
    }

    @Override
    public String toString() {
        return TreeWriter.toJson(this);
    }
}
