package io.github.ofx2json;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds the output tree from element events over an explicit stack of open containers.
///
/// Each frame remembers the leaf and unknown tags opened inside it, newest
/// first. Because OFX leaves are seldom closed, a close tag first walks back
/// through those pending tags; only when none is left and the name matches
/// the frame itself is the container closed and folded into its parent.
/// Closes never reach past the top frame.
final class ContainerStack {

    private static final Logger LOG = Logger.getLogger(ContainerStack.class.getName());

    /// A leaf or unrecognized tag waiting for an optional close.
    record PendingTag(String tag, String text) {}

    /// One open container. The value of a suppressed container is its parent's value.
    static final class Container {
        final String name;
        final SchemaNode node;
        final TreeValue value;
        final Deque<PendingTag> pending = new ArrayDeque<>();

        Container(String name, SchemaNode node, TreeValue value) {
            this.name = name;
            this.node = node;
            this.value = value;
        }

        @Override
        public String toString() {
            return name + "(" + node.mode().key() + ", pending=" + pending.size() + ")";
        }
    }

    private enum CloseOutcome { CLOSED, ABSORBED, MISMATCH }

    private final Deque<Container> stack = new ArrayDeque<>();
    private final OfxDiagnostics diagnostics;

    /// Pushes the root frame, whose value is `document` itself.
    ContainerStack(String rootTag, SchemaNode root, TreeObject document, OfxDiagnostics diagnostics) {
        Objects.requireNonNull(rootTag, "rootTag must not be null");
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(document, "document must not be null");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics must not be null");
        stack.push(new Container(rootTag, root, document));
    }

    void accept(OfxElement element) {
        if (element.close()) {
            close(element.name());
        } else {
            open(element);
        }
    }

    /// Handles an open tag against the container on top of the stack.
    /// @throws OfxLeafDecodeException if a number or boolean leaf does not decode
    void open(OfxElement element) {
        final Container top = stack.peek();
        if (top == null) {
            throw new OfxConversionException("Element <" + element.name() + "> found after the root container closed");
        }
        final String tag = element.name();

        final SchemaNode child = top.node.children().get(tag);
        if (child != null) {
            final TreeValue value = switch (child.mode()) {
                case SUPPRESSED -> top.value;
                case ARRAY -> new TreeArray();
                default -> new TreeObject();
            };
            stack.push(new Container(tag, child, value));
            LOG.finer(() -> "Opened container " + tag + " at depth " + stack.size());
            return;
        }

        final LeafKind kind = top.node.leaves().get(tag);
        if (kind != null) {
            ((TreeObject) top.value).add(memberName(tag), decodeLeaf(tag, kind, element.text()));
        } else {
            diagnostics.unrecognizedElement(top.name, tag, element.text());
        }
        top.pending.push(new PendingTag(tag, element.text()));
    }

    /// Handles a close tag against the container on top of the stack.
    /// @throws OfxCloseMismatchException if the tag closes neither a pending tag nor the container
    void close(String tag) {
        final Container top = stack.peek();
        if (top == null) {
            throw new OfxCloseMismatchException(tag, null);
        }
        switch (resolveClose(top, tag)) {
            case CLOSED -> {
                stack.pop();
                fold(top);
                LOG.finer(() -> "Closed container " + tag + ", depth now " + stack.size());
            }
            case ABSORBED -> LOG.finer(() -> "Close </" + tag + "> absorbed by pending tag in " + top.name);
            case MISMATCH -> throw new OfxCloseMismatchException(tag, top.name);
        }
    }

    /// Closes the root container at the end of input, without folding it anywhere.
    /// @throws OfxUnbalancedStackException if containers other than the root are open
    ///         or the root cannot be closed
    void finish() {
        if (stack.size() > 1) {
            throw new OfxUnbalancedStackException("Stack not empty at end of document, still open:", openContainers());
        }
        final Container root = stack.peek();
        if (root == null) {
            return;
        }
        if (resolveClose(root, root.name) != CloseOutcome.CLOSED) {
            throw new OfxUnbalancedStackException("Unable to close root container, still open:", openContainers());
        }
        stack.pop();
    }

    int depth() {
        return stack.size();
    }

    /// {@return the names of the open containers, innermost first}
    List<String> openContainers() {
        final List<String> names = new ArrayList<>(stack.size());
        for (final Container container : stack) {
            names.add(container.name);
        }
        return names;
    }

    private static CloseOutcome resolveClose(Container top, String tag) {
        boolean found = false;
        while (!found && !top.pending.isEmpty()) {
            found = top.pending.pop().tag().equals(tag);
        }
        if (top.pending.isEmpty() && tag.equals(top.name)) {
            return CloseOutcome.CLOSED;
        }
        return found ? CloseOutcome.ABSORBED : CloseOutcome.MISMATCH;
    }

    private void fold(Container closed) {
        final Container parent = stack.peek();
        if (parent == null) {
            return;
        }
        switch (closed.node.mode()) {
            case MERGED_OBJECT, ARRAY -> ((TreeObject) parent.value).add(memberName(closed.name), closed.value);
            case ARRAY_ELEMENT -> ((TreeArray) parent.value).add(closed.value);
            case NAMED_ARRAY_ELEMENT -> {
                final TreeObject wrapper = new TreeObject();
                wrapper.add(memberName(closed.name), closed.value);
                ((TreeArray) parent.value).add(wrapper);
            }
            case SUPPRESSED -> {
                // value already aliases the parent's
            }
        }
    }

    private static TreeValue decodeLeaf(String tag, LeafKind kind, String text) {
        return switch (kind) {
            case NUMBER -> new TreeNumber(OfxValues.parseNumber(text)
                .orElseThrow(() -> new OfxLeafDecodeException(tag, kind, text)));
            case BOOLEAN -> OfxValues.parseBoolean(text)
                .map(TreeBoolean::new)
                .orElseThrow(() -> new OfxLeafDecodeException(tag, kind, text));
            case DATETIME -> OfxDateTime.parse(text)
                .<TreeValue>map(dateTime -> new TreeString(dateTime.toIsoString()))
                .orElseGet(() -> {
                    LOG.fine(() -> "<" + tag + "> '" + text + "' is not a datetime, kept as text");
                    return new TreeString(text);
                });
            case STRING -> new TreeString(text);
        };
    }

    static String memberName(String tag) {
        return tag.toLowerCase(Locale.ROOT);
    }
}
