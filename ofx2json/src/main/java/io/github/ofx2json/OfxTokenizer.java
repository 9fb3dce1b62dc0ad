package io.github.ofx2json;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Pull tokenizer for OFX tag soup.
///
/// Each call to [#next()] skips whitespace, reads one tag and, for an open tag,
/// the text that follows it up to the next `<` or `>`. Closing tags are never
/// required, attribute values may be unquoted, and a self-closing `<TAG/>`
/// comes out as an open event followed by a synthetic close event.
///
/// The scan stops for good at the close tag of the document root, whatever is
/// still open at that point, or when the input runs out between two tags.
/// Broken markup raises [OfxParseException] immediately.
final class OfxTokenizer {

    private static final Logger LOG = Logger.getLogger(OfxTokenizer.class.getName());

    private final CharSequence input;
    private final String rootTag;
    private int pos;
    private OfxElement pendingClose;
    private boolean finished;
    private boolean rootClosed;

    /// @param input the whole document
    /// @param start offset to start scanning from, just past the root marker
    /// @param rootTag name whose close tag ends the scan
    OfxTokenizer(CharSequence input, int start, String rootTag) {
        this.input = Objects.requireNonNull(input, "input must not be null");
        this.rootTag = Objects.requireNonNull(rootTag, "rootTag must not be null");
        if (start < 0 || start > input.length()) {
            throw new IndexOutOfBoundsException("start " + start + " outside input of length " + input.length());
        }
        this.pos = start;
    }

    /// {@return the next event, or null once the scan is over}
    /// @throws OfxParseException if the markup is broken
    OfxElement next() {
        if (pendingClose != null) {
            final OfxElement synthetic = pendingClose;
            pendingClose = null;
            return synthetic;
        }
        if (finished) {
            return null;
        }

        pos = OfxValues.skipSpace(input, pos);
        if (pos >= input.length()) {
            LOG.finer(() -> "Input exhausted at offset " + pos);
            finished = true;
            return null;
        }
        expect('<', "Expected '<'");
        skipSpaceRequiringMore("Unexpected end of input after '<'");

        final boolean close = input.charAt(pos) == '/';
        if (close) {
            pos++;
            skipSpaceRequiringMore("Unexpected end of input after '</'");
        }
        final String name = readName();
        if (name.isEmpty()) {
            throw error("Expected element name");
        }

        if (close) {
            pos = OfxValues.skipSpace(input, pos);
            expect('>', "Expected '>' to end </" + name);
            if (name.equals(rootTag)) {
                LOG.finer(() -> "Root </" + name + "> reached at offset " + pos);
                finished = true;
                rootClosed = true;
                return null;
            }
            return OfxElement.close(name);
        }

        final Map<String, String> attributes = readAttributes();
        if (pos >= input.length()) {
            throw error("Unexpected end of input in <" + name);
        }
        final boolean selfClosing = input.charAt(pos) == '/';
        if (selfClosing) {
            pos++;
        }
        pos = OfxValues.skipSpace(input, pos);
        expect('>', "Expected '>' to end <" + name);

        if (selfClosing) {
            pendingClose = OfxElement.close(name);
            return OfxElement.open(name, attributes, "");
        }
        final String text = OfxValues.decodeEntities(readText());
        return OfxElement.open(name, attributes, text);
    }

    /// Whether the scan ended on the root's close tag rather than at the end of input.
    boolean rootClosed() {
        return rootClosed;
    }

    /// Current offset into the input.
    int position() {
        return pos;
    }

    /// Reads `name[=value]` pairs, but only when whitespace separates them from the tag name.
    private Map<String, String> readAttributes() {
        final Map<String, String> attributes = new LinkedHashMap<>();
        final int afterName = pos;
        pos = OfxValues.skipSpace(input, pos);
        if (pos == afterName) {
            return attributes;
        }
        while (pos < input.length()) {
            final char c = input.charAt(pos);
            if (c == '>' || c == '/') {
                break;
            }
            final String attrName = readName();
            if (attrName.isEmpty()) {
                throw error("Expected attribute name");
            }
            skipSpaceRequiringMore("Unexpected end of input after attribute " + attrName);

            String value = "";
            if (input.charAt(pos) == '=') {
                pos++;
                skipSpaceRequiringMore("Unexpected end of input after " + attrName + "=");
                final boolean quoted = input.charAt(pos) == '"';
                if (quoted) {
                    pos++;
                }
                value = readAttributeValue(quoted);
                if (value.isEmpty()) {
                    throw error("Expected value for attribute " + attrName);
                }
                if (quoted) {
                    expect('"', "Unterminated quoted value of attribute " + attrName);
                }
            }
            pos = OfxValues.skipSpace(input, pos);
            attributes.putIfAbsent(attrName, OfxValues.decodeEntities(value));
        }
        return attributes;
    }

    private String readName() {
        final int start = pos;
        while (pos < input.length() && !isNameTerminator(input.charAt(pos))) {
            pos++;
        }
        return input.subSequence(start, pos).toString();
    }

    private String readAttributeValue(boolean quoted) {
        final int start = pos;
        while (pos < input.length()) {
            final char c = input.charAt(pos);
            if (quoted ? c == '"' : isNameTerminator(c)) {
                break;
            }
            pos++;
        }
        if (quoted && pos >= input.length()) {
            throw error("Unterminated quoted attribute value");
        }
        return input.subSequence(start, pos).toString();
    }

    /// Reads the raw text after an open tag, leading whitespace skipped and
    /// trailing whitespace trimmed. The text must be followed by `<` or `>`.
    private String readText() {
        pos = OfxValues.skipSpace(input, pos);
        final int start = pos;
        while (pos < input.length()) {
            final char c = input.charAt(pos);
            if (c == '<' || c == '>') {
                int end = pos;
                while (end > start && OfxValues.isSpace(input.charAt(end - 1))) {
                    end--;
                }
                return input.subSequence(start, end).toString();
            }
            pos++;
        }
        throw error("Unexpected end of input in element text");
    }

    private static boolean isNameTerminator(char c) {
        return OfxValues.isSpace(c) || c == '<' || c == '>' || c == '/' || c == '=' || c == '"';
    }

    private void expect(char expected, String message) {
        if (pos >= input.length() || input.charAt(pos) != expected) {
            throw error(message);
        }
        pos++;
    }

    private void skipSpaceRequiringMore(String message) {
        pos = OfxValues.skipSpace(input, pos);
        if (pos >= input.length()) {
            throw error(message);
        }
    }

    private OfxParseException error(String message) {
        return new OfxParseException(message, input, pos);
    }
}
