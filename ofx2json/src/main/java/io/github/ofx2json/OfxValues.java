package io.github.ofx2json;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/// Decoders for the raw text found between OFX tags.
///
/// All of them are pure functions. Number and boolean decoders report failure
/// as an empty optional; deciding whether that is fatal is up to the caller.
public final class OfxValues {

    private static final Map<String, Character> ENTITIES = Map.of(
        "quot", '"',
        "amp", '&',
        "apos", '\'',
        "lt", '<',
        "gt", '>');

    /// How far past the `&` the terminating `;` may be.
    private static final int MAX_ENTITY_SPAN = 5;

    private OfxValues() {}

    /// Replaces the five predefined XML entities. A reference whose `;` is not
    /// within five characters of the `&`, or whose name is not one of the five,
    /// is copied through unchanged.
    /// @return the decoded text, or `text` itself when it holds no `&`
    public static String decodeEntities(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final int amp = text.indexOf('&');
        if (amp < 0) {
            return text;
        }

        final var out = new StringBuilder(text.length());
        out.append(text, 0, amp);
        int pos = amp;
        while (pos < text.length()) {
            final char ch = text.charAt(pos);
            if (ch == '&') {
                final int semi = findEntityEnd(text, pos);
                if (semi > pos + 1) {
                    final Character replacement = ENTITIES.get(text.substring(pos + 1, semi));
                    if (replacement != null) {
                        out.append(replacement.charValue());
                        pos = semi + 1;
                        continue;
                    }
                }
            }
            out.append(ch);
            pos++;
        }
        return out.toString();
    }

    private static int findEntityEnd(String text, int amp) {
        for (int i = 0; i < MAX_ENTITY_SPAN && amp + 1 + i < text.length(); i++) {
            if (text.charAt(amp + 1 + i) == ';') {
                return amp + 1 + i;
            }
        }
        return -1;
    }

    /// Decodes an optionally signed decimal such as `-12.50`. Surrounding
    /// whitespace is allowed; exponents, a second `.`, any other character,
    /// a missing digit and more digits than a `long` holds are not.
    public static OptionalDouble parseNumber(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final int len = text.length();
        int pos = skipSpace(text, 0);
        if (pos >= len) {
            return OptionalDouble.empty();
        }

        boolean negative = false;
        final char sign = text.charAt(pos);
        if (sign == '-' || sign == '+') {
            negative = sign == '-';
            if (++pos >= len) {
                return OptionalDouble.empty();
            }
        }

        long mantissa = 0;
        int scale = 0;
        int digits = 0;
        boolean fraction = false;
        for (; pos < len; pos++) {
            final char ch = text.charAt(pos);
            if (ch == '.') {
                if (fraction) {
                    return OptionalDouble.empty();
                }
                fraction = true;
            } else if (ch >= '0' && ch <= '9') {
                final int digit = ch - '0';
                if (mantissa > (Long.MAX_VALUE - digit) / 10) {
                    return OptionalDouble.empty();
                }
                mantissa = mantissa * 10 + digit;
                digits++;
                if (fraction) {
                    scale++;
                }
            } else {
                break;
            }
        }

        pos = skipSpace(text, pos);
        if (pos < len || digits == 0) {
            return OptionalDouble.empty();
        }
        final double value = BigDecimal.valueOf(mantissa, scale).doubleValue();
        return OptionalDouble.of(negative ? -value : value);
    }

    /// Decodes `Y`/`y` as true and `N`/`n` as false; only whitespace may surround the letter.
    public static Optional<Boolean> parseBoolean(String text) {
        Objects.requireNonNull(text, "text must not be null");
        int pos = skipSpace(text, 0);
        if (pos >= text.length()) {
            return Optional.empty();
        }
        final char ch = text.charAt(pos);
        final Boolean value;
        if (ch == 'Y' || ch == 'y') {
            value = Boolean.TRUE;
        } else if (ch == 'N' || ch == 'n') {
            value = Boolean.FALSE;
        } else {
            return Optional.empty();
        }
        pos = skipSpace(text, pos + 1);
        return pos >= text.length() ? Optional.of(value) : Optional.empty();
    }

    /// The C locale whitespace set: space, tab, line feed, vertical tab, form feed, carriage return.
    static boolean isSpace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\u000B' || ch == '\f' || ch == '\r';
    }

    static int skipSpace(CharSequence text, int pos) {
        while (pos < text.length() && isSpace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }
}
