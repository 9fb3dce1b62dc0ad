package io.github.ofx2json;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/// A decoded OFX datetime such as `20210115120000.000[-5:EST]`.
///
/// Fields are kept as written: month and day are 1-based, the day is only
/// checked against 1..31 and the second may be 60 for a leap second. The
/// offset is in minutes east of UTC.
public record OfxDateTime(int year, int month, int day, int hour, int minute, int second,
                          int millis, int offsetMinutes) {

    private static final int MIN_LENGTH = 8;
    private static final int WITH_TIME_LENGTH = 14;
    private static final int WITH_SUFFIX_LENGTH = 18;
    private static final int MAX_OFFSET_HOURS = 12;

    /// Decodes `YYYYMMDD`, `YYYYMMDDHHMMSS` or `YYYYMMDDHHMMSS[.mmm][ [±H[.0][:TZ]] ]`.
    ///
    /// The fractional part of the timezone hour is read but must be zero: the
    /// format does not say whether it counts minutes or tenths of an hour.
    /// @return the decoded value, or empty when any field is malformed
    public static Optional<OfxDateTime> parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final int len = text.length();
        if (len < MIN_LENGTH) {
            return Optional.empty();
        }
        final int year = fixedDigits(text, 0, 4);
        final int month = fixedDigits(text, 4, 2);
        final int day = fixedDigits(text, 6, 2);
        if (year < 0 || month < 1 || month > 12 || day < 1 || day > 31) {
            return Optional.empty();
        }
        if (len == MIN_LENGTH) {
            return Optional.of(new OfxDateTime(year, month, day, 0, 0, 0, 0, 0));
        }
        if (len < WITH_TIME_LENGTH) {
            return Optional.empty();
        }

        final int hour = fixedDigits(text, 8, 2);
        final int minute = fixedDigits(text, 10, 2);
        final int second = fixedDigits(text, 12, 2);
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59 || second < 0 || second > 60) {
            return Optional.empty();
        }
        if (len == WITH_TIME_LENGTH) {
            return Optional.of(new OfxDateTime(year, month, day, hour, minute, second, 0, 0));
        }
        if (len < WITH_SUFFIX_LENGTH) {
            return Optional.empty();
        }

        int i = WITH_TIME_LENGTH;
        int millis = 0;
        if (text.charAt(i) == '.') {
            millis = fixedDigits(text, ++i, 3);
            if (millis < 0) {
                return Optional.empty();
            }
            i += 3;
        }
        i = OfxValues.skipSpace(text, i);
        if (i >= len) {
            return Optional.of(new OfxDateTime(year, month, day, hour, minute, second, millis, 0));
        }
        final Integer offset = parseZone(text, i);
        return offset == null
            ? Optional.empty()
            : Optional.of(new OfxDateTime(year, month, day, hour, minute, second, millis, offset));
    }

    /// Parses `[±H[.F][:NAME]]` followed by nothing but whitespace.
    /// @return the offset in minutes, or null when malformed
    private static Integer parseZone(String text, int i) {
        final int len = text.length();
        if (text.charAt(i) != '[') {
            return null;
        }
        i = OfxValues.skipSpace(text, i + 1);
        if (i >= len) {
            return null;
        }
        boolean negative = false;
        if (text.charAt(i) == '-' || text.charAt(i) == '+') {
            negative = text.charAt(i) == '-';
            if (++i >= len) {
                return null;
            }
        }

        final int hoursStart = i;
        long hours = 0;
        while (i < len && isDigit(text.charAt(i))) {
            hours = Math.min(hours * 10 + (text.charAt(i) - '0'), Integer.MAX_VALUE);
            i++;
        }
        if (i == hoursStart || hours > MAX_OFFSET_HOURS || i >= len) {
            return null;
        }
        int minutes = (int) hours * 60;

        if (text.charAt(i) == '.') {
            if (++i >= len) {
                return null;
            }
            final int fractionStart = i;
            boolean nonZero = false;
            while (i < len && isDigit(text.charAt(i))) {
                nonZero |= text.charAt(i) != '0';
                i++;
            }
            // TODO: decide whether a fractional hour counts minutes or tenths once a real sample shows up
            if (i == fractionStart || nonZero) {
                return null;
            }
        }
        if (negative) {
            minutes = -minutes;
        }

        i = OfxValues.skipSpace(text, i);
        if (i >= len) {
            return null;
        }
        if (text.charAt(i) == ':') {
            i = text.indexOf(']', i + 1);
            if (i < 0) {
                return null;
            }
        }
        if (text.charAt(i) != ']') {
            return null;
        }
        i = OfxValues.skipSpace(text, i + 1);
        return i < len ? null : minutes;
    }

    /// @return the value of exactly `count` digits at `pos`, or -1
    private static int fixedDigits(String text, int pos, int count) {
        if (pos + count > text.length()) {
            return -1;
        }
        int value = 0;
        for (int i = pos; i < pos + count; i++) {
            final char ch = text.charAt(i);
            if (!isDigit(ch)) {
                return -1;
            }
            value = value * 10 + (ch - '0');
        }
        return value;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    /// Renders `YYYY-MM-DDTHH:MM:SS` with `Z` for a zero offset and `±HH:MM` otherwise.
    /// Milliseconds are not rendered.
    public String toIsoString() {
        final var sb = new StringBuilder(25);
        sb.append(String.format(Locale.ROOT, "%04d-%02d-%02dT%02d:%02d:%02d", year, month, day, hour, minute, second));
        if (offsetMinutes == 0) {
            sb.append('Z');
        } else {
            final int abs = Math.abs(offsetMinutes);
            sb.append(offsetMinutes < 0 ? '-' : '+');
            sb.append(String.format(Locale.ROOT, "%02d:%02d", abs / 60, abs % 60));
        }
        return sb.toString();
    }

    /// Renders the value in OFX form, `YYYYMMDDHHMMSS.mmm[±H:GMT]`.
    /// @throws IllegalStateException if the offset is not a whole number of hours,
    ///         which the OFX form cannot carry
    public String toOfxString() {
        if (offsetMinutes % 60 != 0) {
            throw new IllegalStateException("Offset of " + offsetMinutes + " minutes is not a whole hour");
        }
        final int hours = offsetMinutes / 60;
        return String.format(Locale.ROOT, "%04d%02d%02d%02d%02d%02d.%03d[%s%d:GMT]",
            year, month, day, hour, minute, second, millis, hours > 0 ? "+" : "", hours);
    }
}
