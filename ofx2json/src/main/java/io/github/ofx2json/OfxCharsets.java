package io.github.ofx2json;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Picks the charset of raw OFX bytes from the document header.
///
/// OFX 1.x opens with an SGML header of `KEY:VALUE` lines, where `ENCODING`
/// is `USASCII` or `UTF-8` and `CHARSET` names a code page such as `1252`.
/// OFX 2.x opens with an XML prolog carrying `encoding="..."`. Only the bytes
/// before the root marker are inspected.
public final class OfxCharsets {

    private static final Logger LOG = Logger.getLogger(OfxCharsets.class.getName());

    /// Used for an SGML header that names no usable charset.
    public static final Charset SGML_DEFAULT = Charset.forName("windows-1252");

    private static final int MAX_HEADER_BYTES = 4096;
    private static final Pattern XML_ENCODING = Pattern.compile("<\\?xml[^>]*?encoding\\s*=\\s*[\"']([^\"']+)[\"']");
    private static final Pattern SGML_ENCODING = Pattern.compile("(?m)^\\s*ENCODING\\s*:\\s*(\\S+)");
    private static final Pattern SGML_CHARSET = Pattern.compile("(?m)^\\s*CHARSET\\s*:\\s*(\\S+)");
    private static final Pattern SGML_HEADER = Pattern.compile("(?m)^\\s*OFXHEADER\\s*:");

    private OfxCharsets() {}

    /// {@return the charset the header declares; UTF-8 when there is no header}
    public static Charset detect(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        final String header = header(bytes);

        final Matcher xml = XML_ENCODING.matcher(header);
        if (xml.find()) {
            return lookup(xml.group(1), StandardCharsets.UTF_8);
        }

        final Matcher encoding = SGML_ENCODING.matcher(header);
        final boolean declaresEncoding = encoding.find();
        if (declaresEncoding && isUtf8(encoding.group(1))) {
            return StandardCharsets.UTF_8;
        }
        final Matcher charset = SGML_CHARSET.matcher(header);
        if (charset.find()) {
            return codePage(charset.group(1));
        }
        return declaresEncoding || SGML_HEADER.matcher(header).find() ? SGML_DEFAULT : StandardCharsets.UTF_8;
    }

    /// {@return the bytes decoded with [#detect]}
    public static String decode(byte[] bytes) {
        return new String(bytes, detect(bytes));
    }

    /// Header bytes are ASCII in every charset OFX allows, so Latin-1 reads them faithfully.
    private static String header(byte[] bytes) {
        final int limit = Math.min(bytes.length, MAX_HEADER_BYTES);
        final String head = new String(bytes, 0, limit, StandardCharsets.ISO_8859_1);
        final int root = head.indexOf("<OFX");
        return root < 0 ? head : head.substring(0, root);
    }

    private static boolean isUtf8(String value) {
        final String normalized = value.toUpperCase(Locale.ROOT).replace("-", "");
        return normalized.equals("UTF8") || normalized.equals("UNICODE");
    }

    private static Charset codePage(String value) {
        final String name = value.toUpperCase(Locale.ROOT);
        switch (name) {
            case "NONE":
                return SGML_DEFAULT;
            case "8859-1":
            case "ISO-8859-1":
                return StandardCharsets.ISO_8859_1;
            default:
                break;
        }
        if (name.chars().allMatch(Character::isDigit)) {
            return lookup("windows-" + name, SGML_DEFAULT);
        }
        return lookup(name, SGML_DEFAULT);
    }

    private static Charset lookup(String name, Charset fallback) {
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> "Unsupported charset '" + name + "' in OFX header, using " + fallback);
            return fallback;
        }
    }
}
