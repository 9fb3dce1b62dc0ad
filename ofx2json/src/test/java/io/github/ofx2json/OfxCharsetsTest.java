package io.github.ofx2json;

import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class OfxCharsetsTest extends Ofx2JsonTestBase {

    private static byte[] ascii(String text) {
        return text.getBytes(StandardCharsets.US_ASCII);
    }

    @Test
    void sgmlCodePageIsWindowsCharset() {
        final byte[] doc = ascii("OFXHEADER:100\nENCODING:USASCII\nCHARSET:1252\n\n<OFX></OFX>");
        assertThat(OfxCharsets.detect(doc)).isEqualTo(Charset.forName("windows-1252"));
    }

    @Test
    void sgmlUtf8Encoding() {
        final byte[] doc = ascii("OFXHEADER:100\r\nENCODING:UTF-8\r\nCHARSET:NONE\r\n\r\n<OFX></OFX>");
        assertThat(OfxCharsets.detect(doc)).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void sgmlLatin1AndNoneCharsets() {
        assertThat(OfxCharsets.detect(ascii("OFXHEADER:100\nCHARSET:ISO-8859-1\n<OFX>")))
            .isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(OfxCharsets.detect(ascii("OFXHEADER:100\nENCODING:USASCII\nCHARSET:NONE\n<OFX>")))
            .isEqualTo(OfxCharsets.SGML_DEFAULT);
        assertThat(OfxCharsets.detect(ascii("OFXHEADER:100\n<OFX>")))
            .isEqualTo(OfxCharsets.SGML_DEFAULT);
    }

    @Test
    void xmlPrologEncoding() {
        assertThat(OfxCharsets.detect(ascii("<?xml version=\"1.0\" encoding=\"ISO-8859-1\"?>\n<OFX></OFX>")))
            .isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(OfxCharsets.detect(ascii("<?xml version='1.0' encoding='utf-8'?><OFX></OFX>")))
            .isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void unsupportedNamesFallBack() {
        assertThat(OfxCharsets.detect(ascii("<?xml version=\"1.0\" encoding=\"NO-SUCH-CHARSET\"?><OFX>")))
            .isEqualTo(StandardCharsets.UTF_8);
        assertThat(OfxCharsets.detect(ascii("OFXHEADER:100\nCHARSET:NOSUCH\n<OFX>")))
            .isEqualTo(OfxCharsets.SGML_DEFAULT);
    }

    @Test
    void noHeaderMeansUtf8() {
        assertThat(OfxCharsets.detect(ascii("<OFX><A>1</OFX>"))).isEqualTo(StandardCharsets.UTF_8);
        assertThat(OfxCharsets.detect(new byte[0])).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void onlyTheHeaderIsInspected() {
        final byte[] doc = ascii("<OFX><MEMO>CHARSET:1252\n</OFX>");
        assertThat(OfxCharsets.detect(doc)).isEqualTo(StandardCharsets.UTF_8);
    }

    @Test
    void decodesWithTheDetectedCharset() {
        final byte[] header = ascii("OFXHEADER:100\nCHARSET:1252\n<OFX><NAME>Caf");
        final byte[] doc = new byte[header.length + 1];
        System.arraycopy(header, 0, doc, 0, header.length);
        doc[header.length] = (byte) 0xE9;
        assertThat(OfxCharsets.decode(doc)).endsWith("Caf\u00E9");
    }
}
