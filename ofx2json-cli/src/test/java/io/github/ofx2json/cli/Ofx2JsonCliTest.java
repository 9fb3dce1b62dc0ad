package io.github.ofx2json.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class Ofx2JsonCliTest extends CliTestBase {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String STATEMENT = """
        OFXHEADER:100
        DATA:OFXSGML
        ENCODING:USASCII
        CHARSET:1252

        <OFX>
        <SIGNONMSGSRSV1>
        <SONRS>
        <STATUS>
        <CODE>0
        <SEVERITY>INFO
        </STATUS>
        <DTSERVER>20210115120000.000[-5:EST]
        <LANGUAGE>ENG
        </SONRS>
        </SIGNONMSGSRSV1>
        </OFX>
        """;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();

    private int run(String stdin, String... args) {
        final var in = new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8));
        return Ofx2JsonCli.run(args,
            in,
            new PrintStream(stdout, true, StandardCharsets.UTF_8),
            new PrintStream(stderr, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return stderr.toString(StandardCharsets.UTF_8);
    }

    @Test
    void convertsStandardInput() throws Exception {
        assertThat(run(STATEMENT)).isEqualTo(Ofx2JsonCli.EXIT_OK);
        assertThat(out()).endsWith("\n");
        final JsonNode json = MAPPER.readTree(out());
        assertThat(json.at("/signonmsgsrsv1/sonrs/dtserver").asText()).isEqualTo("2021-01-15T12:00:00-05:00");
        assertThat(json.at("/signonmsgsrsv1/sonrs/status/severity").asText()).isEqualTo("INFO");
        assertThat(err()).isEmpty();
    }

    @Test
    void convertsFileToFile(@TempDir Path dir) throws Exception {
        final Path input = dir.resolve("statement.ofx");
        final Path output = dir.resolve("statement.json");
        Files.writeString(input, STATEMENT, StandardCharsets.US_ASCII);

        assertThat(run("", "--pretty", "-o", output.toString(), input.toString())).isEqualTo(Ofx2JsonCli.EXIT_OK);
        assertThat(out()).isEmpty();
        final String written = Files.readString(output, StandardCharsets.UTF_8);
        assertThat(written).contains("\"language\" : \"ENG\"").endsWith("}\n");
    }

    @Test
    void usesCustomSchemaTable(@TempDir Path dir) throws Exception {
        final Path table = dir.resolve("table.json");
        Files.writeString(table, """
            {"root": "OFX", "start": "main", "nodes": {
              "main": {"serialize": "suppressed", "children": {"SIGNONMSGSRSV1": "signon"}},
              "signon": {"serialize": "object"}
            }}
            """);
        assertThat(run(STATEMENT, "-q", "--schema", table.toString())).isEqualTo(Ofx2JsonCli.EXIT_OK);
        assertThat(out()).isEqualTo("{\"signonmsgsrsv1\":{}}\n");
    }

    @Test
    void helpGoesToStdout() {
        assertThat(run("", "-h")).isEqualTo(Ofx2JsonCli.EXIT_OK);
        assertThat(out()).startsWith("Usage: ofx2json");
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertThat(run("", "--bogus")).isEqualTo(Ofx2JsonCli.EXIT_USAGE);
        assertThat(err()).contains("Unknown option '--bogus'").contains("Usage: ofx2json");
        assertThat(out()).isEmpty();
    }

    @Test
    void conversionFailureExitsWithOne() {
        assertThat(run("this is not ofx")).isEqualTo(Ofx2JsonCli.EXIT_FAILURE);
        assertThat(err()).isEqualTo("ofx2json: Not an OFX file: no <OFX> found" + System.lineSeparator());
        assertThat(out()).isEmpty();
    }

    @Test
    void quietFailureWritesNothing() {
        assertThat(run("<OFX><SIGNONMSGSRSV1><SONRS></OFX>", "--quiet")).isEqualTo(Ofx2JsonCli.EXIT_FAILURE);
        assertThat(err()).isEmpty();
        assertThat(out()).isEmpty();
    }

    @Test
    void missingInputFileExitsWithOne(@TempDir Path dir) {
        assertThat(run("", dir.resolve("absent.ofx").toString())).isEqualTo(Ofx2JsonCli.EXIT_FAILURE);
        assertThat(err()).startsWith("ofx2json: I/O error:");
    }

    @Test
    void forcedCharsetOverridesTheHeader() throws Exception {
        final String doc = "OFXHEADER:100\nCHARSET:1252\n<OFX><SIGNONMSGSRSV1><SONRS><LANGUAGE>Français</SONRS></SIGNONMSGSRSV1></OFX>";
        assertThat(run(doc, "--charset", "UTF-8")).isEqualTo(Ofx2JsonCli.EXIT_OK);
        assertThat(MAPPER.readTree(out()).at("/signonmsgsrsv1/sonrs/language").asText()).isEqualTo("Français");
    }
}
