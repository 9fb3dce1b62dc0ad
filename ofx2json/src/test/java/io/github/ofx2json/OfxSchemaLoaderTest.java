package io.github.ofx2json;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OfxSchemaLoaderTest extends Ofx2JsonTestBase {

    private static final String SMALL_TABLE = """
        {
          "root": "OFX",
          "start": "main",
          "nodes": {
            "main":   { "serialize": "suppressed", "children": { "SIGNONMSGSRSV1": "signon", "OTHER": "status" } },
            "signon": { "serialize": "object", "children": { "STATUS": "status" }, "leaves": { "DTSERVER": "datetime" } },
            "status": { "serialize": "object", "leaves": { "CODE": "string", "SEVERITY": "String " } },
            "unused": { "serialize": "array" }
          }
        }
        """;

    @Test
    void resolvesNodesAndSharesReusedOnes() {
        final OfxSchema schema = OfxSchemaLoader.parse(SMALL_TABLE);
        assertThat(schema.rootTag()).isEqualTo("OFX");
        assertThat(schema.rootMarker()).isEqualTo("<OFX>");
        assertThat(schema.root().mode()).isEqualTo(SerializeMode.SUPPRESSED);

        final SchemaNode signon = schema.root().children().get("SIGNONMSGSRSV1");
        assertThat(signon.leaves()).containsEntry("DTSERVER", LeafKind.DATETIME);
        assertThat(signon.children().get("STATUS")).isSameAs(schema.root().children().get("OTHER"));
        assertThat(signon.children().get("STATUS").leaves()).containsEntry("SEVERITY", LeafKind.STRING);
    }

    @Test
    void loadsFromFileAndStream(@TempDir Path dir) throws Exception {
        final Path file = dir.resolve("table.json");
        Files.writeString(file, SMALL_TABLE);
        assertThat(OfxSchemaLoader.load(file)).isEqualTo(OfxSchemaLoader.parse(SMALL_TABLE));
        assertThat(OfxSchemaLoader.load(new ByteArrayInputStream(SMALL_TABLE.getBytes(StandardCharsets.UTF_8))).rootTag())
            .isEqualTo("OFX");
    }

    @Test
    void missingFileIsAnIoError(@TempDir Path dir) {
        assertThatThrownBy(() -> OfxSchemaLoader.load(dir.resolve("absent.json")))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void rejectsReferenceCycles() {
        assertThatThrownBy(() -> OfxSchemaLoader.parse("""
            {"root": "OFX", "start": "a", "nodes": {
              "a": {"serialize": "suppressed", "children": {"B": "b"}},
              "b": {"serialize": "object", "children": {"A": "a"}}
            }}
            """))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessage("Schema node reference cycle: a -> b -> a");
    }

    @Test
    void rejectsUnknownIdsModesAndKinds() {
        assertThatThrownBy(() -> OfxSchemaLoader.parse("""
            {"root": "OFX", "start": "main", "nodes": {"main": {"serialize": "suppressed", "children": {"X": "nope"}}}}
            """))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessage("Unknown schema node 'nope'");
        assertThatThrownBy(() -> OfxSchemaLoader.parse("""
            {"root": "OFX", "start": "main", "nodes": {"main": {"serialize": "list"}}}
            """))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessageContaining("unknown serialize mode 'list'");
        assertThatThrownBy(() -> OfxSchemaLoader.parse("""
            {"root": "OFX", "start": "main", "nodes": {"main": {"serialize": "object", "leaves": {"X": "date"}}}}
            """))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessageContaining("unknown kind");
    }

    @Test
    void rejectsMalformedTables() {
        assertThatThrownBy(() -> OfxSchemaLoader.parse("[]"))
            .isInstanceOf(OfxSchemaException.class);
        assertThatThrownBy(() -> OfxSchemaLoader.parse("{\"root\": \"OFX\", \"start\": \"main\"}"))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessageContaining("\"nodes\"");
        assertThatThrownBy(() -> OfxSchemaLoader.parse("{\"root\": \" \", \"start\": \"main\", \"nodes\": {}}"))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessageContaining("\"root\"");
        assertThatThrownBy(() -> OfxSchemaLoader.parse("{not json"))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessageStartingWith("Schema table is not valid JSON");
    }

    @Test
    void rejectsChildrenThatCannotAttachToTheirParent() {
        assertThatThrownBy(() -> OfxSchemaLoader.parse("""
            {"root": "OFX", "start": "main", "nodes": {
              "main": {"serialize": "suppressed", "children": {"L": "list"}},
              "list": {"serialize": "array", "children": {"O": "obj"}},
              "obj":  {"serialize": "object"}
            }}
            """))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessageContaining("OFX/L/O");
        assertThatThrownBy(() -> OfxSchemaLoader.parse("""
            {"root": "OFX", "start": "main", "nodes": {
              "main": {"serialize": "suppressed", "children": {"E": "elem"}},
              "elem": {"serialize": "array-element"}
            }}
            """))
            .isInstanceOf(OfxSchemaException.class)
            .hasMessageContaining("cannot be array-element");
    }

    @Test
    void loadsTheBuiltInTable() {
        final OfxSchema schema = OfxSchema.defaultSchema();
        assertThat(schema).isSameAs(OfxSchema.defaultSchema());
        assertThat(schema.rootTag()).isEqualTo("OFX");
        assertThat(schema.root().children().keySet()).containsExactly(
            "SIGNONMSGSRSV1", "SIGNUPMSGSRSV1", "BANKMSGSRSV1", "CREDITCARDMSGSRSV1",
            "INVSTMTMSGSRSV1", "SECLISTMSGSRSV1");
        assertThat(schema.root().children().get("INVSTMTMSGSRSV1").mode()).isEqualTo(SerializeMode.ARRAY);
    }
}
