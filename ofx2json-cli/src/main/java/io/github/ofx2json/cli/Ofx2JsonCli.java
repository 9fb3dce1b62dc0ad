package io.github.ofx2json.cli;

import io.github.ofx2json.Ofx2Json;
import io.github.ofx2json.Ofx2JsonConfig;
import io.github.ofx2json.OfxCharsets;
import io.github.ofx2json.OfxConversionException;
import io.github.ofx2json.OfxDiagnostics;
import io.github.ofx2json.OfxSchema;
import io.github.ofx2json.OfxSchemaException;
import io.github.ofx2json.OfxSchemaLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Objects;
import java.util.logging.Logger;

/// Command line entry point: converts one OFX file, or standard input, to JSON.
///
/// Exit status is 0 on success, 1 when the input cannot be read or converted
/// and 2 for a bad command line.
public final class Ofx2JsonCli {

    private static final Logger LOG = Logger.getLogger(Ofx2JsonCli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private Ofx2JsonCli() {}

    public static void main(String[] args) {
        final int status = run(args, System.in, System.out, System.err);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    static int run(String[] args, InputStream stdin, PrintStream stdout, PrintStream stderr) {
        Objects.requireNonNull(args, "args must not be null");
        final CliOptions options;
        try {
            options = CliOptions.parse(args);
        } catch (IllegalArgumentException e) {
            stderr.println("ofx2json: " + e.getMessage());
            stderr.println(CliOptions.USAGE);
            return EXIT_USAGE;
        }
        if (options.help()) {
            stdout.println(CliOptions.USAGE);
            stdout.flush();
            return EXIT_OK;
        }

        try {
            final String json = convert(options, stdin) + "\n";
            if (options.output() == null) {
                stdout.write(json.getBytes(StandardCharsets.UTF_8));
                stdout.flush();
            } else {
                Files.writeString(options.output(), json, StandardCharsets.UTF_8);
                LOG.fine(() -> "Wrote " + json.length() + " chars to " + options.output());
            }
            return EXIT_OK;
        } catch (OfxConversionException | OfxSchemaException e) {
            return fail(options, stderr, e.getMessage());
        } catch (IOException e) {
            return fail(options, stderr, "I/O error: " + e.getMessage());
        } catch (UncheckedIOException e) {
            return fail(options, stderr, "I/O error: " + e.getCause().getMessage());
        }
    }

    private static String convert(CliOptions options, InputStream stdin) throws IOException {
        final byte[] bytes = options.input() == null ? stdin.readAllBytes() : Files.readAllBytes(options.input());
        LOG.fine(() -> "Read " + bytes.length + " bytes from "
            + (options.input() == null ? "standard input" : options.input()));

        final OfxSchema schema = options.schema() == null
            ? OfxSchema.defaultSchema()
            : OfxSchemaLoader.load(options.schema());
        final var config = new Ofx2JsonConfig(schema, options.quiet(), options.pretty(), OfxDiagnostics.logging());
        final Ofx2Json converter = Ofx2Json.create(config);

        final String document = options.charset() == null
            ? OfxCharsets.decode(bytes)
            : new String(bytes, options.charset());
        return converter.toJson(document);
    }

    private static int fail(CliOptions options, PrintStream stderr, String message) {
        if (!options.quiet()) {
            stderr.println("ofx2json: " + message);
            stderr.flush();
        }
        return EXIT_FAILURE;
    }
}
