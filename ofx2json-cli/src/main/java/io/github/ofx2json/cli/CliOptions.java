package io.github.ofx2json.cli;

import java.nio.charset.Charset;
import java.nio.file.Path;

/// Parsed command line of `ofx2json`.
///
/// @param input the OFX file, or null for standard input
/// @param output the JSON file, or null for standard output
/// @param quiet suppress notices and error messages
/// @param pretty indent the JSON
/// @param schema a schema table file replacing the built-in one, or null
/// @param charset forces the input charset instead of reading it from the header, or null
/// @param help print usage and exit
record CliOptions(Path input, Path output, boolean quiet, boolean pretty, Path schema, Charset charset, boolean help) {

    static final String USAGE = """
        Usage: ofx2json [options] [OFXFILE|-]
        Converts an OFX statement to JSON. Reads standard input when no file or '-' is given.
          -o, --output FILE   write JSON to FILE instead of standard output
          -q, --quiet         no notices or error messages, only the exit code
              --pretty        indent the JSON output
              --schema FILE   use the schema table in FILE instead of the built-in one
              --charset NAME  decode the input as NAME instead of the header's charset
          -h, --help          print this help""";

    /// @throws IllegalArgumentException for an unknown option, a missing option
    ///         value, an unsupported charset or more than one input file
    static CliOptions parse(String... args) {
        Path input = null;
        Path output = null;
        boolean quiet = false;
        boolean pretty = false;
        Path schema = null;
        Charset charset = null;
        boolean help = false;
        boolean inputSeen = false;
        boolean optionsEnded = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            if (!optionsEnded && arg.startsWith("--") && arg.indexOf('=') > 0) {
                inlineValue = arg.substring(arg.indexOf('=') + 1);
                arg = arg.substring(0, arg.indexOf('='));
            }
            if (optionsEnded || arg.equals("-") || !arg.startsWith("-")) {
                if (inputSeen) {
                    throw new IllegalArgumentException("Only one input file may be given, got '" + arg + "' as well");
                }
                inputSeen = true;
                input = arg.equals("-") && !optionsEnded ? null : Path.of(arg);
                continue;
            }
            switch (arg) {
                case "--" -> optionsEnded = true;
                case "-o", "--output" -> {
                    output = Path.of(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    inlineValue = null;
                }
                case "--schema" -> {
                    schema = Path.of(inlineValue != null ? inlineValue : value(args, ++i, arg));
                    inlineValue = null;
                }
                case "--charset" -> {
                    final String name = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    inlineValue = null;
                    charset = charset(name);
                }
                case "-q", "--quiet" -> quiet = true;
                case "--pretty" -> pretty = true;
                case "-h", "--help" -> help = true;
                default -> throw new IllegalArgumentException("Unknown option '" + arg + "'");
            }
            if (inlineValue != null) {
                throw new IllegalArgumentException("Option '" + arg + "' takes no value");
            }
        }
        return new CliOptions(input, output, quiet, pretty, schema, charset, help);
    }

    private static Charset charset(String name) {
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported charset '" + name + "'", e);
        }
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length || args[index].isEmpty()) {
            throw new IllegalArgumentException("Option '" + option + "' needs a value");
        }
        return args[index];
    }
}
