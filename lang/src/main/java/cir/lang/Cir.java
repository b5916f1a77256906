package cir.lang;

import static lombok.AccessLevel.PRIVATE;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor(access = PRIVATE)
public class Cir {

    private static final Logger log = LoggerFactory.getLogger(Cir.class);

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERROR = 1;
    static final int EXIT_USAGE = 64;
    static final int EXIT_IO = 74;

    private static final String USAGE = String.join("\n",
        "Usage: cir [options] [script | -]",
        "  --tokens       print the scanned tokens",
        "  --ast          print the syntax tree",
        "  --debug        on a parse failure, print unconsumed tokens and partial nodes",
        "  --indent=N     indent generated C by N spaces per level (default " + Options.DEFAULT_INDENT_WIDTH + ")",
        "  --temps=N      number of pooled loop counters (default " + Options.DEFAULT_TEMPORARY_COUNT + ")",
        "  -o FILE        write the generated C to FILE instead of stdout");

    public static void main(String[] args) throws IOException {
        System.exit(execute(args));
    }

    static int execute(String[] args) throws IOException {
        Flags flags;
        try {
            flags = Flags.parse(args);
        } catch (IllegalArgumentException ex) {
            System.err.println("cir: " + ex.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        if (flags.help) {
            System.out.println(USAGE);
            return EXIT_OK;
        }
        if (flags.script != null) {
            return runFile(flags.script, flags);
        }
        return runPrompt(flags);
    }

    private static int runFile(String path, Flags flags) {
        byte[] bytes;
        try {
            if ("-".equals(path)) {
                bytes = System.in.readAllBytes();
            } else {
                bytes = Files.readAllBytes(Paths.get(path));
            }
        } catch (IOException ex) {
            System.err.println("cir: cannot read " + path + ": " + ex.getMessage());
            return EXIT_IO;
        }

        var output = new StringBuilder();
        var exitCode = run(new String(bytes, StandardCharsets.UTF_8), flags, output);
        if (exitCode != EXIT_OK) {
            return exitCode;
        }
        return write(output.toString(), flags);
    }

    private static int write(String output, Flags flags) {
        if (flags.output == null) {
            System.out.println(output);
            return EXIT_OK;
        }
        try {
            Files.writeString(Paths.get(flags.output), output + "\n", StandardCharsets.UTF_8);
            log.info("wrote {}", flags.output);
            return EXIT_OK;
        } catch (IOException ex) {
            System.err.println("cir: cannot write " + flags.output + ": " + ex.getMessage());
            return EXIT_IO;
        }
    }

    private static int runPrompt(Flags flags) throws IOException {
        var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));

        var lineBuffer = new ArrayList<String>();
        for (;;) {
            var prompt = String.format(":%02d> ", lineBuffer.size());
            System.out.print(prompt);
            var line = reader.readLine();

            if (line == null || ":q".equals(line)) {
                break;
            } else if (":b".equals(line)) {
                int n = 0;
                for (var l : lineBuffer) {
                    System.out.println(String.format("%02d  %s", ++n, l));
                }
            } else if (line.startsWith(":tok")) {
                var arg = line.substring(4).trim();
                if (!arg.isBlank()) {
                    flags.printTokens = Boolean.parseBoolean(arg);
                }
                System.out.println("print tokens: " + flags.printTokens);
            } else if (line.startsWith(":ast")) {
                var arg = line.substring(4).trim();
                if (!arg.isBlank()) {
                    flags.printAst = Boolean.parseBoolean(arg);
                }
                System.out.println("print ast: " + flags.printAst);
            } else if (!line.isBlank()) {
                lineBuffer.add(line);
            } else if (!lineBuffer.isEmpty()) {
                // an empty line ends the unit, since blocks have no closing token
                var output = new StringBuilder();
                if (run(String.join("\n", lineBuffer), flags, output) == EXIT_OK) {
                    System.out.println(output);
                }
                lineBuffer.clear();
            }
        }
        return EXIT_OK;
    }

    private static int run(String source, Flags flags, StringBuilder output) {
        var listener = new Pipeline.Listener() {
            @Override
            public void scanned(List<Token> tokens) {
                if (flags.printTokens) {
                    tokens.forEach(System.out::println);
                }
            }

            @Override
            public void parsed(List<Node> nodes) {
                if (flags.printAst) {
                    nodes.forEach(System.out::println);
                }
            }

            @Override
            public void warning(Parser.Message warning) {
                report(warning);
            }

            @Override
            public void parseFailed(List<Token> remaining, List<Node> partial) {
                if (flags.debug) {
                    dump(remaining, partial);
                }
            }
        };

        try {
            output.append(new Pipeline(flags.options()).compile(source, listener));
        } catch (CompileException ex) {
            report(ex);
            return EXIT_COMPILE_ERROR;
        }
        return EXIT_OK;
    }

    private static void report(CompileException error) {
        var position = error.hasPosition()
            ? " [line " + error.getLine() + ", col " + error.getColumn() + "]"
            : "";
        System.err.println(error.getPhase() + ": " + error.getMessage() + position);
    }

    private static void report(Parser.Message warning) {
        var token = warning.token();
        System.err.println("warning: " + warning.message() + " [line " + token.line() + ", col " + token.column() + "]");
    }

    private static void dump(List<Token> remaining, List<Node> partial) {
        System.err.println("Remaining tokens:");
        for (var token : remaining) {
            System.err.println("    " + token);
        }
        System.err.println("Partial nodes:");
        for (var node : partial) {
            System.err.println("    " + node);
        }
    }

    static class Flags {
        boolean printTokens = false;
        boolean printAst = false;
        boolean debug = false;
        boolean help = false;
        int indentWidth = Options.DEFAULT_INDENT_WIDTH;
        int temporaryCount = Options.DEFAULT_TEMPORARY_COUNT;
        String output = null;
        String script = null;

        Options options() {
            return new Options(indentWidth, temporaryCount, Options.DEFAULT_TEMPORARY_PREFIX);
        }

        static Flags parse(String... args) {
            var flags = new Flags();
            for (int i = 0; i < args.length; i++) {
                var arg = args[i];
                if ("--tokens".equals(arg)) {
                    flags.printTokens = true;
                } else if ("--ast".equals(arg)) {
                    flags.printAst = true;
                } else if ("--debug".equals(arg)) {
                    flags.debug = true;
                } else if ("-h".equals(arg) || "--help".equals(arg)) {
                    flags.help = true;
                } else if (arg.startsWith("--indent=")) {
                    flags.indentWidth = number(arg, 0);
                } else if (arg.startsWith("--temps=")) {
                    flags.temporaryCount = number(arg, 1);
                } else if ("-o".equals(arg)) {
                    if (i + 1 >= args.length) {
                        throw new IllegalArgumentException("-o needs a file name");
                    }
                    flags.output = args[++i];
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("unknown option " + arg);
                } else if (flags.script == null) {
                    flags.script = arg;
                } else {
                    throw new IllegalArgumentException("only one script may be given");
                }
            }
            return flags;
        }

        private static int number(String arg, int min) {
            var text = arg.substring(arg.indexOf('=') + 1);
            int value;
            try {
                value = Integer.parseInt(text);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("not a number in " + arg);
            }
            if (value < min) {
                throw new IllegalArgumentException(arg + " must be at least " + min);
            }
            return value;
        }
    }
}
