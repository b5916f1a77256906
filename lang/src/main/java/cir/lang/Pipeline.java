package cir.lang;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * The compiler as a pure function from CIR source to C text. Shells that read
 * files, show results or report errors wrap this class; it performs no I/O.
 */
@RequiredArgsConstructor
public final class Pipeline {

    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    /**
     * Observes the intermediate results of one {@link #compile(String, Listener)} run.
     */
    interface Listener {

        default void scanned(List<Token> tokens) {}

        default void parsed(List<Node> nodes) {}

        /** Called for every parser warning, also when parsing then fails. */
        default void warning(Parser.Message warning) {
            var token = warning.token();
            log.warn("{} [line {}, col {}]", warning.message(), token.line(), token.column());
        }

        /** Called before the parse error propagates. */
        default void parseFailed(List<Token> remaining, List<Node> partial) {}
    }

    private static final Listener LOGGING = new Listener() {};

    private final @NonNull Options options;

    public Pipeline() {
        this(Options.defaults());
    }

    /**
     * @throws CompileException on the first lexical, indentation, grammar or
     *         semantic error; no partial output is produced
     */
    public String compile(String source) {
        return compile(source, LOGGING);
    }

    String compile(String source, @NonNull Listener listener) {
        var tokens = new Scanner(source).getTokens();
        listener.scanned(tokens);

        var parser = new Parser(new TokenStream(tokens));
        List<Node> nodes;
        try {
            nodes = parser.parse();
        } catch (CompileException ex) {
            listener.parseFailed(parser.remaining(), parser.partial());
            throw ex;
        } finally {
            parser.getWarnings().forEach(listener::warning);
        }
        listener.parsed(nodes);

        return new Generator(options).generate(nodes);
    }
}
