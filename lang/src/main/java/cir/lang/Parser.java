package cir.lang;

import static cir.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Indentation-sensitive recursive-descent parser. Blocks have no delimiters:
 * a construct that owns a body parses the following lines at one level deeper
 * than its own header, and the first shallower line hands control back to the
 * enclosing block.
 */
@RequiredArgsConstructor
final class Parser {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    public static record Message(Token token, String message) {}

    /** Outcome of one pass over a logical line. */
    private enum Step {
        CONSUMED,
        DONE
    }

    private static record ModeValue(Token mode, Token option) {}

    @FunctionalInterface
    private interface LineParser<T extends Node> {
        void parse(int level, List<T> into);
    }

    private final @NonNull TokenStream tokens;

    private final Indentation indentation = new Indentation();

    private final Set<String> typeNames = new LinkedHashSet<>(List.of("Int", "Byte", "Array"));

    private final List<Node> partial = new ArrayList<>();

    @Getter
    private final List<Message> warnings = new ArrayList<>();

    public List<Node> parse() {
        partial.clear();
        block(0, this::statement, partial);
        return List.copyOf(partial);
    }

    boolean isTypeName(String word) {
        return typeNames.contains(word);
    }

    /**
     * Tokens not consumed yet; after a failure this starts at the offending line.
     */
    List<Token> remaining() {
        return tokens.remaining();
    }

    /**
     * Top-level nodes completed so far.
     */
    List<Node> partial() {
        return List.copyOf(partial);
    }

    //// block structure ////

    private <T extends Node> List<T> block(int minLevel, LineParser<T> lineParser) {
        var nodes = new ArrayList<T>();
        block(minLevel, lineParser, nodes);
        return nodes;
    }

    private <T extends Node> void block(int minLevel, LineParser<T> lineParser, List<T> into) {
        log.debug("parsing block at level {}", minLevel);
        while (!tokens.isAtEnd()) {
            var before = tokens.mark();
            var step = step(minLevel, lineParser, into);
            if (step == Step.DONE) {
                break;
            }
            if (tokens.mark() <= before) {
                throw new CompileException(CompileException.Phase.INTERNAL, tokens.peekHidden(),
                    "parser made no progress on a line");
            }
        }
    }

    private <T extends Node> Step step(int minLevel, LineParser<T> lineParser, List<T> into) {
        skipBlankLines();
        if (tokens.isAtEnd()) {
            return Step.DONE;
        }

        var snapshot = indentation.snapshot(tokens);
        var level = indentation.measure(tokens);
        if (level < minLevel) {
            indentation.restore(tokens, snapshot);
            return Step.DONE;
        }

        lineParser.parse(level, into);
        return Step.CONSUMED;
    }

    private void skipBlankLines() {
        for (;;) {
            var token = tokens.peekHidden();
            if (token == null) {
                return;
            }
            if (token.is(LINE_BREAK)) {
                tokens.advanceHidden();
            } else if (token.is(SPACES) && lineEndsAfterSpaces()) {
                // whitespace-only line, not an indentation sample
                tokens.advanceHidden();
            } else {
                return;
            }
        }
    }

    private boolean lineEndsAfterSpaces() {
        var mark = tokens.mark();
        tokens.advanceHidden();
        var next = tokens.peekHidden();
        tokens.reset(mark);
        return next == null || next.is(LINE_BREAK);
    }

    //// statements ////

    private void statement(int level, List<Node> into) {
        var token = tokens.peekHidden();
        if (token.is(COMMENT)) {
            tokens.advanceHidden();
            into.add(new Node.Comment(token.lexeme()));
            return;
        }

        if (token.is(KEYWORD)) {
            into.add(keywordStatement(level, token, into));
            return;
        }

        var node = headExpression();
        if (node == null) {
            throw error(token, "Unhandled token: " + token);
        }
        into.add(node);
    }

    private Node keywordStatement(int level, Token token, List<Node> siblings) {
        var keyword = Keyword.lookup(token.lexeme());
        if (!token.lexeme().equals(token.lexeme().toUpperCase(Locale.ROOT))) {
            var upper = token.lexeme().toUpperCase(Locale.ROOT);
            warning(token, "Keywords should be in all UPPERCASE, like '" + upper
                + "'. If you meant something else, do not use a keyword here.");
        }

        switch (keyword) {
            case STRUCTURE:
                return structure(level);
            case METHOD:
                return method(level);
            case PASS:
                tokens.advance();
                endOfLine("PASS");
                return new Node.Pass();
            case TODO:
                tokens.advance();
                endOfLine("TODO");
                return new Node.Todo();
            case DEFAULT: {
                var value = keywordEquals("DEFAULT");
                return new Node.DefaultDefine(value.mode(), value.option());
            }
            case DEFINE: {
                var value = keywordEquals("DEFINE");
                return new Node.Define(value.mode(), value.option());
            }
            case SETMODE:
                return setMode();
            case MUTABLE:
                return mutable();
            case REPEAT:
                return repeat(level);
            case IF:
                tokens.advance();
                return new Node.If(condition("IF"), body(level));
            case ELSEIF:
                requireIfBefore(token, siblings);
                tokens.advance();
                return new Node.ElseIf(condition("ELSEIF"), body(level));
            case ELSE:
                requireIfBefore(token, siblings);
                tokens.advance();
                consume(COLON, "Expected ':' after ELSE");
                endOfLine("ELSE");
                return new Node.Else(body(level));
            case WHILE:
                tokens.advance();
                return new Node.While(condition("WHILE"), body(level));
            case FOR:
                return forLoop(level);
            case CHOOSE:
                return choose(level);
            case RETURN: {
                tokens.advance();
                var expression = restOfLine();
                endOfLine("RETURN");
                return new Node.Return(expression);
            }
            default:
                throw error(token, "Unexpected keyword: " + keyword);
        }
    }

    /**
     * <pre>
     *  head        :: TYPE "(" names ")" | WORD "(" arguments ")" | WORD "=" expression
     * </pre>
     * Returns {@code null} when the line does not start with any of these.
     */
    private Node headExpression() {
        if (checkSequence(WORD, PAREN_LEFT)) {
            var word = tokens.advance();
            tokens.advance();
            if (isTypeName(word.lexeme())) {
                return declaration(word);
            }
            var arguments = arguments(word);
            endOfLine("call to " + word.lexeme());
            return new Node.MethodCall(word, arguments);
        }

        if (checkSequence(WORD, SET_EQUALS)) {
            var name = tokens.advance();
            var equals = tokens.advance();
            var expression = restOfLine();
            if (expression.isEmpty()) {
                throw error(equals, "Expected expression after '=' in assignment to " + name.lexeme());
            }
            endOfLine("assignment to " + name.lexeme());
            return new Node.Assignment(name, expression);
        }

        return null;
    }

    private Node.Declaration declaration(Token type) {
        var names = parameterized(type.lexeme() + " declaration");
        if (names.isEmpty()) {
            throw error(type, "Expected 1 or more variables for " + type.lexeme() + " variable declaration.");
        }
        endOfLine(type.lexeme() + " declaration");
        return new Node.Declaration(type.lexeme(), names, false);
    }

    /**
     * <pre>
     *  mutable     :: "MUTABLE" declaration
     * </pre>
     */
    private Node mutable() {
        var keyword = tokens.advance();
        if (checkSequence(WORD, PAREN_LEFT) && isTypeName(tokens.peek().lexeme())) {
            var type = tokens.advance();
            tokens.advance();
            return declaration(type).asMutable();
        }
        throw error(keyword, "Declaration must follow MUTABLE");
    }

    /**
     * <pre>
     *  structure   :: "STRUCTURE" WORD ":" EOL INDENT ( declaration | "PASS" | "TODO" )
     * </pre>
     */
    private Node structure(int level) {
        var keyword = tokens.advance();
        var name = consume(WORD, "Malformed STRUCTURE command");
        consume(COLON, "Malformed STRUCTURE command");
        endOfLine("STRUCTURE");
        typeNames.add(name.lexeme());

        var children = withoutComments(block(level + 1, this::statement));
        if (children.isEmpty()) {
            throw error(keyword, "STRUCTURE " + name.lexeme() + " requires a body");
        }
        if (children.size() > 1) {
            throw error(keyword, "Complex structures currently unimplemented");
        }

        var child = children.get(0);
        if (!(child instanceof Node.Declaration
                || child instanceof Node.Pass
                || child instanceof Node.Todo)) {
            throw error(keyword, "STRUCTURE " + name.lexeme() + " must contain a declaration or a placeholder");
        }
        return new Node.Structure(name.lexeme(), child);
    }

    /**
     * <pre>
     *  method      :: "METHOD" WORD ( "(" parameters ")" )? ( "->" type )? ":" EOL body
     * </pre>
     */
    private Node method(int level) {
        var keyword = tokens.advance();
        if (level != 0) {
            throw error(keyword, "Can only have method declarations at base level");
        }
        var name = consume(WORD, "Malformed METHOD command");

        List<Node.Parameter> parameters = List.of();
        if (check(PAREN_LEFT)) {
            tokens.advance();
            parameters = parameters(name);
        }

        Node.TypeRef returnType = null;
        if (check(RETURN_TYPE)) {
            tokens.advance();
            returnType = typeRef("Malformed return type indicator");
        }

        consume(COLON, "Expected colon following METHOD argument list");
        endOfLine("METHOD " + name.lexeme());

        log.debug("method {} at level {}", name.lexeme(), level);
        return new Node.MethodDeclaration(name.lexeme(), parameters, returnType, block(level + 1, this::statement));
    }

    /**
     * <pre>
     *  parameters  :: ( type ","? WORD ","? )* ")"
     * </pre>
     * Commas are optional anywhere in the list; entries are read in type/name pairs.
     */
    private List<Node.Parameter> parameters(Token method) {
        var runaway = "Runaway parameter list for METHOD " + method.lexeme();
        var parameters = new ArrayList<Node.Parameter>();
        for (;;) {
            skipCommas(method, runaway);
            if (check(PAREN_RIGHT)) {
                break;
            }
            var type = typeRef("Expected a list of type-name pairs");
            skipCommas(method, runaway);
            var name = consume(WORD, "Expected a list of type-name pairs");
            parameters.add(new Node.Parameter(type, name.lexeme()));
        }
        tokens.advance();
        return parameters;
    }

    private void skipCommas(Token construct, String runaway) {
        requireOnLine(construct, runaway);
        while (check(COMMA)) {
            tokens.advance();
            requireOnLine(construct, runaway);
        }
    }

    /**
     * <pre>
     *  type        :: WORD | "Array" "[" WORD "]" ( "[" ( NUMBER | WORD ) "]" )+
     * </pre>
     */
    private Node.TypeRef typeRef(String message) {
        var word = consume(WORD, message);
        if (!"Array".equals(word.lexeme()) || !checkOperator("[")) {
            return Node.TypeRef.of(word.lexeme());
        }

        consumeOperator("[", message);
        var element = consume(WORD, "Expected element type inside Array[...]");
        consumeOperator("]", "Expected ']' after Array element type");

        var dimensions = new ArrayList<String>();
        while (checkOperator("[")) {
            tokens.advance();
            var dimension = tokens.peek();
            if (dimension == null || !(dimension.is(NUMBER) || dimension.is(WORD))) {
                throw error(dimension != null ? dimension : word, "Expected Array dimension");
            }
            tokens.advance();
            dimensions.add(dimension.lexeme());
            consumeOperator("]", "Expected ']' after Array dimension");
        }
        if (dimensions.isEmpty()) {
            throw error(element, "Array of " + element.lexeme() + " needs at least one dimension");
        }
        return new Node.TypeRef(element.lexeme(), dimensions);
    }

    /**
     * <pre>
     *  setmode     :: "SETMODE" WORD "(" WORD ( "," WORD )* ")"
     * </pre>
     */
    private Node setMode() {
        var keyword = tokens.peek();
        if (!checkSequence(KEYWORD, WORD, PAREN_LEFT)) {
            throw error(keyword, "Malformed SETMODE command");
        }
        tokens.advance();
        var mode = tokens.advance();
        tokens.advance();

        var options = parameterized("SETMODE " + mode.lexeme());
        if (options.isEmpty()) {
            throw error(mode, "Malformed SETMODE command: mode " + mode.lexeme() + " has no options");
        }
        var seen = new LinkedHashSet<String>();
        for (var option : options) {
            if (!seen.add(option.lexeme())) {
                throw error(option, "Duplicate option " + option.lexeme() + " in SETMODE " + mode.lexeme());
            }
        }
        endOfLine("SETMODE");
        return new Node.SetMode(mode, options);
    }

    /**
     * <pre>
     *  default     :: "DEFAULT" WORD "=" WORD
     *  define      :: "DEFINE" WORD "=" WORD
     * </pre>
     */
    private ModeValue keywordEquals(String construct) {
        var keyword = tokens.peek();
        if (!checkSequence(KEYWORD, WORD, SET_EQUALS)) {
            throw error(keyword, "Malformed " + construct + " command");
        }
        tokens.advance();
        var name = tokens.advance();
        tokens.advance();

        var value = tokens.peek();
        if (value == null || !(value.is(WORD) || value.is(NUMBER))) {
            throw error(keyword, "Malformed " + construct + " command");
        }
        tokens.advance();
        endOfLine(construct);
        return new ModeValue(name, value);
    }

    /**
     * <pre>
     *  repeat      :: "REPEAT" expression "TIMES" ":" EOL body
     * </pre>
     */
    private Node repeat(int level) {
        var keyword = tokens.advance();
        var count = new ArrayList<Token>();
        for (;;) {
            var token = tokens.peekHidden();
            if (token == null || token.is(LINE_BREAK) || token.is(COMMENT)) {
                throw error(keyword, "Runaway REPEAT loop");
            }
            if (token.isKeyword(Keyword.TIMES)) {
                break;
            }
            count.add(tokens.advanceHidden());
        }
        if (isBlank(count)) {
            throw error(keyword, "REPEAT needs a count before TIMES");
        }
        tokens.advance();
        consume(COLON, "Expected ':' after TIMES");
        endOfLine("REPEAT");
        return new Node.Repeat(count, body(level));
    }

    /**
     * <pre>
     *  for         :: "FOR" expression "TO" expression ":" EOL body
     * </pre>
     */
    private Node forLoop(int level) {
        var keyword = tokens.advance();
        var from = new ArrayList<Token>();
        for (;;) {
            var token = tokens.peekHidden();
            if (token == null || token.is(LINE_BREAK) || token.is(COMMENT)) {
                throw error(keyword, "Runaway FOR loop: expected TO");
            }
            if (token.isKeyword(Keyword.TO)) {
                break;
            }
            from.add(tokens.advanceHidden());
        }
        if (from.stream().noneMatch(t -> t.is(WORD))) {
            throw error(keyword, "Malformed FOR command: no loop variable before TO");
        }
        tokens.advance();
        var to = condition("FOR");
        return new Node.For(from, to, body(level));
    }

    /**
     * <pre>
     *  choose      :: "CHOOSE" WORD ":" EOL INDENT ( ( WORD | NUMBER ) ":" EOL body )+
     * </pre>
     */
    private Node choose(int level) {
        var keyword = tokens.advance();
        var mode = consume(WORD, "Malformed CHOOSE command");
        consume(COLON, "Malformed CHOOSE command");
        endOfLine("CHOOSE");

        var options = block(level + 1, this::option);
        if (options.isEmpty()) {
            throw error(keyword, "CHOOSE " + mode.lexeme() + " requires at least one option");
        }
        return new Node.Choose(mode, options);
    }

    private void option(int level, List<Node.Option> into) {
        var token = tokens.peekHidden();
        if (token.is(COMMENT)) {
            tokens.advanceHidden();
            return;
        }
        var name = tokens.peek();
        if (name == null || !(name.is(WORD) || name.is(NUMBER))) {
            throw error(name != null ? name : tokens.previous(), "Expected option name in CHOOSE block");
        }
        tokens.advance();
        consume(COLON, "Expected ':' after option " + name.lexeme());
        endOfLine("option " + name.lexeme());
        into.add(new Node.Option(name, body(level)));
    }

    //// shared pieces ////

    private List<Node> body(int level) {
        log.debug("descending {} -> {}", level, level + 1);
        return block(level + 1, this::statement);
    }

    /**
     * Tokens of a block header up to its trailing ':', which is consumed.
     */
    private List<Token> condition(String construct) {
        var header = restOfLine();
        var last = header.isEmpty() ? null : header.get(header.size() - 1);
        if (last == null || !last.is(COLON)) {
            throw error(last != null ? last : tokens.previous(), "Expected ':' at end of " + construct + " header");
        }
        var condition = header.subList(0, header.size() - 1);
        if (isBlank(condition)) {
            throw error(last, "Expected expression in " + construct + " header");
        }
        endOfLine(construct);
        return List.copyOf(condition);
    }

    /**
     * Everything up to the line break or a trailing comment, without the
     * surrounding spaces.
     */
    private List<Token> restOfLine() {
        var result = new ArrayList<Token>();
        tokens.skipHidden();
        for (;;) {
            var token = tokens.peekHidden();
            if (token == null || token.is(LINE_BREAK) || token.is(COMMENT)) {
                break;
            }
            result.add(tokens.advanceHidden());
        }
        while (!result.isEmpty() && result.get(result.size() - 1).is(SPACES)) {
            result.remove(result.size() - 1);
        }
        return result;
    }

    /**
     * <pre>
     *  parameterized :: ( ( WORD | NUMBER ) ( ","? ( WORD | NUMBER ) )* )? ")"
     * </pre>
     * The opening parenthesis has already been consumed.
     */
    private List<Token> parameterized(String construct) {
        var declared = new ArrayList<Token>();
        for (;;) {
            var token = tokens.peekHidden();
            if (token == null || token.is(LINE_BREAK)) {
                throw error(token != null ? token : tokens.previous(), "Runaway parameter list for " + construct);
            }
            if (token.is(PAREN_RIGHT)) {
                break;
            }
            if (token.is(WORD) || token.is(NUMBER)) {
                declared.add(token);
            } else if (!token.is(COMMA) && !token.is(SPACES)) {
                throw error(token, "Unexpected token: " + token);
            }
            tokens.advanceHidden();
        }
        tokens.advanceHidden();
        return declared;
    }

    /**
     * Raw argument tokens up to the matching ')', which is consumed.
     */
    private List<Token> arguments(Token callee) {
        var arguments = new ArrayList<Token>();
        var depth = 0;
        for (;;) {
            var token = tokens.peekHidden();
            if (token == null || token.is(LINE_BREAK) || token.is(COMMENT)) {
                throw error(callee, "Runaway argument list for call to " + callee.lexeme());
            }
            tokens.advanceHidden();
            if (token.is(PAREN_RIGHT)) {
                if (depth == 0) {
                    return arguments;
                }
                depth--;
            } else if (token.is(PAREN_LEFT)) {
                depth++;
            }
            arguments.add(token);
        }
    }

    private void endOfLine(String construct) {
        tokens.skipHidden();
        var token = tokens.peekHidden();
        if (token != null && token.is(COMMENT)) {
            tokens.advanceHidden();
            token = tokens.peekHidden();
        }
        if (token != null && !token.is(LINE_BREAK)) {
            throw error(token, "Unexpected token after " + construct + ": " + token);
        }
    }

    private void requireIfBefore(Token keyword, List<Node> siblings) {
        for (int i = siblings.size() - 1; i >= 0; i--) {
            var sibling = siblings.get(i);
            if (sibling instanceof Node.Comment) {
                continue;
            }
            if (sibling instanceof Node.If || sibling instanceof Node.ElseIf) {
                return;
            }
            break;
        }
        throw error(keyword, keyword.lexeme().toUpperCase(Locale.ROOT) + " without a preceding IF");
    }

    private void requireOnLine(Token construct, String message) {
        var token = tokens.peek();
        if (token == null || token.is(LINE_BREAK)) {
            throw error(construct, message);
        }
    }

    private static boolean isBlank(List<Token> tokens) {
        return tokens.stream().allMatch(t -> t.is(SPACES));
    }

    private static List<Node> withoutComments(List<Node> nodes) {
        var result = new ArrayList<Node>();
        for (var node : nodes) {
            if (!(node instanceof Node.Comment)) {
                result.add(node);
            }
        }
        return result;
    }

    //// utility methods ////

    private Token consume(Token.Type type, String message) {
        if (check(type)) {
            return tokens.advance();
        }
        var found = tokens.peek();
        throw error(found != null ? found : tokens.previous(), message);
    }

    private void consumeOperator(String lexeme, String message) {
        if (!checkOperator(lexeme)) {
            var found = tokens.peek();
            throw error(found != null ? found : tokens.previous(), message);
        }
        tokens.advance();
    }

    private boolean check(Token.Type type) {
        var token = tokens.peek();
        return token != null && token.is(type);
    }

    private boolean checkOperator(String lexeme) {
        var token = tokens.peek();
        return token != null && token.is(OPERATOR) && token.lexeme().equals(lexeme);
    }

    /**
     * Whether the next visible tokens have the given types, ignoring spaces
     * between them.
     */
    private boolean checkSequence(Token.Type... types) {
        for (int i = 0; i < types.length; i++) {
            var token = tokens.peek(i);
            if (token == null || !token.is(types[i])) {
                return false;
            }
        }
        return true;
    }

    private CompileException error(Token token, String message) {
        return new CompileException(CompileException.Phase.GRAMMAR, token, message);
    }

    private void warning(Token token, String message) {
        log.debug("warning: {} [line {}, col {}]", message, token.line(), token.column());
        warnings.add(new Message(token, message));
    }
}
