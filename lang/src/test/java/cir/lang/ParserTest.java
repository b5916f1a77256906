package cir.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

public class ParserTest {

    Parser parser;

    private List<Node> parse(String... lines) {
        var tokens = new Scanner(String.join("\n", lines)).getTokens();
        parser = new Parser(new TokenStream(tokens));
        return parser.parse();
    }

    private CompileException parseError(String... lines) {
        return assertThrows(CompileException.class, () -> parse(lines));
    }

    private static List<String> lexemes(List<Token> tokens) {
        return tokens.stream()
            .filter(t -> !t.is(Token.Type.SPACES))
            .map(Token::lexeme)
            .collect(Collectors.toList());
    }

    @Test
    void declarationAndAssignment() {
        var nodes = parse("Int(x, y)", "x = 5");
        assertEquals(2, nodes.size());

        var declaration = assertInstanceOf(Node.Declaration.class, nodes.get(0));
        assertEquals("Int", declaration.type());
        assertEquals(List.of("x", "y"), lexemes(declaration.names()));
        assertFalse(declaration.mutable());

        var assignment = assertInstanceOf(Node.Assignment.class, nodes.get(1));
        assertEquals("x", assignment.name().lexeme());
        assertEquals(List.of("5"), lexemes(assignment.expression()));
    }

    @Test
    void mutableDeclaration() {
        var nodes = parse("MUTABLE Byte(counter)");
        var declaration = assertInstanceOf(Node.Declaration.class, nodes.get(0));
        assertEquals("Byte", declaration.type());
        assertTrue(declaration.mutable());
    }

    @Test
    void mutableNeedsDeclaration() {
        var ex = parseError("MUTABLE x = 5");
        assertEquals(CompileException.Phase.GRAMMAR, ex.getPhase());
        assertEquals("Declaration must follow MUTABLE", ex.getMessage());

        assertEquals("Declaration must follow MUTABLE", parseError("MUTABLE foo(x)").getMessage());
    }

    @Test
    void methodWithParameters() {
        var nodes = parse("METHOD add(Int a, Int b):", "    RETURN a+b");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        assertEquals("add", method.name());
        assertEquals(List.of(
                new Node.Parameter(Node.TypeRef.of("Int"), "a"),
                new Node.Parameter(Node.TypeRef.of("Int"), "b")),
            method.parameters());
        assertNull(method.returnType());

        var ret = assertInstanceOf(Node.Return.class, method.body().get(0));
        assertEquals(List.of("a", "+", "b"), lexemes(ret.expression()));
    }

    @Test
    void methodWithArrayParameterAndReturnType() {
        var nodes = parse("METHOD mix(Array[Byte][4][4] state, Int n) -> Byte:", "    PASS");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        assertEquals(new Node.TypeRef("Byte", List.of("4", "4")), method.parameters().get(0).type());
        assertEquals("state", method.parameters().get(0).name());
        assertEquals(Node.TypeRef.of("Byte"), method.returnType());
    }

    @Test
    void methodWithoutParameters() {
        var nodes = parse("METHOD main:", "    PASS");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        assertTrue(method.parameters().isEmpty());
        assertInstanceOf(Node.Pass.class, method.body().get(0));
    }

    @Test
    void parameterCommasAreOptional() {
        var expected = List.of(
            new Node.Parameter(Node.TypeRef.of("Int"), "a"),
            new Node.Parameter(new Node.TypeRef("Byte", List.of("2")), "b"));
        for (var header : List.of(
                "METHOD f(Int a, Array[Byte][2] b):",
                "METHOD f(Int a Array[Byte][2] b):",
                "METHOD f(Int, a, Array[Byte][2], b):")) {
            var method = assertInstanceOf(Node.MethodDeclaration.class, parse(header, "    PASS").get(0));
            assertEquals(expected, method.parameters(), header);
        }
        assertEquals("Runaway parameter list for METHOD f", parseError("METHOD f(Int a,", "    PASS").getMessage());
    }

    @Test
    void parameterListsComeInPairs() {
        assertEquals("Expected a list of type-name pairs", parseError("METHOD f(Int):", "    PASS").getMessage());
    }

    @Test
    void nestedBlocksReturnToTheirParent() {
        var nodes = parse(
            "METHOD main:",
            "    IF x:",
            "        a()",
            "        WHILE y:",
            "            b()",
            "    c()",
            "METHOD other:",
            "    PASS");
        assertEquals(2, nodes.size());

        var main = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        assertEquals(2, main.body().size());
        var ifNode = assertInstanceOf(Node.If.class, main.body().get(0));
        assertEquals("c", assertInstanceOf(Node.MethodCall.class, main.body().get(1)).callee().lexeme());

        assertEquals(2, ifNode.body().size());
        assertEquals("a", assertInstanceOf(Node.MethodCall.class, ifNode.body().get(0)).callee().lexeme());
        var whileNode = assertInstanceOf(Node.While.class, ifNode.body().get(1));
        assertEquals(List.of("y"), lexemes(whileNode.condition()));
        assertEquals(1, whileNode.body().size());

        var other = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(1));
        assertInstanceOf(Node.Pass.class, other.body().get(0));
    }

    @Test
    void bodyMayBeEmpty() {
        var nodes = parse("METHOD first:", "METHOD second:", "    PASS");
        assertEquals(2, nodes.size());
        assertTrue(assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0)).body().isEmpty());
    }

    @Test
    void firstIndentFixesUnit() {
        var nodes = parse("METHOD m:", "  IF x:", "    a()");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        assertEquals(1, assertInstanceOf(Node.If.class, method.body().get(0)).body().size());

        var ex = parseError("METHOD m:", "  IF x:", "     a()");
        assertEquals(CompileException.Phase.INDENTATION, ex.getPhase());
        assertEquals("Improper indentation: Expected a multiple of 2 space(s), got 5.", ex.getMessage());
        assertEquals(3, ex.getLine());
    }

    @Test
    void tabsIndent() {
        var nodes = parse("METHOD m:", "\tIF x:", "\t\ta()");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        assertEquals(1, assertInstanceOf(Node.If.class, method.body().get(0)).body().size());
    }

    @Test
    void whitespaceOnlyLinesDoNotFixUnit() {
        var nodes = parse("METHOD m:", "   ", "    IF x:", "", "        a()");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        assertEquals(1, assertInstanceOf(Node.If.class, method.body().get(0)).body().size());
    }

    @Test
    void methodsOnlyAtBaseLevel() {
        var ex = parseError("METHOD m:", "    METHOD n:", "        PASS");
        assertEquals("Can only have method declarations at base level", ex.getMessage());
    }

    @Test
    void arrayStructure() {
        var nodes = parse("STRUCTURE Block:", "    Array(Byte, 4, 4)", "Block(b)");
        var structure = assertInstanceOf(Node.Structure.class, nodes.get(0));
        assertEquals("Block", structure.name());
        var body = assertInstanceOf(Node.Declaration.class, structure.body());
        assertEquals("Array", body.type());
        assertEquals(List.of("Byte", "4", "4"), lexemes(body.names()));

        // structure names become type names
        var declaration = assertInstanceOf(Node.Declaration.class, nodes.get(1));
        assertEquals("Block", declaration.type());
    }

    @Test
    void placeholderStructure() {
        var nodes = parse("STRUCTURE State:", "    // opaque for now", "    TODO");
        var structure = assertInstanceOf(Node.Structure.class, nodes.get(0));
        assertInstanceOf(Node.Todo.class, structure.body());
    }

    @Test
    void structureNeedsExactlyOneChild() {
        assertEquals("Complex structures currently unimplemented",
            parseError("STRUCTURE Pair:", "    Int(a)", "    Int(b)").getMessage());
        assertEquals("STRUCTURE Pair requires a body", parseError("STRUCTURE Pair:").getMessage());
        assertEquals("Malformed STRUCTURE command", parseError("STRUCTURE Pair", "    PASS").getMessage());
    }

    @Test
    void callArgumentsKeepNesting() {
        var nodes = parse("METHOD m:", "    foo(a + 1, g(b))");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        var call = assertInstanceOf(Node.MethodCall.class, method.body().get(0));
        assertEquals("foo", call.callee().lexeme());
        assertEquals(List.of("a", "+", "1", ",", "g", "(", "b", ")"), lexemes(call.arguments()));
    }

    @Test
    void runawayArguments() {
        assertEquals("Runaway argument list for call to foo", parseError("METHOD m:", "    foo(a", "").getMessage());
    }

    @Test
    void modeCommands() {
        var nodes = parse("SETMODE LEVEL(LOW, HIGH)", "DEFAULT LEVEL = LOW", "DEFINE LEVEL=HIGH");

        var setMode = assertInstanceOf(Node.SetMode.class, nodes.get(0));
        assertEquals("LEVEL", setMode.mode().lexeme());
        assertEquals(List.of("LOW", "HIGH"), lexemes(setMode.options()));

        var defaultDefine = assertInstanceOf(Node.DefaultDefine.class, nodes.get(1));
        assertEquals("LEVEL", defaultDefine.mode().lexeme());
        assertEquals("LOW", defaultDefine.option().lexeme());

        var define = assertInstanceOf(Node.Define.class, nodes.get(2));
        assertEquals("HIGH", define.option().lexeme());
    }

    @Test
    void malformedModeCommands() {
        assertEquals("Malformed SETMODE command", parseError("SETMODE LEVEL").getMessage());
        assertEquals("Malformed DEFINE command", parseError("DEFINE LEVEL HIGH").getMessage());
        assertEquals("Malformed DEFAULT command", parseError("DEFAULT = LOW").getMessage());
        assertEquals("Duplicate option LOW in SETMODE LEVEL", parseError("SETMODE LEVEL(LOW, LOW)").getMessage());
    }

    @Test
    void runawayDeclaration() {
        var ex = parseError("Int(a, b");
        assertEquals(CompileException.Phase.GRAMMAR, ex.getPhase());
        assertEquals("Runaway parameter list for Int declaration", ex.getMessage());
    }

    @Test
    void unexpectedTokenInDeclaration() {
        assertTrue(parseError("Int(a + b)").getMessage().startsWith("Unexpected token: (Token OPERATOR \"+\""));
    }

    @Test
    void declarationNeedsNames() {
        assertEquals("Expected 1 or more variables for Int variable declaration.", parseError("Int()").getMessage());
    }

    @Test
    void repeat() {
        var nodes = parse("METHOD m:", "    REPEAT n + 1 TIMES:", "        a()");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0));
        var repeat = assertInstanceOf(Node.Repeat.class, method.body().get(0));
        assertEquals(List.of("n", "+", "1"), lexemes(repeat.count()));
        assertEquals(1, repeat.body().size());
    }

    @Test
    void repeatNeedsTimes() {
        assertEquals("Runaway REPEAT loop", parseError("METHOD m:", "    REPEAT 3:", "        a()").getMessage());
    }

    @Test
    void conditionalChain() {
        var nodes = parse(
            "METHOD m:",
            "    IF x is 1:",
            "        a()",
            "    ELIF x is 2:",
            "        b()",
            "    ELSE:",
            "        c()");
        var body = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0)).body();
        assertEquals(List.of("x", "is", "1"), lexemes(assertInstanceOf(Node.If.class, body.get(0)).condition()));
        assertEquals(List.of("x", "is", "2"), lexemes(assertInstanceOf(Node.ElseIf.class, body.get(1)).condition()));
        assertEquals(1, assertInstanceOf(Node.Else.class, body.get(2)).body().size());
    }

    @Test
    void elseNeedsIf() {
        assertEquals("ELSE without a preceding IF", parseError("METHOD m:", "    a()", "    ELSE:", "        b()").getMessage());
    }

    @Test
    void headerNeedsColon() {
        assertEquals("Expected ':' at end of WHILE header", parseError("METHOD m:", "    WHILE x", "        a()").getMessage());
    }

    @Test
    void forLoop() {
        var nodes = parse("METHOD m:", "    FOR i = 0 TO n - 1:", "        a(i)");
        var loop = assertInstanceOf(Node.For.class, assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0)).body().get(0));
        assertEquals(List.of("i", "=", "0"), lexemes(loop.from()));
        assertEquals(List.of("n", "-", "1"), lexemes(loop.to()));
        assertEquals(1, loop.body().size());
    }

    @Test
    void choose() {
        var nodes = parse(
            "METHOD m:",
            "    CHOOSE LEVEL:",
            "        LOW:",
            "            slow()",
            "        HIGH:",
            "            fast()",
            "            PASS",
            "    done()");
        var body = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(0)).body();
        assertEquals(2, body.size());

        var choose = assertInstanceOf(Node.Choose.class, body.get(0));
        assertEquals("LEVEL", choose.mode().lexeme());
        assertEquals(2, choose.options().size());
        assertEquals("LOW", choose.options().get(0).name().lexeme());
        assertEquals(1, choose.options().get(0).body().size());
        assertEquals("HIGH", choose.options().get(1).name().lexeme());
        assertEquals(2, choose.options().get(1).body().size());
    }

    @Test
    void chooseNumericOptions() {
        var nodes = parse(
            "SETMODE WIDTH(8, 16)",
            "METHOD m:",
            "    CHOOSE WIDTH:",
            "        8:",
            "            narrow()",
            "        16:",
            "            wide()");
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(1));
        var choose = assertInstanceOf(Node.Choose.class, method.body().get(0));
        assertEquals("8", choose.options().get(0).name().lexeme());
        assertEquals("16", choose.options().get(1).name().lexeme());

        assertEquals("Expected option name in CHOOSE block",
            parseError("METHOD m:", "    CHOOSE WIDTH:", "        (8):", "            PASS").getMessage());
    }

    @Test
    void comments() {
        var nodes = parse("// top", "METHOD m: // trailing", "    PASS // why");
        assertEquals(2, nodes.size());
        assertEquals("// top", assertInstanceOf(Node.Comment.class, nodes.get(0)).text());
        var method = assertInstanceOf(Node.MethodDeclaration.class, nodes.get(1));
        assertEquals(1, method.body().size());
    }

    @Test
    void trailingTokens() {
        assertTrue(parseError("METHOD m:", "    PASS extra").getMessage().startsWith("Unexpected token after PASS"));
    }

    @Test
    void unhandledToken() {
        var ex = parseError("5 = x");
        assertEquals(CompileException.Phase.GRAMMAR, ex.getPhase());
        assertTrue(ex.getMessage().startsWith("Unhandled token: (Token NUMBER \"5\""));
    }

    @Test
    void lowercaseKeywordsWarn() {
        var nodes = parse("method m:", "    Pass");
        assertEquals(1, nodes.size());
        assertEquals(2, parser.getWarnings().size());
        assertTrue(parser.getWarnings().get(0).message().startsWith("Keywords should be in all UPPERCASE, like 'METHOD'"));
        assertEquals("Pass", parser.getWarnings().get(1).token().lexeme());
    }

    @Test
    void diagnosticsAfterFailure() {
        parseError("Int(x)", "x = 5", "5 = x");
        assertEquals(2, parser.partial().size());
        assertEquals("5", parser.remaining().get(0).lexeme());
    }
}
