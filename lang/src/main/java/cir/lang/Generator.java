package cir.lang;

import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Walks the syntax tree depth-first and emits a C skeleton. Each call to
 * {@link #generate} runs against a fresh {@link Context}, so the same tree
 * always produces the same text.
 */
@RequiredArgsConstructor
final class Generator implements Node.Visitor<Void, Context> {

    private static final Logger log = LoggerFactory.getLogger(Generator.class);

    static final String PLACEHOLDER = "//TODO:";

    private final @NonNull Options options;

    Generator() {
        this(Options.defaults());
    }

    public String generate(List<Node> nodes) {
        var context = new Context(options);
        for (var node : nodes) {
            node.accept(this, context);
        }
        return context.getEmitter().render();
    }

    //// declarations ////

    @Override
    public Void visitComment(Node.Comment node, Context context) {
        return null;
    }

    @Override
    public Void visitDeclaration(Node.Declaration node, Context context) {
        var first = node.names().get(0);
        if ("Array".equals(node.type())) {
            throw new CompileException(CompileException.Phase.SEMANTIC, first,
                "Array declarations are only supported inside STRUCTURE");
        }

        var cType = context.getTypes().resolve(first, node.type());
        for (var name : node.names()) {
            context.getVariables().declare(name.lexeme(), cType, node.mutable());
        }

        // immutable names only exist as macros, see visitAssignment
        if (node.mutable()) {
            var names = node.names().stream().map(Token::lexeme).collect(Collectors.joining(", "));
            context.getEmitter().emit(cType + " " + names + ";");
        }
        return null;
    }

    @Override
    public Void visitAssignment(Node.Assignment node, Context context) {
        var variable = context.getVariables().lookup(node.name());
        var name = node.name().lexeme();
        var expression = ExpressionRenderer.render(node.expression());

        var emitter = context.getEmitter();
        if (variable.mutable()) {
            emitter.emit(name + " = " + expression + ";");
            return null;
        }

        context.getVariables().define(node.name());
        var macro = "#define " + name + " ((" + variable.cType() + ") " + expression + ")";
        if (context.isTopLevel()) {
            emitter.header(macro);
        } else {
            emitter.directive(macro);
            context.getLocalMacros().add(name);
        }
        return null;
    }

    @Override
    public Void visitStructure(Node.Structure node, Context context) {
        var name = node.name();
        var types = context.getTypes();
        var body = node.body();

        if (body instanceof Node.Declaration declaration) {
            if (!"Array".equals(declaration.type())) {
                throw new CompileException(CompileException.Phase.SEMANTIC, declaration.names().get(0),
                    "Structure " + name + " of " + declaration.type() + " is not implemented, only Array structures are");
            }
            var declared = declaration.names();
            if (declared.size() < 2) {
                throw new CompileException(CompileException.Phase.SEMANTIC, declared.get(0),
                    "Array structure " + name + " needs at least one dimension");
            }
            var element = types.resolve(declared.get(0), declared.get(0).lexeme());
            var dimensions = declared.subList(1, declared.size()).stream()
                .map(token -> "[" + token.lexeme() + "]")
                .collect(Collectors.joining());
            context.getEmitter().header("typedef " + element + " " + name + dimensions + ";");
        } else if (body instanceof Node.Pass || body instanceof Node.Todo) {
            context.getEmitter().header("typedef struct " + name + " " + name + ";");
        } else {
            throw new CompileException(CompileException.Phase.SEMANTIC,
                "Structure " + name + " must have a variable declaration");
        }

        types.addStructure(name);
        return null;
    }

    @Override
    public Void visitMethodDeclaration(Node.MethodDeclaration node, Context context) {
        if (!context.isTopLevel()) {
            throw new CompileException(CompileException.Phase.SEMANTIC,
                "Can only have method declarations at base level: " + node.name());
        }

        var types = context.getTypes();
        var returnType = "void";
        if (node.returnType() != null) {
            if (node.returnType().isArray()) {
                throw new CompileException(CompileException.Phase.SEMANTIC,
                    "METHOD " + node.name() + " cannot return an array");
            }
            returnType = types.resolve(null, node.returnType().name());
        }

        for (var parameter : node.parameters()) {
            var cType = types.resolve(null, parameter.type().name());
            context.getVariables().declare(parameter.name(), cType, true);
        }
        var signature = node.parameters().stream()
            .map(p -> types.declare(null, p.type(), p.name()))
            .collect(Collectors.joining(", "));
        if (signature.isEmpty()) {
            signature = "void";
        }

        var prototype = returnType + " " + node.name() + "(" + signature + ")";
        log.debug("method {}", prototype);
        context.getEmitter().header(prototype + ";");
        block(prototype, node.body(), context);

        // undefine the macros local to this body
        var locals = context.getLocalMacros();
        for (var macro : locals) {
            context.getEmitter().directive("#undef " + macro);
        }
        locals.clear();
        return null;
    }

    //// statements ////

    @Override
    public Void visitMethodCall(Node.MethodCall node, Context context) {
        if (context.isTopLevel()) {
            throw new CompileException(CompileException.Phase.SEMANTIC, node.callee(),
                "Cannot call method at top level");
        }
        // argument types are traced only, never checked
        if (log.isDebugEnabled()) {
            var inferred = node.arguments().stream()
                .filter(t -> t.is(Token.Type.WORD) || t.is(Token.Type.NUMBER))
                .map(t -> t.lexeme() + ":" + context.getVariables().infer(t).orElse("?"))
                .collect(Collectors.joining(", "));
            log.debug("call {}({})", node.callee().lexeme(), inferred);
        }
        var arguments = ExpressionRenderer.render(node.arguments());
        context.getEmitter().emit(node.callee().lexeme() + "(" + arguments + ");");
        return null;
    }

    @Override
    public Void visitIf(Node.If node, Context context) {
        block("if(" + ExpressionRenderer.render(node.condition()) + ")", node.body(), context);
        return null;
    }

    @Override
    public Void visitElseIf(Node.ElseIf node, Context context) {
        block("else if(" + ExpressionRenderer.render(node.condition()) + ")", node.body(), context);
        return null;
    }

    @Override
    public Void visitElse(Node.Else node, Context context) {
        block("else", node.body(), context);
        return null;
    }

    @Override
    public Void visitWhile(Node.While node, Context context) {
        block("while(" + ExpressionRenderer.render(node.condition()) + ")", node.body(), context);
        return null;
    }

    @Override
    public Void visitFor(Node.For node, Context context) {
        var iterator = node.from().stream()
            .filter(t -> t.is(Token.Type.WORD))
            .findFirst()
            .orElseThrow(() -> new CompileException(CompileException.Phase.SEMANTIC, "FOR loop without a loop variable"));
        var name = iterator.lexeme();

        var initializer = ExpressionRenderer.render(node.from());
        if (node.from().stream().noneMatch(t -> t.is(Token.Type.SET_EQUALS))) {
            initializer = name + " = 0";
        }

        var variables = context.getVariables();
        var existing = variables.find(name);
        if (existing.isEmpty() || !existing.get().mutable()) {
            initializer = iteratorType(node.to(), context) + " " + initializer;
        }

        var bound = ExpressionRenderer.render(node.to());
        block("for(" + initializer + "; " + name + " <= " + bound + "; " + name + "++)", node.body(), context);
        return null;
    }

    /**
     * The declared type of a bound that is a single variable, {@code int} otherwise.
     */
    private String iteratorType(List<Token> bound, Context context) {
        var visible = bound.stream().filter(t -> !t.is(Token.Type.SPACES)).collect(Collectors.toList());
        if (visible.size() == 1) {
            return context.getVariables().infer(visible.get(0)).orElse("int");
        }
        return "int";
    }

    @Override
    public Void visitRepeat(Node.Repeat node, Context context) {
        var count = ExpressionRenderer.render(node.count());
        try (var temporary = context.getTemporaries().acquire(node.count().get(0))) {
            var name = temporary.getName();
            block("for(int " + name + " = 0; " + name + " < " + count + "; " + name + "++)", node.body(), context);
        }
        return null;
    }

    @Override
    public Void visitChoose(Node.Choose node, Context context) {
        var modes = context.getModes();
        var emitter = context.getEmitter();
        var first = true;
        for (var option : node.options()) {
            var mode = modes.validate(node.mode(), option.name());
            emitter.directive((first ? "#if" : "#elif") + " defined(" + mode.macro(option.name().lexeme()) + ")");
            option.accept(this, context);
            first = false;
        }
        emitter.directive("#endif");
        return null;
    }

    @Override
    public Void visitOption(Node.Option node, Context context) {
        for (var child : node.body()) {
            child.accept(this, context);
        }
        return null;
    }

    @Override
    public Void visitPass(Node.Pass node, Context context) {
        context.getEmitter().emit(PLACEHOLDER);
        return null;
    }

    @Override
    public Void visitTodo(Node.Todo node, Context context) {
        context.getEmitter().emit(PLACEHOLDER);
        return null;
    }

    @Override
    public Void visitReturn(Node.Return node, Context context) {
        if (context.isTopLevel()) {
            throw new CompileException(CompileException.Phase.SEMANTIC, "RETURN outside of a METHOD");
        }
        var expression = ExpressionRenderer.render(node.expression());
        context.getEmitter().emit(expression.isEmpty() ? "return;" : "return " + expression + ";");
        return null;
    }

    //// modes ////

    @Override
    public Void visitSetMode(Node.SetMode node, Context context) {
        var mode = context.getModes().register(node.mode(), node.options());
        var macros = mode.getOptions().stream().map(mode::macro).collect(Collectors.joining(" | "));
        context.getEmitter().header("/** " + mode.getName() + ": " + macros + " **/");
        return null;
    }

    @Override
    public Void visitDefaultDefine(Node.DefaultDefine node, Context context) {
        var mode = context.getModes().validate(node.mode(), node.option());
        var condition = mode.getOptions().stream()
            .map(option -> "!defined(" + mode.macro(option) + ")")
            .collect(Collectors.joining(" && "));

        var emitter = context.getEmitter();
        emitter.header("#if " + condition);
        emitter.header("  #define " + mode.macro(node.option().lexeme()));
        emitter.header("#endif");

        if (mode.getSelection() == null) {
            mode.select(node.option().lexeme());
        }
        return null;
    }

    @Override
    public Void visitDefine(Node.Define node, Context context) {
        var mode = context.getModes().validate(node.mode(), node.option());
        var emitter = context.getEmitter();
        mode.currentMacro().ifPresent(previous -> emitter.header("#undef " + previous));
        emitter.header("#define " + mode.macro(node.option().lexeme()));
        mode.select(node.option().lexeme());
        return null;
    }

    //// utility methods ////

    private void block(String opener, List<Node> body, Context context) {
        var emitter = context.getEmitter();
        emitter.emit(opener + " {");
        emitter.openGroup();
        context.enter();
        for (var child : body) {
            child.accept(this, context);
        }
        context.leave();
        emitter.closeGroup();
        emitter.emit("}");
    }
}
