package cir.lang;

import java.util.List;
import java.util.stream.Collectors;

import lombok.NonNull;

/**
 * Syntax tree produced by {@link Parser}. Nodes own their children; lists are
 * copied on construction so a tree never shares structure.
 */
public sealed interface Node {

    <R, C> R accept(Visitor<R, C> visitor, C context);

    /**
     * A reference to a CIR type. Non-empty {@code dimensions} make it the
     * compound {@code Array} form over the element type {@code name}.
     */
    record TypeRef(@NonNull String name, @NonNull List<String> dimensions) {

        public TypeRef {
            dimensions = List.copyOf(dimensions);
        }

        static TypeRef of(String name) {
            return new TypeRef(name, List.of());
        }

        boolean isArray() {
            return !dimensions.isEmpty();
        }

        @Override
        public String toString() {
            if (!isArray()) {
                return name;
            }
            return "Array[" + name + "]" + dimensions.stream()
                .map(d -> "[" + d + "]")
                .collect(Collectors.joining());
        }
    }

    record Parameter(@NonNull TypeRef type, @NonNull String name) {}

    record Comment(@NonNull String text) implements Node {

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitComment(this, context);
        }
    }

    record Declaration(@NonNull String type, @NonNull List<Token> names, boolean mutable) implements Node {

        public Declaration {
            names = List.copyOf(names);
        }

        Declaration asMutable() {
            return new Declaration(type, names, true);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitDeclaration(this, context);
        }
    }

    record Assignment(@NonNull Token name, @NonNull List<Token> expression) implements Node {

        public Assignment {
            expression = List.copyOf(expression);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitAssignment(this, context);
        }
    }

    record Structure(@NonNull String name, @NonNull Node body) implements Node {

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitStructure(this, context);
        }
    }

    record MethodDeclaration(
        @NonNull String name,
        @NonNull List<Parameter> parameters,
        TypeRef returnType,
        @NonNull List<Node> body) implements Node {

        public MethodDeclaration {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitMethodDeclaration(this, context);
        }
    }

    record MethodCall(@NonNull Token callee, @NonNull List<Token> arguments) implements Node {

        public MethodCall {
            arguments = List.copyOf(arguments);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitMethodCall(this, context);
        }
    }

    record If(@NonNull List<Token> condition, @NonNull List<Node> body) implements Node {

        public If {
            condition = List.copyOf(condition);
            body = List.copyOf(body);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitIf(this, context);
        }
    }

    record ElseIf(@NonNull List<Token> condition, @NonNull List<Node> body) implements Node {

        public ElseIf {
            condition = List.copyOf(condition);
            body = List.copyOf(body);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitElseIf(this, context);
        }
    }

    record Else(@NonNull List<Node> body) implements Node {

        public Else {
            body = List.copyOf(body);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitElse(this, context);
        }
    }

    record While(@NonNull List<Token> condition, @NonNull List<Node> body) implements Node {

        public While {
            condition = List.copyOf(condition);
            body = List.copyOf(body);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitWhile(this, context);
        }
    }

    record For(@NonNull List<Token> from, @NonNull List<Token> to, @NonNull List<Node> body) implements Node {

        public For {
            from = List.copyOf(from);
            to = List.copyOf(to);
            body = List.copyOf(body);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitFor(this, context);
        }
    }

    record Repeat(@NonNull List<Token> count, @NonNull List<Node> body) implements Node {

        public Repeat {
            count = List.copyOf(count);
            body = List.copyOf(body);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitRepeat(this, context);
        }
    }

    record Choose(@NonNull Token mode, @NonNull List<Option> options) implements Node {

        public Choose {
            options = List.copyOf(options);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitChoose(this, context);
        }
    }

    record Option(@NonNull Token name, @NonNull List<Node> body) implements Node {

        public Option {
            body = List.copyOf(body);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitOption(this, context);
        }
    }

    record Pass() implements Node {

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitPass(this, context);
        }
    }

    record Todo() implements Node {

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitTodo(this, context);
        }
    }

    record DefaultDefine(@NonNull Token mode, @NonNull Token option) implements Node {

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitDefaultDefine(this, context);
        }
    }

    record Define(@NonNull Token mode, @NonNull Token option) implements Node {

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitDefine(this, context);
        }
    }

    record SetMode(@NonNull Token mode, @NonNull List<Token> options) implements Node {

        public SetMode {
            options = List.copyOf(options);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitSetMode(this, context);
        }
    }

    record Return(@NonNull List<Token> expression) implements Node {

        public Return {
            expression = List.copyOf(expression);
        }

        public <R, C> R accept(Visitor<R, C> visitor, C context) {
            return visitor.visitReturn(this, context);
        }
    }

    interface Visitor<R, C> {
        R visitComment(Comment node, C context);
        R visitDeclaration(Declaration node, C context);
        R visitAssignment(Assignment node, C context);
        R visitStructure(Structure node, C context);
        R visitMethodDeclaration(MethodDeclaration node, C context);
        R visitMethodCall(MethodCall node, C context);
        R visitIf(If node, C context);
        R visitElseIf(ElseIf node, C context);
        R visitElse(Else node, C context);
        R visitWhile(While node, C context);
        R visitFor(For node, C context);
        R visitRepeat(Repeat node, C context);
        R visitChoose(Choose node, C context);
        R visitOption(Option node, C context);
        R visitPass(Pass node, C context);
        R visitTodo(Todo node, C context);
        R visitDefaultDefine(DefaultDefine node, C context);
        R visitDefine(Define node, C context);
        R visitSetMode(SetMode node, C context);
        R visitReturn(Return node, C context);
    }
}
