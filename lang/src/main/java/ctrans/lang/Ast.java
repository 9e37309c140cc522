package ctrans.lang;

import java.util.List;

import lombok.NonNull;

/**
 * Syntax tree produced by the {@link Parser}.
 * <p>
 * The node set is closed. Consumers match on it through {@link Visitor}, which
 * has one method per node kind. Nodes are immutable and lists are copied on
 * construction, so a tree is never shared or changed after parsing. Fields
 * documented as optional hold {@code null} when the source left them out.
 */
public interface Ast {

    <R> R accept(Visitor<R> visitor);

    /**
     * Root node. {@code body} is only null for a hand-built, malformed root.
     */
    record Program(List<Ast> body) implements Ast {

        public Program {
            body = body == null ? null : List.copyOf(body);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitProgram(this);
        }
    }

    record Include(@NonNull String library) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitInclude(this);
        }
    }

    record Parameter(@NonNull String type, @NonNull String name) {}

    record Function(
            @NonNull String returnType,
            @NonNull String name,
            @NonNull List<Parameter> parameters,
            @NonNull List<Ast> body) implements Ast {

        public Function {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }

        public boolean isMain() {
            return "main".equals(name);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    /**
     * Declaration; {@code value} is optional.
     */
    record Variable(@NonNull String dataType, @NonNull String name, Ast value) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    /**
     * {@code x = v}, {@code x += v} and friends, or {@code x++}/{@code x--}
     * with no {@code value}.
     */
    record Assignment(@NonNull String identifier, @NonNull String operator, Ast value) implements Ast {

        public boolean isStep() {
            return "++".equals(operator) || "--".equals(operator);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    /**
     * All three parts are optional. An {@code else if} chain is an
     * IfStatement in {@code elseBranch}.
     */
    record IfStatement(Ast condition, Ast thenBranch, Ast elseBranch) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIfStatement(this);
        }
    }

    record WhileLoop(Ast condition, Ast body) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhileLoop(this);
        }
    }

    record ForLoop(Ast init, Ast condition, Ast update, Ast body) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitForLoop(this);
        }
    }

    record ReturnStatement(Ast value) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturnStatement(this);
        }
    }

    record PrintfStatement(@NonNull List<Ast> arguments) implements Ast {

        public PrintfStatement {
            arguments = List.copyOf(arguments);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrintfStatement(this);
        }
    }

    record ScanfStatement(@NonNull List<Ast> arguments) implements Ast {

        public ScanfStatement {
            arguments = List.copyOf(arguments);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitScanfStatement(this);
        }
    }

    record FunctionCall(@NonNull String name, @NonNull List<Ast> arguments) implements Ast {

        public FunctionCall {
            arguments = List.copyOf(arguments);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunctionCall(this);
        }
    }

    record Block(@NonNull List<Ast> body) implements Ast {

        public Block {
            body = List.copyOf(body);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    record BinaryExpression(@NonNull Ast left, @NonNull String operator, @NonNull Ast right) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBinaryExpression(this);
        }
    }

    record UnaryExpression(@NonNull String operator, @NonNull Ast operand) implements Ast {

        public boolean isAddressOf() {
            return "&".equals(operator);
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnaryExpression(this);
        }
    }

    record Literal(@NonNull String value, @NonNull Subtype subtype) implements Ast {

        public enum Subtype {
            INT,
            FLOAT,
            STRING;
        }

        public boolean isString() {
            return subtype == Subtype.STRING;
        }

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }
    }

    record Identifier(@NonNull String name) implements Ast {

        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    interface Visitor<R> {
        R visitProgram(Program program);
        R visitInclude(Include include);
        R visitFunction(Function function);
        R visitVariable(Variable variable);
        R visitAssignment(Assignment assignment);
        R visitIfStatement(IfStatement statement);
        R visitWhileLoop(WhileLoop loop);
        R visitForLoop(ForLoop loop);
        R visitReturnStatement(ReturnStatement statement);
        R visitPrintfStatement(PrintfStatement statement);
        R visitScanfStatement(ScanfStatement statement);
        R visitFunctionCall(FunctionCall call);
        R visitBlock(Block block);
        R visitBinaryExpression(BinaryExpression expression);
        R visitUnaryExpression(UnaryExpression expression);
        R visitLiteral(Literal literal);
        R visitIdentifier(Identifier identifier);
    }
}
