package ctrans.lang;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Indented, one node per line dump of a syntax tree.
 */
public final class AstPrinter implements Ast.Visitor<Void> {

    private final SourceWriter out = new SourceWriter("  ", "");

    public static String print(Ast node) {
        var printer = new AstPrinter();
        printer.child(node);
        return printer.out.toString();
    }

    private void child(Ast node) {
        if (node != null) {
            node.accept(this);
        }
    }

    private void children(List<Ast> nodes) {
        out.indent();
        if (nodes != null) {
            nodes.forEach(this::child);
        }
        out.dedent();
    }

    private void labelled(String label, Ast node) {
        if (node == null) {
            return;
        }
        out.indent();
        out.line(label);
        out.indent();
        child(node);
        out.dedent();
        out.dedent();
    }

    @Override
    public Void visitProgram(Ast.Program program) {
        out.line("Program");
        children(program.body());
        return null;
    }

    @Override
    public Void visitInclude(Ast.Include include) {
        out.line("Include " + include.library());
        return null;
    }

    @Override
    public Void visitFunction(Ast.Function function) {
        var parameters = function.parameters().stream()
            .map(parameter -> parameter.type() + " " + parameter.name())
            .collect(Collectors.joining(", "));
        out.line("Function " + function.returnType() + " " + function.name() + "(" + parameters + ")");
        children(function.body());
        return null;
    }

    @Override
    public Void visitVariable(Ast.Variable variable) {
        out.line("Variable " + variable.dataType() + " " + variable.name());
        children(Arrays.asList(variable.value()));
        return null;
    }

    @Override
    public Void visitAssignment(Ast.Assignment assignment) {
        out.line("Assignment " + assignment.identifier() + " " + assignment.operator());
        children(Arrays.asList(assignment.value()));
        return null;
    }

    @Override
    public Void visitIfStatement(Ast.IfStatement statement) {
        out.line("IfStatement");
        labelled("condition", statement.condition());
        labelled("then", statement.thenBranch());
        labelled("else", statement.elseBranch());
        return null;
    }

    @Override
    public Void visitWhileLoop(Ast.WhileLoop loop) {
        out.line("WhileLoop");
        labelled("condition", loop.condition());
        labelled("body", loop.body());
        return null;
    }

    @Override
    public Void visitForLoop(Ast.ForLoop loop) {
        out.line("ForLoop");
        labelled("init", loop.init());
        labelled("condition", loop.condition());
        labelled("update", loop.update());
        labelled("body", loop.body());
        return null;
    }

    @Override
    public Void visitReturnStatement(Ast.ReturnStatement statement) {
        out.line("ReturnStatement");
        children(Arrays.asList(statement.value()));
        return null;
    }

    @Override
    public Void visitPrintfStatement(Ast.PrintfStatement statement) {
        out.line("PrintfStatement");
        children(statement.arguments());
        return null;
    }

    @Override
    public Void visitScanfStatement(Ast.ScanfStatement statement) {
        out.line("ScanfStatement");
        children(statement.arguments());
        return null;
    }

    @Override
    public Void visitFunctionCall(Ast.FunctionCall call) {
        out.line("FunctionCall " + call.name());
        children(call.arguments());
        return null;
    }

    @Override
    public Void visitBlock(Ast.Block block) {
        out.line("Block");
        children(block.body());
        return null;
    }

    @Override
    public Void visitBinaryExpression(Ast.BinaryExpression expression) {
        out.line("BinaryExpression " + expression.operator());
        children(Arrays.asList(expression.left(), expression.right()));
        return null;
    }

    @Override
    public Void visitUnaryExpression(Ast.UnaryExpression expression) {
        out.line("UnaryExpression " + expression.operator());
        children(Arrays.asList(expression.operand()));
        return null;
    }

    @Override
    public Void visitLiteral(Ast.Literal literal) {
        var value = literal.isString() ? "\"" + literal.value() + "\"" : literal.value();
        out.line("Literal " + literal.subtype() + " " + value);
        return null;
    }

    @Override
    public Void visitIdentifier(Ast.Identifier identifier) {
        out.line("Identifier " + identifier.name());
        return null;
    }
}
