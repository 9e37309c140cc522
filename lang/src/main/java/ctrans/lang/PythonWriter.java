package ctrans.lang;

import static java.util.Map.entry;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Indentation scoped dialect. Types are dropped, nested blocks are flattened
 * into the enclosing suite, and a suite with no code gets {@code pass}.
 * <p>
 * A C {@code for} loop only survives as {@code for v in range(a, b)}: the
 * loop variable's initial value and the bound of a {@code <} or {@code <=}
 * test on that same variable. The update clause is not inspected. Any other
 * shape leaves a placeholder comment in place of the loop.
 */
final class PythonWriter extends DialectWriter {

    private static final Map<String, String> DEFAULTS = Map.ofEntries(
        entry("int", "0"),
        entry("float", "0.0"),
        entry("double", "0.0"),
        entry("char", "''"),
        entry("void", "None"),
        entry("long", "0"),
        entry("short", "0"),
        entry("bool", "False"));

    PythonWriter(Consumer<String> warnings) {
        super(Dialect.PYTHON, warnings);
    }

    static String defaultValue(String cType) {
        return DEFAULTS.getOrDefault(cType, "None");
    }

    @Override
    String write(Ast.Program program) {
        var hasMain = false;
        for (var node : program.body()) {
            if (node instanceof Ast.Function function) {
                out.separate();
                define(function);
                out.separate();
                hasMain |= function.isMain();
            } else {
                statement(node);
            }
        }

        if (hasMain) {
            out.separate();
            out.line("if __name__ == \"__main__\":");
            out.indent();
            out.line("main()");
            out.dedent();
        }
        return out.toString();
    }

    private void define(Ast.Function function) {
        var parameters = function.parameters().stream()
            .map(Ast.Parameter::name)
            .collect(Collectors.joining(", "));
        out.line("def " + function.name() + "(" + parameters + "):");
        suite(function.body());
    }

    private void suite(List<Ast> statements) {
        out.indent();
        var before = out.getCodeLines();
        statements(statements);
        if (out.getCodeLines() == before) {
            out.line("pass");
        }
        out.dedent();
    }

    private void suite(Ast node) {
        if (node instanceof Ast.Block block) {
            suite(block.body());
        } else {
            suite(node == null ? List.of() : List.of(node));
        }
    }

    @Override
    protected String operator(String operator) {
        switch (operator) {
        case "&&":
            return "and";
        case "||":
            return "or";
        default:
            return operator;
        }
    }

    @Override
    protected String negation() {
        return "not ";
    }

    /**
     * Python chains comparisons ({@code a < b < c}) and binds {@code not}
     * looser than comparisons, so both get wrapped when nested.
     */
    @Override
    protected boolean needsParentheses(Ast.BinaryExpression parent, Ast child, boolean right) {
        if (child instanceof Ast.UnaryExpression unary && "!".equals(unary.operator())) {
            return true;
        }
        if (child instanceof Ast.BinaryExpression binary
                && isComparison(parent.operator()) && isComparison(binary.operator())) {
            return true;
        }
        return super.needsParentheses(parent, child, right);
    }

    private static boolean isComparison(String operator) {
        var precedence = precedence(operator);
        return precedence == 3 || precedence == 4;
    }

    @Override
    public Void visitFunction(Ast.Function function) {
        define(function);
        return null;
    }

    @Override
    public Void visitVariable(Ast.Variable variable) {
        var value = variable.value() == null ? defaultValue(variable.dataType()) : render(variable.value());
        out.line(variable.name() + " = " + value);
        return null;
    }

    @Override
    public Void visitAssignment(Ast.Assignment assignment) {
        if ("++".equals(assignment.operator())) {
            out.line(assignment.identifier() + " += 1");
        } else if ("--".equals(assignment.operator())) {
            out.line(assignment.identifier() + " -= 1");
        } else {
            out.line(assignment.identifier() + " " + assignment.operator() + " " + render(assignment.value()));
        }
        return null;
    }

    @Override
    public Void visitIfStatement(Ast.IfStatement statement) {
        out.line("if " + render(statement.condition()) + ":");
        suite(statement.thenBranch());

        var otherwise = statement.elseBranch();
        while (otherwise instanceof Ast.IfStatement elseIf) {
            out.line("elif " + render(elseIf.condition()) + ":");
            suite(elseIf.thenBranch());
            otherwise = elseIf.elseBranch();
        }
        if (otherwise != null) {
            out.line("else:");
            suite(otherwise);
        }
        return null;
    }

    @Override
    public Void visitWhileLoop(Ast.WhileLoop loop) {
        out.line("while " + render(loop.condition()) + ":");
        suite(loop.body());
        return null;
    }

    @Override
    public Void visitForLoop(Ast.ForLoop loop) {
        var range = range(loop);
        if (range == null) {
            warning("for loop is not 'variable < bound' or 'variable <= bound'; placeholder emitted.");
            out.comment("For loop conversion needed");
            return null;
        }
        out.line("for " + range + ":");
        suite(loop.body());
        return null;
    }

    private String range(Ast.ForLoop loop) {
        String variable;
        Ast start;
        if (loop.init() instanceof Ast.Variable declaration) {
            variable = declaration.name();
            start = declaration.value();
        } else if (loop.init() instanceof Ast.Assignment assignment && "=".equals(assignment.operator())) {
            variable = assignment.identifier();
            start = assignment.value();
        } else {
            return null;
        }

        if (loop.update() == null
                || !(loop.condition() instanceof Ast.BinaryExpression condition)
                || !(condition.left() instanceof Ast.Identifier counter)
                || !counter.name().equals(variable)) {
            return null;
        }

        String bound;
        switch (condition.operator()) {
        case "<":
            bound = render(condition.right());
            break;
        case "<=":
            bound = inclusive(condition.right());
            break;
        default:
            return null;
        }
        return variable + " in range(" + (start == null ? "0" : render(start)) + ", " + bound + ")";
    }

    private String inclusive(Ast bound) {
        if (bound instanceof Ast.Literal literal && literal.subtype() == Ast.Literal.Subtype.INT) {
            return new BigInteger(literal.value()).add(BigInteger.ONE).toString();
        }
        var text = render(bound);
        if (bound instanceof Ast.BinaryExpression binary && precedence(binary.operator()) < precedence("+")) {
            text = "(" + text + ")";
        }
        return text + " + 1";
    }

    @Override
    public Void visitReturnStatement(Ast.ReturnStatement statement) {
        out.line(statement.value() == null ? "return" : "return " + render(statement.value()));
        return null;
    }

    @Override
    public Void visitPrintfStatement(Ast.PrintfStatement statement) {
        var arguments = statement.arguments();
        if (arguments.isEmpty()) {
            out.line("print()");
            return null;
        }

        var format = arguments.get(0);
        var values = arguments.subList(1, arguments.size());
        var rest = renderAll(values);

        if (!isStringLiteral(format)) {
            if (values.isEmpty()) {
                out.line("print(" + render(format) + ")");
            } else {
                var tuple = values.size() == 1 ? "(" + rest + ",)" : "(" + rest + ")";
                out.line("print(" + render(format) + " % " + tuple + ")");
            }
            return null;
        }

        var text = ((Ast.Literal) format).value();
        var newline = FormatString.endsWithNewline(text);
        var body = FormatString.stripNewline(text);
        var end = newline ? "" : ", end=\"\"";

        if (!values.isEmpty()) {
            out.line("print(" + quote(FormatString.toTemplate(body), '"') + ".format(" + rest + ")" + end + ")");
        } else {
            var plain = FormatString.toPlain(body);
            out.line(plain.isEmpty() && newline ? "print()" : "print(" + quote(plain, '"') + end + ")");
        }
        return null;
    }

    @Override
    public Void visitScanfStatement(Ast.ScanfStatement statement) {
        var arguments = statement.arguments();
        if (arguments.size() < 2) {
            warning("scanf without a target variable; placeholder emitted.");
            out.comment("Input needed");
            return null;
        }

        var format = arguments.get(0);
        var conversions = FormatString.conversions(
            isStringLiteral(format) ? ((Ast.Literal) format).value() : null);
        for (var i = 1; i < arguments.size(); i++) {
            var conversion = i - 1 < conversions.size()
                ? conversions.get(i - 1)
                : FormatString.Conversion.INTEGER;
            out.line(render(arguments.get(i)) + " = " + read(conversion));
        }
        return null;
    }

    private static String read(FormatString.Conversion conversion) {
        switch (conversion) {
        case FLOAT:
        case DOUBLE:
            return "float(input())";
        case STRING:
            return "input()";
        case CHAR:
            return "input()[0]";
        case INTEGER:
        default:
            return "int(input())";
        }
    }

    @Override
    public Void visitFunctionCall(Ast.FunctionCall call) {
        out.line(call.name() + "(" + renderAll(call.arguments()) + ")");
        return null;
    }

    @Override
    public Void visitBlock(Ast.Block block) {
        statements(block.body());
        return null;
    }
}
