package ctrans.lang;

import static java.util.Map.entry;

import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Typed block dialect. When the program has a {@code main}, everything is
 * wrapped in {@code public class Main} and {@code main} owns the input
 * scanner: it opens it on entry and closes it on the way out.
 */
final class JavaWriter extends DialectWriter {

    private static final Map<String, String> TYPES = Map.ofEntries(
        entry("int", "int"),
        entry("float", "float"),
        entry("double", "double"),
        entry("char", "char"),
        entry("void", "void"),
        entry("long", "long"),
        entry("short", "short"),
        entry("bool", "boolean"));

    private static final Map<String, String> DEFAULTS = Map.ofEntries(
        entry("int", "0"),
        entry("float", "0.0f"),
        entry("double", "0.0"),
        entry("char", "'\\0'"),
        entry("boolean", "false"),
        entry("long", "0L"),
        entry("short", "0"));

    private boolean inMain = false;

    JavaWriter(Consumer<String> warnings) {
        super(Dialect.JAVA, warnings);
    }

    static String type(String cType) {
        return TYPES.getOrDefault(cType, "Object");
    }

    static String defaultValue(String javaType) {
        return DEFAULTS.getOrDefault(javaType, "null");
    }

    @Override
    String write(Ast.Program program) {
        var hasMain = program.body().stream()
            .anyMatch(node -> node instanceof Ast.Function function && function.isMain());

        if (hasMain) {
            out.line("import java.util.Scanner;");
            out.separate();
            out.line("public class Main {");
            out.indent();
            out.line("private static Scanner scanner;");
        }

        for (var node : program.body()) {
            if (node instanceof Ast.Function function) {
                member(function);
            } else if (node instanceof Ast.Variable variable) {
                out.line((hasMain ? "static " : "") + declaration(variable) + ";");
            } else {
                statement(node);
            }
        }

        if (hasMain) {
            out.dedent();
            out.line("}");
        }
        return out.toString();
    }

    private void member(Ast.Function function) {
        out.separate();
        if (function.isMain()) {
            out.line("public static void main(String[] args) {");
            out.indent();
            out.line("scanner = new Scanner(System.in);");
            out.line("try {");
            out.indent();
            inMain = true;
            statements(function.body());
            inMain = false;
            out.dedent();
            out.line("} finally {");
            out.indent();
            out.line("scanner.close();");
            out.dedent();
            out.line("}");
        } else {
            var parameters = function.parameters().stream()
                .map(parameter -> type(parameter.type()) + " " + parameter.name())
                .collect(Collectors.joining(", "));
            out.line("public static " + type(function.returnType()) + " " + function.name()
                + "(" + parameters + ") {");
            out.indent();
            statements(function.body());
        }
        out.dedent();
        out.line("}");
        out.separate();
    }

    private String declaration(Ast.Variable variable) {
        var type = type(variable.dataType());
        return type + " " + variable.name() + " = " + initializer(variable, type);
    }

    private String initializer(Ast.Variable variable, String type) {
        var value = variable.value();
        if (value == null) {
            return defaultValue(type);
        }
        if ("char".equals(type) && value instanceof Ast.Literal literal && isCharacter(literal)) {
            return quote(literal.value(), '\'');
        }
        if ("float".equals(type) && isFloatLiteral(value)) {
            return render(value) + "f";
        }
        return render(value);
    }

    /**
     * {@code 1.5} or {@code -1.5}: a double in Java, so a float needs the suffix.
     */
    private static boolean isFloatLiteral(Ast value) {
        if (value instanceof Ast.UnaryExpression unary && "-".equals(unary.operator())) {
            value = unary.operand();
        }
        return value instanceof Ast.Literal literal && literal.subtype() == Ast.Literal.Subtype.FLOAT;
    }

    private static boolean isCharacter(Ast.Literal literal) {
        var text = literal.value();
        return literal.isString()
            && (text.length() == 1 || (text.length() == 2 && text.charAt(0) == '\\'));
    }

    private String inline(Ast node) {
        if (node instanceof Ast.Variable variable) {
            return declaration(variable);
        }
        if (node instanceof Ast.Assignment assignment) {
            return assignment(assignment);
        }
        return render(node);
    }

    private String assignment(Ast.Assignment assignment) {
        if (assignment.isStep()) {
            return assignment.identifier() + assignment.operator();
        }
        return assignment.identifier() + " " + assignment.operator() + " " + render(assignment.value());
    }

    private void body(Ast node) {
        if (node instanceof Ast.Block block) {
            statements(block.body());
        } else {
            statement(node);
        }
    }

    @Override
    protected String operator(String operator) {
        return operator;
    }

    @Override
    protected String negation() {
        return "!";
    }

    @Override
    public Void visitFunction(Ast.Function function) {
        warning("Nested function '" + function.name() + "' has no Java counterpart; omitted.");
        out.comment("nested function " + function.name() + " omitted");
        return null;
    }

    @Override
    public Void visitVariable(Ast.Variable variable) {
        out.line(declaration(variable) + ";");
        return null;
    }

    @Override
    public Void visitAssignment(Ast.Assignment assignment) {
        out.line(assignment(assignment) + ";");
        return null;
    }

    @Override
    public Void visitIfStatement(Ast.IfStatement statement) {
        out.line("if (" + render(statement.condition()) + ") {");
        out.indent();
        body(statement.thenBranch());
        out.dedent();

        var otherwise = statement.elseBranch();
        while (otherwise instanceof Ast.IfStatement elseIf) {
            out.line("} else if (" + render(elseIf.condition()) + ") {");
            out.indent();
            body(elseIf.thenBranch());
            out.dedent();
            otherwise = elseIf.elseBranch();
        }
        if (otherwise != null) {
            out.line("} else {");
            out.indent();
            body(otherwise);
            out.dedent();
        }
        out.line("}");
        return null;
    }

    @Override
    public Void visitWhileLoop(Ast.WhileLoop loop) {
        out.line("while (" + render(loop.condition()) + ") {");
        out.indent();
        body(loop.body());
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public Void visitForLoop(Ast.ForLoop loop) {
        out.line("for (" + inline(loop.init()) + "; " + render(loop.condition()) + "; "
            + inline(loop.update()) + ") {");
        out.indent();
        body(loop.body());
        out.dedent();
        out.line("}");
        return null;
    }

    @Override
    public Void visitReturnStatement(Ast.ReturnStatement statement) {
        // main is void in Java; its exit status is dropped
        if (statement.value() == null || inMain) {
            out.line("return;");
        } else {
            out.line("return " + render(statement.value()) + ";");
        }
        return null;
    }

    @Override
    public Void visitPrintfStatement(Ast.PrintfStatement statement) {
        var arguments = statement.arguments();
        if (arguments.isEmpty()) {
            out.line("System.out.println();");
            return null;
        }

        var format = arguments.get(0);
        var rest = renderAll(arguments.subList(1, arguments.size()));

        if (!isStringLiteral(format)) {
            out.line(rest.isEmpty()
                ? "System.out.print(" + render(format) + ");"
                : "System.out.printf(" + render(format) + ", " + rest + ");");
            return null;
        }

        var text = ((Ast.Literal) format).value();
        if (!rest.isEmpty()) {
            out.line("System.out.printf(" + quote(FormatString.toJava(text), '"') + ", " + rest + ");");
        } else if (FormatString.hasConversions(text)) {
            out.line("System.out.printf(" + quote(FormatString.toJava(text), '"') + ");");
        } else if (FormatString.endsWithNewline(text)) {
            var plain = FormatString.toPlain(FormatString.stripNewline(text));
            out.line(plain.isEmpty() ? "System.out.println();" : "System.out.println(" + quote(plain, '"') + ");");
        } else {
            out.line("System.out.print(" + quote(FormatString.toPlain(text), '"') + ");");
        }
        return null;
    }

    @Override
    public Void visitScanfStatement(Ast.ScanfStatement statement) {
        var arguments = statement.arguments();
        if (arguments.size() < 2) {
            warning("scanf without a target variable; placeholder emitted.");
            out.comment("Scanner input needed");
            return null;
        }

        var format = arguments.get(0);
        var conversions = FormatString.conversions(
            isStringLiteral(format) ? ((Ast.Literal) format).value() : null);
        for (var i = 1; i < arguments.size(); i++) {
            var conversion = i - 1 < conversions.size()
                ? conversions.get(i - 1)
                : FormatString.Conversion.INTEGER;
            out.line(render(arguments.get(i)) + " = " + read(conversion) + ";");
        }
        return null;
    }

    private static String read(FormatString.Conversion conversion) {
        switch (conversion) {
        case FLOAT:
            return "scanner.nextFloat()";
        case DOUBLE:
            return "scanner.nextDouble()";
        case STRING:
            return "scanner.next()";
        case CHAR:
            return "scanner.next().charAt(0)";
        case INTEGER:
        default:
            return "scanner.nextInt()";
        }
    }

    @Override
    public Void visitFunctionCall(Ast.FunctionCall call) {
        out.line(call.name() + "(" + renderAll(call.arguments()) + ");");
        return null;
    }

    @Override
    public Void visitBlock(Ast.Block block) {
        out.line("{");
        out.indent();
        statements(block.body());
        out.dedent();
        out.line("}");
        return null;
    }
}
