package ctrans.lang;

import java.util.List;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Shared half of a dialect back end. Subclasses emit statements; expressions
 * are rendered here, with the operator spellings and parenthesization rules a
 * dialect may override.
 * <p>
 * Expressions that stand alone as statements have no effect worth keeping and
 * are dropped. Includes have no counterpart in either dialect.
 */
abstract class DialectWriter implements Ast.Visitor<Void> {

    protected final SourceWriter out;

    private final Consumer<String> warnings;
    private final Expressions expressions = new Expressions();

    DialectWriter(Dialect dialect, Consumer<String> warnings) {
        this.out = new SourceWriter("    ", dialect.getCommentPrefix());
        this.warnings = warnings;
    }

    /**
     * Renders a whole program. Called once per writer.
     */
    abstract String write(Ast.Program program);

    protected abstract String operator(String operator);

    protected abstract String negation();

    protected void statements(List<Ast> statements) {
        for (var statement : statements) {
            statement(statement);
        }
    }

    protected void statement(Ast statement) {
        if (statement != null) {
            statement.accept(this);
        }
    }

    protected String render(Ast expression) {
        return expression == null ? "" : expression.accept(expressions);
    }

    protected String renderAll(List<Ast> expressions) {
        return expressions.stream().map(this::render).collect(Collectors.joining(", "));
    }

    /**
     * Wraps raw literal text in {@code quote}. Escape pairs are copied as they
     * are; a bare {@code quote} inside the text is escaped.
     */
    static String quote(String raw, char quote) {
        var quoted = new StringBuilder().append(quote);
        for (var i = 0; i < raw.length(); i++) {
            var c = raw.charAt(i);
            if (c == '\\') {
                if (i + 1 < raw.length()) {
                    quoted.append(c).append(raw.charAt(++i));
                } else {
                    quoted.append("\\\\"); // lone trailing backslash
                }
            } else if (c == quote) {
                quoted.append('\\').append(c);
            } else {
                quoted.append(c);
            }
        }
        return quoted.append(quote).toString();
    }

    protected static boolean isStringLiteral(Ast node) {
        return node instanceof Ast.Literal literal && literal.isString();
    }

    protected void warning(String message) {
        warnings.accept(message);
    }

    /**
     * Whether {@code child}, an operand of {@code parent}, must be wrapped to
     * keep the tree's grouping.
     */
    protected boolean needsParentheses(Ast.BinaryExpression parent, Ast child, boolean right) {
        if (!(child instanceof Ast.BinaryExpression binary)) {
            return false;
        }
        var outer = precedence(parent.operator());
        var inner = precedence(binary.operator());
        return inner < outer || (right && inner == outer);
    }

    static int precedence(String operator) {
        switch (operator) {
        case "||":
            return 1;
        case "&&":
            return 2;
        case "==":
        case "!=":
            return 3;
        case "<":
        case ">":
        case "<=":
        case ">=":
            return 4;
        case "+":
        case "-":
            return 5;
        case "*":
        case "/":
        case "%":
            return 6;
        default:
            return 0;
        }
    }

    //// nodes with nothing to emit at statement level ////

    @Override
    public Void visitProgram(Ast.Program program) {
        return null;
    }

    @Override
    public Void visitInclude(Ast.Include include) {
        return null;
    }

    @Override
    public Void visitBinaryExpression(Ast.BinaryExpression expression) {
        return dropped(expression);
    }

    @Override
    public Void visitUnaryExpression(Ast.UnaryExpression expression) {
        return dropped(expression);
    }

    @Override
    public Void visitLiteral(Ast.Literal literal) {
        return dropped(literal);
    }

    @Override
    public Void visitIdentifier(Ast.Identifier identifier) {
        return dropped(identifier);
    }

    private Void dropped(Ast expression) {
        warning("Expression statement '" + render(expression) + "' has no effect; dropped.");
        return null;
    }

    /**
     * Renders expressions. Statement nodes never appear inside an expression
     * in a parsed tree and render as nothing.
     */
    private final class Expressions implements Ast.Visitor<String> {

        @Override
        public String visitBinaryExpression(Ast.BinaryExpression expression) {
            var left = operand(expression, expression.left(), false);
            var right = operand(expression, expression.right(), true);
            return left + " " + operator(expression.operator()) + " " + right;
        }

        private String operand(Ast.BinaryExpression parent, Ast child, boolean right) {
            var text = render(child);
            return needsParentheses(parent, child, right) ? "(" + text + ")" : text;
        }

        @Override
        public String visitUnaryExpression(Ast.UnaryExpression expression) {
            var operand = render(expression.operand());
            if (expression.isAddressOf()) {
                // no addresses in either dialect; the variable itself stands in
                return operand;
            }
            if (expression.operand() instanceof Ast.BinaryExpression
                    || (expression.operand() instanceof Ast.UnaryExpression inner && !inner.isAddressOf())) {
                operand = "(" + operand + ")";
            }
            var prefix = "!".equals(expression.operator()) ? negation() : expression.operator();
            return prefix + operand;
        }

        @Override
        public String visitLiteral(Ast.Literal literal) {
            return literal.isString() ? quote(literal.value(), '"') : literal.value();
        }

        @Override
        public String visitIdentifier(Ast.Identifier identifier) {
            return identifier.name();
        }

        @Override
        public String visitFunctionCall(Ast.FunctionCall call) {
            return call.name() + "(" + renderAll(call.arguments()) + ")";
        }

        @Override
        public String visitProgram(Ast.Program program) {
            return "";
        }

        @Override
        public String visitInclude(Ast.Include include) {
            return "";
        }

        @Override
        public String visitFunction(Ast.Function function) {
            return "";
        }

        @Override
        public String visitVariable(Ast.Variable variable) {
            return "";
        }

        @Override
        public String visitAssignment(Ast.Assignment assignment) {
            return "";
        }

        @Override
        public String visitIfStatement(Ast.IfStatement statement) {
            return "";
        }

        @Override
        public String visitWhileLoop(Ast.WhileLoop loop) {
            return "";
        }

        @Override
        public String visitForLoop(Ast.ForLoop loop) {
            return "";
        }

        @Override
        public String visitReturnStatement(Ast.ReturnStatement statement) {
            return "";
        }

        @Override
        public String visitPrintfStatement(Ast.PrintfStatement statement) {
            return "";
        }

        @Override
        public String visitScanfStatement(Ast.ScanfStatement statement) {
            return "";
        }

        @Override
        public String visitBlock(Ast.Block block) {
            return "";
        }
    }
}
