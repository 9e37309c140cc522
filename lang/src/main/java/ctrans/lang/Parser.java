package ctrans.lang;

import static ctrans.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Recursive descent parser for the C subset.
 * <p>
 * The parser is total. It never throws on malformed input: tokens that fit no
 * rule are skipped and reported through {@link #getWarnings()}. Every
 * statement rule consumes at least one token, so parsing always terminates and
 * the program never has more nodes than there are tokens.
 */
@RequiredArgsConstructor
public final class Parser {

    public static record Message(Token token, String message) {}

    static final Set<String> TYPE_KEYWORDS = Set.of(
        "int", "float", "double", "char", "void", "bool", "long", "short");

    private static final Set<String> QUALIFIERS = Set.of(
        "const", "static", "extern", "register", "auto", "volatile", "signed", "unsigned");

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=", "*=", "/=");

    private static final Set<String> STEP_OPERATORS = Set.of("++", "--");

    private final @NonNull TokenStream tokens;

    @Getter
    private final List<Message> warnings = new ArrayList<>();

    public static Ast.Program parse(List<Token> tokens) {
        return new Parser(new TokenStream(tokens)).parse();
    }

    public Ast.Program parse() {
        return program();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    //// grammar rules ////

    /**
     * <pre>
     * program     :: statement* EOF
     * </pre>
     */
    private Ast.Program program() {
        var body = new ArrayList<Ast>();
        while (!isAtEnd()) {
            statement().ifPresent(body::add);
        }
        return new Ast.Program(body);
    }

    /**
     * <pre>
     * statement   :: include | declaration | if | while | for | return
     *              | printf | scanf | identifierStatement | block
     * </pre>
     * Anything else is skipped and yields no node.
     */
    private Optional<Ast> statement() {
        var token = peek();

        if (token.type() == EOF) {
            return Optional.empty();
        }

        if (token.type() == DELIMITER && token.is("#")) {
            return include();
        }

        if (token.type() == KEYWORD) {
            switch (token.lexeme()) {
            case "if":
                return Optional.of(ifStatement());
            case "while":
                return Optional.of(whileLoop());
            case "for":
                return Optional.of(forLoop());
            case "return":
                return Optional.of(returnStatement());
            case "printf":
                advance();
                return Optional.of(new Ast.PrintfStatement(parenthesizedArguments()));
            case "scanf":
                advance();
                return Optional.of(new Ast.ScanfStatement(parenthesizedArguments()));
            default:
                if (TYPE_KEYWORDS.contains(token.lexeme())) {
                    return declarationOrFunction();
                }
                if (QUALIFIERS.contains(token.lexeme())) {
                    advance(); // no effect on translation
                    return Optional.empty();
                }
                return skip("Unsupported keyword '" + token.lexeme() + "' skipped.");
            }
        }

        if (token.type() == IDENTIFIER) {
            return Optional.of(identifierStatement());
        }

        if (token.type() == OPERATOR && STEP_OPERATORS.contains(token.lexeme())
                && peekNext().type() == IDENTIFIER) {
            var step = prefixStep();
            match(";");
            return Optional.of(step);
        }

        if (token.is("{")) {
            return Optional.of(block());
        }

        if (token.is(";")) {
            advance(); // empty statement
            return Optional.empty();
        }

        return skip("Unexpected '" + token.lexeme() + "' skipped.");
    }

    /**
     * <pre>
     * include     :: "#" "include" ( STRING | "<" name ">" )
     * </pre>
     * The library name is every token up to {@code >} on the same line.
     */
    private Optional<Ast> include() {
        var hash = advance();
        if (!match("include")) {
            warning(hash, "Expect 'include' after '#'.");
            return Optional.empty();
        }
        if (check(STRING)) {
            return Optional.of(new Ast.Include(advance().lexeme()));
        }
        if (!match("<")) {
            warning(peek(), "Expect '<' or '\"' after include.");
            return Optional.empty();
        }

        var library = new StringBuilder();
        while (!isAtEnd() && !check(">") && peek().line() == hash.line()) {
            library.append(advance().lexeme());
        }
        if (!match(">")) {
            warning(previous(), "Expect '>' after library name.");
        }
        if (library.length() == 0) {
            warning(hash, "Expect library name.");
            return Optional.empty();
        }
        return Optional.of(new Ast.Include(library.toString()));
    }

    /**
     * <pre>
     * declaration :: TYPE ID ( function | variable )
     * </pre>
     */
    private Optional<Ast> declarationOrFunction() {
        var type = advance();
        if (!check(IDENTIFIER)) {
            warning(type, "Expect name after '" + type.lexeme() + "'.");
            return Optional.empty();
        }
        var name = advance();
        if (check("(")) {
            return Optional.of(function(type.lexeme(), name.lexeme()));
        }
        return Optional.of(variable(type.lexeme(), name.lexeme()));
    }

    /**
     * <pre>
     * function    :: "(" ( TYPE ID ( "," TYPE ID )* )? ")" ( block | ";" )?
     * </pre>
     * Tokens that do not form a parameter are skipped.
     */
    private Ast.Function function(String returnType, String name) {
        var paren = advance();
        var parameters = new ArrayList<Ast.Parameter>();
        while (!match(")")) {
            if (isAtEnd() || check("{")) {
                warning(paren, "Expect ')' after parameters.");
                break;
            }
            if (match(",")) {
                continue;
            }
            var token = advance();
            if (token.type() == KEYWORD && TYPE_KEYWORDS.contains(token.lexeme())) {
                if (check(IDENTIFIER)) {
                    parameters.add(new Ast.Parameter(token.lexeme(), advance().lexeme()));
                } else if (!"void".equals(token.lexeme())) {
                    warning(token, "Expect parameter name.");
                }
            } else if (!(token.type() == KEYWORD && QUALIFIERS.contains(token.lexeme()))) {
                warning(token, "Malformed parameter '" + token.lexeme() + "' skipped.");
            }
        }

        List<Ast> body = List.of();
        if (check("{")) {
            body = block().body();
        } else {
            match(";"); // prototype
        }
        return new Ast.Function(returnType, name, parameters, body);
    }

    /**
     * <pre>
     * variable    :: ( "=" expression )? ";"?
     * </pre>
     */
    private Ast.Variable variable(String type, String name) {
        Ast value = null;
        if (match("=")) {
            value = expectExpression("Expect initializer after '='.");
        }
        match(";");
        return new Ast.Variable(type, name, value);
    }

    /**
     * <pre>
     * block       :: "{" statement* "}"
     * </pre>
     */
    private Ast.Block block() {
        var brace = advance();
        var body = new ArrayList<Ast>();
        while (!match("}")) {
            if (isAtEnd()) {
                warning(brace, "Expect '}' after block.");
                break;
            }
            statement().ifPresent(body::add);
        }
        return new Ast.Block(body);
    }

    /**
     * <pre>
     * if          :: "if" "(" expression ")" statement ( "else" statement )?
     * </pre>
     * The else is taken by the innermost if still being parsed, which settles
     * the dangling else.
     */
    private Ast.IfStatement ifStatement() {
        advance(); // if
        var condition = condition();
        var thenBranch = statement().orElse(null);
        Ast elseBranch = null;
        if (check(KEYWORD) && match("else")) {
            elseBranch = statement().orElse(null);
        }
        return new Ast.IfStatement(condition, thenBranch, elseBranch);
    }

    /**
     * <pre>
     * while       :: "while" "(" expression ")" statement
     * </pre>
     */
    private Ast.WhileLoop whileLoop() {
        advance(); // while
        var condition = condition();
        var body = statement().orElse(null);
        return new Ast.WhileLoop(condition, body);
    }

    /**
     * <pre>
     * for         :: "for" "(" ( declaration | identifierStatement )? ";"?
     *                expression? ";" update? ")" statement
     * </pre>
     */
    private Ast.ForLoop forLoop() {
        advance(); // for
        match("(");

        Ast init = null;
        if (check(KEYWORD) && TYPE_KEYWORDS.contains(peek().lexeme())) {
            init = declarationOrFunction().orElse(null);
        } else if (check(IDENTIFIER)) {
            init = identifierStatement();
        }
        if (!previous().is(";")) {
            match(";");
        }

        var condition = check(";") ? null : expression();
        match(";");

        var update = check(")") ? null : update();
        if (!match(")")) {
            warning(peek(), "Expect ')' after for clauses.");
        }

        var body = statement().orElse(null);
        return new Ast.ForLoop(init, condition, update, body);
    }

    /**
     * <pre>
     * update      :: ( "++" | "--" ) ID | identifierStatement | expression
     * </pre>
     */
    private Ast update() {
        if (check(OPERATOR) && STEP_OPERATORS.contains(peek().lexeme())
                && peekNext().type() == IDENTIFIER) {
            return prefixStep();
        }
        if (check(IDENTIFIER)) {
            return identifierStatement();
        }
        return expression();
    }

    /**
     * <pre>
     * return      :: "return" expression? ";"?
     * </pre>
     */
    private Ast.ReturnStatement returnStatement() {
        advance(); // return
        var value = check(";") ? null : expression();
        match(";");
        return new Ast.ReturnStatement(value);
    }

    /**
     * <pre>
     * identifierStatement
     *             :: ID "(" arguments ")" ";"?
     *              | ID ( "=" | "+=" | "-=" | "*=" | "/=" ) expression ";"?
     *              | ID ( "++" | "--" ) ";"?
     *              | expression ";"?
     * </pre>
     * The branch is picked by looking at the token after the identifier.
     */
    private Ast identifierStatement() {
        var next = peekNext();

        if (next.is("(")) {
            var call = call();
            match(";");
            return call;
        }

        if (next.type() == OPERATOR && ASSIGNMENT_OPERATORS.contains(next.lexeme())) {
            var name = advance();
            var operator = advance();
            var value = expectExpression("Expect expression after '" + operator.lexeme() + "'.");
            match(";");
            return new Ast.Assignment(name.lexeme(), operator.lexeme(), value);
        }

        if (next.type() == OPERATOR && STEP_OPERATORS.contains(next.lexeme())) {
            var name = advance();
            var operator = advance();
            match(";");
            return new Ast.Assignment(name.lexeme(), operator.lexeme(), null);
        }

        var expression = expression();
        match(";");
        return expression;
    }

    private Ast.Assignment prefixStep() {
        var operator = advance();
        var name = advance();
        return new Ast.Assignment(name.lexeme(), operator.lexeme(), null);
    }

    /**
     * <pre>
     * expression  :: or
     * </pre>
     * Returns null when no expression starts at the current token; nothing is
     * consumed in that case.
     */
    private Ast expression() {
        return or();
    }

    /**
     * <pre>
     * or          :: and ( "||" and )*
     * </pre>
     */
    private Ast or() {
        return binary(this::and, "||");
    }

    /**
     * <pre>
     * and         :: equality ( "&&" equality )*
     * </pre>
     */
    private Ast and() {
        return binary(this::equality, "&&");
    }

    /**
     * <pre>
     * equality    :: relational ( ( "==" | "!=" ) relational )*
     * </pre>
     */
    private Ast equality() {
        return binary(this::relational, "==", "!=");
    }

    /**
     * <pre>
     * relational  :: additive ( ( "<" | ">" | "<=" | ">=" ) additive )*
     * </pre>
     */
    private Ast relational() {
        return binary(this::additive, "<", ">", "<=", ">=");
    }

    /**
     * <pre>
     * additive    :: multiplicative ( ( "+" | "-" ) multiplicative )*
     * </pre>
     */
    private Ast additive() {
        return binary(this::multiplicative, "+", "-");
    }

    /**
     * <pre>
     * multiplicative
     *             :: unary ( ( "*" | "/" | "%" ) unary )*
     * </pre>
     */
    private Ast multiplicative() {
        return binary(this::unary, "*", "/", "%");
    }

    private Ast binary(Supplier<Ast> operand, String... operators) {
        var left = operand.get();
        while (checkOperator(operators)) {
            var operator = advance();
            var right = operand.get();
            if (left == null || right == null) {
                warning(operator, "Missing operand for '" + operator.lexeme() + "'.");
                left = left != null ? left : right;
            } else {
                left = new Ast.BinaryExpression(left, operator.lexeme(), right);
            }
        }
        return left;
    }

    /**
     * <pre>
     * unary       :: "&" primary | ( "-" | "!" ) unary | primary
     * </pre>
     */
    private Ast unary() {
        if (checkOperator("&", "-", "!")) {
            var operator = advance();
            var operand = operator.is("&") ? primary() : unary();
            if (operand == null) {
                warning(operator, "Expect operand after '" + operator.lexeme() + "'.");
                return null;
            }
            return new Ast.UnaryExpression(operator.lexeme(), operand);
        }
        return primary();
    }

    /**
     * <pre>
     * primary     :: NUMBER | STRING | ID | call | "(" expression ")"
     * </pre>
     */
    private Ast primary() {
        if (check(NUMBER)) {
            var number = advance().lexeme();
            var subtype = number.contains(".") ? Ast.Literal.Subtype.FLOAT : Ast.Literal.Subtype.INT;
            return new Ast.Literal(number, subtype);
        }
        if (check(STRING)) {
            return new Ast.Literal(advance().lexeme(), Ast.Literal.Subtype.STRING);
        }
        if (check(IDENTIFIER)) {
            if (peekNext().is("(")) {
                return call();
            }
            return new Ast.Identifier(advance().lexeme());
        }
        if (check("(")) {
            var paren = advance();
            var expression = expression();
            if (!match(")")) {
                warning(paren, "Expect ')' after expression.");
            }
            return expression;
        }
        return null;
    }

    /**
     * <pre>
     * call        :: ID "(" arguments ")"
     * </pre>
     */
    private Ast.FunctionCall call() {
        var name = advance();
        advance(); // (
        return new Ast.FunctionCall(name.lexeme(), arguments());
    }

    private List<Ast> parenthesizedArguments() {
        if (!match("(")) {
            warning(peek(), "Expect '(' before arguments.");
            match(";");
            return List.of();
        }
        var arguments = arguments();
        match(";");
        return arguments;
    }

    /**
     * <pre>
     * arguments   :: ( expression ( "," expression )* )? ")"
     * </pre>
     * Stops early, leaving the offending token, if an argument cannot be read.
     */
    private List<Ast> arguments() {
        var arguments = new ArrayList<Ast>();
        while (!match(")")) {
            if (match(",")) {
                continue;
            }
            var before = tokens.position();
            var argument = expression();
            if (argument != null) {
                arguments.add(argument);
            }
            if (tokens.position() == before) {
                warning(peek(), "Expect ')' after arguments.");
                break;
            }
        }
        return arguments;
    }

    //// utility methods ////

    private Optional<Ast> skip(String message) {
        warning(advance(), message);
        return Optional.empty();
    }

    private Ast condition() {
        if (!match("(")) {
            warning(peek(), "Expect '(' before condition.");
        }
        var condition = expression();
        if (condition == null) {
            warning(peek(), "Expect condition.");
        }
        if (!match(")")) {
            warning(peek(), "Expect ')' after condition.");
        }
        return condition;
    }

    private Ast expectExpression(String message) {
        var expression = expression();
        if (expression == null) {
            warning(peek(), message);
        }
        return expression;
    }

    private void warning(Token token, String message) {
        warnings.add(new Message(token, message));
    }

    private boolean match(String text) {
        if (check(text)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(String text) {
        return peek().is(text);
    }

    private boolean check(Token.Type type) {
        return peek().type() == type;
    }

    private boolean checkOperator(String... operators) {
        if (!check(OPERATOR)) {
            return false;
        }
        for (var operator : operators) {
            if (check(operator)) {
                return true;
            }
        }
        return false;
    }

    private Token advance() {
        return tokens.advance();
    }

    private boolean isAtEnd() {
        return tokens.isAtEnd();
    }

    private Token peek() {
        return tokens.peek();
    }

    private Token peekNext() {
        return tokens.peekNext();
    }

    private Token previous() {
        return tokens.previous();
    }
}
