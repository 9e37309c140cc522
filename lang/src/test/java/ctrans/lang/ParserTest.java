package ctrans.lang;

import static ctrans.lang.Token.Type.IDENTIFIER;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class ParserTest {

    private static List<Ast> parse(String source) {
        return Parser.parse(Tokenizer.tokenize(source)).body();
    }

    private static Ast parseOne(String source) {
        var body = parse(source);
        assertEquals(1, body.size(), () -> "expected one statement in " + body);
        return body.get(0);
    }

    private static Ast.Identifier id(String name) {
        return new Ast.Identifier(name);
    }

    private static Ast.Literal num(String value) {
        return new Ast.Literal(value, value.contains(".") ? Ast.Literal.Subtype.FLOAT : Ast.Literal.Subtype.INT);
    }

    private static Ast.Literal str(String value) {
        return new Ast.Literal(value, Ast.Literal.Subtype.STRING);
    }

    private static Ast.BinaryExpression bin(Ast left, String operator, Ast right) {
        return new Ast.BinaryExpression(left, operator, right);
    }

    private static Ast.Assignment assign(String name, String operator, Ast value) {
        return new Ast.Assignment(name, operator, value);
    }

    @Test
    void addFunction() {
        var expected = new Ast.Function("int", "add",
            List.of(new Ast.Parameter("int", "a"), new Ast.Parameter("int", "b")),
            List.of(new Ast.ReturnStatement(bin(id("a"), "+", id("b")))));
        assertEquals(expected, parseOne("int add(int a, int b) { return a + b; }"));
    }

    @Test
    void mainIsAnOrdinaryFunction() {
        var function = (Ast.Function) parseOne("int main() { return 0; }");
        assertTrue(function.isMain());
        assertEquals(List.of(new Ast.ReturnStatement(num("0"))), function.body());
    }

    @Test
    void prototypesAndParameters() {
        var parser = new Parser(new TokenStream(Tokenizer.tokenize("int f(void); void g(int a, float);")));
        var body = parser.parse().body();
        assertEquals(List.of(
            new Ast.Function("int", "f", List.of(), List.of()),
            new Ast.Function("void", "g", List.of(new Ast.Parameter("int", "a")), List.of())), body);
        assertEquals(1, parser.getWarnings().size());
        assertEquals("Expect parameter name.", parser.getWarnings().get(0).message());
    }

    @Test
    void danglingElseBindsToInnerIf() {
        var expected = new Ast.IfStatement(id("a"),
            new Ast.IfStatement(id("b"), assign("x", "=", num("1")), assign("x", "=", num("2"))),
            null);
        assertEquals(expected, parseOne("if (a) if (b) x = 1; else x = 2;"));
    }

    @Test
    void elseIfChain() {
        var expected = new Ast.IfStatement(bin(id("n"), "<", num("0")),
            new Ast.Block(List.of(assign("s", "=", num("1")))),
            new Ast.IfStatement(bin(id("n"), "==", num("0")),
                new Ast.Block(List.of(assign("s", "=", num("2")))),
                new Ast.Block(List.of(assign("s", "=", num("3"))))));
        assertEquals(expected, parseOne("if (n < 0) { s = 1; } else if (n == 0) { s = 2; } else { s = 3; }"));
    }

    @Test
    void includes() {
        assertEquals(List.of(new Ast.Include("stdio.h"), new Ast.Include("my.h")),
            parse("#include <stdio.h>\n#include \"my.h\"\n"));
    }

    @Test
    void variables() {
        assertEquals(List.of(
            new Ast.Variable("int", "x", null),
            new Ast.Variable("float", "y", num("2.5")),
            new Ast.Variable("char", "c", str("a"))),
            parse("int x; float y = 2.5; char c = 'a';"));
    }

    @Test
    void qualifiersAndNewlinesAreIgnored() {
        assertEquals(List.of(new Ast.Variable("int", "x", num("1"))), parse("const\nint\nx\n=\n1\n;"));
    }

    @Test
    void precedence() {
        var expected = assign("x", "=",
            bin(
                bin(bin(num("1"), "+", bin(num("2"), "*", num("3"))), "==", num("7")),
                "||",
                bin(new Ast.UnaryExpression("!", id("y")), "&&", id("z"))));
        assertEquals(expected, parseOne("x = 1 + 2 * 3 == 7 || !y && z;"));
    }

    @Test
    void leftAssociative() {
        assertEquals(assign("x", "=", bin(bin(id("a"), "-", id("b")), "-", id("c"))), parseOne("x = a - b - c;"));
        assertEquals(assign("x", "=", bin(id("a"), "-", bin(id("b"), "-", id("c")))), parseOne("x = a - (b - c);"));
    }

    @Test
    void unaryMinus() {
        assertEquals(assign("x", "=", bin(new Ast.UnaryExpression("-", id("y")), "*", num("2"))),
            parseOne("x = -y * 2;"));
    }

    @Test
    void compoundAssignmentsAndSteps() {
        assertEquals(List.of(
            assign("a", "+=", num("2")),
            assign("b", "--", null),
            assign("c", "++", null)),
            parse("a += 2; b--; ++c;"));
    }

    @Test
    void callStatement() {
        assertEquals(new Ast.FunctionCall("foo", List.of(num("1"), str("s"), new Ast.FunctionCall("bar", List.of()))),
            parseOne("foo(1, \"s\", bar());"));
    }

    @Test
    void whileLoop() {
        assertEquals(new Ast.WhileLoop(bin(id("i"), "<", num("3")), assign("i", "++", null)),
            parseOne("while (i < 3) i++;"));
    }

    @Test
    void forLoop() {
        var expected = new Ast.ForLoop(
            new Ast.Variable("int", "i", num("0")),
            bin(id("i"), "<", num("10")),
            assign("i", "++", null),
            new Ast.Block(List.of(assign("sum", "+=", id("i")))));
        assertEquals(expected, parseOne("for (int i = 0; i < 10; i++) { sum += i; }"));
    }

    @Test
    void forLoopClauseForms() {
        assertEquals(new Ast.ForLoop(null, null, null, assign("x", "++", null)), parseOne("for (;;) x++;"));
        assertEquals(new Ast.ForLoop(assign("i", "=", num("0")), null, assign("i", "+=", num("2")), new Ast.Block(List.of())),
            parseOne("for (i = 0; ; i += 2) {}"));
        assertEquals(new Ast.ForLoop(new Ast.Variable("int", "i", num("9")), null, assign("i", "--", null), new Ast.Block(List.of())),
            parseOne("for (int i = 9; ; --i) {}"));
    }

    @Test
    void printfAndScanf() {
        assertEquals(List.of(
            new Ast.ScanfStatement(List.of(str("%d"), new Ast.UnaryExpression("&", id("n")))),
            new Ast.PrintfStatement(List.of(str("%d\\n"), id("n")))),
            parse("scanf(\"%d\", &n); printf(\"%d\\n\", n);"));
    }

    @Test
    void returnWithoutValue() {
        assertEquals(new Ast.ReturnStatement(null), parseOne("return;"));
    }

    @Test
    void emptyAndMissingEof() {
        assertEquals(new Ast.Program(List.of()), Parser.parse(List.of()));
        assertEquals(new Ast.Program(List.of(id("x"))), Parser.parse(List.of(new Token(IDENTIFIER, "x", 1, 1))));
    }

    @Test
    void unknownTokensAreSkippedWithWarning() {
        var parser = new Parser(new TokenStream(Tokenizer.tokenize("} x = 1;")));
        assertEquals(List.of(assign("x", "=", num("1"))), parser.parse().body());
        assertFalse(parser.getWarnings().isEmpty());
        assertEquals("}", parser.getWarnings().get(0).token().lexeme());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        ") ) } else @ ; + ++ = ,",
        "int",
        "int (",
        "if",
        "if ( while ( for ( ;",
        "printf",
        "scanf(",
        "f(@ ] , ,",
        "x = ;",
        "x = 1 + ;",
        "#",
        "# include <",
        "{ { {",
        "for",
        "return",
        "int f(int int , ) {",
        "&& || ! - &"
    })
    void terminatesOnMalformedInput(String source) {
        var tokens = Tokenizer.tokenize(source);
        var program = assertTimeoutPreemptively(Duration.ofSeconds(5), () -> Parser.parse(tokens));
        assertTrue(program.body().size() <= tokens.size());
    }
}
