package ctrans.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class AstPrinterTest {

    private static String print(String source) {
        return AstPrinter.print(Parser.parse(Tokenizer.tokenize(source)));
    }

    @Test
    void function() {
        var expected = """
            Program
              Function int add(int a, int b)
                ReturnStatement
                  BinaryExpression +
                    Identifier a
                    Identifier b
            """;
        assertEquals(expected, print("int add(int a, int b) { return a + b; }"));
    }

    @Test
    void labelledChildren() {
        var expected = """
            Program
              IfStatement
                condition
                  Identifier a
                then
                  Assignment x =
                    Literal INT 1
                else
                  Assignment x ++
            """;
        assertEquals(expected, print("if (a) x = 1; else x++;"));
    }

    @Test
    void forLoopSkipsMissingClauses() {
        var expected = """
            Program
              ForLoop
                body
                  Block
                    PrintfStatement
                      Literal STRING "hi"
            """;
        assertEquals(expected, print("for (;;) { printf(\"hi\"); }"));
    }

    @Test
    void nullTree() {
        assertEquals("", AstPrinter.print(null));
        assertEquals("Program\n", AstPrinter.print(new Ast.Program(null)));
    }
}
