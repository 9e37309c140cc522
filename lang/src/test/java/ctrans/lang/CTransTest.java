package ctrans.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CTransTest {

    ByteArrayOutputStream out;
    ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String input, String... args) throws IOException {
        var in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
        return CTrans.execute(args, in,
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void usageErrors() throws IOException {
        assertEquals(64, run("", "--bogus"));
        assertEquals(CTrans.USAGE + System.lineSeparator(), out());
        assertEquals(64, run("", "--dialect=cobol", "-"));
        assertEquals(64, run("", "a.c", "b.c"));
    }

    @Test
    void stdinDefaultsToJava() throws IOException {
        assertEquals(0, run("int x;", "-"));
        assertEquals("int x = 0;\n", out());
        assertEquals("", err());
    }

    @Test
    void dialectOption() throws IOException {
        assertEquals(0, run("int x;", "--dialect=python", "-"));
        assertEquals("x = 0\n", out());
    }

    @Test
    void dialectAlias() throws IOException {
        assertEquals(0, run("int x;", "--dialect=Indented", "-"));
        assertEquals("x = 0\n", out());
    }

    @Test
    void file(@TempDir Path dir) throws IOException {
        var source = dir.resolve("add.c");
        Files.writeString(source, "int add(int a, int b) { return a + b; }");
        assertEquals(0, run("", "--dialect=python", source.toString()));
        assertEquals("def add(a, b):\n    return a + b\n", out());
    }

    @Test
    void warningsAreQuietByDefault() throws IOException {
        assertEquals(0, run("int @x;", "-"));
        assertEquals("", err());
    }

    @Test
    void warningsOption() throws IOException {
        assertEquals(0, run("int @x;", "--warnings", "-"));
        assertEquals("tokenizer: Unexpected character '@' skipped. [line 1, col 5]" + System.lineSeparator(), err());
    }

    @Test
    void strictFailsOnWarnings() throws IOException {
        assertEquals(1, run("int @x;\n}", "--strict", "-"));
        assertEquals("int x = 0;\n", out());
        assertTrue(err().contains("tokenizer: Unexpected character '@' skipped."));
        assertTrue(err().contains("parser: Unexpected '}' skipped. [line 2, col 1]"));
    }

    @Test
    void strictPassesCleanInput() throws IOException {
        assertEquals(0, run("int x;", "--strict", "-"));
    }

    @Test
    void tokens() throws IOException {
        assertEquals(0, run("x =\n1;", "--tokens", "-"));
        var nl = System.lineSeparator();
        assertEquals("IDENTIFIER : x" + nl
            + "OPERATOR : =" + nl
            + "NUMBER : 1" + nl
            + "DELIMITER : ;" + nl
            + "EOF : EOF" + nl
            + "x = 1;\n", out());
    }

    @Test
    void ast() throws IOException {
        assertEquals(0, run("return;", "--ast", "-"));
        assertEquals("Program\n  ReturnStatement\nreturn;\n", out());
    }

    @Test
    void promptBuffersUntilBracesBalance() throws IOException {
        assertEquals(0, run(":lang python\nvoid f() {\n:b\n}\n:q\n"));
        var output = out();
        assertTrue(output.contains("dialect: python"));
        assertTrue(output.contains("01  void f() {"));
        assertTrue(output.contains("def f():\n    pass\n"));
    }

    @Test
    void promptToggles() throws IOException {
        assertEquals(0, run(":tok true\n:ast\n:lang cobol\n"));
        var output = out();
        assertTrue(output.contains("print tokens: true"));
        assertTrue(output.contains("print ast: false"));
        assertTrue(output.contains("unknown dialect: cobol"));
        assertTrue(output.contains("dialect: java"));
    }

    @Test
    void dialectNameIgnoresDefaultLocale() throws IOException {
        var locale = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals(0, run(":lang indented\n"));
            assertTrue(out().contains("dialect: python"));
        } finally {
            Locale.setDefault(locale);
        }
    }

    @Test
    void unmatchedBraces() {
        assertEquals(1, CTrans.countUnmatchedBraces("int f() {"));
        assertEquals(0, CTrans.countUnmatchedBraces("printf(\"{\");"));
        assertEquals(-1, CTrans.countUnmatchedBraces("}"));
    }

    @Test
    void listing() {
        assertEquals("KEYWORD : int", CTrans.listing(new Token(Token.Type.KEYWORD, "int", 1, 1)));
        assertEquals("EOF : EOF", CTrans.listing(new Token(Token.Type.EOF, null, 1, 1)));
    }
}
