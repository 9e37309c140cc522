package ctrans.lang;

import static ctrans.lang.Token.Type.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class TokenizerTest {

    private static List<Token.Type> types(String source) {
        return Tokenizer.tokenize(source).stream()
            .filter(token -> !token.hidden())
            .map(Token::type)
            .collect(Collectors.toList());
    }

    private static List<String> texts(String source) {
        return Tokenizer.tokenize(source).stream()
            .filter(token -> token.type() != EOF && !token.hidden())
            .map(Token::lexeme)
            .collect(Collectors.toList());
    }

    @Test
    void addFunction() {
        var source = "int add(int a, int b) { return a + b; }";
        assertEquals(List.of(
            KEYWORD, IDENTIFIER, DELIMITER, KEYWORD, IDENTIFIER, DELIMITER, KEYWORD, IDENTIFIER, DELIMITER,
            DELIMITER, KEYWORD, IDENTIFIER, OPERATOR, IDENTIFIER, DELIMITER, DELIMITER, EOF), types(source));
        assertEquals(List.of(
            "int", "add", "(", "int", "a", ",", "int", "b", ")",
            "{", "return", "a", "+", "b", ";", "}"), texts(source));
    }

    @Test
    void endsWithSingleEof() {
        for (var source : List.of("", "   ", "\n\n", "x", "@@@", "\"open", "/* open")) {
            var tokens = Tokenizer.tokenize(source);
            assertEquals(EOF, tokens.get(tokens.size() - 1).type(), source);
            assertEquals(1, tokens.stream().filter(token -> token.type() == EOF).count(), source);
        }
    }

    @Test
    void strayCharactersDoNotChangeTokens() {
        assertEquals(texts("int x = 1;"), texts("int @x = 1;"));
        assertEquals(types("int x = 1;"), types("int @x = 1;"));

        var tokenizer = new Tokenizer("int @x = 1;");
        tokenizer.getTokens();
        assertTrue(tokenizer.hasWarnings());
        assertEquals("Unexpected character '@' skipped.", tokenizer.getWarnings().get(0).message());
    }

    @Test
    void mainAndIncludeAreIdentifiers() {
        assertEquals(List.of(KEYWORD, IDENTIFIER, DELIMITER, IDENTIFIER, EOF), types("int main # include"));
    }

    @Test
    void commentsSkipped() {
        assertEquals(List.of("x", "y"), texts("x // line comment\ny"));
        assertEquals(List.of("x", "y"), texts("x /* block\n comment */ y"));
    }

    @Test
    void unterminatedComment() {
        var tokenizer = new Tokenizer("x /* never closed");
        assertEquals(List.of(IDENTIFIER, EOF),
            tokenizer.getTokens().stream().map(Token::type).collect(Collectors.toList()));
        assertEquals("Unterminated comment.", tokenizer.getWarnings().get(0).message());
    }

    @Test
    void numbers() {
        assertEquals(List.of("42", "3.14"), texts("42 3.14"));
        assertEquals(List.of("1.2", ".", "3"), texts("1.2.3"));
        assertEquals(List.of(NUMBER, DELIMITER, NUMBER, EOF), types("1.2.3"));
    }

    @Test
    void literalsKeepEscapesRaw() {
        var tokens = Tokenizer.tokenize("\"a\\\"b\\n\" 'c'");
        assertEquals(new Token(STRING, "a\\\"b\\n", 1, 1), tokens.get(0));
        assertEquals(new Token(STRING, "c", 1, 10), tokens.get(1));
    }

    @Test
    void unterminatedLiteral() {
        var tokenizer = new Tokenizer("\"abc");
        assertEquals(new Token(STRING, "abc", 1, 1), tokenizer.getTokens().get(0));
        assertFalse(tokenizer.getWarnings().isEmpty());
    }

    @Test
    void multiLineLiteralKeepsStartPosition() {
        var tokens = Tokenizer.tokenize("x \"a\nb\" y");
        assertEquals(new Token(STRING, "a\nb", 1, 3), tokens.get(1));
        assertEquals(new Token(IDENTIFIER, "y", 2, 4), tokens.get(2));
    }

    @ParameterizedTest
    @ValueSource(strings = {"==", "!=", "<=", ">=", "++", "--", "&&", "||", "+=", "-=", "*=", "/=", "%=", "<<", ">>"})
    void twoCharOperators(String operator) {
        assertEquals(List.of(operator), texts(operator));
        assertEquals(List.of(OPERATOR, EOF), types(operator));
    }

    @Test
    void operatorsAreGreedyPairs() {
        assertEquals(List.of("+=", "=", "<", "!"), texts("+==<!"));
        assertEquals(List.of("&", "x"), texts("&x"));
    }

    @Test
    void positions() {
        var tokens = Tokenizer.tokenize("int x;\n  x = 2;");
        assertEquals(new Token(KEYWORD, "int", 1, 1), tokens.get(0));
        assertEquals(new Token(IDENTIFIER, "x", 1, 5), tokens.get(1));
        assertEquals(new Token(NEWLINE, "\n", 1, 7), tokens.get(3));
        assertEquals(new Token(IDENTIFIER, "x", 2, 3), tokens.get(4));
        assertEquals(new Token(NUMBER, "2", 2, 7), tokens.get(6));
    }
}
