package ctrans.lang;

import static ctrans.lang.Token.Type.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Splits C source text into tokens.
 * <p>
 * The tokenizer never fails: characters it does not understand are skipped and
 * noted in {@link #getWarnings()}, and an unterminated comment or literal runs
 * to the end of the input.
 */
@Getter
@RequiredArgsConstructor
public final class Tokenizer {

    public static record Message(int line, int column, String message) {}

    static final Set<String> KEYWORDS = Set.of(
        // types
        "int", "float", "double", "char", "void", "bool", "long", "short",
        // control
        "if", "else", "while", "for", "do", "switch", "case", "default",
        "break", "continue", "return", "goto", "sizeof",
        // i/o
        "printf", "scanf",
        // storage and qualifiers
        "const", "static", "struct", "union", "enum", "typedef", "extern",
        "register", "auto", "volatile", "signed", "unsigned");

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
        "==", "!=", "<=", ">=", "++", "--", "&&", "||",
        "+=", "-=", "*=", "/=", "%=", "<<", ">>");

    private static final String OPERATORS = "+-*/%=<>!&|^~";
    private static final String DELIMITERS = "(){}[];,#.";

    private final @NonNull String source;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Message> warnings = new ArrayList<>();

    private int start = 0;
    private int current = 0;
    private int lineStart = 0;
    private int line = 1;

    public static List<Token> tokenize(String source) {
        return new Tokenizer(source).getTokens();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<Token> getTokens() {
        if (!tokens.isEmpty()) {
            return tokens;
        }

        while (!isAtEnd()) {
            start = current;
            scanToken();
        }

        start = current; // report the correct EOF column
        tokens.add(new Token(EOF, null, line, getColumn()));
        return tokens;
    }

    private int getColumn() {
        return 1 + start - lineStart;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private void scanToken() {
        var c = advance();

        if (c == '\n') {
            addToken(NEWLINE);
            newLine();
        } else if (Character.isWhitespace(c)) {
            // completely ignore
        } else if (c == '/' && match('/')) {
            while (peek() != '\n' && !isAtEnd()) {
                advance();
            }
        } else if (c == '/' && match('*')) {
            blockComment();
        } else if (isAlpha(c)) {
            identifier();
        } else if (isDigit(c)) {
            number();
        } else if (c == '"' || c == '\'') {
            literal(c);
        } else if (OPERATORS.indexOf(c) >= 0) {
            operator(c);
        } else if (DELIMITERS.indexOf(c) >= 0) {
            addToken(DELIMITER);
        } else {
            warning("Unexpected character '" + c + "' skipped.");
        }
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z')
            || (c >= 'A' && c <= 'Z')
            || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        var text = source.substring(start, current);
        addToken(KEYWORDS.contains(text) ? KEYWORD : IDENTIFIER);
    }

    private void number() {
        // a second '.' ends the number and is read as a delimiter
        var hasDecimal = false;
        while (isDigit(peek()) || (peek() == '.' && !hasDecimal)) {
            if (advance() == '.') {
                hasDecimal = true;
            }
        }
        addToken(NUMBER);
    }

    private void literal(char quote) {
        var startLine = line;
        var startColumn = getColumn();
        var value = new StringBuilder();
        while (peek() != quote && !isAtEnd()) {
            var c = advance();
            value.append(c);
            if (c == '\n') {
                newLine();
            } else if (c == '\\' && !isAtEnd()) {
                // escapes are kept verbatim
                var escaped = advance();
                value.append(escaped);
                if (escaped == '\n') {
                    newLine();
                }
            }
        }

        if (isAtEnd()) {
            warning("Unterminated literal.");
        } else {
            advance(); // closing quote
        }
        tokens.add(new Token(STRING, value.toString(), startLine, startColumn));
    }

    private void operator(char first) {
        if (!isAtEnd() && TWO_CHAR_OPERATORS.contains("" + first + peek())) {
            advance();
        }
        addToken(OPERATOR);
    }

    private void blockComment() {
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) {
            if (advance() == '\n') {
                newLine();
            }
        }

        if (isAtEnd()) {
            warning("Unterminated comment.");
            return;
        }
        // discard the `*/`
        advance();
        advance();
    }

    private void newLine() {
        line++;
        lineStart = current;
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean match(char expected) {
        if (isAtEnd()) {
            return false;
        }
        if (source.charAt(current) != expected) {
            return false;
        }

        current++;
        return true;
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private void addToken(Token.Type type) {
        var text = source.substring(start, current);
        tokens.add(new Token(type, text, line, getColumn()));
    }

    private void warning(String msg) {
        warnings.add(new Message(line, getColumn(), msg));
    }
}
