package ctrans.lang;

import lombok.NonNull;

/**
 * A single lexeme read by the {@link Tokenizer}.
 * <p>
 * String and character literals carry their text without the surrounding
 * quotes. The {@link Type#EOF} token is the only one whose lexeme is null.
 */
public record Token(
    @NonNull Type type,
    String lexeme,
    int line,
    int column) {

    /**
     * Newlines are kept in the token list but the parser never sees them.
     */
    public boolean hidden() {
        return type == Type.NEWLINE;
    }

    /**
     * True if this token's text is exactly {@code text}. String literals never
     * match, so {@code "else"} in quotes is not the keyword.
     */
    public boolean is(String text) {
        return type != Type.STRING && text.equals(lexeme);
    }

    @Override
    public String toString() {
        var text = lexeme == null ? "" : " \"" + lexeme.replace("\n", "\\n") + "\"";
        return "(Token " + type + text + " " + line + ":" + column + ")";
    }

    public enum Type {
        KEYWORD,
        IDENTIFIER,

        // literals
        NUMBER,
        STRING,

        OPERATOR,
        DELIMITER,

        // end-of-line
        NEWLINE,

        // end-of-file
        EOF;
    }
}
