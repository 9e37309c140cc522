package ctrans.lang;

import static ctrans.lang.Token.Type.*;

import java.util.List;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Cursor over a token list that steps over hidden (newline) tokens unless
 * asked not to. Reading past the last token, or a list with no EOF at all,
 * yields a synthetic EOF.
 */
@RequiredArgsConstructor
public final class TokenStream {

    private final @NonNull List<Token> tokens;

    private int current = 0;
    private Token previous = null;

    public Token previous() {
        return previous != null ? previous : peek();
    }

    /**
     * Index of the next token; only grows.
     */
    public int position() {
        return current;
    }

    public boolean isAtEnd() {
        return isAtEnd(false);
    }

    public boolean isAtEnd(boolean includeHidden) {
        return peek(includeHidden).type() == EOF;
    }

    public Token peek() {
        return peek(false);
    }

    public Token peek(boolean includeHidden) {
        return peekFrom(current, includeHidden);
    }

    public Token peekNext() {
        return peekNext(false);
    }

    public Token peekNext(boolean includeHidden) {
        if (isAtEnd(includeHidden)) {
            return peek(includeHidden);
        }
        var index = includeHidden ? current : nextVisible(current);
        return peekFrom(index + 1, includeHidden);
    }

    public Token advance() {
        return advance(false);
    }

    public Token advance(boolean includeHidden) {
        if (!includeHidden) {
            current = nextVisible(current);
        }
        previous = tokenAt(current);
        if (previous.type() != EOF) {
            current++;
        }
        if (!includeHidden) {
            current = nextVisible(current);
        }
        return previous;
    }

    private int nextVisible(int index) {
        var token = tokenAt(index);
        while (token.hidden() && EOF != token.type()) {
            index++;
            token = tokenAt(index);
        }
        return index;
    }

    private Token peekFrom(int index, boolean includeHidden) {
        if (!includeHidden) {
            index = nextVisible(index);
        }
        return tokenAt(index);
    }

    private Token tokenAt(int index) {
        if (index < tokens.size()) {
            return tokens.get(index);
        }
        if (tokens.isEmpty()) {
            return new Token(EOF, null, 1, 1);
        }
        var last = tokens.get(tokens.size() - 1);
        return last.type() == EOF ? last : new Token(EOF, null, last.line(), last.column());
    }
}
