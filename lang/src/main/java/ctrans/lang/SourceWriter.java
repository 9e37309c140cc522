package ctrans.lang;

import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Line buffer with indentation. Comment lines are kept apart from code lines
 * so a caller can tell whether a suite ended up with any code in it.
 */
@RequiredArgsConstructor
final class SourceWriter {

    private final @NonNull String indentUnit;
    private final @NonNull String commentPrefix;

    private final StringBuilder text = new StringBuilder();
    private int depth = 0;
    private boolean separate = false;

    @Getter
    private int codeLines = 0;

    void line(String code) {
        write(code);
        codeLines++;
    }

    void comment(String comment) {
        write(commentPrefix + " " + comment);
    }

    /**
     * Asks for a blank line before the next line. Dropped when the block is
     * closed first, or when nothing has been written yet.
     */
    void separate() {
        separate = text.length() > 0;
    }

    void indent() {
        depth++;
    }

    void dedent() {
        depth = Math.max(0, depth - 1);
        separate = false;
    }

    private void write(String line) {
        if (separate) {
            text.append('\n');
            separate = false;
        }
        text.append(indentUnit.repeat(depth)).append(line).append('\n');
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
