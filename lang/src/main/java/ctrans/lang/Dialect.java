package ctrans.lang;

import java.util.Locale;
import java.util.Optional;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Output syntax chosen by the caller.
 */
@RequiredArgsConstructor
public enum Dialect {
    /** Braces and type annotations. */
    JAVA("//", "typed"),

    /** Indentation scoped, untyped. */
    PYTHON("#", "indented");

    @Getter
    private final String commentPrefix;

    private final String alias;

    public String comment(String text) {
        return commentPrefix + " " + text;
    }

    /**
     * Looks a dialect up by name ({@code java}, {@code python}) or alias
     * ({@code typed}, {@code indented}), ignoring case.
     */
    public static Optional<Dialect> forName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        var key = name.trim().toLowerCase(Locale.ROOT);
        for (var dialect : values()) {
            if (dialect.name().toLowerCase(Locale.ROOT).equals(key) || dialect.alias.equals(key)) {
                return Optional.of(dialect);
            }
        }
        return Optional.empty();
    }
}
