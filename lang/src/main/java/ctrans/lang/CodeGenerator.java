package ctrans.lang;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import lombok.NonNull;

/**
 * Renders a {@link Ast.Program} in one of the output dialects.
 * <p>
 * Constructs with no counterpart in the target are approximated or left out,
 * and each such loss is noted in {@link #getWarnings()}. The only input that
 * is refused is a root that is not a well-formed program, which renders as a
 * single diagnostic comment line.
 */
public final class CodeGenerator {

    public static record Message(String message) {}

    static final String INVALID_AST = "Error: Invalid AST structure";

    @Getter
    private final List<Message> warnings = new ArrayList<>();

    public String generate(Ast root, @NonNull Dialect dialect) {
        if (!(root instanceof Ast.Program program) || program.body() == null) {
            return dialect.comment(INVALID_AST);
        }
        return writer(dialect).write(program);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    private DialectWriter writer(Dialect dialect) {
        switch (dialect) {
        case PYTHON:
            return new PythonWriter(message -> warnings.add(new Message(message)));
        case JAVA:
        default:
            return new JavaWriter(message -> warnings.add(new Message(message)));
        }
    }
}
