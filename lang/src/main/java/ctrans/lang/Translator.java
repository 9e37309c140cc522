package ctrans.lang;

import static lombok.AccessLevel.PRIVATE;

import java.util.List;

import lombok.NoArgsConstructor;
import lombok.NonNull;

/**
 * Runs the whole pipeline: tokenize, parse, generate. Each call builds its own
 * stages, so calls share nothing and may run concurrently.
 */
@NoArgsConstructor(access = PRIVATE)
public final class Translator {

    /**
     * Everything a run produced, including the intermediate tokens and tree.
     */
    public static record Translation(
        List<Token> tokens,
        Ast.Program program,
        String output,
        List<Tokenizer.Message> tokenizerWarnings,
        List<Parser.Message> parserWarnings,
        List<CodeGenerator.Message> generatorWarnings) {

        public Translation {
            tokens = List.copyOf(tokens);
            tokenizerWarnings = List.copyOf(tokenizerWarnings);
            parserWarnings = List.copyOf(parserWarnings);
            generatorWarnings = List.copyOf(generatorWarnings);
        }

        public boolean hasWarnings() {
            return !tokenizerWarnings.isEmpty() || !parserWarnings.isEmpty() || !generatorWarnings.isEmpty();
        }
    }

    public static Translation translate(@NonNull String source, @NonNull Dialect dialect) {
        var tokenizer = new Tokenizer(source);
        var tokens = tokenizer.getTokens();

        var parser = new Parser(new TokenStream(tokens));
        var program = parser.parse();

        var generator = new CodeGenerator();
        var output = generator.generate(program, dialect);

        return new Translation(tokens, program, output,
            tokenizer.getWarnings(), parser.getWarnings(), generator.getWarnings());
    }
}
