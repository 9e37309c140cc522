package ctrans.lang;

import static lombok.AccessLevel.PRIVATE;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor(access = PRIVATE)
public class CTrans {
    static final String USAGE = "Usage: ctrans [--dialect=java|python] [--tokens] [--ast] [--warnings] [--strict] [file|-]";

    public static void main(String[] args) throws IOException {
        System.exit(execute(args, System.in, System.out, System.err));
    }

    static int execute(String[] args, InputStream in, PrintStream out, PrintStream err) throws IOException {
        var cli = new CTrans(in, out, err);

        String path = null;
        for (var arg : args) {
            if (arg.startsWith("--dialect=")) {
                var dialect = Dialect.forName(arg.substring("--dialect=".length()));
                if (dialect.isEmpty()) {
                    return usage(out);
                }
                cli.flags.dialect = dialect.get();
            } else if ("--tokens".equals(arg)) {
                cli.flags.printTokens = true;
            } else if ("--ast".equals(arg)) {
                cli.flags.printAst = true;
            } else if ("--warnings".equals(arg)) {
                cli.flags.printWarnings = true;
            } else if ("--strict".equals(arg)) {
                cli.flags.strict = true;
            } else if (arg.startsWith("--") || path != null) {
                return usage(out);
            } else {
                path = arg;
            }
        }

        return path == null ? cli.runPrompt() : cli.runFile(path);
    }

    private static int usage(PrintStream out) {
        out.println(USAGE);
        return 64;
    }

    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final Flags flags = new Flags();

    private int runFile(String path) throws IOException {
        byte[] bytes;
        if ("-".equals(path)) {
            bytes = in.readAllBytes();
        } else {
            bytes = Files.readAllBytes(Paths.get(path));
        }

        return run(new String(bytes, StandardCharsets.UTF_8));
    }

    private int runPrompt() throws IOException {
        var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));

        var unmatchedBraces = 0;
        var lineBuffer = new ArrayList<String>();
        for (;;) {
            var prompt = String.format(":%02d> ", lineBuffer.size());
            out.print(prompt);
            var line = reader.readLine();

            if (line == null || ":q".equals(line)) {
                break;
            } else if (":b".equals(line)) {
                int n = 0;
                for (var l : lineBuffer) {
                    out.println(String.format("%02d  %s", ++n, l));
                }
            } else if (line.startsWith(":tok")) {
                var arg = line.substring(4).trim();
                if (!arg.isBlank()) {
                    flags.printTokens = Boolean.parseBoolean(arg);
                }
                out.println("print tokens: " + flags.printTokens);
            } else if (line.startsWith(":ast")) {
                var arg = line.substring(4).trim();
                if (!arg.isBlank()) {
                    flags.printAst = Boolean.parseBoolean(arg);
                }
                out.println("print ast: " + flags.printAst);
            } else if (line.startsWith(":lang")) {
                var arg = line.substring(5).trim();
                if (!arg.isBlank()) {
                    Dialect.forName(arg).ifPresentOrElse(
                        dialect -> flags.dialect = dialect,
                        () -> out.println("unknown dialect: " + arg));
                }
                out.println("dialect: " + flags.dialect.name().toLowerCase(Locale.ROOT));
            } else if (!line.isEmpty()) {
                lineBuffer.add(line);
                unmatchedBraces += countUnmatchedBraces(line);

                // translate once braces are at least balanced
                if (unmatchedBraces <= 0) {
                    run(String.join("\n", lineBuffer));
                    lineBuffer.clear();
                    unmatchedBraces = 0;
                }
            }
        }
        return 0;
    }

    private int run(String source) {
        var translation = Translator.translate(source, flags.dialect);

        if (flags.printTokens) {
            translation.tokens().stream()
                .filter(token -> !token.hidden())
                .map(CTrans::listing)
                .forEach(out::println);
        }

        if (flags.printAst) {
            out.print(AstPrinter.print(translation.program()));
        }

        if (flags.printWarnings || flags.strict) {
            translation.tokenizerWarnings().forEach(this::report);
            translation.parserWarnings().forEach(this::report);
            translation.generatorWarnings().forEach(this::report);
        }

        out.print(translation.output());

        if (flags.strict && translation.hasWarnings()) {
            return 1;
        }
        return 0;
    }

    static String listing(Token token) {
        return token.type() + " : " + (token.lexeme() == null ? "EOF" : token.lexeme());
    }

    private void report(Tokenizer.Message warning) {
        err.println("tokenizer: " + warning.message() + " [line " + warning.line() + ", col " + warning.column() + "]");
    }

    private void report(Parser.Message warning) {
        var token = warning.token();
        err.println("parser: " + warning.message() + " [line " + token.line() + ", col " + token.column() + "]");
    }

    private void report(CodeGenerator.Message warning) {
        err.println("generator: " + warning.message());
    }

    private static final List<String> OPEN = List.of("{", "(", "[");
    private static final List<String> CLOSE = List.of("}", ")", "]");

    static int countUnmatchedBraces(String line) {
        int count = 0;
        for (var token : Tokenizer.tokenize(line)) {
            if (token.type() != Token.Type.DELIMITER) {
                continue;
            }
            if (OPEN.contains(token.lexeme())) {
                count++;
            }
            if (CLOSE.contains(token.lexeme())) {
                count--;
            }
        }
        return count;
    }

    private static class Flags {
        Dialect dialect = Dialect.JAVA;
        boolean printTokens = false;
        boolean printAst = false;
        boolean printWarnings = false;
        boolean strict = false;
    }
}
