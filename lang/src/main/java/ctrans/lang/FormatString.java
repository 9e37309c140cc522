package ctrans.lang;

import static lombok.AccessLevel.PRIVATE;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import lombok.NoArgsConstructor;

/**
 * Reads the conversion markers of a printf/scanf format string, as it appears
 * in the source (escapes still raw), and respells it for each dialect.
 */
@NoArgsConstructor(access = PRIVATE)
final class FormatString {

    enum Conversion {
        INTEGER,
        FLOAT,
        DOUBLE,
        STRING,
        CHAR;
    }

    // %[flags][width][.precision][length]conversion
    private static final Pattern SPECIFIER = Pattern.compile(
        "%([-+ 0#]*)(\\d+)?(?:\\.(\\d+))?(hh|h|ll|l|L|z|j|t)?([diuoxXeEfFgGcsp%])");

    private static final String NEWLINE = "\\n";

    /**
     * The conversions in order of appearance. {@code %%} is not a conversion.
     */
    static List<Conversion> conversions(String format) {
        var found = new ArrayList<Conversion>();
        if (format == null) {
            return found;
        }
        var matcher = SPECIFIER.matcher(format);
        while (matcher.find()) {
            var conversion = conversion(matcher.group(4), matcher.group(5).charAt(0));
            if (conversion != null) {
                found.add(conversion);
            }
        }
        return found;
    }

    static boolean hasConversions(String format) {
        return !conversions(format).isEmpty();
    }

    private static Conversion conversion(String length, char letter) {
        switch (letter) {
        case 'd':
        case 'i':
        case 'u':
        case 'o':
        case 'x':
        case 'X':
            return Conversion.INTEGER;
        case 'e':
        case 'E':
        case 'f':
        case 'F':
        case 'g':
        case 'G':
            return "l".equals(length) || "L".equals(length) ? Conversion.DOUBLE : Conversion.FLOAT;
        case 'c':
            return Conversion.CHAR;
        case 's':
        case 'p':
            return Conversion.STRING;
        default:
            return null; // %%
        }
    }

    static boolean endsWithNewline(String format) {
        return format.endsWith(NEWLINE) && !format.endsWith("\\" + NEWLINE);
    }

    static String stripNewline(String format) {
        return endsWithNewline(format) ? format.substring(0, format.length() - NEWLINE.length()) : format;
    }

    /**
     * Rewrites the markers to ones {@code java.util.Formatter} accepts:
     * length modifiers go, {@code i} and {@code u} become {@code d}.
     */
    static String toJava(String format) {
        return replace(format, matcher -> {
            var letter = matcher.group(5);
            switch (letter) {
            case "%":
                return "%%";
            case "i":
            case "u":
                letter = "d";
                break;
            case "p":
                letter = "s";
                break;
            default:
                break;
            }
            return "%" + flags(matcher) + letter;
        });
    }

    /**
     * Rewrites the markers as {@code str.format} replacement fields, keeping
     * width and precision: {@code %5.2f} becomes {@code {:5.2f}}.
     */
    static String toTemplate(String format) {
        var escaped = format.replace("{", "{{").replace("}", "}}");
        return replace(escaped, matcher -> {
            var letter = matcher.group(5);
            if ("%".equals(letter)) {
                return "%";
            }
            var spec = new StringBuilder();
            var flags = matcher.group(1) == null ? "" : matcher.group(1);
            if (flags.contains("-")) {
                spec.append('<');
            }
            if (flags.contains("+")) {
                spec.append('+');
            }
            if (flags.contains("0") && !flags.contains("-")) {
                spec.append('0');
            }
            if (matcher.group(2) != null) {
                spec.append(matcher.group(2));
            }
            if (matcher.group(3) != null) {
                spec.append('.').append(matcher.group(3));
            }
            if (spec.length() > 0 || "xXoeEfFgG".contains(letter)) {
                spec.append(pythonType(letter));
            }
            return spec.length() == 0 ? "{}" : "{:" + spec + "}";
        });
    }

    /**
     * Text for a plain print: no markers to fill, {@code %%} is a literal %.
     */
    static String toPlain(String format) {
        return format.replace("%%", "%");
    }

    private static String pythonType(String letter) {
        switch (letter) {
        case "d":
        case "i":
        case "u":
            return "d";
        case "c":
        case "s":
        case "p":
            return "";
        default:
            return letter;
        }
    }

    private static String flags(Matcher matcher) {
        var result = new StringBuilder();
        if (matcher.group(1) != null) {
            result.append(matcher.group(1));
        }
        if (matcher.group(2) != null) {
            result.append(matcher.group(2));
        }
        if (matcher.group(3) != null) {
            result.append('.').append(matcher.group(3));
        }
        return result.toString();
    }

    private static String replace(String format, Function<Matcher, String> replacement) {
        var matcher = SPECIFIER.matcher(format);
        var result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement.apply(matcher)));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
