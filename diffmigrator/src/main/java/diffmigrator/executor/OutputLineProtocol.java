package diffmigrator.executor;

import diffmigrator.model.PrimitiveKind;
import diffmigrator.validator.OutputValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for the line format printed by generated harnesses.
 *
 * <pre>
 * testId=value1,value2,...
 * </pre>
 *
 * <p>Values appear in {@link OutputSignature} order. A value is {@code null},
 * {@code true} or {@code false}, an integer, a float ({@code nan}, {@code inf}
 * and {@code -inf} included), a double-quoted string with backslash escapes
 * ({@code \\ \" \n \t \r \,}), or an array {@code [a;b;c]}.
 *
 * <p>Lines that do not start with a known test id are ignored, so output the
 * function under test prints itself does not disturb parsing.
 */
public final class OutputLineProtocol {

    private OutputLineProtocol() {}

    /**
     * Extracts the outputs of every known case from a process's stdout.
     * When a case prints more than one line, the first wins.
     *
     * @param stdout captured standard output
     * @param signatures output signature per test id
     * @return parsed outputs per test id, for the cases that printed a line
     */
    public static Map<String, Map<String, OutputValue>> parse(String stdout,
                                                              Map<String, OutputSignature> signatures) {
        Map<String, Map<String, OutputValue>> parsed = new LinkedHashMap<>();
        for (String line : stdout.split("\r?\n")) {
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String testId = line.substring(0, eq);
            OutputSignature signature = signatures.get(testId);
            if (signature == null || parsed.containsKey(testId)) continue;
            parsed.put(testId, parseValues(line.substring(eq + 1), signature));
        }
        return parsed;
    }

    /**
     * Parses the value list of one line. Missing trailing values are left out
     * of the result; values that do not parse as their declared kind are kept
     * as raw text so the validator reports a type mismatch.
     */
    public static Map<String, OutputValue> parseValues(String values, OutputSignature signature) {
        Map<String, OutputValue> outputs = new LinkedHashMap<>();
        List<String> tokens = values.isEmpty() ? List.of() : split(values, ',');
        List<OutputSignature.Slot> slots = signature.slots();
        for (int i = 0; i < slots.size() && i < tokens.size(); i++) {
            OutputSignature.Slot slot = slots.get(i);
            outputs.put(slot.name(), parseValue(tokens.get(i), slot.kind(), slot.sequence()));
        }
        return outputs;
    }

    static OutputValue parseValue(String token, PrimitiveKind kind, boolean sequence) {
        String t = token.trim();
        if (t.equals("null")) {
            return OutputValue.Null.INSTANCE;
        }
        if (sequence) {
            if (!t.startsWith("[") || !t.endsWith("]")) {
                return new OutputValue.Text(t);
            }
            String inner = t.substring(1, t.length() - 1);
            List<OutputValue> elements = new ArrayList<>();
            if (!inner.isEmpty()) {
                for (String element : split(inner, ';')) {
                    elements.add(parseScalar(element.trim(), kind));
                }
            }
            return new OutputValue.Array(elements);
        }
        return parseScalar(t, kind);
    }

    private static OutputValue parseScalar(String t, PrimitiveKind kind) {
        try {
            if (kind == PrimitiveKind.BOOL) {
                if (t.equals("true") || t.equals("1")) return new OutputValue.Bool(true);
                if (t.equals("false") || t.equals("0")) return new OutputValue.Bool(false);
                return new OutputValue.Text(t);
            }
            if (kind == PrimitiveKind.STRING) {
                return t.startsWith("\"") && t.endsWith("\"") && t.length() >= 2
                        ? new OutputValue.Text(unescape(t.substring(1, t.length() - 1)))
                        : new OutputValue.Text(t);
            }
            if (kind.isFloating()) {
                return new OutputValue.Floating(kind, parseFloating(t));
            }
            if (kind.isIntegral()) {
                long v = kind == PrimitiveKind.ULONG ? Long.parseUnsignedLong(t) : Long.parseLong(t);
                return new OutputValue.Integral(kind, v);
            }
        } catch (NumberFormatException e) {
            return new OutputValue.Text(t);
        }
        return new OutputValue.Text(t);
    }

    private static double parseFloating(String t) {
        return switch (t.toLowerCase(java.util.Locale.ROOT)) {
            case "nan", "-nan" -> Double.NaN;
            case "inf", "infinity", "+inf" -> Double.POSITIVE_INFINITY;
            case "-inf", "-infinity" -> Double.NEGATIVE_INFINITY;
            default -> Double.parseDouble(t);
        };
    }

    /** Splits on {@code separator} outside quotes and not preceded by a backslash. */
    static List<String> split(String text, char separator) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                current.append(c).append(text.charAt(++i));
            } else if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (c == separator && !quoted) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        parts.add(current.toString());
        return parts;
    }

    static String unescape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= text.length()) {
                sb.append(c);
                continue;
            }
            char next = text.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                default -> sb.append(next);
            }
        }
        return sb.toString();
    }
}
