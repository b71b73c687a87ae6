package diffmigrator.executor;

import diffmigrator.model.FunctionDecl;
import diffmigrator.model.Parameter;
import diffmigrator.model.PrimitiveKind;
import diffmigrator.model.TranslationUnit;
import diffmigrator.model.TypeRef;
import diffmigrator.oracle.InputValue;
import diffmigrator.oracle.TestCase;
import diffmigrator.oracle.TestSuite;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Generates C99 harnesses for the baseline side.
 *
 * <p>The harness is a separate translation unit: it declares a prototype for
 * each function under test using the declared type spellings, and is linked
 * with the unit. Arrays and strings are copied into local buffers so the
 * function may write to them; output parameters are printed after the call.
 */
public final class CHarnessGenerator implements HarnessGenerator {

    static final String HARNESS_FILE = "dm_harness.c";

    private static final Pattern MAIN_SIGNATURE =
            Pattern.compile("\\b(?:int|void)\\s+main\\s*\\([^)]*\\)\\s*\\{");
    private static final Pattern STORAGE_KEYWORDS = Pattern.compile("\\b(?:static|extern|inline)\\b");

    @Override
    public Backend backend() {
        return Backend.C;
    }

    @Override
    public String harnessFileName() {
        return HARNESS_FILE;
    }

    /** Removes the unit's {@code main} so the harness can supply its own. */
    @Override
    public String prepareSource(String sourceText) {
        Matcher m = MAIN_SIGNATURE.matcher(sourceText);
        if (!m.find()) return sourceText;
        int close = SourceScanner.matchingBrace(sourceText, m.end() - 1);
        if (close < 0) return sourceText;
        return sourceText.substring(0, m.start()) + sourceText.substring(close + 1);
    }

    @Override
    public String generate(TranslationUnit unit, TestSuite suite) {
        StringBuilder sb = new StringBuilder();
        sb.append("/* Test harness for unit ").append(unit.id()).append(". Generated, do not edit. */\n");
        sb.append("#include <stdio.h>\n#include <stdlib.h>\n#include <string.h>\n#include <stdint.h>\n")
                .append("#include <stddef.h>\n#include <stdbool.h>\n#include <math.h>\n\n");

        for (String name : suite.functionNames()) {
            FunctionDecl fn = unit.function(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unit " + unit.id() + " has no function " + name));
            sb.append(prototype(fn)).append(";\n");
        }
        sb.append('\n').append(HELPERS).append('\n');

        List<TestCase> cases = suite.cases();
        for (int i = 0; i < cases.size(); i++) {
            TestCase tc = cases.get(i);
            FunctionDecl fn = unit.function(tc.functionName()).orElseThrow();
            appendCase(sb, i, tc, fn);
        }

        sb.append("int main(int argc, char **argv) {\n");
        sb.append("    const char *only = argc > 1 ? argv[1] : NULL;\n");
        for (int i = 0; i < cases.size(); i++) {
            sb.append("    if (!only || strcmp(only, \"").append(cases.get(i).name())
                    .append("\") == 0) dm_case_").append(i).append("();\n");
        }
        sb.append("    return 0;\n}\n");
        return sb.toString();
    }

    private static final String HELPERS = """
            static void dm_print_long(long long v) { printf("%lld", v); }
            static void dm_print_ulong(unsigned long long v) { printf("%llu", v); }
            static void dm_print_bool(int v) { fputs(v ? "true" : "false", stdout); }
            static void dm_print_double(double v) {
                if (isnan(v)) fputs("nan", stdout);
                else if (isinf(v)) fputs(v > 0 ? "inf" : "-inf", stdout);
                else printf("%.17g", v);
            }
            static void dm_print_text(const char *s) {
                if (!s) { fputs("null", stdout); return; }
                putchar('"');
                for (; *s; s++) {
                    switch (*s) {
                        case '\\\\': fputs("\\\\\\\\", stdout); break;
                        case '"': fputs("\\\\\\"", stdout); break;
                        case ',': fputs("\\\\,", stdout); break;
                        case '\\n': fputs("\\\\n", stdout); break;
                        case '\\r': fputs("\\\\r", stdout); break;
                        case '\\t': fputs("\\\\t", stdout); break;
                        default: putchar(*s);
                    }
                }
                putchar('"');
            }
            """;

    private void appendCase(StringBuilder sb, int index, TestCase tc, FunctionDecl fn) {
        sb.append("static void dm_case_").append(index).append("(void) {\n");
        for (Parameter p : fn.parameters()) {
            sb.append("    ").append(declaration(p, tc.input(p.name()))).append('\n');
        }

        String args = fn.parameters().stream().map(p -> local(p.name())).collect(Collectors.joining(", "));
        String call = fn.name() + "(" + args + ")";
        if (fn.returnType().isVoid()) {
            sb.append("    ").append(call).append(";\n");
        } else {
            sb.append("    ").append(spelling(fn.returnType())).append(" dm_r = ").append(call).append(";\n");
        }

        // start a fresh line in case the function printed without a trailing newline
        sb.append("    fputs(\"\\n").append(tc.name()).append("=\", stdout);\n");
        boolean first = true;
        if (!fn.returnType().isVoid()) {
            sb.append("    ").append(printScalar(fn.returnType().kind(), "dm_r")).append('\n');
            first = false;
        }
        for (Parameter p : fn.parameters()) {
            if (!p.isOutput()) continue;
            if (!first) sb.append("    putchar(',');\n");
            first = false;
            appendSequencePrint(sb, p, tc.input(p.name()));
        }
        sb.append("    putchar('\\n');\n    fflush(stdout);\n}\n\n");
    }

    private void appendSequencePrint(StringBuilder sb, Parameter p, InputValue input) {
        if (!(input instanceof InputValue.Array array)) {
            sb.append("    fputs(\"null\", stdout);\n");
            return;
        }
        sb.append("    putchar('[');\n");
        sb.append("    for (int dm_i = 0; dm_i < ").append(array.length()).append("; dm_i++) { ")
                .append("if (dm_i) putchar(';'); ")
                .append(printScalar(p.type().kind(), local(p.name()) + "[dm_i]")).append(" }\n");
        sb.append("    putchar(']');\n");
    }

    private static String local(String name) {
        return "p_" + name;
    }

    private static String declaration(Parameter p, InputValue value) {
        TypeRef type = p.type();
        String name = local(p.name());
        if (type.kind() == PrimitiveKind.STRING) {
            if (value instanceof InputValue.Text text) {
                return "char " + name + "[] = " + stringLiteral(text.value()) + ";";
            }
            return "char *" + name + " = NULL;";
        }
        if (type.isSequence()) {
            String element = elementSpelling(type);
            if (value instanceof InputValue.Array array) {
                if (array.length() == 0) {
                    return element + " " + name + "[1] = {0};";
                }
                String items = array.elements().stream().map(CHarnessGenerator::literal)
                        .collect(Collectors.joining(", "));
                return element + " " + name + "[" + array.length() + "] = {" + items + "};";
            }
            return element + " *" + name + " = NULL;";
        }
        return spelling(type) + " " + name + " = " + literal(value) + ";";
    }

    static String prototype(FunctionDecl fn) {
        String params = fn.parameters().isEmpty() ? "void" : fn.parameters().stream()
                .map(CHarnessGenerator::parameterDeclaration)
                .collect(Collectors.joining(", "));
        return spelling(fn.returnType()) + " " + fn.name() + "(" + params + ")";
    }

    private static String parameterDeclaration(Parameter p) {
        TypeRef type = p.type();
        if (type.arrayLength() != null) {
            return elementSpelling(type) + " " + p.name() + "[" + type.arrayLength() + "]";
        }
        return spelling(type) + " " + p.name();
    }

    /** Declared spelling without storage class keywords. */
    static String spelling(TypeRef type) {
        String s = STORAGE_KEYWORDS.matcher(type.spelling()).replaceAll("").trim().replaceAll("\\s+", " ");
        return s.isEmpty() ? type.kind().cName() : s;
    }

    /** Element type of a pointer or array, const kept. */
    static String elementSpelling(TypeRef type) {
        String s = spelling(type).replaceAll("\\[.*?]", "").replace("*", " ").trim().replaceAll("\\s+", " ");
        return s.isEmpty() ? type.kind().cName() : s;
    }

    static String printScalar(PrimitiveKind kind, String expr) {
        if (kind == PrimitiveKind.BOOL) return "dm_print_bool((int) (" + expr + "));";
        if (kind == PrimitiveKind.STRING) return "dm_print_text(" + expr + ");";
        if (kind.isFloating()) return "dm_print_double((double) (" + expr + "));";
        if (kind.isUnsigned()) return "dm_print_ulong((unsigned long long) (" + expr + "));";
        return "dm_print_long((long long) (" + expr + "));";
    }

    static String literal(InputValue value) {
        if (value instanceof InputValue.Integral i) {
            PrimitiveKind kind = i.kind();
            if (kind.isUnsigned()) {
                return "((" + kind.cName() + ") " + Long.toUnsignedString(i.value()) + "ULL)";
            }
            if (i.value() == Long.MIN_VALUE) {
                return "(-9223372036854775807LL - 1)";
            }
            return "((" + kind.cName() + ") " + i.value() + "LL)";
        }
        if (value instanceof InputValue.Floating f) {
            double d = f.value();
            if (Double.isNaN(d)) return "NAN";
            if (Double.isInfinite(d)) return d > 0 ? "INFINITY" : "(-INFINITY)";
            return "((" + f.kind().cName() + ") " + Double.toString(d) + ")";
        }
        if (value instanceof InputValue.Bool b) {
            return b.value() ? "true" : "false";
        }
        if (value instanceof InputValue.Text t) {
            return stringLiteral(t.value());
        }
        if (value instanceof InputValue.Null) {
            return "NULL";
        }
        throw new IllegalArgumentException("No scalar C literal for " + value);
    }

    static String stringLiteral(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (byte b : text.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c > 0x7E) {
                        sb.append(String.format("\\%03o", c));
                    } else {
                        sb.append((char) c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
