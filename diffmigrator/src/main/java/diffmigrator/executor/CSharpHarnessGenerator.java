package diffmigrator.executor;

import diffmigrator.model.FunctionDecl;
import diffmigrator.model.Parameter;
import diffmigrator.model.PrimitiveKind;
import diffmigrator.model.TranslationUnit;
import diffmigrator.model.TypeRef;
import diffmigrator.oracle.InputValue;
import diffmigrator.oracle.TestCase;
import diffmigrator.oracle.TestSuite;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Generates C# harnesses for the target side.
 *
 * <p>Converted code is expected to expose each function as a public static
 * method with the C name on a class named after the unit
 * ({@code math_utils} becomes {@code MathUtils}, see {@link #typeNameFor(String)}).
 * Parameters map as follows:
 * <ul>
 *   <li>scalars to the matching C# primitive ({@code char} to {@code sbyte},
 *       {@code unsigned char} to {@code byte})</li>
 *   <li>{@code char*} to {@code string}</li>
 *   <li>pointers and arrays to one-dimensional arrays of the element type;
 *       a pointer to a single value is an array of length one, and a null
 *       pointer is a null array</li>
 * </ul>
 */
public final class CSharpHarnessGenerator implements HarnessGenerator {

    static final String HARNESS_FILE = "DiffHarness.cs";
    static final String HARNESS_CLASS = "DiffHarness";

    @Override
    public Backend backend() {
        return Backend.CSHARP;
    }

    @Override
    public String harnessFileName() {
        return HARNESS_FILE;
    }

    /** Removes markdown code fences a code generator may have wrapped around the source. */
    @Override
    public String prepareSource(String sourceText) {
        String stripped = sourceText.lines()
                .filter(line -> !line.strip().startsWith("```"))
                .collect(Collectors.joining("\n"));
        return stripped.endsWith("\n") ? stripped : stripped + "\n";
    }

    /**
     * Returns the class name converted code for a unit must declare.
     */
    public static String typeNameFor(String unitId) {
        StringBuilder sb = new StringBuilder();
        for (String part : unitId.split("[^A-Za-z0-9]+")) {
            if (part.isEmpty()) continue;
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        if (sb.length() == 0 || Character.isDigit(sb.charAt(0))) {
            sb.insert(0, "Unit");
        }
        return sb.toString();
    }

    @Override
    public String generate(TranslationUnit unit, TestSuite suite) {
        String owner = typeNameFor(unit.id());
        StringBuilder sb = new StringBuilder();
        sb.append("// Test harness for unit ").append(unit.id()).append(". Generated, do not edit.\n");
        sb.append("using System;\nusing System.Globalization;\nusing System.Text;\n\n");
        sb.append("public static class ").append(HARNESS_CLASS).append("\n{\n");
        sb.append(HELPERS);

        List<TestCase> cases = suite.cases();
        for (int i = 0; i < cases.size(); i++) {
            TestCase tc = cases.get(i);
            FunctionDecl fn = unit.function(tc.functionName())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unit " + unit.id() + " has no function " + tc.functionName()));
            appendCase(sb, i, tc, fn, owner);
        }

        sb.append("    public static int Main(string[] args)\n    {\n");
        sb.append("        string only = args.Length > 0 ? args[0] : null;\n");
        for (int i = 0; i < cases.size(); i++) {
            sb.append("        if (only == null || only == \"").append(cases.get(i).name())
                    .append("\") Case").append(i).append("();\n");
        }
        sb.append("        return 0;\n    }\n}\n");
        return sb.toString();
    }

    private static final String HELPERS = """
                static string Fmt(long v) { return v.ToString(CultureInfo.InvariantCulture); }
                static string Fmt(ulong v) { return v.ToString(CultureInfo.InvariantCulture); }
                static string Fmt(bool v) { return v ? "true" : "false"; }
                static string Fmt(double v)
                {
                    if (double.IsNaN(v)) return "nan";
                    if (double.IsPositiveInfinity(v)) return "inf";
                    if (double.IsNegativeInfinity(v)) return "-inf";
                    return v.ToString("R", CultureInfo.InvariantCulture);
                }
                static string Fmt(string s)
                {
                    if (s == null) return "null";
                    var sb = new StringBuilder("\\"");
                    foreach (char c in s)
                    {
                        switch (c)
                        {
                            case '\\\\': sb.Append("\\\\\\\\"); break;
                            case '"': sb.Append("\\\\\\""); break;
                            case ',': sb.Append("\\\\,"); break;
                            case '\\n': sb.Append("\\\\n"); break;
                            case '\\r': sb.Append("\\\\r"); break;
                            case '\\t': sb.Append("\\\\t"); break;
                            default: sb.Append(c); break;
                        }
                    }
                    return sb.Append('"').ToString();
                }
                static string FmtArray<T>(T[] a, Func<T, string> f)
                {
                    if (a == null) return "null";
                    var parts = new string[a.Length];
                    for (int i = 0; i < a.Length; i++) parts[i] = f(a[i]);
                    return "[" + string.Join(";", parts) + "]";
                }

            """;

    private void appendCase(StringBuilder sb, int index, TestCase tc, FunctionDecl fn, String owner) {
        sb.append("    static void Case").append(index).append("()\n    {\n");
        for (Parameter p : fn.parameters()) {
            sb.append("        ").append(declaration(p, tc.input(p.name()))).append('\n');
        }
        String args = fn.parameters().stream().map(p -> local(p.name())).collect(Collectors.joining(", "));
        String call = owner + "." + fn.name() + "(" + args + ")";
        if (fn.returnType().isVoid()) {
            sb.append("        ").append(call).append(";\n");
        } else {
            sb.append("        var dm_r = ").append(call).append(";\n");
        }

        StringBuilder values = new StringBuilder();
        if (!fn.returnType().isVoid()) {
            values.append(format(fn.returnType().kind(), "dm_r"));
        }
        for (Parameter p : fn.parameters()) {
            if (!p.isOutput()) continue;
            if (values.length() > 0) values.append(", ");
            values.append("FmtArray(").append(local(p.name())).append(", e => ")
                    .append(format(p.type().kind(), "e")).append(')');
        }
        sb.append("        Console.Out.Write(\"\\n").append(tc.name()).append("=\" + string.Join(\",\", new string[] { ")
                .append(values).append(" }) + \"\\n\");\n");
        sb.append("        Console.Out.Flush();\n    }\n\n");
    }

    private static String local(String name) {
        return "p_" + name;
    }

    static String csType(TypeRef type) {
        if (type.kind() == PrimitiveKind.STRING) return "string";
        return type.isSequence() ? type.kind().csName() + "[]" : type.kind().csName();
    }

    private static String declaration(Parameter p, InputValue value) {
        TypeRef type = p.type();
        String decl = csType(type) + " " + local(p.name()) + " = ";
        if (type.kind() != PrimitiveKind.STRING && type.isSequence()) {
            if (value instanceof InputValue.Array array) {
                String element = type.kind().csName();
                if (array.length() == 0) {
                    return decl + "new " + element + "[0];";
                }
                String items = array.elements().stream().map(CSharpHarnessGenerator::literal)
                        .collect(Collectors.joining(", "));
                return decl + "new " + element + "[] { " + items + " };";
            }
            return decl + "null;";
        }
        return decl + literal(value) + ";";
    }

    static String format(PrimitiveKind kind, String expr) {
        if (kind == PrimitiveKind.BOOL) return "Fmt((bool) " + expr + ")";
        if (kind == PrimitiveKind.STRING) return "Fmt((string) " + expr + ")";
        if (kind.isFloating()) return "Fmt((double) " + expr + ")";
        if (kind.isUnsigned()) return "Fmt((ulong) " + expr + ")";
        return "Fmt((long) " + expr + ")";
    }

    static String literal(InputValue value) {
        if (value instanceof InputValue.Integral i) {
            PrimitiveKind kind = i.kind();
            if (kind.isUnsigned()) {
                return "((" + kind.csName() + ") " + Long.toUnsignedString(i.value()) + "UL)";
            }
            if (i.value() == Long.MIN_VALUE) {
                return "long.MinValue";
            }
            return "((" + kind.csName() + ") (" + i.value() + "L))";
        }
        if (value instanceof InputValue.Floating f) {
            String type = f.kind().csName();
            double d = f.value();
            if (Double.isNaN(d)) return type + ".NaN";
            if (Double.isInfinite(d)) return d > 0 ? type + ".PositiveInfinity" : type + ".NegativeInfinity";
            return "((" + type + ") (" + Double.toString(d) + "))";
        }
        if (value instanceof InputValue.Bool b) {
            return b.value() ? "true" : "false";
        }
        if (value instanceof InputValue.Text t) {
            return stringLiteral(t.value());
        }
        if (value instanceof InputValue.Null) {
            return "null";
        }
        throw new IllegalArgumentException("No scalar C# literal for " + value);
    }

    static String stringLiteral(String text) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20 || c > 0x7E) {
                        sb.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
