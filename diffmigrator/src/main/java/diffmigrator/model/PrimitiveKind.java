package diffmigrator.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scalar kinds understood by the oracle generator and the harness generators.
 *
 * <p>Each kind knows its spelling in the source language (C) and the target
 * language (C#), and the numeric range used for boundary and random inputs.
 * Unsigned 64-bit values are carried in a {@code long} and interpreted
 * unsigned; {@link #maxValue()} of {@link #ULONG} is therefore {@code -1L}.
 */
public enum PrimitiveKind {
    BOOL("bool", "bool", 1, false, false),
    CHAR("char", "sbyte", 8, true, false),
    UCHAR("unsigned char", "byte", 8, false, false),
    SHORT("short", "short", 16, true, false),
    USHORT("unsigned short", "ushort", 16, false, false),
    INT("int", "int", 32, true, false),
    UINT("unsigned int", "uint", 32, false, false),
    LONG("long", "long", 64, true, false),
    ULONG("unsigned long", "ulong", 64, false, false),
    FLOAT("float", "float", 32, true, true),
    DOUBLE("double", "double", 64, true, true),
    STRING("const char*", "string", 0, false, false),
    VOID("void", "void", 0, false, false),
    /** Structs, unions, function pointers and anything else without a value domain. */
    OPAQUE("", "", 0, false, false);

    private final String cName;
    private final String csName;
    private final int bits;
    private final boolean signed;
    private final boolean floating;

    PrimitiveKind(String cName, String csName, int bits, boolean signed, boolean floating) {
        this.cName = cName;
        this.csName = csName;
        this.bits = bits;
        this.signed = signed;
        this.floating = floating;
    }

    /** Returns the spelling used in generated C code. */
    public String cName() { return cName; }

    /** Returns the spelling used in generated C# code. */
    public String csName() { return csName; }

    public int bits() { return bits; }

    public boolean isSigned() { return signed; }

    public boolean isFloating() { return floating; }

    public boolean isIntegral() {
        return bits > 1 && !floating;
    }

    public boolean isUnsigned() {
        return isIntegral() && !signed;
    }

    /** Returns true for kinds the generator can produce values for. */
    public boolean hasValueDomain() {
        return this != VOID && this != OPAQUE;
    }

    /**
     * Smallest representable value of an integral kind.
     *
     * @throws IllegalStateException if the kind is not integral
     */
    public long minValue() {
        requireIntegral();
        return signed ? -(1L << (bits - 1)) : 0L;
    }

    /**
     * Largest representable value of an integral kind, as raw bits for {@link #ULONG}.
     *
     * @throws IllegalStateException if the kind is not integral
     */
    public long maxValue() {
        requireIntegral();
        if (bits == 64) {
            return signed ? Long.MAX_VALUE : -1L;
        }
        return signed ? (1L << (bits - 1)) - 1 : (1L << bits) - 1;
    }

    private void requireIntegral() {
        if (!isIntegral()) {
            throw new IllegalStateException(name() + " is not an integral kind");
        }
    }

    /**
     * Resolves a C base type spelling (without pointer stars) to a kind.
     *
     * <p>Qualifiers such as {@code const}, {@code static} and {@code signed}
     * are ignored; {@code long long} and {@code long int} map to {@link #LONG}.
     * Unknown spellings resolve to {@link #OPAQUE}.
     *
     * @param spelling the base type as written in the source
     * @return the matching kind
     */
    public static PrimitiveKind fromC(String spelling) {
        if (spelling == null) return OPAQUE;
        boolean unsigned = false;
        List<String> tokens = new ArrayList<>();
        for (String token : spelling.toLowerCase(Locale.ROOT).trim().split("\\s+")) {
            switch (token) {
                case "const", "static", "volatile", "extern", "inline", "signed", "" -> { }
                case "unsigned" -> unsigned = true;
                default -> tokens.add(token);
            }
        }
        if (tokens.size() > 1 && tokens.get(tokens.size() - 1).equals("int")) {
            tokens.remove(tokens.size() - 1);
        }
        String s = String.join(" ", tokens);

        switch (s) {
            case "bool":
            case "_bool":
                return BOOL;
            case "char":
            case "int8_t":
                return unsigned ? UCHAR : CHAR;
            case "uint8_t":
                return UCHAR;
            case "short":
            case "int16_t":
                return unsigned ? USHORT : SHORT;
            case "uint16_t":
                return USHORT;
            case "":
            case "int":
            case "int32_t":
                return unsigned ? UINT : INT;
            case "uint32_t":
                return UINT;
            case "long":
            case "long long":
            case "int64_t":
                return unsigned ? ULONG : LONG;
            case "uint64_t":
            case "size_t":
                return ULONG;
            case "float":
                return FLOAT;
            case "double":
            case "long double":
                return DOUBLE;
            case "void":
                return VOID;
            default:
                return OPAQUE;
        }
    }
}
