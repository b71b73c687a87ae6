package diffmigrator.model;

import java.util.Objects;

/**
 * A declared type: a base kind plus pointer depth, const-ness and an optional
 * fixed array length.
 *
 * <p>{@code char*} parameters are modelled as {@link PrimitiveKind#STRING} with
 * pointer depth zero, since they carry text rather than an address.
 *
 * @param kind base scalar kind
 * @param spelling the type as written in the source, for diagnostics
 * @param pointerDepth number of pointer levels ({@code int**} is 2)
 * @param isConst true if the pointee is const-qualified
 * @param arrayLength fixed array length for {@code int a[4]}, or null
 */
public record TypeRef(
        PrimitiveKind kind,
        String spelling,
        int pointerDepth,
        boolean isConst,
        Integer arrayLength
) {

    public static final TypeRef VOID = new TypeRef(PrimitiveKind.VOID, "void", 0, false, null);

    public TypeRef {
        Objects.requireNonNull(kind, "kind");
        if (pointerDepth < 0) {
            throw new IllegalArgumentException("pointerDepth must not be negative: " + pointerDepth);
        }
        if (arrayLength != null && arrayLength < 0) {
            throw new IllegalArgumentException("arrayLength must not be negative: " + arrayLength);
        }
        spelling = spelling != null ? spelling : kind.cName();
    }

    /** Creates a plain scalar type. */
    public static TypeRef scalar(PrimitiveKind kind) {
        return new TypeRef(kind, kind.cName(), 0, false, null);
    }

    /** Creates a single-level pointer to {@code kind}. */
    public static TypeRef pointer(PrimitiveKind kind, boolean isConst) {
        return new TypeRef(kind, (isConst ? "const " : "") + kind.cName() + "*", 1, isConst, null);
    }

    /** Creates a fixed-length array of {@code kind}. */
    public static TypeRef array(PrimitiveKind kind, int length) {
        return new TypeRef(kind, kind.cName() + "[" + length + "]", 0, false, length);
    }

    /**
     * Parses a C declaration type such as {@code const double *} or {@code unsigned int}.
     *
     * @param spelling the declared type, pointer stars included
     * @return the parsed type reference
     */
    public static TypeRef parseC(String spelling) {
        String s = spelling == null ? "" : spelling.trim();
        int depth = (int) s.chars().filter(c -> c == '*').count();
        String base = s.replace("*", " ").trim();
        boolean isConst = base.contains("const");
        PrimitiveKind kind = PrimitiveKind.fromC(base);
        if ((kind == PrimitiveKind.CHAR) && depth == 1) {
            return new TypeRef(PrimitiveKind.STRING, s, 0, isConst, null);
        }
        return new TypeRef(kind, s, depth, isConst, null);
    }

    public boolean isVoid() {
        return kind == PrimitiveKind.VOID && pointerDepth == 0;
    }

    public boolean isPointer() {
        return pointerDepth > 0;
    }

    /** True for fixed arrays and single-level pointers used as sequences. */
    public boolean isSequence() {
        return arrayLength != null || pointerDepth == 1;
    }

    /** A pointer (not a fixed array) may legally be passed as NULL. */
    public boolean isNullable() {
        return pointerDepth > 0 || kind == PrimitiveKind.STRING;
    }

    /**
     * True if the engine can bind inputs to this type: a scalar or string, or a
     * single-level pointer or fixed array of a scalar kind.
     */
    public boolean isSupported() {
        if (!kind.hasValueDomain()) return false;
        if (kind == PrimitiveKind.STRING) return pointerDepth == 0;
        return pointerDepth <= 1;
    }

    @Override
    public String toString() {
        return spelling;
    }
}
