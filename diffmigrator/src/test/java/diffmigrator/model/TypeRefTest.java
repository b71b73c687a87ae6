package diffmigrator.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TypeRef")
class TypeRefTest {

    @Nested
    @DisplayName("parseC")
    class ParseC {

        @Test
        @DisplayName("should parse unsigned scalars")
        void shouldParseUnsignedScalars() {
            assertThat(TypeRef.parseC("unsigned int").kind()).isEqualTo(PrimitiveKind.UINT);
            assertThat(TypeRef.parseC("unsigned char").kind()).isEqualTo(PrimitiveKind.UCHAR);
            assertThat(TypeRef.parseC("unsigned long long").kind()).isEqualTo(PrimitiveKind.ULONG);
            assertThat(TypeRef.parseC("signed short int").kind()).isEqualTo(PrimitiveKind.SHORT);
        }

        @Test
        @DisplayName("should parse const pointers")
        void shouldParseConstPointers() {
            TypeRef type = TypeRef.parseC("const double *");

            assertThat(type.kind()).isEqualTo(PrimitiveKind.DOUBLE);
            assertThat(type.pointerDepth()).isEqualTo(1);
            assertThat(type.isConst()).isTrue();
            assertThat(type.isSequence()).isTrue();
            assertThat(type.isNullable()).isTrue();
        }

        @Test
        @DisplayName("should model char pointers as strings")
        void shouldModelCharPointersAsStrings() {
            TypeRef type = TypeRef.parseC("const char*");

            assertThat(type.kind()).isEqualTo(PrimitiveKind.STRING);
            assertThat(type.isPointer()).isFalse();
            assertThat(type.isNullable()).isTrue();
            assertThat(type.isSupported()).isTrue();
        }

        @Test
        @DisplayName("should resolve unknown types to opaque")
        void shouldResolveUnknownTypesToOpaque() {
            TypeRef type = TypeRef.parseC("struct Point *");

            assertThat(type.kind()).isEqualTo(PrimitiveKind.OPAQUE);
            assertThat(type.isSupported()).isFalse();
        }
    }

    @Test
    @DisplayName("double pointers should be unsupported")
    void doublePointersShouldBeUnsupported() {
        assertThat(TypeRef.parseC("int **").isSupported()).isFalse();
    }

    @Test
    @DisplayName("fixed arrays should be sequences but not nullable")
    void fixedArraysShouldNotBeNullable() {
        TypeRef type = TypeRef.array(PrimitiveKind.INT, 3);

        assertThat(type.isSequence()).isTrue();
        assertThat(type.isNullable()).isFalse();
        assertThat(new Parameter("values", type).isOutput()).isTrue();
    }

    @Test
    @DisplayName("const pointer parameters should not be outputs")
    void constPointerParametersShouldNotBeOutputs() {
        assertThat(new Parameter("in", TypeRef.pointer(PrimitiveKind.INT, true)).isOutput()).isFalse();
        assertThat(new Parameter("out", TypeRef.pointer(PrimitiveKind.INT, false)).isOutput()).isTrue();
    }

    @Test
    @DisplayName("integral ranges should follow bit widths")
    void integralRangesShouldFollowBitWidths() {
        assertThat(PrimitiveKind.CHAR.minValue()).isEqualTo(-128);
        assertThat(PrimitiveKind.UCHAR.maxValue()).isEqualTo(255);
        assertThat(PrimitiveKind.INT.minValue()).isEqualTo(Integer.MIN_VALUE);
        assertThat(PrimitiveKind.UINT.maxValue()).isEqualTo(4294967295L);
        assertThat(PrimitiveKind.ULONG.maxValue()).isEqualTo(-1L);
    }
}
