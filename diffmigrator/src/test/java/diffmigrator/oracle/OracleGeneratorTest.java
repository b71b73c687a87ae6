package diffmigrator.oracle;

import diffmigrator.model.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("OracleGenerator")
class OracleGeneratorTest {

    private static final Set<TestCategory> ALL = EnumSet.allOf(TestCategory.class);
    private static final TypeRef INT = TypeRef.scalar(PrimitiveKind.INT);
    private static final TypeRef DOUBLE = TypeRef.scalar(PrimitiveKind.DOUBLE);

    private final OracleGenerator generator = new OracleGenerator(100, 5);

    private static FunctionDecl function(String name, TypeRef returnType, String body, Parameter... params) {
        return new FunctionDecl(name, returnType, List.of(params), Set.of(), false, body);
    }

    private static FunctionDecl divide() {
        return function("divide", INT, "{ return a / b; }", new Parameter("a", INT), new Parameter("b", INT));
    }

    @Nested
    @DisplayName("boundary strategy")
    class BoundaryStrategy {

        @Test
        @DisplayName("should include the smallest normal magnitudes for doubles")
        void shouldIncludeSmallestNormalDoubles() {
            FunctionDecl fn = function("half", DOUBLE, "", new Parameter("x", DOUBLE));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.BOUNDARY), 1);

            assertThat(suite.cases()).extracting(c -> c.input("x"))
                    .contains(InputValue.of(PrimitiveKind.DOUBLE, Double.MIN_NORMAL),
                            InputValue.of(PrimitiveKind.DOUBLE, -Double.MIN_NORMAL),
                            InputValue.of(PrimitiveKind.DOUBLE, 1e308));
        }

        @Test
        @DisplayName("should include the smallest normal magnitude for floats")
        void shouldIncludeSmallestNormalFloat() {
            FunctionDecl fn = function("halff", TypeRef.scalar(PrimitiveKind.FLOAT), "",
                    new Parameter("x", TypeRef.scalar(PrimitiveKind.FLOAT)));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.BOUNDARY), 1);

            assertThat(suite.cases()).extracting(c -> c.input("x").render())
                    .contains(Float.toString(Float.MIN_NORMAL), Float.toString(-Float.MIN_NORMAL));
        }

        @Test
        @DisplayName("should keep the extremes at the ends of the all-minimum and all-maximum rows")
        void shouldKeepExtremeRows() {
            FunctionDecl fn = function("hypot2", DOUBLE, "", new Parameter("x", DOUBLE), new Parameter("y", DOUBLE));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.BOUNDARY), 1);

            InputValue min = InputValue.of(PrimitiveKind.DOUBLE, -1e308);
            InputValue max = InputValue.of(PrimitiveKind.DOUBLE, 1e308);
            assertThat(suite.cases()).anySatisfy(c -> {
                assertThat(c.input("x")).isEqualTo(min);
                assertThat(c.input("y")).isEqualTo(min);
            });
            assertThat(suite.cases()).anySatisfy(c -> {
                assertThat(c.input("x")).isEqualTo(max);
                assertThat(c.input("y")).isEqualTo(max);
            });
        }

        @Test
        @DisplayName("should pass null and empty arrays to pointers with a length")
        void shouldIncludeNullAndEmptyArrays() {
            FunctionDecl fn = function("sum", INT, "",
                    new Parameter("values", TypeRef.pointer(PrimitiveKind.INT, true)), new Parameter("n", INT));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.BOUNDARY), 1);

            assertThat(suite.cases()).extracting(c -> c.input("values").render()).contains("[]", "null");
            assertThat(suite.cases())
                    .filteredOn(c -> c.input("values").equals(InputValue.nullValue()))
                    .singleElement()
                    .satisfies(c -> assertThat(c.input("n")).isEqualTo(InputValue.of(PrimitiveKind.INT, 0L)));
        }

        @Test
        @DisplayName("should pass null to a string parameter")
        void shouldIncludeNullString() {
            FunctionDecl fn = function("length", INT, "", new Parameter("s", TypeRef.parseC("const char*")));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.BOUNDARY), 1);

            assertThat(suite.cases()).anySatisfy(c -> assertThat(c.input("s")).isEqualTo(InputValue.nullValue()));
        }

        @Test
        @DisplayName("should not pass null to fixed size arrays")
        void shouldNotNullFixedArrays() {
            FunctionDecl fn = function("first", INT, "", new Parameter("v", TypeRef.array(PrimitiveKind.INT, 4)));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.BOUNDARY), 1);

            assertThat(suite.cases()).isNotEmpty()
                    .noneSatisfy(c -> assertThat(c.input("v")).isEqualTo(InputValue.nullValue()));
        }
    }

    @Nested
    @DisplayName("edge strategy")
    class EdgeStrategy {

        @Test
        @DisplayName("should emit a zero divisor for divide(a, b)")
        void shouldEmitZeroDivisor() {
            TestSuite suite = generator.generate(divide(), EnumSet.of(TestCategory.EDGE), 42);

            assertThat(suite.cases())
                    .anySatisfy(c -> assertThat(c.input("b")).isEqualTo(InputValue.of(PrimitiveKind.INT, 0L)));
        }

        @Test
        @DisplayName("should emit a zero for integer parameters even without a body")
        void shouldEmitZeroWithoutBody() {
            FunctionDecl declared = FunctionDecl.of("divide", INT, new Parameter("a", INT), new Parameter("b", INT));

            TestSuite suite = generator.generate(declared, EnumSet.of(TestCategory.EDGE), 42);

            assertThat(suite.cases())
                    .anySatisfy(c -> assertThat(c.input("b")).isEqualTo(InputValue.of(PrimitiveKind.INT, 0L)));
        }

        @Test
        @DisplayName("should emit null for nullable pointers")
        void shouldEmitNullForPointers() {
            FunctionDecl fn = function("length", INT, "",
                    new Parameter("s", TypeRef.parseC("const char*")));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.EDGE), 1);

            assertThat(suite.cases()).anySatisfy(c -> assertThat(c.input("s")).isEqualTo(InputValue.nullValue()));
        }

        @Test
        @DisplayName("should emit float specials")
        void shouldEmitFloatSpecials() {
            FunctionDecl fn = function("half", DOUBLE, "", new Parameter("x", DOUBLE));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.EDGE), 1);

            assertThat(suite.cases()).extracting(c -> c.input("x").render())
                    .contains("nan", "inf", "-inf", "-0.0");
        }

        @Test
        @DisplayName("should emit empty and single element arrays for pointers with a length")
        void shouldEmitEmptyAndSingleElementArrays() {
            FunctionDecl fn = function("sum", INT, "",
                    new Parameter("values", TypeRef.pointer(PrimitiveKind.INT, true)), new Parameter("n", INT));

            TestSuite suite = generator.generate(fn, EnumSet.of(TestCategory.EDGE), 1);

            assertThat(suite.cases()).extracting(c -> c.input("values").render())
                    .contains("[]", "[1]", "null");
        }
    }

    @Nested
    @DisplayName("bindings")
    class Bindings {

        @Test
        @DisplayName("should bind a length parameter to the length of the array before it")
        void shouldBindLengthCompanion() {
            FunctionDecl fn = function("sum", INT, "",
                    new Parameter("values", TypeRef.pointer(PrimitiveKind.INT, true)), new Parameter("n", INT));

            TestSuite suite = generator.generate(fn, ALL, 9);

            assertThat(suite.cases()).isNotEmpty().allSatisfy(c -> {
                InputValue values = c.input("values");
                long expected = values instanceof InputValue.Array array ? array.length() : 0;
                assertThat(c.input("n")).isEqualTo(InputValue.of(PrimitiveKind.INT, expected));
            });
        }

        @Test
        @DisplayName("should hold divisors at one while other parameters vary")
        void shouldHoldDivisorsAtOne() {
            TestSuite suite = generator.generate(divide(), EnumSet.of(TestCategory.BOUNDARY), 42);

            List<TestCase> varyingA = suite.cases().stream()
                    .filter(c -> !c.input("a").equals(InputValue.of(PrimitiveKind.INT, 0L)))
                    .filter(c -> c.input("b").equals(InputValue.of(PrimitiveKind.INT, 1L)))
                    .toList();

            assertThat(varyingA).isNotEmpty();
            assertThat(suite.cases().get(0).input("b")).isEqualTo(InputValue.of(PrimitiveKind.INT, 1L));
        }

        @Test
        @DisplayName("should name cases by function, category and index")
        void shouldNameCases() {
            TestSuite suite = generator.generate(divide(), ALL, 42);

            assertThat(suite.cases().get(0).name()).isEqualTo("divide_boundary_0");
            assertThat(suite.cases()).extracting(TestCase::name)
                    .contains("divide_edge_0", "divide_random_0", "divide_random_4")
                    .doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("should generate a single case for functions without parameters")
        void shouldGenerateSingleCaseWithoutParameters() {
            FunctionDecl fn = function("answer", INT, "{ return 42; }");

            TestSuite suite = generator.generate(fn, ALL, 42);

            assertThat(suite.cases()).singleElement()
                    .satisfies(c -> assertThat(c.inputs()).isEmpty());
        }

        @Test
        @DisplayName("should cover two-parameter combinations in the boundary strategy")
        void shouldCoverCombinations() {
            TestSuite suite = generator.generate(divide(), EnumSet.of(TestCategory.BOUNDARY), 42);

            InputValue min = InputValue.of(PrimitiveKind.INT, Integer.MIN_VALUE);
            InputValue max = InputValue.of(PrimitiveKind.INT, Integer.MAX_VALUE);
            assertThat(suite.cases()).anySatisfy(c -> {
                assertThat(c.input("a")).isEqualTo(min);
                assertThat(c.input("b")).isEqualTo(max);
            });
        }
    }

    @Nested
    @DisplayName("determinism")
    class Determinism {

        @Test
        @DisplayName("should produce byte-identical suites for identical arguments")
        void shouldBeIdempotent() {
            FunctionDecl fn = function("scale", DOUBLE, "",
                    new Parameter("data", TypeRef.pointer(PrimitiveKind.DOUBLE, false)),
                    new Parameter("len", INT), new Parameter("factor", DOUBLE));

            TestSuite first = generator.generate(fn, ALL, 1234);
            TestSuite second = generator.generate(fn, ALL, 1234);

            assertThat(first.canonicalForm()).isEqualTo(second.canonicalForm());
            assertThat(first.cases()).isEqualTo(second.cases());
        }

        @Test
        @DisplayName("should draw different random cases for different seeds")
        void shouldDependOnSeed() {
            Set<TestCategory> random = EnumSet.of(TestCategory.RANDOM);

            TestSuite first = generator.generate(divide(), random, 1);
            TestSuite second = generator.generate(divide(), random, 2);

            assertThat(first.canonicalForm()).isNotEqualTo(second.canonicalForm());
        }

        @Test
        @DisplayName("should keep boundary cases independent of the seed")
        void boundaryShouldNotDependOnSeed() {
            Set<TestCategory> boundary = EnumSet.of(TestCategory.BOUNDARY);

            assertThat(generator.generate(divide(), boundary, 1).cases())
                    .isEqualTo(generator.generate(divide(), boundary, 2).cases());
        }
    }

    @Nested
    @DisplayName("eligibility and limits")
    class EligibilityAndLimits {

        @Test
        @DisplayName("should cap cases per function keeping the earliest")
        void shouldCapCases() {
            OracleGenerator capped = new OracleGenerator(10, 5);

            TestSuite suite = capped.generate(divide(), ALL, 42);
            TestSuite full = generator.generate(divide(), ALL, 42);

            assertThat(suite.size()).isEqualTo(10);
            assertThat(suite.cases()).isEqualTo(full.cases().subList(0, 10));
        }

        @Test
        @DisplayName("should skip main, static and opaque functions")
        void shouldSkipIneligibleFunctions() {
            FunctionDecl main = function("main", INT, "");
            FunctionDecl helper = new FunctionDecl("helper", INT, List.of(new Parameter("x", INT)),
                    Set.of(), true, "");
            FunctionDecl area = function("area", DOUBLE, "",
                    new Parameter("p", TypeRef.parseC("struct Rect *")));
            TranslationUnit unit = TranslationUnit.of("shapes", "", List.of(), List.of(main, helper, area, divide()));

            TestSuite suite = generator.generateForUnit(unit, ALL, 42);

            assertThat(OracleGenerator.isEligible(main)).isFalse();
            assertThat(OracleGenerator.isEligible(helper)).isFalse();
            assertThat(OracleGenerator.isEligible(area)).isFalse();
            assertThat(suite.functionNames()).containsExactly("divide");
            assertThat(suite.unitId()).isEqualTo("shapes");
        }

        @Test
        @DisplayName("should produce an empty suite for a unit without eligible functions")
        void shouldProduceEmptySuite() {
            TranslationUnit unit = TranslationUnit.of("app", "", List.of(), List.of(function("main", INT, "")));

            assertThat(generator.generateForUnit(unit, ALL, 42).isEmpty()).isTrue();
        }
    }
}
