package diffmigrator.oracle;

import diffmigrator.config.MigrationConfig;
import diffmigrator.model.FunctionDecl;
import diffmigrator.model.Parameter;
import diffmigrator.model.PrimitiveKind;
import diffmigrator.model.TranslationUnit;
import diffmigrator.model.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Generates deterministic test suites for the functions of a translation unit.
 *
 * <p>Three strategies are available, applied in this order:
 * <ul>
 *   <li>{@link TestCategory#BOUNDARY}: each parameter over its boundary set
 *       while the others hold neutral values, the full product of boundary
 *       sets for two-parameter functions, and all-minimum / all-maximum rows.
 *       Pointer boundary sets include null and, with a length, the empty array</li>
 *   <li>{@link TestCategory#EDGE}: null pointers, zero divisors, empty and
 *       single-element arrays, float specials and integer wrap points</li>
 *   <li>{@link TestCategory#RANDOM}: seeded draws within each type's range</li>
 * </ul>
 *
 * <p>Generation is a pure function of the function declaration, the enabled
 * strategies and the seed. Cases beyond {@code maxTestsPerFunction} are
 * dropped, keeping the earliest.
 *
 * <p>An integer parameter directly after a pointer parameter whose name looks
 * like a length ({@code n}, {@code len}, {@code size}, ...) is not varied; it
 * is bound to the length of the array passed before it.
 *
 * <p>Entry points, static functions and functions with struct or other opaque
 * types are not generated for.
 */
public final class OracleGenerator {

    private static final Logger log = LoggerFactory.getLogger(OracleGenerator.class);

    private static final Set<String> LENGTH_NAMES = Set.of(
            "n", "len", "length", "size", "count", "num", "cnt", "sz", "nelems", "nitems");
    private static final List<String> LENGTH_SUFFIXES = List.of("len", "length", "size", "count");

    static final int DEFAULT_SEQUENCE_LENGTH = 4;
    static final int MAX_RANDOM_SEQUENCE_LENGTH = 8;
    static final int MAX_COMBINATIONS = 49;

    private final int maxTestsPerFunction;
    private final int randomCount;

    public OracleGenerator(int maxTestsPerFunction, int randomCount) {
        if (maxTestsPerFunction <= 0) {
            throw new IllegalArgumentException("maxTestsPerFunction must be positive");
        }
        if (randomCount < 0) {
            throw new IllegalArgumentException("randomCount must not be negative");
        }
        this.maxTestsPerFunction = maxTestsPerFunction;
        this.randomCount = randomCount;
    }

    public static OracleGenerator fromConfig(MigrationConfig config) {
        return new OracleGenerator(config.maxTestsPerFunction(), config.randomCount());
    }

    /**
     * Generates the suite for every eligible function of a unit.
     *
     * @param unit the unit
     * @param strategies enabled strategies
     * @param seed generation seed
     * @return the frozen suite; empty if no function is eligible
     */
    public TestSuite generateForUnit(TranslationUnit unit, Set<TestCategory> strategies, long seed) {
        TestSuite.Builder builder = TestSuite.builder(unit.id(), seed, strategies);
        for (FunctionDecl function : unit.functions()) {
            builder.addAll(casesFor(function, strategies, seed));
        }
        TestSuite suite = builder.build();
        log.debug("Generated {} test cases for unit {} (seed={})", suite.size(), unit.id(), seed);
        return suite;
    }

    /**
     * Generates a single-function suite. The suite's unit id is the function name.
     */
    public TestSuite generate(FunctionDecl function, Set<TestCategory> strategies, long seed) {
        return TestSuite.builder(function.name(), seed, strategies)
                .addAll(casesFor(function, strategies, seed))
                .build();
    }

    /**
     * True if cases can be generated for the function.
     */
    public static boolean isEligible(FunctionDecl function) {
        return !function.isEntryPoint() && !function.isStatic() && function.isTestable();
    }

    /**
     * Generates the cases of one function, capped and named
     * {@code <function>_<category>_<index>}.
     *
     * @return the cases; empty for ineligible functions
     */
    public List<TestCase> casesFor(FunctionDecl function, Set<TestCategory> strategies, long seed) {
        if (function.isEntryPoint()) {
            log.debug("Skipping entry point {}", function.name());
            return List.of();
        }
        if (function.isStatic()) {
            log.warn("Skipping static function {}: not callable from a harness", function.name());
            return List.of();
        }
        if (!function.isTestable()) {
            log.warn("Skipping function {}: unsupported parameter or return type", function.name());
            return List.of();
        }

        List<ParamShape> shapes = shapesOf(function);
        Random random = new Random(31 * seed + function.name().hashCode());
        List<TestCase> cases = new ArrayList<>();

        for (TestCategory category : TestCategory.values()) {
            if (!strategies.contains(category)) continue;
            List<Map<String, InputValue>> bindings = switch (category) {
                case BOUNDARY -> boundaryBindings(shapes);
                case EDGE -> edgeBindings(shapes);
                case RANDOM -> randomBindings(shapes, random);
            };
            if (shapes.isEmpty()) {
                // nothing to vary: one call is enough
                if (cases.isEmpty()) {
                    cases.add(new TestCase(caseName(function, category, 0), function.name(), category, Map.of()));
                }
                continue;
            }
            int index = 0;
            for (Map<String, InputValue> binding : bindings) {
                cases.add(new TestCase(caseName(function, category, index++), function.name(), category, binding));
            }
        }

        if (cases.size() > maxTestsPerFunction) {
            log.info("Capping {} test cases for {} at {}", cases.size(), function.name(), maxTestsPerFunction);
            return List.copyOf(cases.subList(0, maxTestsPerFunction));
        }
        return cases;
    }

    private static String caseName(FunctionDecl function, TestCategory category, int index) {
        return function.name() + "_" + category.label() + "_" + index;
    }

    // ===== parameter shapes =====

    private enum Shape { SCALAR, SEQUENCE, COMPANION }

    private record ParamShape(Parameter param, Shape shape, boolean divisor, int length, boolean variableLength) {
        PrimitiveKind kind() {
            return param.type().kind();
        }

        String name() {
            return param.name();
        }
    }

    private static List<ParamShape> shapesOf(FunctionDecl function) {
        Set<String> divisors = DivisorAnalysis.divisorParameters(function);
        List<Parameter> params = function.parameters();
        List<ParamShape> shapes = new ArrayList<>(params.size());
        for (int i = 0; i < params.size(); i++) {
            Parameter p = params.get(i);
            TypeRef type = p.type();
            boolean divisor = divisors.contains(p.name());
            if (isCompanion(params, i)) {
                shapes.add(new ParamShape(p, Shape.COMPANION, divisor, 0, false));
            } else if (type.arrayLength() != null) {
                shapes.add(new ParamShape(p, Shape.SEQUENCE, divisor, type.arrayLength(), false));
            } else if (type.isPointer()) {
                boolean hasCompanion = isCompanion(params, i + 1);
                int length = hasCompanion ? DEFAULT_SEQUENCE_LENGTH : 1;
                shapes.add(new ParamShape(p, Shape.SEQUENCE, divisor, length, hasCompanion));
            } else {
                shapes.add(new ParamShape(p, Shape.SCALAR, divisor, 0, false));
            }
        }
        return shapes;
    }

    private static boolean isCompanion(List<Parameter> params, int index) {
        if (index <= 0 || index >= params.size()) return false;
        Parameter candidate = params.get(index);
        Parameter previous = params.get(index - 1);
        if (candidate.type().isPointer() || !candidate.type().kind().isIntegral()) return false;
        if (!previous.type().isSequence() || previous.type().kind() == PrimitiveKind.STRING) return false;
        String name = candidate.name().toLowerCase(Locale.ROOT);
        if (LENGTH_NAMES.contains(name)) return true;
        return LENGTH_SUFFIXES.stream().anyMatch(name::endsWith);
    }

    private static InputValue neutral(ParamShape shape) {
        InputValue element = BoundaryValues.neutral(shape.kind(), shape.divisor());
        if (shape.shape() == Shape.SEQUENCE) {
            return filled(shape, element, shape.length());
        }
        return element;
    }

    private static InputValue.Array filled(ParamShape shape, InputValue element, int length) {
        return new InputValue.Array(shape.kind(), Collections.nCopies(length, element));
    }

    private static InputValue.Array cycled(ParamShape shape, List<InputValue> source, int length) {
        List<InputValue> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(source.get(i % source.size()));
        }
        return new InputValue.Array(shape.kind(), elements);
    }

    /**
     * Completes a binding: unvaried parameters take neutral values and length
     * companions take the length of the array before them.
     */
    private static Map<String, InputValue> bind(List<ParamShape> shapes, Map<String, InputValue> varied) {
        Map<String, InputValue> binding = new LinkedHashMap<>();
        InputValue previous = null;
        for (ParamShape shape : shapes) {
            InputValue value;
            if (shape.shape() == Shape.COMPANION) {
                long length = previous instanceof InputValue.Array array ? array.length() : 0;
                value = InputValue.of(shape.kind(), length);
            } else {
                value = varied.containsKey(shape.name()) ? varied.get(shape.name()) : neutral(shape);
            }
            binding.put(shape.name(), value);
            previous = value;
        }
        return binding;
    }

    private static List<ParamShape> varied(List<ParamShape> shapes) {
        return shapes.stream().filter(s -> s.shape() != Shape.COMPANION).toList();
    }

    // ===== boundary =====

    /**
     * Boundary values of one parameter. Pointers also take null and, when a
     * length follows them, the empty array; those come last so the extremes
     * stay at either end of the numeric values.
     */
    private static List<InputValue> boundarySet(ParamShape shape) {
        List<InputValue> scalars = BoundaryValues.boundaries(shape.kind());
        List<InputValue> values = new ArrayList<>();
        if (shape.shape() == Shape.SCALAR) {
            values.addAll(scalars);
        } else if (shape.length() <= 1) {
            for (InputValue v : scalars) {
                values.add(new InputValue.Array(shape.kind(), List.of(v)));
            }
        } else {
            values.add(cycled(shape, scalars, shape.length()));
            values.add(filled(shape, BoundaryValues.minimum(shape.kind()), shape.length()));
            values.add(filled(shape, BoundaryValues.maximum(shape.kind()), shape.length()));
        }
        if (shape.variableLength()) {
            values.add(new InputValue.Array(shape.kind(), List.of()));
        }
        if (shape.param().type().isNullable() && shape.param().type().arrayLength() == null) {
            values.add(InputValue.nullValue());
        }
        return values;
    }

    private static List<Map<String, InputValue>> boundaryBindings(List<ParamShape> shapes) {
        List<ParamShape> varied = varied(shapes);
        Set<Map<String, InputValue>> rows = new LinkedHashSet<>();

        for (ParamShape shape : varied) {
            for (InputValue value : boundarySet(shape)) {
                rows.add(bind(shapes, Map.of(shape.name(), value)));
            }
        }

        if (varied.size() == 2) {
            ParamShape first = varied.get(0);
            ParamShape second = varied.get(1);
            int added = 0;
            outer:
            for (InputValue a : boundarySet(first)) {
                for (InputValue b : boundarySet(second)) {
                    if (added++ >= MAX_COMBINATIONS) break outer;
                    rows.add(bind(shapes, Map.of(first.name(), a, second.name(), b)));
                }
            }
        }

        if (varied.size() >= 2) {
            Map<String, InputValue> allMin = new HashMap<>();
            Map<String, InputValue> allMax = new HashMap<>();
            for (ParamShape shape : varied) {
                allMin.put(shape.name(), extreme(shape, true));
                allMax.put(shape.name(), extreme(shape, false));
            }
            rows.add(bind(shapes, allMin));
            rows.add(bind(shapes, allMax));
        }
        return new ArrayList<>(rows);
    }

    private static InputValue extreme(ParamShape shape, boolean min) {
        InputValue scalar = min ? BoundaryValues.minimum(shape.kind()) : BoundaryValues.maximum(shape.kind());
        return shape.shape() == Shape.SEQUENCE ? filled(shape, scalar, shape.length()) : scalar;
    }

    // ===== edge =====

    private static List<Map<String, InputValue>> edgeBindings(List<ParamShape> shapes) {
        Set<Map<String, InputValue>> rows = new LinkedHashSet<>();
        for (ParamShape shape : varied(shapes)) {
            for (InputValue value : edgeValues(shape)) {
                rows.add(bind(shapes, Map.of(shape.name(), value)));
            }
        }
        return new ArrayList<>(rows);
    }

    private static List<InputValue> edgeValues(ParamShape shape) {
        List<InputValue> values = new ArrayList<>();
        PrimitiveKind kind = shape.kind();
        if (shape.param().type().isNullable() && shape.param().type().arrayLength() == null) {
            values.add(InputValue.nullValue());
        }
        boolean numeric = kind.isFloating() || kind.isIntegral();
        // zero for every numeric scalar; sequences only when divided by
        if (numeric && (shape.divisor() || shape.shape() == Shape.SCALAR)) {
            InputValue zero = BoundaryValues.zero(kind);
            values.add(shape.shape() == Shape.SEQUENCE ? filled(shape, zero, shape.length()) : zero);
        }
        if (shape.shape() == Shape.SEQUENCE) {
            if (shape.variableLength()) {
                values.add(new InputValue.Array(kind, List.of()));
                values.add(new InputValue.Array(kind, List.of(BoundaryValues.neutral(kind, true))));
            }
            List<InputValue> specials = BoundaryValues.edges(kind);
            if (kind.isFloating() && !specials.isEmpty()) {
                values.add(cycled(shape, specials, shape.length()));
            }
        } else {
            values.addAll(BoundaryValues.edges(kind));
        }
        return values;
    }

    // ===== random =====

    private List<Map<String, InputValue>> randomBindings(List<ParamShape> shapes, Random random) {
        List<Map<String, InputValue>> rows = new ArrayList<>(randomCount);
        List<ParamShape> varied = varied(shapes);
        for (int i = 0; i < randomCount; i++) {
            Map<String, InputValue> values = new HashMap<>();
            for (ParamShape shape : varied) {
                values.put(shape.name(), randomValue(shape, random));
            }
            rows.add(bind(shapes, values));
        }
        return rows;
    }

    private static InputValue randomValue(ParamShape shape, Random random) {
        if (shape.shape() == Shape.SCALAR) {
            return BoundaryValues.random(shape.kind(), random);
        }
        int length = shape.variableLength() ? 1 + random.nextInt(MAX_RANDOM_SEQUENCE_LENGTH) : shape.length();
        List<InputValue> elements = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            elements.add(BoundaryValues.random(shape.kind(), random));
        }
        return new InputValue.Array(shape.kind(), elements);
    }
}
