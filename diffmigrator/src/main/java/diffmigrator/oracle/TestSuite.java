package diffmigrator.oracle;

import diffmigrator.validator.OutputValue;

import java.util.*;

/**
 * The frozen set of test cases for one translation unit.
 *
 * <p>Suites are assembled with a {@link Builder}, which only appends, and are
 * immutable once built. The same suite validates every conversion attempt of
 * its unit unless suite regeneration is configured.
 */
public final class TestSuite {

    private final String unitId;
    private final long seed;
    private final Set<TestCategory> strategies;
    private final List<TestCase> cases;
    private final Map<String, TestCase> byName;

    private TestSuite(String unitId, long seed, Set<TestCategory> strategies, List<TestCase> cases) {
        this.unitId = unitId;
        this.seed = seed;
        this.strategies = Collections.unmodifiableSet(strategies.isEmpty()
                ? EnumSet.noneOf(TestCategory.class) : EnumSet.copyOf(strategies));
        this.cases = List.copyOf(cases);
        Map<String, TestCase> index = new LinkedHashMap<>();
        for (TestCase c : cases) {
            index.put(c.name(), c);
        }
        this.byName = Collections.unmodifiableMap(index);
    }

    public static Builder builder(String unitId, long seed, Set<TestCategory> strategies) {
        return new Builder(unitId, seed, strategies);
    }

    public String unitId() {
        return unitId;
    }

    public long seed() {
        return seed;
    }

    public Set<TestCategory> strategies() {
        return strategies;
    }

    public List<TestCase> cases() {
        return cases;
    }

    public int size() {
        return cases.size();
    }

    public boolean isEmpty() {
        return cases.isEmpty();
    }

    public Optional<TestCase> caseNamed(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public List<TestCase> casesFor(String functionName) {
        return cases.stream().filter(c -> c.functionName().equals(functionName)).toList();
    }

    /** Names of the functions covered by this suite, in first-appearance order. */
    public List<String> functionNames() {
        return cases.stream().map(TestCase::functionName).distinct().toList();
    }

    /**
     * Returns a copy whose cases carry the given expected outputs.
     *
     * @param outputsByCase expected outputs keyed by case name; cases without an entry are kept as is
     */
    public TestSuite withExpectedOutputs(Map<String, Map<String, OutputValue>> outputsByCase) {
        List<TestCase> updated = new ArrayList<>(cases.size());
        for (TestCase c : cases) {
            Map<String, OutputValue> outputs = outputsByCase.get(c.name());
            updated.add(outputs != null ? c.withExpectedOutputs(outputs) : c);
        }
        return new TestSuite(unitId, seed, strategies, updated);
    }

    /**
     * Byte-stable text rendering of the suite inputs. Two suites generated
     * from the same unit, strategies and seed render identically.
     */
    public String canonicalForm() {
        StringBuilder sb = new StringBuilder();
        sb.append("suite ").append(unitId).append(" seed=").append(seed)
                .append(" strategies=").append(strategies).append('\n');
        for (TestCase c : cases) {
            sb.append(c.name()).append(' ').append(c.functionName()).append(' ')
                    .append(c.category().label()).append(" (").append(c.describeInputs()).append(")\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "TestSuite{unit=" + unitId + ", cases=" + cases.size() + ", seed=" + seed + '}';
    }

    /**
     * Append-only builder. After {@link #build()} the builder rejects further changes.
     */
    public static final class Builder {
        private final String unitId;
        private final long seed;
        private final Set<TestCategory> strategies;
        private final List<TestCase> cases = new ArrayList<>();
        private final Set<String> names = new HashSet<>();
        private boolean frozen;

        private Builder(String unitId, long seed, Set<TestCategory> strategies) {
            this.unitId = Objects.requireNonNull(unitId, "unitId");
            this.seed = seed;
            this.strategies = strategies;
        }

        /**
         * Appends a case.
         *
         * @throws IllegalStateException if the suite was already built
         * @throws IllegalArgumentException if a case with the same name exists
         */
        public Builder add(TestCase testCase) {
            if (frozen) {
                throw new IllegalStateException("Test suite for " + unitId + " is frozen");
            }
            if (!names.add(testCase.name())) {
                throw new IllegalArgumentException("Duplicate test case name: " + testCase.name());
            }
            cases.add(testCase);
            return this;
        }

        public Builder addAll(Collection<TestCase> testCases) {
            testCases.forEach(this::add);
            return this;
        }

        public int size() {
            return cases.size();
        }

        public TestSuite build() {
            frozen = true;
            return new TestSuite(unitId, seed, strategies, cases);
        }
    }
}
