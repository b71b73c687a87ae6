package diffmigrator.oracle;

import diffmigrator.validator.OutputValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One concrete invocation of a function.
 *
 * @param name unique name within the suite, also used as the harness test id
 * @param functionName the function under test
 * @param category the strategy that produced the case
 * @param inputs parameter bindings in declaration order
 * @param expectedOutputs outputs recorded from the baseline run; empty until then
 */
public record TestCase(
        String name,
        String functionName,
        TestCategory category,
        Map<String, InputValue> inputs,
        Map<String, OutputValue> expectedOutputs
) {

    public TestCase {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(functionName, "functionName");
        Objects.requireNonNull(category, "category");
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        expectedOutputs = expectedOutputs == null || expectedOutputs.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(expectedOutputs));
    }

    public TestCase(String name, String functionName, TestCategory category, Map<String, InputValue> inputs) {
        this(name, functionName, category, inputs, Map.of());
    }

    public InputValue input(String parameter) {
        return inputs.get(parameter);
    }

    public TestCase withExpectedOutputs(Map<String, OutputValue> outputs) {
        return new TestCase(name, functionName, category, inputs, outputs);
    }

    /** Renders the bindings as {@code a=1, b=0}. */
    public String describeInputs() {
        return inputs.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue().render())
                .collect(Collectors.joining(", "));
    }
}
