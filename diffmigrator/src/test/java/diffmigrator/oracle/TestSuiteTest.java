package diffmigrator.oracle;

import diffmigrator.model.PrimitiveKind;
import diffmigrator.validator.OutputValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TestSuite")
class TestSuiteTest {

    private static TestCase testCase(String name) {
        return new TestCase(name, "square", TestCategory.BOUNDARY,
                Map.of("x", InputValue.of(PrimitiveKind.INT, 3L)));
    }

    @Test
    @DisplayName("builder should reject cases after build")
    void builderShouldRejectCasesAfterBuild() {
        TestSuite.Builder builder = TestSuite.builder("math", 42, EnumSet.allOf(TestCategory.class));
        builder.add(testCase("square_boundary_0"));
        builder.build();

        assertThatThrownBy(() -> builder.add(testCase("square_boundary_1")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("frozen");
    }

    @Test
    @DisplayName("builder should reject duplicate case names")
    void builderShouldRejectDuplicateNames() {
        TestSuite.Builder builder = TestSuite.builder("math", 42, EnumSet.allOf(TestCategory.class));
        builder.add(testCase("square_boundary_0"));

        assertThatThrownBy(() -> builder.add(testCase("square_boundary_0")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("withExpectedOutputs should attach outputs by case name")
    void withExpectedOutputsShouldAttachOutputs() {
        TestSuite suite = TestSuite.builder("math", 42, EnumSet.of(TestCategory.BOUNDARY))
                .add(testCase("square_boundary_0"))
                .add(testCase("square_boundary_1"))
                .build();
        Map<String, OutputValue> outputs = Map.of("return", new OutputValue.Integral(PrimitiveKind.INT, 9));

        TestSuite frozen = suite.withExpectedOutputs(Map.of("square_boundary_0", outputs));

        assertThat(frozen.caseNamed("square_boundary_0").orElseThrow().expectedOutputs()).isEqualTo(outputs);
        assertThat(frozen.caseNamed("square_boundary_1").orElseThrow().expectedOutputs()).isEmpty();
        assertThat(suite.caseNamed("square_boundary_0").orElseThrow().expectedOutputs()).isEmpty();
    }

    @Test
    @DisplayName("canonicalForm should render inputs")
    void canonicalFormShouldRenderInputs() {
        TestSuite suite = TestSuite.builder("math", 7, EnumSet.of(TestCategory.BOUNDARY))
                .add(testCase("square_boundary_0"))
                .build();

        assertThat(suite.canonicalForm())
                .startsWith("suite math seed=7")
                .contains("square_boundary_0 square boundary (x=3)");
    }
}
