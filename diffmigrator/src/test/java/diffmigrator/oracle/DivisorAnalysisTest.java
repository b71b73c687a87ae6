package diffmigrator.oracle;

import diffmigrator.model.FunctionDecl;
import diffmigrator.model.Parameter;
import diffmigrator.model.PrimitiveKind;
import diffmigrator.model.TypeRef;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DivisorAnalysis")
class DivisorAnalysisTest {

    private static FunctionDecl withBody(String body) {
        TypeRef type = TypeRef.scalar(PrimitiveKind.INT);
        return new FunctionDecl("f", type,
                List.of(new Parameter("a", type), new Parameter("b", type), new Parameter("bits", type)),
                Set.of(), false, body);
    }

    @Test
    @DisplayName("should find right operands of division and modulo")
    void shouldFindDivisors() {
        assertThat(DivisorAnalysis.divisorParameters(withBody("{ return a / b + a % (bits); }")))
                .containsExactly("b", "bits");
    }

    @Test
    @DisplayName("should find compound assignments")
    void shouldFindCompoundAssignments() {
        assertThat(DivisorAnalysis.divisorParameters(withBody("{ int x = 10; x /= a; return x; }")))
                .containsExactly("a");
    }

    @Test
    @DisplayName("should not match a parameter that only prefixes another name")
    void shouldRespectWordBoundaries() {
        assertThat(DivisorAnalysis.divisorParameters(withBody("{ return a / bits; }")))
                .containsExactly("bits");
    }

    @Test
    @DisplayName("should ignore comments and string literals")
    void shouldIgnoreCommentsAndStrings() {
        String body = """
                {
                    // a / b
                    /* b % a */
                    printf("%d / a", b);
                    return a * b;
                }
                """;

        assertThat(DivisorAnalysis.divisorParameters(withBody(body))).isEmpty();
    }

    @Test
    @DisplayName("should return nothing for a function without a body")
    void shouldHandleMissingBody() {
        assertThat(DivisorAnalysis.divisorParameters(withBody(""))).isEmpty();
    }
}
