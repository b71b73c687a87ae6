package diffmigrator.orchestrator;

import diffmigrator.model.TranslationUnit;
import diffmigrator.validator.CaseVerdict;
import diffmigrator.validator.Difference;
import diffmigrator.validator.UnitVerdict;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Input to a {@link CodeGenerator} for one conversion attempt.
 *
 * @param unit the unit to convert
 * @param attempt attempt number, starting at 1
 * @param previousVerdict verdict of the previous attempt, null on the first attempt
 *                        or when the previous attempt produced no code
 * @param previousFailure reason the previous attempt was rejected, null on the first attempt
 * @param dependencyArtifacts converted code of the unit's dependencies
 */
public record ConversionRequest(
        TranslationUnit unit,
        int attempt,
        UnitVerdict previousVerdict,
        String previousFailure,
        List<ConvertedArtifact> dependencyArtifacts
) {

    public ConversionRequest {
        Objects.requireNonNull(unit, "unit");
        if (attempt < 1) throw new IllegalArgumentException("attempt starts at 1: " + attempt);
        dependencyArtifacts = List.copyOf(dependencyArtifacts);
    }

    public static ConversionRequest first(TranslationUnit unit, List<ConvertedArtifact> dependencyArtifacts) {
        return new ConversionRequest(unit, 1, null, null, dependencyArtifacts);
    }

    public boolean isRetry() {
        return attempt > 1;
    }

    public Optional<UnitVerdict> previous() {
        return Optional.ofNullable(previousVerdict);
    }

    /**
     * Feedback lines describing why the previous attempt was rejected, at most
     * {@code maxLines} differences. Empty on the first attempt.
     */
    public List<String> feedback(int maxLines) {
        List<String> lines = new ArrayList<>();
        if (previousFailure != null) lines.add(previousFailure);
        if (previousVerdict == null) return lines;
        previousVerdict.targetCompilationFailure().ifPresent(stderr -> lines.add("compiler: " + stderr.strip()));
        for (CaseVerdict c : previousVerdict.mismatchedCases()) {
            for (Difference d : c.differences()) {
                if (lines.size() >= maxLines) return lines;
                lines.add(c.caseName() + " " + d.describe());
            }
        }
        return lines;
    }
}
