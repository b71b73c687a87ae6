package diffmigrator.orchestrator;

import java.util.Objects;

/**
 * Target-language source produced for one unit by a {@link CodeGenerator}.
 *
 * @param unitId the converted unit
 * @param sourceText the C# source text
 */
public record ConvertedArtifact(String unitId, String sourceText) {

    public ConvertedArtifact {
        Objects.requireNonNull(unitId, "unitId");
        Objects.requireNonNull(sourceText, "sourceText");
    }
}
