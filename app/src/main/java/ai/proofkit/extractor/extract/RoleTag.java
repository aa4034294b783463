package ai.proofkit.extractor.extract;

import java.util.Objects;
import java.util.Optional;

/**
 * A logical marker found in a statement.
 */
public record RoleTag(LogicalRole role, String marker, Optional<String> suggestedTactic,
                      int statementIndex, String statementText) {

    public RoleTag {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(marker, "marker");
        suggestedTactic = suggestedTactic == null ? Optional.empty() : suggestedTactic;
        Objects.requireNonNull(statementText, "statementText");
    }
}
