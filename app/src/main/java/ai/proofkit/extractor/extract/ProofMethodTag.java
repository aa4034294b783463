package ai.proofkit.extractor.extract;

import java.util.Objects;
import java.util.Optional;

/**
 * A proof-method keyword found in a statement.
 */
public record ProofMethodTag(String keyword, ProofMethod method, Optional<String> suggestedTactic,
                             int statementIndex, String statementText) {

    public ProofMethodTag {
        Objects.requireNonNull(keyword, "keyword");
        Objects.requireNonNull(method, "method");
        suggestedTactic = suggestedTactic == null ? Optional.empty() : suggestedTactic;
        Objects.requireNonNull(statementText, "statementText");
    }
}
