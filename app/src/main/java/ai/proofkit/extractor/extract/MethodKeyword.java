package ai.proofkit.extractor.extract;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry of the proof-method table.
 */
public record MethodKeyword(String keyword, ProofMethod method, Optional<String> suggestedTactic) {

    public MethodKeyword {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword must not be blank");
        }
        keyword = keyword.toLowerCase(Locale.ROOT);
        Objects.requireNonNull(method, "method");
        suggestedTactic = suggestedTactic == null ? Optional.empty() : suggestedTactic;
    }

    public static MethodKeyword of(String keyword, ProofMethod method, String tactic) {
        return new MethodKeyword(keyword, method, Optional.ofNullable(tactic));
    }
}
