package ai.proofkit.extractor.hint;

import java.util.Map;
import java.util.Objects;

/**
 * Keyword-based guess at the mathematical domain of a theorem and its proof.
 *
 * @param scores keyword hit counts per domain name, in declaration order
 */
public record DomainClassification(
        String domainName,
        String mscCode,
        double confidence,
        boolean involvesDiscrete,
        boolean evennessProof,
        Map<String, Integer> scores
) {

    public DomainClassification {
        Objects.requireNonNull(domainName, "domainName");
        Objects.requireNonNull(mscCode, "mscCode");
        scores = scores == null ? Map.of() : scores;
    }
}
