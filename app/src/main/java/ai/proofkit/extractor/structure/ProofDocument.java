package ai.proofkit.extractor.structure;

import ai.proofkit.extractor.config.TargetProver;
import ai.proofkit.extractor.hint.DomainClassification;
import ai.proofkit.extractor.hint.ProofPattern;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything recovered from a combined theorem-and-proof input, ready for the translator.
 */
public record ProofDocument(
        String originalText,
        String theoremText,
        String proofText,
        TargetProver prover,
        ParseResult parseResult,
        ProofPattern pattern,
        Optional<String> inductionVariable,
        DomainClassification domain
) {

    public ProofDocument {
        originalText = originalText == null ? "" : originalText;
        theoremText = theoremText == null ? "" : theoremText;
        proofText = proofText == null ? "" : proofText;
        Objects.requireNonNull(prover, "prover");
        Objects.requireNonNull(parseResult, "parseResult");
        Objects.requireNonNull(pattern, "pattern");
        inductionVariable = inductionVariable == null ? Optional.empty() : inductionVariable;
        Objects.requireNonNull(domain, "domain");
    }

    public ProofStructure structure() {
        return parseResult.structure();
    }
}
