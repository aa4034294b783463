package ai.proofkit.extractor.hint;

import java.util.Objects;

/**
 * Single proof pattern chosen from the method hints, with a heuristic confidence.
 */
public record ProofPattern(String name, double confidence, String description) {

    public static final ProofPattern INDUCTION = new ProofPattern("induction", 1.0, "Proof by induction");
    public static final ProofPattern CONTRADICTION = new ProofPattern("contradiction", 1.0, "Proof by contradiction");
    public static final ProofPattern CASE_ANALYSIS = new ProofPattern("case_analysis", 1.0, "Proof by case analysis");
    public static final ProofPattern EVENNESS = new ProofPattern("evenness_proof", 0.8, "Proof of an evenness property");
    public static final ProofPattern DIRECT = new ProofPattern("direct", 0.7, "Direct proof");
    public static final ProofPattern UNKNOWN = new ProofPattern("unknown", 0.5, "Unknown proof pattern");

    public ProofPattern {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(description, "description");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be between 0.0 and 1.0");
        }
    }
}
