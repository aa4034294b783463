package ai.proofkit.extractor.text;

/**
 * Theorem statement and proof body separated from a combined input.
 */
public record TheoremProofSplit(String theorem, String proof) {

    public TheoremProofSplit {
        theorem = theorem == null ? "" : theorem;
        proof = proof == null ? "" : proof;
    }

    public boolean hasProof() {
        return !proof.isBlank();
    }
}
