package ai.proofkit.extractor.extract;

import java.util.Locale;

/**
 * Canonical proof strategies hinted at by keywords.
 */
public enum ProofMethod {
    INDUCTION,
    CONTRADICTION,
    CASES,
    DIRECT;

    public String canonicalName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
