package ai.proofkit.extractor.config;

import java.util.Locale;

/**
 * Proof assistant the downstream translator targets.
 */
public enum TargetProver {
    COQ,
    LEAN;

    public static TargetProver from(String raw) {
        if (raw == null || raw.isBlank()) {
            return COQ;
        }
        for (TargetProver prover : values()) {
            if (prover.name().equalsIgnoreCase(raw.trim())) {
                return prover;
            }
        }
        throw new IllegalArgumentException("Unsupported prover: " + raw);
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
