package ai.proofkit.extractor.nlp;

import java.util.Locale;

/**
 * Selects the linguistic analysis backend.
 */
public enum AnalyzerMode {
    CORENLP,
    RULE_BASED;

    public static AnalyzerMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return CORENLP;
        }
        String normalized = raw.trim().replace('-', '_');
        for (AnalyzerMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported analyzer: " + raw);
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
