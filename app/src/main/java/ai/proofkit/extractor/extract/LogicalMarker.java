package ai.proofkit.extractor.extract;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry of the logical-marker table. A missing tactic means the marker needs surrounding context before
 * a tactic can be suggested.
 */
public record LogicalMarker(String marker, LogicalRole role, Optional<String> suggestedTactic) {

    public LogicalMarker {
        if (marker == null || marker.isBlank()) {
            throw new IllegalArgumentException("marker must not be blank");
        }
        marker = marker.toLowerCase(Locale.ROOT);
        Objects.requireNonNull(role, "role");
        suggestedTactic = suggestedTactic == null ? Optional.empty() : suggestedTactic;
    }

    public static LogicalMarker assumption(String marker, String tactic) {
        return new LogicalMarker(marker, LogicalRole.ASSUMPTION, Optional.ofNullable(tactic));
    }

    public static LogicalMarker conclusion(String marker, String tactic) {
        return new LogicalMarker(marker, LogicalRole.CONCLUSION, Optional.ofNullable(tactic));
    }
}
