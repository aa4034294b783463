package ai.proofkit.extractor.config;

import java.util.Optional;

/**
 * Source of environment values, injectable so configuration can be tested without touching the host.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value, empty when unset or blank.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
