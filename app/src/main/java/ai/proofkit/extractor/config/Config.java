package ai.proofkit.extractor.config;

import ai.proofkit.extractor.nlp.AnalyzerMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        AnalyzerMode analyzerMode,
        TargetProver prover,
        int maxDepth,
        LogFormat logFormat,
        boolean proofOnly,
        Optional<Path> inputFile,
        boolean prettyOutput,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(analyzerMode, "analyzerMode");
        Objects.requireNonNull(prover, "prover");
        Objects.requireNonNull(logFormat, "logFormat");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be greater than or equal to zero");
        }
        inputFile = inputFile == null ? Optional.empty() : inputFile;
    }
}
