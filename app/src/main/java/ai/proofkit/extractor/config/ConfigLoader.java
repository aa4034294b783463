package ai.proofkit.extractor.config;

import ai.proofkit.extractor.cli.CliArguments;
import ai.proofkit.extractor.nlp.AnalyzerMode;
import ai.proofkit.extractor.structure.ProofParser;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} by layering CLI arguments over environment variables over defaults.
 */
public class ConfigLoader {

    static final String ENV_ANALYZER = "PROOF_ANALYZER";
    static final String ENV_TARGET_PROVER = "PROOF_TARGET_PROVER";
    static final String ENV_MAX_DEPTH = "PROOF_MAX_DEPTH";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_PROOF_ONLY = "PROOF_ONLY";
    static final String ENV_VERBOSE = "PROOF_VERBOSE";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        AnalyzerMode analyzerMode = resolveAnalyzer(arguments);
        TargetProver prover = resolveProver(arguments);
        int maxDepth = resolveMaxDepth(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean proofOnly = arguments.proofOnly() || resolveFlag(ENV_PROOF_ONLY);
        boolean verbose = arguments.verbose() || resolveFlag(ENV_VERBOSE);
        return new Config(analyzerMode, prover, maxDepth, logFormat, proofOnly,
                Optional.ofNullable(arguments.inputFile()), arguments.pretty(), verbose);
    }

    private AnalyzerMode resolveAnalyzer(CliArguments arguments) {
        if (arguments.analyzerMode() != null) {
            return arguments.analyzerMode();
        }
        return environmentReader.getNonBlank(ENV_ANALYZER)
                .map(AnalyzerMode::from)
                .orElse(AnalyzerMode.CORENLP);
    }

    private TargetProver resolveProver(CliArguments arguments) {
        if (arguments.prover() != null) {
            return arguments.prover();
        }
        return environmentReader.getNonBlank(ENV_TARGET_PROVER)
                .map(TargetProver::from)
                .orElse(TargetProver.COQ);
    }

    private int resolveMaxDepth(CliArguments arguments) {
        Integer cliValue = arguments.maxDepth();
        if (cliValue != null) {
            return requireNonNegative(cliValue, "--max-depth");
        }
        return environmentReader.getNonBlank(ENV_MAX_DEPTH)
                .map(value -> parseNonNegativeInteger(value, ENV_MAX_DEPTH))
                .orElse(ProofParser.DEFAULT_MAX_DEPTH);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        if (arguments.logFormat() != null) {
            return arguments.logFormat();
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveFlag(String envKey) {
        return environmentReader.getNonBlank(envKey)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static int parseNonNegativeInteger(String raw, String name) {
        try {
            return requireNonNegative(Integer.parseInt(raw), name);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be an integer", ex);
        }
    }

    private static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be zero or greater");
        }
        return value;
    }
}
