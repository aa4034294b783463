package ai.proofkit.extractor.cli;

import ai.proofkit.extractor.config.LogFormat;
import ai.proofkit.extractor.config.TargetProver;
import ai.proofkit.extractor.nlp.AnalyzerMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "proof-structure-extractor", mixinStandardHelpOptions = true,
        description = "Extracts assumptions, conclusions, proof methods, variables and expressions from a natural-language proof")
public class CliArguments {

    @CommandLine.Option(names = "--input", description = "File containing the theorem and proof (defaults to stdin)", paramLabel = "FILE")
    private Path inputFile;

    @CommandLine.Option(names = "--analyzer", converter = AnalyzerModeConverter.class, description = "Linguistic analyzer: corenlp or rule-based")
    private AnalyzerMode analyzerMode;

    @CommandLine.Option(names = "--prover", converter = TargetProverConverter.class, description = "Target proof assistant: coq or lean")
    private TargetProver prover;

    @CommandLine.Option(names = "--max-depth", description = "Recursion depth ceiling for the parser", paramLabel = "DEPTH")
    private Integer maxDepth;

    @CommandLine.Option(names = "--proof-only", description = "Treat the whole input as proof text instead of splitting off the theorem")
    private boolean proofOnly;

    @CommandLine.Option(names = "--log-format", converter = LogFormatConverter.class, description = "Log format: text or json")
    private LogFormat logFormat;

    @CommandLine.Option(names = "--pretty", description = "Pretty-print the JSON result")
    private boolean pretty;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log per-statement extraction details")
    private boolean verbose;

    public Path inputFile() {
        return inputFile;
    }

    public AnalyzerMode analyzerMode() {
        return analyzerMode;
    }

    public TargetProver prover() {
        return prover;
    }

    public Integer maxDepth() {
        return maxDepth;
    }

    public boolean proofOnly() {
        return proofOnly;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean pretty() {
        return pretty;
    }

    public boolean verbose() {
        return verbose;
    }
}
