package ai.proofkit.extractor.cli;

import ai.proofkit.extractor.config.Config;
import ai.proofkit.extractor.config.ConfigLoader;
import ai.proofkit.extractor.config.EnvironmentReader;
import ai.proofkit.extractor.extract.ExpressionExtractor;
import ai.proofkit.extractor.extract.LogicalRoleClassifier;
import ai.proofkit.extractor.extract.VariableExtractor;
import ai.proofkit.extractor.logging.LoggingConfigurator;
import ai.proofkit.extractor.nlp.ProofTokenizer;
import ai.proofkit.extractor.nlp.ProofTokenizerFactory;
import ai.proofkit.extractor.structure.ProofDocument;
import ai.proofkit.extractor.structure.ProofDocumentParser;
import ai.proofkit.extractor.structure.ProofParser;
import ai.proofkit.extractor.structure.RecursionLimitExceededException;
import ai.proofkit.extractor.structure.StructureAggregator;
import ai.proofkit.extractor.text.ProofTextNormalizer;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and extraction pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final ProofTokenizerFactory tokenizerFactory;
    private final InputStream stdin;
    private final PrintWriter stdout;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new ProofTokenizerFactory(), System.in,
                new PrintWriter(System.out, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, ProofTokenizerFactory tokenizerFactory,
                   InputStream stdin, PrintWriter stdout) {
        this.configLoader = configLoader;
        this.tokenizerFactory = tokenizerFactory;
        this.stdin = stdin;
        this.stdout = stdout;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Extracting proof structure (analyzer={}, prover={}, maxDepth={})",
                config.analyzerMode().displayName(), config.prover().id(), config.maxDepth());

        try {
            String text = readInput(config);
            ProofDocumentParser documentParser = new ProofDocumentParser(createProofParser(config));
            ProofDocument document = config.proofOnly()
                    ? documentParser.parseProofOnly(text, config.prover())
                    : documentParser.parse(text, config.prover());
            LOGGER.info("Found {} statements, {} assumptions, {} conclusions; pattern {}",
                    document.parseResult().statements().size(),
                    document.structure().assumptions().size(),
                    document.structure().conclusions().size(),
                    document.pattern().name());
            stdout.println(new ProofJsonWriter().write(document, config.prettyOutput()));
            stdout.flush();
            return 0;
        } catch (RecursionLimitExceededException | UncheckedIOException | IllegalStateException ex) {
            LOGGER.error("Proof extraction failed: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private ProofParser createProofParser(Config config) {
        ProofTokenizer tokenizer = tokenizerFactory.select(config.analyzerMode());
        StructureAggregator aggregator = new StructureAggregator(
                new VariableExtractor(), new ExpressionExtractor(), new LogicalRoleClassifier());
        return new ProofParser(tokenizer, aggregator, new ProofTextNormalizer(), config.maxDepth());
    }

    private String readInput(Config config) {
        if (config.inputFile().isPresent()) {
            Path inputFile = config.inputFile().get();
            try {
                return Files.readString(inputFile, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to read proof from " + inputFile, ex);
            }
        }
        try {
            return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read proof from standard input", ex);
        }
    }
}
