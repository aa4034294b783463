package ai.proofkit.extractor.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.proofkit.extractor.config.Config;
import ai.proofkit.extractor.config.ConfigLoader;
import ai.proofkit.extractor.config.LogFormat;
import ai.proofkit.extractor.config.TargetProver;
import ai.proofkit.extractor.nlp.AnalyzerMode;
import ai.proofkit.extractor.nlp.ProofTokenizerFactory;
import ai.proofkit.extractor.nlp.RuleBasedProofTokenizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    private static final String THEOREM_AND_PROOF = """
            Theorem: For every integer n, n + n is even.
            Proof: Assume n is an integer. Then n + n = 2*n. Therefore n + n is even.
            """;

    @TempDir
    Path tempDir;

    private final StringWriter output = new StringWriter();

    @Test
    void writesProofDocumentForInputFile() throws Exception {
        Path input = tempDir.resolve("proof.txt");
        Files.writeString(input, THEOREM_AND_PROOF, StandardCharsets.UTF_8);
        CliApplication application = application(config(Optional.of(input), false), emptyStdin());

        int exitCode = application.run(new String[0]);

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(output.toString());
        assertThat(json.get("prover").asText()).isEqualTo("lean");
        assertThat(json.get("theorem_text").asText()).isEqualTo("Theorem: For every integer n, n + n is even.");
        assertThat(json.get("parsed_statements")).hasSize(3);
        JsonNode structure = json.get("proof_structure");
        assertThat(structure.get("assumptions").get(0).get("marker").asText()).isEqualTo("assume");
        assertThat(structure.get("assumptions").get(0).get("tactic").asText()).isEqualTo("intros");
        assertThat(structure.get("conclusions")).hasSize(2);
        assertThat(structure.get("variables")).hasSize(3);
        assertThat(structure.get("expressions").get(1).get(0).get("form").asText()).isEqualTo("n + n = 2*n");
        assertThat(json.get("pattern").get("name").asText()).isEqualTo("evenness_proof");
        assertThat(json.get("domain").get("domain_name").asText()).isEqualTo("number_theory");
    }

    @Test
    void readsProofOnlyInputFromStdin() throws Exception {
        InputStream stdin = new ByteArrayInputStream(
                "We use induction on n. In the base case n = 0.".getBytes(StandardCharsets.UTF_8));
        CliApplication application = application(config(Optional.empty(), true), stdin);

        int exitCode = application.run(new String[0]);

        assertThat(exitCode).isZero();
        JsonNode json = new ObjectMapper().readTree(output.toString());
        assertThat(json.get("theorem_text").asText()).isEmpty();
        assertThat(json.get("parsed_statements")).hasSize(2);
        assertThat(json.get("proof_structure").get("proof_methods").get(0).get("method").asText())
                .isEqualTo("induction");
        assertThat(json.get("pattern").get("name").asText()).isEqualTo("induction");
    }

    @Test
    void missingInputFileFailsWithExitCodeOne() {
        CliApplication application = application(
                config(Optional.of(tempDir.resolve("absent.txt")), false), emptyStdin());

        int exitCode = application.run(new String[0]);

        assertThat(exitCode).isEqualTo(1);
        assertThat(output.toString()).isEmpty();
    }

    @Test
    void invalidOptionValueIsReportedAsInvalidInput() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                ruleBasedOnlyFactory(), emptyStdin(), new PrintWriter(output, true));

        int exitCode = application.run(new String[] {"--analyzer", "spacy"});

        assertThat(exitCode).isEqualTo(2);
        assertThat(output.toString()).isEmpty();
    }

    @Test
    void configurationErrorsAreReportedAsInvalidInput() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                ruleBasedOnlyFactory(), emptyStdin(), new PrintWriter(output, true));

        int exitCode = application.run(new String[] {"--max-depth=-5"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void usageHelpExitsCleanly() {
        CliApplication application = new CliApplication(new ConfigLoader(key -> Optional.empty()),
                ruleBasedOnlyFactory(), emptyStdin(), new PrintWriter(output, true));

        assertThat(application.run(new String[] {"--help"})).isZero();
    }

    private CliApplication application(Config config, InputStream stdin) {
        return new CliApplication(new FixedConfigLoader(config), ruleBasedOnlyFactory(), stdin,
                new PrintWriter(output, true));
    }

    private static Config config(Optional<Path> input, boolean proofOnly) {
        return new Config(AnalyzerMode.RULE_BASED, TargetProver.LEAN, 1000, LogFormat.TEXT, proofOnly, input,
                false, false);
    }

    private static ProofTokenizerFactory ruleBasedOnlyFactory() {
        return new ProofTokenizerFactory(
                () -> {
                    throw new AssertionError("CoreNLP must not be loaded in CLI tests");
                },
                RuleBasedProofTokenizer::new);
    }

    private static InputStream emptyStdin() {
        return new ByteArrayInputStream(new byte[0]);
    }

    private static final class FixedConfigLoader extends ConfigLoader {

        private final Config config;

        FixedConfigLoader(Config config) {
            super(key -> Optional.empty());
            this.config = config;
        }

        @Override
        public Config load(CliArguments arguments) {
            return config;
        }
    }
}
