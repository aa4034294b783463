package ai.proofkit.extractor.nlp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class ProofTokenizerFactoryTest {

    @Test
    void selectsTokenizerForMode() {
        ProofTokenizer coreNlp = text -> List.of();
        ProofTokenizer ruleBased = new RuleBasedProofTokenizer();
        ProofTokenizerFactory factory = new ProofTokenizerFactory(() -> coreNlp, () -> ruleBased);

        assertThat(factory.select(AnalyzerMode.CORENLP)).isSameAs(coreNlp);
        assertThat(factory.select(AnalyzerMode.RULE_BASED)).isSameAs(ruleBased);
    }

    @Test
    void unselectedBackendIsNeverBuilt() {
        AtomicInteger coreNlpBuilds = new AtomicInteger();
        ProofTokenizerFactory factory = new ProofTokenizerFactory(() -> {
            coreNlpBuilds.incrementAndGet();
            return text -> List.of();
        }, RuleBasedProofTokenizer::new);

        factory.select(AnalyzerMode.RULE_BASED);

        assertThat(coreNlpBuilds).hasValue(0);
    }

    @Test
    void analyzerModeAcceptsDisplayNames() {
        assertThat(AnalyzerMode.from("rule-based")).isEqualTo(AnalyzerMode.RULE_BASED);
        assertThat(AnalyzerMode.from("CoreNLP")).isEqualTo(AnalyzerMode.CORENLP);
        assertThat(AnalyzerMode.from(null)).isEqualTo(AnalyzerMode.CORENLP);
        assertThat(AnalyzerMode.RULE_BASED.displayName()).isEqualTo("rule-based");
        assertThat(catchThrowable(() -> AnalyzerMode.from("spacy"))).isInstanceOf(IllegalArgumentException.class);
    }
}
