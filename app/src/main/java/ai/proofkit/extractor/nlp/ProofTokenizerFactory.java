package ai.proofkit.extractor.nlp;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Provides tokenizer instances based on the configured analyzer. The CoreNLP backend is only
 * constructed when selected because loading its models takes several seconds.
 */
public class ProofTokenizerFactory {

    private final Supplier<ProofTokenizer> coreNlpTokenizer;
    private final Supplier<ProofTokenizer> ruleBasedTokenizer;

    public ProofTokenizerFactory() {
        this(CoreNlpProofTokenizer::new, RuleBasedProofTokenizer::new);
    }

    public ProofTokenizerFactory(Supplier<ProofTokenizer> coreNlpTokenizer,
                                 Supplier<ProofTokenizer> ruleBasedTokenizer) {
        this.coreNlpTokenizer = Objects.requireNonNull(coreNlpTokenizer, "coreNlpTokenizer");
        this.ruleBasedTokenizer = Objects.requireNonNull(ruleBasedTokenizer, "ruleBasedTokenizer");
    }

    public ProofTokenizer select(AnalyzerMode mode) {
        Objects.requireNonNull(mode, "mode");
        return switch (mode) {
            case CORENLP -> coreNlpTokenizer.get();
            case RULE_BASED -> ruleBasedTokenizer.get();
        };
    }
}
