package ai.proofkit.extractor.structure;

import ai.proofkit.extractor.config.TargetProver;
import ai.proofkit.extractor.hint.DomainClassification;
import ai.proofkit.extractor.hint.DomainClassifier;
import ai.proofkit.extractor.hint.ProofPattern;
import ai.proofkit.extractor.hint.ProofPatternClassifier;
import ai.proofkit.extractor.text.ProofTextNormalizer;
import ai.proofkit.extractor.text.TheoremProofSplit;
import ai.proofkit.extractor.text.TheoremProofSplitter;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a combined input into theorem and proof, parses the proof and attaches pattern and domain hints.
 */
public class ProofDocumentParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProofDocumentParser.class);

    private final ProofParser proofParser;
    private final TheoremProofSplitter splitter;
    private final ProofTextNormalizer normalizer;
    private final ProofPatternClassifier patternClassifier;
    private final DomainClassifier domainClassifier;

    public ProofDocumentParser(ProofParser proofParser) {
        this(proofParser, new TheoremProofSplitter(), new ProofTextNormalizer(),
                new ProofPatternClassifier(), new DomainClassifier());
    }

    public ProofDocumentParser(ProofParser proofParser,
                               TheoremProofSplitter splitter,
                               ProofTextNormalizer normalizer,
                               ProofPatternClassifier patternClassifier,
                               DomainClassifier domainClassifier) {
        this.proofParser = Objects.requireNonNull(proofParser, "proofParser");
        this.splitter = Objects.requireNonNull(splitter, "splitter");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.patternClassifier = Objects.requireNonNull(patternClassifier, "patternClassifier");
        this.domainClassifier = Objects.requireNonNull(domainClassifier, "domainClassifier");
    }

    /**
     * Parses theorem and proof; the split happens on the raw text because normalization removes line breaks.
     */
    public ProofDocument parse(String text, TargetProver prover) {
        Objects.requireNonNull(prover, "prover");
        TheoremProofSplit split = splitter.split(text);
        String theorem = normalizer.normalize(split.theorem());
        String proof = normalizer.normalize(split.proof());
        if (!split.hasProof()) {
            LOGGER.info("No proof section found; annotating the theorem only");
        }
        return annotate(text, theorem, proof, prover, proofParser.parse(proof, 0));
    }

    /**
     * Treats the whole input as proof text.
     */
    public ProofDocument parseProofOnly(String text, TargetProver prover) {
        Objects.requireNonNull(prover, "prover");
        String proof = normalizer.normalize(text);
        return annotate(text, "", proof, prover, proofParser.parse(proof, 0));
    }

    private ProofDocument annotate(String original, String theorem, String proof, TargetProver prover,
                                   ParseResult parseResult) {
        ProofPattern pattern = patternClassifier.identify(parseResult.structure());
        Optional<String> inductionVariable = ProofPattern.INDUCTION.equals(pattern)
                ? Optional.of(patternClassifier.inductionVariable(parseResult.structure()))
                : Optional.empty();
        DomainClassification domain = domainClassifier.classify(theorem, proof);
        LOGGER.debug("Document pattern={} domain={} ({})", pattern.name(), domain.domainName(), domain.mscCode());
        return new ProofDocument(original, theorem, proof, prover, parseResult, pattern, inductionVariable, domain);
    }
}
