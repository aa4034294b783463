package ai.proofkit.extractor.structure;

import ai.proofkit.extractor.nlp.ProofTokenizer;
import ai.proofkit.extractor.nlp.Statement;
import ai.proofkit.extractor.text.ProofTextNormalizer;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point turning proof text into statements and a {@link ProofStructure}.
 *
 * <p>The depth counter is checked but never incremented here; callers that re-enter the parser for
 * nested sub-proofs pass their own depth. Instances hold no mutable state and may be shared.
 */
public class ProofParser {

    public static final int DEFAULT_MAX_DEPTH = 1000;

    private static final Logger LOGGER = LoggerFactory.getLogger(ProofParser.class);

    private final ProofTokenizer tokenizer;
    private final StructureAggregator aggregator;
    private final ProofTextNormalizer normalizer;
    private final int maxDepth;

    public ProofParser(ProofTokenizer tokenizer, StructureAggregator aggregator) {
        this(tokenizer, aggregator, new ProofTextNormalizer(), DEFAULT_MAX_DEPTH);
    }

    public ProofParser(ProofTokenizer tokenizer, StructureAggregator aggregator,
                       ProofTextNormalizer normalizer, int maxDepth) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be greater than or equal to zero");
        }
        this.maxDepth = maxDepth;
    }

    public ParseResult parse(String text) {
        return parse(text, 0);
    }

    /**
     * @throws RecursionLimitExceededException if {@code depth} is above the configured ceiling
     */
    public ParseResult parse(String text, int depth) {
        if (depth > maxDepth) {
            LOGGER.warn("Refusing to parse at depth {} (ceiling {})", depth, maxDepth);
            throw new RecursionLimitExceededException(depth, maxDepth);
        }
        if (text == null || text.isBlank()) {
            return ParseResult.empty();
        }
        String normalized = normalizer.normalize(text);
        List<Statement> statements = tokenizer.tokenize(normalized);
        if (statements.isEmpty()) {
            return ParseResult.empty();
        }
        ProofStructure structure = aggregator.aggregate(statements);
        LOGGER.debug("Parsed {} statements: {} assumptions, {} conclusions, {} method hints",
                statements.size(), structure.assumptions().size(), structure.conclusions().size(),
                structure.proofMethods().size());
        return new ParseResult(statements, structure);
    }

    public int maxDepth() {
        return maxDepth;
    }
}
