package ai.proofkit.extractor.nlp;

import java.util.List;

/**
 * Splits proof text into statements of tagged tokens. This is the only place natural-language
 * structure enters the pipeline.
 */
public interface ProofTokenizer {

    /**
     * @param text proof text, possibly blank
     * @return statements in source order; empty for blank input
     */
    List<Statement> tokenize(String text);
}
