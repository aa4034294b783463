package ai.proofkit.extractor.nlp;

import java.util.List;
import java.util.Objects;

/**
 * A sentence-like unit of the proof, in source order.
 */
public record Statement(int index, String text, List<Token> tokens) {

    public Statement {
        if (index < 0) {
            throw new IllegalArgumentException("index must be greater than or equal to zero");
        }
        Objects.requireNonNull(text, "text");
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
    }
}
