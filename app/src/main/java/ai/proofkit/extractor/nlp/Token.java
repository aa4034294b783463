package ai.proofkit.extractor.nlp;

import java.util.Objects;

/**
 * A single linguistic unit of a statement with its grammatical category and dependency relation.
 */
public record Token(String text, PartOfSpeech category, String relation) {

    public Token {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(category, "category");
        relation = relation == null ? "" : relation;
    }
}
