package ai.proofkit.extractor.extract;

import ai.proofkit.extractor.nlp.PartOfSpeech;
import ai.proofkit.extractor.nlp.Token;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Picks single-letter alphabetic tokens outside closed grammatical classes as candidate variables.
 * Trades recall for few false positives on ordinary English words such as "a".
 */
public class VariableExtractor {

    private static final Set<PartOfSpeech> EXCLUDED_CATEGORIES =
            EnumSet.of(PartOfSpeech.DET, PartOfSpeech.CCONJ, PartOfSpeech.ADP);

    public SortedSet<String> extract(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return Collections.emptySortedSet();
        }
        TreeSet<String> variables = new TreeSet<>();
        for (Token token : tokens) {
            if (isVariableCandidate(token)) {
                variables.add(token.text());
            }
        }
        return Collections.unmodifiableSortedSet(variables);
    }

    private boolean isVariableCandidate(Token token) {
        String text = token.text();
        return text.length() == 1
                && Character.isLetter(text.charAt(0))
                && !EXCLUDED_CATEGORIES.contains(token.category());
    }
}
