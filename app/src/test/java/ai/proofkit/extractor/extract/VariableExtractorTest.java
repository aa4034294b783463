package ai.proofkit.extractor.extract;

import static org.assertj.core.api.Assertions.assertThat;

import ai.proofkit.extractor.nlp.PartOfSpeech;
import ai.proofkit.extractor.nlp.Token;
import java.util.List;
import org.junit.jupiter.api.Test;

class VariableExtractorTest {

    private final VariableExtractor extractor = new VariableExtractor();

    @Test
    void collectsSingleLetterTokensSorted() {
        List<Token> tokens = List.of(
                token("Let", PartOfSpeech.VERB),
                token("y", PartOfSpeech.NOUN),
                token("and", PartOfSpeech.CCONJ),
                token("x", PartOfSpeech.PROPN),
                token("be", PartOfSpeech.AUX),
                token("reals", PartOfSpeech.NOUN),
                token("x", PartOfSpeech.NOUN));

        assertThat(extractor.extract(tokens)).containsExactly("x", "y");
    }

    @Test
    void ignoresArticlesConjunctionsAndPrepositions() {
        List<Token> tokens = List.of(
                token("a", PartOfSpeech.DET),
                token("b", PartOfSpeech.CCONJ),
                token("c", PartOfSpeech.ADP),
                token("a", PartOfSpeech.NOUN));

        assertThat(extractor.extract(tokens)).containsExactly("a");
    }

    @Test
    void ignoresDigitsSymbolsAndLongerWords() {
        List<Token> tokens = List.of(
                token("2", PartOfSpeech.NUM),
                token("+", PartOfSpeech.SYM),
                token("xy", PartOfSpeech.NOUN),
                token("n1", PartOfSpeech.NOUN));

        assertThat(extractor.extract(tokens)).isEmpty();
    }

    @Test
    void emptyInputYieldsEmptySet() {
        assertThat(extractor.extract(List.of())).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
    }

    private static Token token(String text, PartOfSpeech category) {
        return new Token(text, category, "dep");
    }
}
