package ai.proofkit.extractor.nlp;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Model-free tokenizer using terminal punctuation for sentence boundaries and a closed-class lexicon for
 * categories. Open-class words default to {@link PartOfSpeech#NOUN}. No dependency parse is attempted:
 * punctuation carries the {@code punct} relation and everything else {@code dep}.
 */
public class RuleBasedProofTokenizer implements ProofTokenizer {

    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
    private static final Pattern TOKEN = Pattern.compile("[\\p{L}]+(?:'[\\p{L}]+)?|\\d+(?:\\.\\d+)?|\\S");
    private static final String SYMBOL_CHARACTERS = "+-*/^=<>|%&~";
    private static final String PUNCT_RELATION = "punct";
    private static final String DEFAULT_RELATION = "dep";

    private static final Map<String, PartOfSpeech> LEXICON = buildLexicon();

    @Override
    public List<Statement> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Statement> statements = new ArrayList<>();
        for (String sentence : SENTENCE_BOUNDARY.split(text.trim())) {
            if (sentence.isBlank()) {
                continue;
            }
            statements.add(new Statement(statements.size(), sentence.trim(), tokenizeSentence(sentence)));
        }
        return List.copyOf(statements);
    }

    private List<Token> tokenizeSentence(String sentence) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(sentence);
        while (matcher.find()) {
            String surface = matcher.group();
            PartOfSpeech category = classify(surface);
            String relation = category == PartOfSpeech.PUNCT ? PUNCT_RELATION : DEFAULT_RELATION;
            tokens.add(new Token(surface, category, relation));
        }
        return tokens;
    }

    private PartOfSpeech classify(String surface) {
        char first = surface.charAt(0);
        if (Character.isDigit(first)) {
            return PartOfSpeech.NUM;
        }
        if (!Character.isLetter(first)) {
            return SYMBOL_CHARACTERS.indexOf(first) >= 0 ? PartOfSpeech.SYM : PartOfSpeech.PUNCT;
        }
        return LEXICON.getOrDefault(surface.toLowerCase(Locale.ROOT), PartOfSpeech.NOUN);
    }

    private static Map<String, PartOfSpeech> buildLexicon() {
        Map<String, PartOfSpeech> lexicon = new HashMap<>();
        register(lexicon, PartOfSpeech.DET, Set.of(
                "a", "an", "the", "any", "every", "each", "some", "all", "no", "this", "that", "these", "those",
                "another", "either", "neither"));
        register(lexicon, PartOfSpeech.CCONJ, Set.of("and", "or", "but", "nor", "yet"));
        register(lexicon, PartOfSpeech.ADP, Set.of(
                "in", "on", "of", "for", "by", "with", "to", "from", "at", "into", "over", "under", "between",
                "than", "as", "about", "through", "without", "within", "among", "modulo"));
        register(lexicon, PartOfSpeech.SCONJ, Set.of(
                "if", "because", "since", "although", "though", "whether", "unless", "while", "whereas", "once"));
        register(lexicon, PartOfSpeech.AUX, Set.of(
                "is", "are", "be", "been", "being", "was", "were", "will", "would", "can", "could", "must",
                "may", "might", "shall", "should", "do", "does", "did", "has", "have", "had"));
        register(lexicon, PartOfSpeech.PRON, Set.of(
                "we", "it", "i", "they", "he", "she", "us", "them", "itself", "our", "its", "which", "who"));
        register(lexicon, PartOfSpeech.ADV, Set.of(
                "then", "therefore", "thus", "hence", "also", "not", "so", "consequently", "clearly"));
        register(lexicon, PartOfSpeech.VERB, Set.of(
                "let", "assume", "suppose", "show", "prove", "know", "follows", "holds", "consider", "write",
                "divides", "equals", "gives", "implies"));
        return Map.copyOf(lexicon);
    }

    private static void register(Map<String, PartOfSpeech> lexicon, PartOfSpeech category, Set<String> words) {
        for (String word : words) {
            lexicon.putIfAbsent(word, category);
        }
    }
}
