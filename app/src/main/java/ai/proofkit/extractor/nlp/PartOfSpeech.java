package ai.proofkit.extractor.nlp;

import java.util.Locale;
import java.util.Set;

/**
 * Universal Dependencies coarse part-of-speech categories.
 */
public enum PartOfSpeech {
    ADJ,
    ADP,
    ADV,
    AUX,
    CCONJ,
    DET,
    INTJ,
    NOUN,
    NUM,
    PART,
    PRON,
    PROPN,
    PUNCT,
    SCONJ,
    SYM,
    VERB,
    X;

    // Penn tags IN for both prepositions and subordinators
    private static final Set<String> SUBORDINATORS = Set.of(
            "if", "because", "since", "although", "though", "whether", "unless", "while", "whereas", "once");

    /**
     * Maps a Penn Treebank tag onto the coarse category. The word is needed to tell subordinating
     * conjunctions apart from prepositions, both of which are tagged {@code IN}.
     */
    public static PartOfSpeech fromPennTag(String tag, String word) {
        if (tag == null || tag.isBlank()) {
            return X;
        }
        return switch (tag) {
            case "CC" -> CCONJ;
            case "CD" -> NUM;
            case "DT", "PDT", "WDT" -> DET;
            case "EX", "PRP", "PRP$", "WP", "WP$" -> PRON;
            case "FW", "LS" -> X;
            case "IN" -> word != null && SUBORDINATORS.contains(word.toLowerCase(Locale.ROOT)) ? SCONJ : ADP;
            case "JJ", "JJR", "JJS" -> ADJ;
            case "MD" -> AUX;
            case "NN", "NNS" -> NOUN;
            case "NNP", "NNPS" -> PROPN;
            case "POS", "TO" -> PART;
            case "RB", "RBR", "RBS", "WRB" -> ADV;
            case "RP" -> ADP;
            case "SYM", "$", "#" -> SYM;
            case "UH" -> INTJ;
            case "VB", "VBD", "VBG", "VBN", "VBP", "VBZ" -> VERB;
            case ".", ",", ":", "``", "''", "-LRB-", "-RRB-", "HYPH", "NFP" -> PUNCT;
            default -> X;
        };
    }
}
