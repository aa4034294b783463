package ai.proofkit.extractor.text;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Spells out mathematical Unicode symbols and collapses whitespace so downstream matching sees plain
 * English words. Line breaks are collapsed too, so split theorem and proof before normalizing.
 */
public class ProofTextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Map<String, String> SYMBOL_WORDS = buildSymbolWords();

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String result = text;
        for (Map.Entry<String, String> entry : SYMBOL_WORDS.entrySet()) {
            if (result.contains(entry.getKey())) {
                result = result.replace(entry.getKey(), " " + entry.getValue() + " ");
            }
        }
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    private static Map<String, String> buildSymbolWords() {
        Map<String, String> words = new LinkedHashMap<>();
        words.put("∀", "for all");
        words.put("∃", "there exists");
        words.put("∈", "in");
        words.put("⊆", "subset of");
        words.put("⊂", "proper subset of");
        words.put("∩", "intersection");
        words.put("∪", "union");
        words.put("⇒", "implies");
        words.put("→", "implies");
        words.put("⟹", "implies");
        words.put("⟺", "if and only if");
        words.put("⟷", "if and only if");
        words.put("≠", "not equal to");
        words.put("≤", "less than or equal to");
        words.put("≥", "greater than or equal to");
        words.put("≡", "equivalent to");
        words.put("≈", "approximately equal to");
        words.put("∞", "infinity");
        words.put("√", "square root of");
        words.put("∑", "sum");
        words.put("∏", "product");
        words.put("∫", "integral");
        words.put("∂", "partial");
        return words;
    }
}
