package ai.proofkit.extractor.hint;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores {@link MathDomain}s by counting keyword occurrences in the combined theorem and proof text.
 * Ties go to the domain declared first.
 */
public class DomainClassifier {

    private static final List<String> DISCRETE_TERMS = List.of("natural number", "integer", "even", "odd", "divisible");

    public DomainClassification classify(String theoremText, String proofText) {
        String combined = ((theoremText == null ? "" : theoremText) + " " + (proofText == null ? "" : proofText))
                .toLowerCase(Locale.ROOT);

        Map<String, Integer> scores = new LinkedHashMap<>();
        MathDomain best = null;
        int bestScore = 0;
        int total = 0;
        for (MathDomain domain : MathDomain.values()) {
            int score = 0;
            for (String keyword : domain.keywords()) {
                score += countOccurrences(combined, keyword);
            }
            scores.put(domain.domainName(), score);
            total += score;
            if (score > bestScore) {
                best = domain;
                bestScore = score;
            }
        }

        String name = best == null ? MathDomain.GENERAL_NAME : best.domainName();
        String mscCode = best == null ? MathDomain.GENERAL_MSC_CODE : best.mscCode();
        double confidence = (double) bestScore / (total == 0 ? 1 : total);
        boolean discrete = DISCRETE_TERMS.stream().anyMatch(combined::contains);
        return new DomainClassification(name, mscCode, confidence, discrete, isEvennessProof(combined),
                Collections.unmodifiableMap(scores));
    }

    private boolean isEvennessProof(String combined) {
        if (!combined.contains("even")) {
            return false;
        }
        for (char variable = 'a'; variable <= 'z'; variable++) {
            if (combined.contains(variable + " + " + variable)) {
                return true;
            }
        }
        return false;
    }

    static int countOccurrences(String text, String keyword) {
        int count = 0;
        int from = text.indexOf(keyword);
        while (from >= 0) {
            count++;
            from = text.indexOf(keyword, from + keyword.length());
        }
        return count;
    }
}
