package ai.proofkit.extractor.hint;

import ai.proofkit.extractor.extract.ProofMethod;
import ai.proofkit.extractor.extract.ProofMethodTag;
import ai.proofkit.extractor.extract.RoleTag;
import ai.proofkit.extractor.structure.ProofStructure;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Collapses the multiset of method hints into one pattern. Precedence: induction, contradiction, case
 * analysis, then structural guesses (evenness, direct) and finally unknown.
 */
public class ProofPatternClassifier {

    private static final Pattern INDUCTION_VARIABLE = Pattern.compile("induction on\\s+([a-zA-Z])", Pattern.CASE_INSENSITIVE);
    private static final String DEFAULT_INDUCTION_VARIABLE = "n";

    public ProofPattern identify(ProofStructure structure) {
        Objects.requireNonNull(structure, "structure");
        if (structure.hasMethod(ProofMethod.INDUCTION)) {
            return ProofPattern.INDUCTION;
        }
        if (structure.hasMethod(ProofMethod.CONTRADICTION)) {
            return ProofPattern.CONTRADICTION;
        }
        if (structure.hasMethod(ProofMethod.CASES)) {
            return ProofPattern.CASE_ANALYSIS;
        }
        int assumptionCount = structure.assumptions().size();
        int conclusionCount = structure.conclusions().size();
        if (assumptionCount > 0 && mentionsEvenness(structure)) {
            return ProofPattern.EVENNESS;
        }
        if (assumptionCount == 1 && conclusionCount >= 1) {
            return ProofPattern.DIRECT;
        }
        return ProofPattern.UNKNOWN;
    }

    /**
     * Letter following "induction on" in the first induction hint, or {@code n}.
     */
    public String inductionVariable(ProofStructure structure) {
        Objects.requireNonNull(structure, "structure");
        return structure.proofMethods().stream()
                .filter(tag -> tag.method() == ProofMethod.INDUCTION)
                .map(ProofMethodTag::statementText)
                .map(INDUCTION_VARIABLE::matcher)
                .filter(Matcher::find)
                .map(matcher -> matcher.group(1))
                .findFirst()
                .orElse(DEFAULT_INDUCTION_VARIABLE);
    }

    private boolean mentionsEvenness(ProofStructure structure) {
        Stream<String> roleTexts = Stream.concat(structure.assumptions().stream(), structure.conclusions().stream())
                .map(RoleTag::statementText);
        Stream<String> methodTexts = structure.proofMethods().stream().map(ProofMethodTag::statementText);
        return Stream.concat(roleTexts, methodTexts)
                .map(text -> text.toLowerCase(Locale.ROOT))
                .anyMatch(text -> text.contains("even"));
    }
}
