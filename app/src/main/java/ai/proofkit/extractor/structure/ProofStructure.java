package ai.proofkit.extractor.structure;

import ai.proofkit.extractor.extract.ExpressionRecord;
import ai.proofkit.extractor.extract.ProofMethod;
import ai.proofkit.extractor.extract.ProofMethodTag;
import ai.proofkit.extractor.extract.RoleTag;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Aggregated annotation of a proof. {@code variables} and {@code expressions} hold exactly one entry per
 * statement; the tag lists accumulate matches and are independent of the statement count.
 */
public record ProofStructure(
        List<RoleTag> assumptions,
        List<RoleTag> conclusions,
        List<ProofMethodTag> proofMethods,
        List<Set<String>> variables,
        List<List<ExpressionRecord>> expressions
) {

    private static final ProofStructure EMPTY = new ProofStructure(List.of(), List.of(), List.of(), List.of(), List.of());

    public ProofStructure {
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        conclusions = conclusions == null ? List.of() : List.copyOf(conclusions);
        proofMethods = proofMethods == null ? List.of() : List.copyOf(proofMethods);
        variables = variables == null
                ? List.of()
                : variables.stream()
                .map(ProofStructure::sortedCopy)
                .collect(Collectors.toUnmodifiableList());
        expressions = expressions == null
                ? List.of()
                : expressions.stream()
                .map(List::copyOf)
                .collect(Collectors.toUnmodifiableList());
        if (variables.size() != expressions.size()) {
            throw new IllegalArgumentException("variables and expressions must have one entry per statement");
        }
    }

    private static Set<String> sortedCopy(Set<String> names) {
        return names == null
                ? Collections.emptySortedSet()
                : Collections.unmodifiableSortedSet(new TreeSet<>(names));
    }

    public static ProofStructure empty() {
        return EMPTY;
    }

    public int statementCount() {
        return variables.size();
    }

    public boolean isEmpty() {
        return assumptions.isEmpty() && conclusions.isEmpty() && proofMethods.isEmpty() && variables.isEmpty();
    }

    public boolean hasMethod(ProofMethod method) {
        return proofMethods.stream().anyMatch(tag -> tag.method() == method);
    }
}
