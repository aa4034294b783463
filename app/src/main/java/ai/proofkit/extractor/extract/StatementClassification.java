package ai.proofkit.extractor.extract;

import java.util.List;

/**
 * Tags contributed by a single statement.
 */
public record StatementClassification(List<RoleTag> assumptions, List<RoleTag> conclusions,
                                      List<ProofMethodTag> proofMethods) {

    public StatementClassification {
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        conclusions = conclusions == null ? List.of() : List.copyOf(conclusions);
        proofMethods = proofMethods == null ? List.of() : List.copyOf(proofMethods);
    }

    public boolean isEmpty() {
        return assumptions.isEmpty() && conclusions.isEmpty() && proofMethods.isEmpty();
    }
}
