package ai.proofkit.extractor.structure;

import ai.proofkit.extractor.nlp.Statement;
import java.util.List;
import java.util.Objects;

/**
 * Per-statement token sequences together with the aggregated structure.
 */
public record ParseResult(List<Statement> statements, ProofStructure structure) {

    private static final ParseResult EMPTY = new ParseResult(List.of(), ProofStructure.empty());

    public ParseResult {
        statements = statements == null ? List.of() : List.copyOf(statements);
        Objects.requireNonNull(structure, "structure");
        if (structure.statementCount() != statements.size()) {
            throw new IllegalArgumentException("structure must describe every statement");
        }
    }

    public static ParseResult empty() {
        return EMPTY;
    }
}
