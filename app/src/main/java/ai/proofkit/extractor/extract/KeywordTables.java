package ai.proofkit.extractor.extract;

import java.util.List;

/**
 * Ordered keyword tables driving role and method classification. Iteration follows declaration order.
 */
public record KeywordTables(List<LogicalMarker> logicalMarkers, List<MethodKeyword> methodKeywords) {

    private static final String INTRODUCE = "intros";
    private static final String ASSERT = "assert";

    private static final KeywordTables DEFAULTS = new KeywordTables(
            List.of(
                    LogicalMarker.assumption("assume", INTRODUCE),
                    LogicalMarker.assumption("suppose", INTRODUCE),
                    LogicalMarker.assumption("let", INTRODUCE),
                    LogicalMarker.assumption("if", INTRODUCE),
                    LogicalMarker.conclusion("then", ASSERT),
                    LogicalMarker.conclusion("therefore", ASSERT),
                    LogicalMarker.conclusion("thus", ASSERT),
                    LogicalMarker.conclusion("hence", ASSERT),
                    LogicalMarker.conclusion("by", null),
                    LogicalMarker.conclusion("because", null),
                    LogicalMarker.conclusion("since", null),
                    LogicalMarker.conclusion("we know", ASSERT),
                    LogicalMarker.conclusion("we have", ASSERT)),
            List.of(
                    MethodKeyword.of("induction", ProofMethod.INDUCTION, "induction"),
                    MethodKeyword.of("contradiction", ProofMethod.CONTRADICTION, "contradiction"),
                    MethodKeyword.of("case", ProofMethod.CASES, "destruct"),
                    MethodKeyword.of("cases", ProofMethod.CASES, "destruct"),
                    MethodKeyword.of("direct", ProofMethod.DIRECT, null)));

    public KeywordTables {
        logicalMarkers = logicalMarkers == null ? List.of() : List.copyOf(logicalMarkers);
        methodKeywords = methodKeywords == null ? List.of() : List.copyOf(methodKeywords);
    }

    public static KeywordTables defaults() {
        return DEFAULTS;
    }
}
