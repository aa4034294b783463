package ai.proofkit.extractor.extract;

/**
 * Role a logical marker assigns to the clause containing it.
 */
public enum LogicalRole {
    ASSUMPTION,
    CONCLUSION
}
