package ai.proofkit.extractor.expression;

/**
 * A named free variable.
 */
public record Symbol(String name) {

    public Symbol {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Symbol name must not be blank");
        }
    }
}
