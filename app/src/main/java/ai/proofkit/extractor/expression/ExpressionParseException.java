package ai.proofkit.extractor.expression;

/**
 * Raised when a candidate expression cannot be turned into a {@link SymbolicExpression}.
 */
public class ExpressionParseException extends RuntimeException {

    private final String source;

    public ExpressionParseException(String source, String message) {
        super(message);
        this.source = source;
    }

    public ExpressionParseException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
